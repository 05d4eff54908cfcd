package com.stakeduel.repository;

import com.stakeduel.model.EventLogEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface EventLogEntryRepository extends JpaRepository<EventLogEntry, Long> {

    List<EventLogEntry> findByEventIdGreaterThanOrderByEventIdAsc(long afterEventId, Pageable pageable);

    List<EventLogEntry> findByAccountIdAndSequenceNumberGreaterThanOrderBySequenceNumberAsc(
            String accountId,
            long afterSequenceNumber,
            Pageable pageable
    );

    long countByAccountId(String accountId);
}
