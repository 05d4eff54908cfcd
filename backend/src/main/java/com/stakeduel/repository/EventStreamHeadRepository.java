package com.stakeduel.repository;

import com.stakeduel.model.EventStreamHead;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface EventStreamHeadRepository extends JpaRepository<EventStreamHead, Integer> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select h from EventStreamHead h where h.streamId = :streamId")
    Optional<EventStreamHead> findByStreamIdForUpdate(@Param("streamId") Integer streamId);
}
