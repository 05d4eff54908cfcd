package com.stakeduel.repository;

import com.stakeduel.model.DuelMatch;
import com.stakeduel.model.DuelOutcome;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface DuelMatchRepository extends JpaRepository<DuelMatch, UUID> {

    List<DuelMatch> findByAccountIdOrderBySequenceNumberDesc(String accountId, Pageable pageable);

    @Query("select m.outcome from DuelMatch m where m.accountId = :accountId order by m.sequenceNumber desc")
    List<DuelOutcome> findRecentOutcomes(@Param("accountId") String accountId, Pageable pageable);

    @Query("select m.outcome from DuelMatch m order by m.createdAt desc, m.matchId desc")
    List<DuelOutcome> findRecentPlatformOutcomes(Pageable pageable);

    @Query("select coalesce(sum(m.stake), 0) from DuelMatch m")
    long sumStakes();

    @Query("select coalesce(sum(m.payout), 0) from DuelMatch m")
    long sumPayouts();
}
