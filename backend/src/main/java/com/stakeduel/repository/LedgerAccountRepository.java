package com.stakeduel.repository;

import com.stakeduel.model.LedgerAccount;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Optional;

@Repository
public interface LedgerAccountRepository extends JpaRepository<LedgerAccount, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select a from LedgerAccount a where a.accountId = :accountId")
    Optional<LedgerAccount> findByAccountIdForUpdate(@Param("accountId") String accountId);

    /**
     * Inserts an empty account unless one exists. A concurrent insert of the same id waits for
     * the other transaction and then does nothing.
     */
    @Modifying
    @Query(value = "INSERT INTO ledger_accounts " +
            "(account_id, credit_balance, round_sequence, event_sequence, entry_sequence, created_at, updated_at) " +
            "VALUES (:accountId, 0, 0, 0, 0, :createdAt, :createdAt) " +
            "ON CONFLICT DO NOTHING", nativeQuery = true)
    int insertIfAbsent(@Param("accountId") String accountId, @Param("createdAt") OffsetDateTime createdAt);

    @Query("select coalesce(sum(a.creditBalance), 0) from LedgerAccount a")
    long sumCreditBalances();
}
