package com.stakeduel.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;
import java.time.OffsetDateTime;

@Getter
@Setter
@Entity
@Table(name = "ledger_accounts")
public class LedgerAccount {

    @Id
    @Column(name = "account_id", nullable = false, updatable = false, length = 128)
    private String accountId;

    @Column(name = "credit_balance", nullable = false)
    private long creditBalance;

    @Column(name = "last_known_day")
    private LocalDate lastKnownDay;

    @Column(name = "round_sequence", nullable = false)
    private long roundSequence;

    @Column(name = "event_sequence", nullable = false)
    private long eventSequence;

    @Column(name = "entry_sequence", nullable = false)
    private long entrySequence;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
