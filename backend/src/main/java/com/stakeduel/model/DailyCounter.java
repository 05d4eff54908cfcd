package com.stakeduel.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;
import java.time.OffsetDateTime;

/**
 * Per-account, per-UTC-day participation counters. A missing row means zero.
 */
@Getter
@Setter
@Entity
@IdClass(DailyCounterId.class)
@Table(name = "daily_counters")
public class DailyCounter {

    @Id
    @Column(name = "account_id", nullable = false, updatable = false, length = 128)
    private String accountId;

    @Id
    @Column(name = "counter_day", nullable = false, updatable = false)
    private LocalDate counterDay;

    @Column(name = "rounds_played", nullable = false)
    private int roundsPlayed;

    @Column(name = "credits_wagered", nullable = false)
    private long creditsWagered;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
