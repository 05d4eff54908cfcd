package com.stakeduel.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/**
 * Singleton row of admin-mutable constants and the global pause flag.
 */
@Getter
@Setter
@Entity
@Table(name = "platform_settings")
public class PlatformSettings {

    public static final int SINGLETON_ID = 1;

    @Id
    @Column(name = "settings_id", nullable = false, updatable = false)
    private Integer settingsId = SINGLETON_ID;

    @Column(name = "max_daily_rounds", nullable = false)
    private int maxDailyRounds;

    @Column(name = "max_daily_wager", nullable = false)
    private long maxDailyWager;

    @Column(name = "win_multiplier_bps", nullable = false)
    private int winMultiplierBps;

    @Column(name = "target_win_probability", nullable = false, precision = 5, scale = 4)
    private BigDecimal targetWinProbability;

    @Column(name = "history_window_size", nullable = false)
    private int historyWindowSize;

    @Enumerated(EnumType.STRING)
    @Column(name = "default_difficulty", nullable = false, length = 16)
    private OpponentDifficulty defaultDifficulty = OpponentDifficulty.NORMAL;

    @Column(name = "paused", nullable = false)
    private boolean paused;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
