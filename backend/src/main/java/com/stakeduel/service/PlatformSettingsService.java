package com.stakeduel.service;

import com.stakeduel.config.OpponentProperties;
import com.stakeduel.config.StakeduelProperties;
import com.stakeduel.model.OpponentDifficulty;
import com.stakeduel.model.PlatformSettings;
import com.stakeduel.repository.PlatformSettingsRepository;
import com.stakeduel.web.StakeLedgerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Owns the admin-mutable platform constants and the global pause flag.
 */
@Service
public class PlatformSettingsService {

    private static final Logger log = LoggerFactory.getLogger(PlatformSettingsService.class);

    private final PlatformSettingsRepository platformSettingsRepository;
    private final StakeduelProperties stakeduelProperties;
    private final OpponentProperties opponentProperties;
    private final Clock clock;

    public PlatformSettingsService(
            PlatformSettingsRepository platformSettingsRepository,
            StakeduelProperties stakeduelProperties,
            OpponentProperties opponentProperties,
            Clock clock
    ) {
        this.platformSettingsRepository = platformSettingsRepository;
        this.stakeduelProperties = stakeduelProperties;
        this.opponentProperties = opponentProperties;
        this.clock = clock;
    }

    /**
     * Current settings. Falls back to configured defaults until the row has been seeded.
     */
    @Transactional(readOnly = true)
    public PlatformSettings current() {
        return platformSettingsRepository.findById(PlatformSettings.SINGLETON_ID)
                .orElseGet(this::defaults);
    }

    @Transactional(readOnly = true)
    public void requireNotPaused() {
        if (current().isPaused()) {
            log.warn("operation_rejected reason=system_paused");
            throw StakeLedgerException.systemPaused();
        }
    }

    @Transactional
    public PlatformSettings seedIfMissing() {
        return platformSettingsRepository.findById(PlatformSettings.SINGLETON_ID)
                .orElseGet(() -> {
                    PlatformSettings saved = platformSettingsRepository.save(defaults());
                    log.info("Seeded platform settings: maxDailyRounds={}, maxDailyWager={}, winMultiplierBps={}",
                            saved.getMaxDailyRounds(), saved.getMaxDailyWager(), saved.getWinMultiplierBps());
                    return saved;
                });
    }

    @Transactional
    public PlatformSettings update(SettingsUpdate update) {
        PlatformSettings settings = seedIfMissing();
        if (update.maxDailyRounds() != null) {
            settings.setMaxDailyRounds(update.maxDailyRounds());
        }
        if (update.maxDailyWager() != null) {
            settings.setMaxDailyWager(update.maxDailyWager());
        }
        if (update.winMultiplierBps() != null) {
            settings.setWinMultiplierBps(update.winMultiplierBps());
        }
        if (update.targetWinProbability() != null) {
            settings.setTargetWinProbability(update.targetWinProbability());
        }
        if (update.historyWindowSize() != null) {
            settings.setHistoryWindowSize(update.historyWindowSize());
        }
        if (update.defaultDifficulty() != null) {
            settings.setDefaultDifficulty(update.defaultDifficulty());
        }
        settings.setUpdatedAt(OffsetDateTime.now(clock));
        PlatformSettings saved = platformSettingsRepository.save(settings);
        log.info("settings_updated maxDailyRounds={} maxDailyWager={} winMultiplierBps={} target={} historyWindow={} difficulty={}",
                saved.getMaxDailyRounds(), saved.getMaxDailyWager(), saved.getWinMultiplierBps(),
                saved.getTargetWinProbability(), saved.getHistoryWindowSize(), saved.getDefaultDifficulty());
        return saved;
    }

    @Transactional
    public PlatformSettings setPaused(boolean paused) {
        PlatformSettings settings = seedIfMissing();
        settings.setPaused(paused);
        settings.setUpdatedAt(OffsetDateTime.now(clock));
        PlatformSettings saved = platformSettingsRepository.save(settings);
        log.info("platform_{}", paused ? "paused" : "unpaused");
        return saved;
    }

    private PlatformSettings defaults() {
        PlatformSettings settings = new PlatformSettings();
        settings.setSettingsId(PlatformSettings.SINGLETON_ID);
        settings.setMaxDailyRounds(stakeduelProperties.getLimits().getMaxDailyRounds());
        settings.setMaxDailyWager(stakeduelProperties.getLimits().getMaxDailyWager());
        settings.setWinMultiplierBps(stakeduelProperties.getPayout().getWinMultiplierBps());
        settings.setTargetWinProbability(opponentProperties.getTargetWinProbability());
        settings.setHistoryWindowSize(stakeduelProperties.getHistory().getWindowSize());
        settings.setDefaultDifficulty(opponentProperties.getDefaultDifficulty());
        settings.setPaused(false);
        settings.setUpdatedAt(OffsetDateTime.now(clock));
        return settings;
    }

    /**
     * Partial update; {@code null} fields keep their current value.
     */
    public record SettingsUpdate(
            Integer maxDailyRounds,
            Long maxDailyWager,
            Integer winMultiplierBps,
            BigDecimal targetWinProbability,
            Integer historyWindowSize,
            OpponentDifficulty defaultDifficulty
    ) {
    }
}
