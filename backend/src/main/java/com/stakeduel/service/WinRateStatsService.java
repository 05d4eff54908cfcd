package com.stakeduel.service;

import com.stakeduel.config.OpponentProperties;
import com.stakeduel.model.DuelOutcome;
import com.stakeduel.model.PlatformSettings;
import com.stakeduel.model.WinRateScope;
import com.stakeduel.opponent.WinRateStats;
import com.stakeduel.repository.DuelMatchRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Measures the opponent's realized win rate over the configured rolling window,
 * either for one account or across the platform.
 */
@Service
public class WinRateStatsService {

    private final DuelMatchRepository duelMatchRepository;
    private final OpponentProperties opponentProperties;

    public WinRateStatsService(DuelMatchRepository duelMatchRepository, OpponentProperties opponentProperties) {
        this.duelMatchRepository = duelMatchRepository;
        this.opponentProperties = opponentProperties;
    }

    @Transactional(readOnly = true)
    public WinRateStats statsFor(String accountId, PlatformSettings settings) {
        PageRequest window = PageRequest.of(0, Math.max(1, opponentProperties.getWinRateWindow()));
        List<DuelOutcome> outcomes = opponentProperties.getScope() == WinRateScope.PLATFORM
                ? duelMatchRepository.findRecentPlatformOutcomes(window)
                : duelMatchRepository.findRecentOutcomes(accountId, window);

        int opponentWins = 0;
        for (DuelOutcome outcome : outcomes) {
            if (outcome.opponentWon()) {
                opponentWins++;
            }
        }
        return new WinRateStats(outcomes.size(), opponentWins, settings.getTargetWinProbability().doubleValue());
    }
}
