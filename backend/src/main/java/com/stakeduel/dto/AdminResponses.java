package com.stakeduel.dto;

import com.stakeduel.model.OpponentDifficulty;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

public final class AdminResponses {

    private AdminResponses() {
    }

    public record Settings(
            int maxDailyRounds,
            long maxDailyWager,
            int winMultiplierBps,
            BigDecimal targetWinProbability,
            int historyWindowSize,
            OpponentDifficulty defaultDifficulty,
            boolean paused,
            OffsetDateTime updatedAt
    ) {
    }

    public record Reconciliation(
            long totalPurchasedCredits,
            long totalCashedOutCredits,
            long totalStaked,
            long totalPaidOut,
            long houseEarnings,
            long expectedBalances,
            long actualBalances,
            boolean balanced
    ) {
    }
}
