package com.stakeduel.dto;

import com.stakeduel.model.OpponentDifficulty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.math.BigInteger;

public final class AdminRequests {

    private AdminRequests() {
    }

    public record UpdateSettingsRequest(
            @Min(value = 0, message = "maxDailyRounds must be non-negative")
            Integer maxDailyRounds,

            @Min(value = 0, message = "maxDailyWager must be non-negative")
            Long maxDailyWager,

            @Min(value = 0, message = "winMultiplierBps must be non-negative")
            @Max(value = 1_000_000, message = "winMultiplierBps must be at most 1000000")
            Integer winMultiplierBps,

            @DecimalMin(value = "0.0", message = "targetWinProbability must be between 0 and 1")
            @DecimalMax(value = "1.0", message = "targetWinProbability must be between 0 and 1")
            BigDecimal targetWinProbability,

            @Min(value = 1, message = "historyWindowSize must be at least 1")
            @Max(value = 64, message = "historyWindowSize must be at most 64")
            Integer historyWindowSize,

            OpponentDifficulty defaultDifficulty
    ) {
    }

    public record RegisterAssetRequest(
            @NotBlank(message = "assetId is required")
            @Size(max = 32, message = "assetId must be at most 32 characters")
            String assetId,

            @NotBlank(message = "priceFeedRef is required")
            @Size(max = 128, message = "priceFeedRef must be at most 128 characters")
            String priceFeedRef,

            @Min(value = 0, message = "decimals must be between 0 and 36")
            @Max(value = 36, message = "decimals must be between 0 and 36")
            int decimals,

            @NotNull(message = "minPurchase is required")
            @Positive(message = "minPurchase must be positive")
            BigInteger minPurchase,

            @NotNull(message = "maxPurchase is required")
            @Positive(message = "maxPurchase must be positive")
            BigInteger maxPurchase
    ) {
    }
}
