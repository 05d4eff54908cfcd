package com.stakeduel.dto;

import com.stakeduel.model.OpponentDifficulty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.math.BigInteger;

public final class AccountRequests {

    private AccountRequests() {
    }

    public record PurchaseRequest(
            @NotBlank(message = "assetId is required")
            @Size(max = 32, message = "assetId must be at most 32 characters")
            String assetId,

            @NotNull(message = "assetAmount is required")
            BigInteger assetAmount
    ) {
    }

    public record CashoutRequest(
            @NotBlank(message = "assetId is required")
            @Size(max = 32, message = "assetId must be at most 32 characters")
            String assetId,

            @Positive(message = "credits must be positive")
            long credits
    ) {
    }

    /**
     * {@code action} is validated by the settlement engine so that a paused platform
     * reports the pause before any input problem.
     */
    public record PlayRoundRequest(
            String action,

            long stake,

            OpponentDifficulty difficulty
    ) {
    }
}
