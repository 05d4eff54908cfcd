package com.stakeduel.dto;

import com.stakeduel.model.DuelAction;
import com.stakeduel.model.DuelOutcome;
import com.stakeduel.model.LedgerEntryType;
import com.stakeduel.model.LedgerReason;
import com.stakeduel.model.OpponentDifficulty;

import java.math.BigInteger;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

public final class AccountResponses {

    private AccountResponses() {
    }

    public record Balance(
            String accountId,
            long creditBalance,
            LocalDate lastKnownDay,
            long roundsSettled,
            OffsetDateTime updatedAt
    ) {
    }

    public record LedgerEntry(
            UUID entryId,
            long sequenceNumber,
            LedgerEntryType entryType,
            LedgerReason reason,
            long amount,
            long balanceAfter,
            UUID referenceId,
            OffsetDateTime createdAt
    ) {
    }

    public record ExchangeReceipt(
            UUID referenceId,
            String accountId,
            String assetId,
            BigInteger assetAmount,
            long credits,
            long price,
            int pricePrecision,
            OffsetDateTime priceObservedAt,
            long balance
    ) {
    }

    public record RoundResult(
            UUID matchId,
            long sequenceNumber,
            DuelAction playerAction,
            DuelAction opponentAction,
            DuelOutcome outcome,
            OpponentDifficulty difficulty,
            long stake,
            long payout,
            long balance,
            int roundsPlayedToday,
            long creditsWageredToday
    ) {
    }

    public record MatchSummary(
            UUID matchId,
            long sequenceNumber,
            DuelAction playerAction,
            DuelAction opponentAction,
            DuelOutcome outcome,
            OpponentDifficulty difficulty,
            long stake,
            long payout,
            long balanceAfter,
            OffsetDateTime createdAt
    ) {
    }

    public record DailyLimits(
            String accountId,
            LocalDate day,
            int roundsPlayed,
            int maxDailyRounds,
            long creditsWagered,
            long maxDailyWager
    ) {
    }
}
