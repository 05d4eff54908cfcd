package com.stakeduel.service;

import com.stakeduel.model.DuelAction;
import com.stakeduel.model.DuelOutcome;
import com.stakeduel.model.OpponentDifficulty;

import java.math.BigInteger;

/**
 * JSON bodies of event log entries, one per event kind.
 */
public final class EventPayloads {

    private EventPayloads() {
    }

    public record Round(
            long sequenceNumber,
            DuelAction playerAction,
            DuelAction opponentAction,
            DuelOutcome outcome,
            OpponentDifficulty difficulty,
            long stake,
            long payout,
            long balanceAfter
    ) {
    }

    public record Purchase(
            String assetId,
            BigInteger assetAmount,
            long credits,
            long price,
            int pricePrecision,
            long balanceAfter
    ) {
    }

    public record Cashout(
            String assetId,
            BigInteger assetAmount,
            long credits,
            long price,
            int pricePrecision,
            long balanceAfter
    ) {
    }
}
