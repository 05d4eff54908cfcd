package com.stakeduel.service;

import com.stakeduel.model.DuelAction;
import com.stakeduel.model.DuelOutcome;
import com.stakeduel.model.OpponentDifficulty;

import java.util.UUID;

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
