package com.stakeduel.model;

/**
 * Round outcome from the player's side.
 */
public enum DuelOutcome {
    WIN,
    TIE,
    LOSE;

    public static DuelOutcome resolve(DuelAction playerAction, DuelAction opponentAction) {
        if (playerAction == opponentAction) {
            return TIE;
        }
        return playerAction.beats(opponentAction) ? WIN : LOSE;
    }

    public boolean opponentWon() {
        return this == LOSE;
    }
}
