package com.stakeduel.model;

/**
 * Settlement progress of a single round. A failure in any state rolls the
 * round back to the state before INITIATED.
 */
public enum RoundState {
    INITIATED,
    LIMIT_RESERVED,
    STAKE_DEBITED,
    OPPONENT_MOVED,
    RESOLVED
}
