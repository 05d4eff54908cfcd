package com.stakeduel.model;

public enum LedgerReason {
    PURCHASE,
    CASHOUT,
    ROUND_STAKE,
    ROUND_PAYOUT
}
