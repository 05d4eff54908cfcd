package com.stakeduel.model;

public enum EventKind {
    PURCHASE,
    ROUND,
    CASHOUT
}
