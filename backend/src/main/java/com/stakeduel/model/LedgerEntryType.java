package com.stakeduel.model;

public enum LedgerEntryType {
    CREDIT,
    DEBIT
}
