package com.stakeduel.model;

public enum WinRateScope {
    PER_ACCOUNT,
    PLATFORM
}
