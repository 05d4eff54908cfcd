package com.stakeduel.model;

public enum OpponentDifficulty {
    EASY,
    NORMAL,
    HARD
}
