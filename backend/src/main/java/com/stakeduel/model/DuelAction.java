package com.stakeduel.model;

/**
 * The three legal round inputs. Each action beats exactly one other:
 * ROCK beats SCISSORS, PAPER beats ROCK, SCISSORS beats PAPER.
 */
public enum DuelAction {
    ROCK('R'),
    PAPER('P'),
    SCISSORS('S');

    private final char code;

    DuelAction(char code) {
        this.code = code;
    }

    public char getCode() {
        return code;
    }

    public boolean beats(DuelAction other) {
        return other == beaten();
    }

    public DuelAction beaten() {
        return switch (this) {
            case ROCK -> SCISSORS;
            case PAPER -> ROCK;
            case SCISSORS -> PAPER;
        };
    }

    /**
     * The action that beats this one.
     */
    public DuelAction counter() {
        return switch (this) {
            case ROCK -> PAPER;
            case PAPER -> SCISSORS;
            case SCISSORS -> ROCK;
        };
    }

    public static DuelAction fromCode(char code) {
        for (DuelAction action : values()) {
            if (action.code == code) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown action code: " + code);
    }
}
