package com.stakeduel.opponent;

/**
 * Turns the opponent's win deficit into a corrective bias in [-1, 1]. Positive means the
 * opponent is behind target and should press its prediction; negative means it is ahead
 * and should back off towards uniform play.
 */
public class WinRateController {

    private final double saturationWins;

    public WinRateController(double saturationWins) {
        if (!(saturationWins > 0.0)) {
            throw new IllegalArgumentException("saturationWins must be positive");
        }
        this.saturationWins = saturationWins;
    }

    public double bias(WinRateStats stats) {
        if (stats.rounds() == 0) {
            return 0.0;
        }
        double deficit = stats.targetWinProbability() * stats.rounds() - stats.opponentWins();
        return Math.max(-1.0, Math.min(1.0, deficit / saturationWins));
    }
}
