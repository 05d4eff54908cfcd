package com.stakeduel.opponent;

/**
 * Opponent performance over the rolling window, together with the rate it should hold.
 */
public record WinRateStats(
        int rounds,
        int opponentWins,
        double targetWinProbability
) {

    public static WinRateStats empty(double targetWinProbability) {
        return new WinRateStats(0, 0, targetWinProbability);
    }

    public double realizedWinRate() {
        return rounds == 0 ? 0.0 : (double) opponentWins / rounds;
    }
}
