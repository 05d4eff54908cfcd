package com.stakeduel.config;

import com.stakeduel.model.OpponentDifficulty;
import com.stakeduel.model.WinRateScope;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Opponent tuning. Difficulty levels differ only in confidence and randomness floor.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "stakeduel.opponent")
public class OpponentProperties {

    private BigDecimal targetWinProbability = new BigDecimal("0.75");
    private WinRateScope scope = WinRateScope.PER_ACCOUNT;

    /**
     * Number of most recent rounds the realized win rate is measured over.
     */
    private int winRateWindow = 500;

    /**
     * Win deficit (or surplus) at which the corrective bias saturates at +1 (or -1).
     */
    private double biasSaturationWins = 4.0;

    private double tieWeight = 0.05;
    private OpponentDifficulty defaultDifficulty = OpponentDifficulty.NORMAL;

    private Difficulty easy = new Difficulty(0.60, 0.10);
    private Difficulty normal = new Difficulty(0.80, 0.05);
    private Difficulty hard = new Difficulty(0.95, 0.02);

    public Difficulty profileFor(OpponentDifficulty difficulty) {
        return switch (difficulty) {
            case EASY -> easy;
            case NORMAL -> normal;
            case HARD -> hard;
        };
    }

    @Getter
    @Setter
    public static class Difficulty {
        private double confidence;
        private double randomnessFloor;

        public Difficulty() {
        }

        public Difficulty(double confidence, double randomnessFloor) {
            this.confidence = confidence;
            this.randomnessFloor = randomnessFloor;
        }
    }
}
