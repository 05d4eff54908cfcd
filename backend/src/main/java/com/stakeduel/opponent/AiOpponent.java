package com.stakeduel.opponent;

import com.stakeduel.config.OpponentProperties;
import com.stakeduel.model.DuelAction;
import com.stakeduel.model.OpponentDifficulty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.random.RandomGenerator;

/**
 * Chooses the opponent's action for one round. The choice depends only on the arguments
 * and the configured tuning, so the same inputs and random sequence give the same action.
 */
@Component
public class AiOpponent {

    private final OpponentProperties opponentProperties;
    private final PatternRecognizer patternRecognizer;
    private final WinRateController winRateController;
    private final MoveSelector moveSelector;

    public AiOpponent(OpponentProperties opponentProperties) {
        this.opponentProperties = opponentProperties;
        this.patternRecognizer = new PatternRecognizer();
        this.winRateController = new WinRateController(opponentProperties.getBiasSaturationWins());
        this.moveSelector = new MoveSelector(opponentProperties.getTieWeight());
    }

    public DuelAction selectAction(
            List<DuelAction> history,
            OpponentDifficulty difficulty,
            WinRateStats winRateStats,
            RandomGenerator random
    ) {
        return moveSelector.select(distribution(history, difficulty, winRateStats), random);
    }

    public ActionDistribution distribution(
            List<DuelAction> history,
            OpponentDifficulty difficulty,
            WinRateStats winRateStats
    ) {
        PatternAnalysis prediction = patternRecognizer.analyze(history);
        double bias = winRateController.bias(winRateStats);
        return moveSelector.distribution(prediction, opponentProperties.profileFor(difficulty), bias);
    }
}
