package com.stakeduel.opponent;

import com.stakeduel.config.OpponentProperties;
import com.stakeduel.model.DuelAction;

import java.util.EnumMap;
import java.util.Map;
import java.util.random.RandomGenerator;

/**
 * Blends three components into an action distribution:
 * counter-play against the predicted input, scaled up by positive bias and suppressed by
 * negative bias; a light tie weight on the predicted input itself; and a uniform component
 * fed by low confidence and negative bias, never below the difficulty's randomness floor.
 */
public class MoveSelector {

    private final double tieWeight;

    public MoveSelector(double tieWeight) {
        this.tieWeight = tieWeight;
    }

    public ActionDistribution distribution(
            PatternAnalysis prediction,
            OpponentProperties.Difficulty difficulty,
            double bias
    ) {
        double confidence = prediction.hasPrediction()
                ? clamp01(prediction.confidence() * difficulty.getConfidence())
                : 0.0;
        double pressure = Math.max(bias, 0.0);
        double restraint = Math.max(-bias, 0.0);

        double counterWeight = confidence * (0.5 + 0.5 * pressure) * (1.0 - restraint);
        double predictedWeight = tieWeight * confidence;
        double uniformWeight = Math.max(
                difficulty.getRandomnessFloor(),
                (1.0 - confidence) * (1.0 - pressure) + restraint
        );

        Map<DuelAction, Double> weights = new EnumMap<>(DuelAction.class);
        double uniformShare = uniformWeight / DuelAction.values().length;
        for (DuelAction action : DuelAction.values()) {
            weights.put(action, uniformShare);
        }
        if (prediction.hasPrediction()) {
            weights.merge(prediction.predicted().counter(), counterWeight, Double::sum);
            weights.merge(prediction.predicted(), predictedWeight, Double::sum);
        }
        return ActionDistribution.fromWeights(weights);
    }

    public DuelAction select(ActionDistribution distribution, RandomGenerator random) {
        return distribution.pick(random.nextDouble());
    }

    private static double clamp01(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
