package com.stakeduel.opponent;

import com.stakeduel.model.DuelAction;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Normalized probability of each opponent action.
 */
public final class ActionDistribution {

    private final Map<DuelAction, Double> probabilities;

    private ActionDistribution(Map<DuelAction, Double> probabilities) {
        this.probabilities = Collections.unmodifiableMap(probabilities);
    }

    static ActionDistribution fromWeights(Map<DuelAction, Double> weights) {
        double total = 0.0;
        for (DuelAction action : DuelAction.values()) {
            total += weights.getOrDefault(action, 0.0);
        }

        Map<DuelAction, Double> normalized = new EnumMap<>(DuelAction.class);
        for (DuelAction action : DuelAction.values()) {
            double weight = weights.getOrDefault(action, 0.0);
            normalized.put(action, total > 0.0 ? weight / total : 1.0 / DuelAction.values().length);
        }
        return new ActionDistribution(normalized);
    }

    public double probability(DuelAction action) {
        return probabilities.get(action);
    }

    public Map<DuelAction, Double> asMap() {
        return probabilities;
    }

    /**
     * Maps a uniform sample in [0, 1) to an action.
     */
    DuelAction pick(double sample) {
        double cumulative = 0.0;
        DuelAction last = null;
        for (DuelAction action : DuelAction.values()) {
            double p = probabilities.get(action);
            if (p <= 0.0) {
                continue;
            }
            cumulative += p;
            last = action;
            if (sample < cumulative) {
                return action;
            }
        }
        return last;
    }
}
