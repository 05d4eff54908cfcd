package com.stakeduel.opponent;

import com.stakeduel.model.DuelAction;

import java.util.List;
import java.util.Map;

/**
 * Result of reading a player's recent inputs.
 *
 * @param frequencies count of each action in the window
 * @param pattern     repeating suffix the prediction came from, empty when none was found
 * @param predicted   most likely next input, {@code null} for an empty history
 * @param confidence  strength of the prediction in [0, 1]
 */
public record PatternAnalysis(
        Map<DuelAction, Integer> frequencies,
        List<DuelAction> pattern,
        DuelAction predicted,
        double confidence
) {

    public boolean hasPrediction() {
        return predicted != null && confidence > 0.0;
    }
}
