package com.stakeduel.opponent;

import com.stakeduel.model.DuelAction;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Predicts a player's next input from their recent ones.
 * <p>
 * The longest suffix (three inputs, then two) that also occurred earlier in the window is
 * taken as the active pattern; the input that most often followed its earlier occurrences
 * is the prediction, with confidence equal to that follower's share. Without a repeating
 * suffix the most frequent input is predicted, with confidence scaled so that a uniform
 * mix yields zero.
 */
public class PatternRecognizer {

    static final int MAX_PATTERN_LENGTH = 3;
    static final int MIN_PATTERN_LENGTH = 2;

    private static final double UNIFORM_SHARE = 1.0 / 3.0;

    public PatternAnalysis analyze(List<DuelAction> history) {
        Map<DuelAction, Integer> frequencies = countFrequencies(history);
        if (history.isEmpty()) {
            return new PatternAnalysis(frequencies, List.of(), null, 0.0);
        }

        for (int length = MAX_PATTERN_LENGTH; length >= MIN_PATTERN_LENGTH; length--) {
            PatternAnalysis analysis = matchSuffix(history, length, frequencies);
            if (analysis != null) {
                return analysis;
            }
        }

        DuelAction mostFrequent = mostFrequent(frequencies, history);
        double share = (double) frequencies.get(mostFrequent) / history.size();
        double confidence = Math.max(0.0, (share - UNIFORM_SHARE) / (1.0 - UNIFORM_SHARE));
        return new PatternAnalysis(frequencies, List.of(), mostFrequent, confidence);
    }

    private PatternAnalysis matchSuffix(List<DuelAction> history, int length, Map<DuelAction, Integer> frequencies) {
        int size = history.size();
        if (size <= length) {
            return null;
        }

        List<DuelAction> suffix = history.subList(size - length, size);
        Map<DuelAction, Integer> followers = new EnumMap<>(DuelAction.class);
        int occurrences = 0;
        for (int start = 0; start + length < size; start++) {
            if (history.subList(start, start + length).equals(suffix)) {
                followers.merge(history.get(start + length), 1, Integer::sum);
                occurrences++;
            }
        }
        if (occurrences == 0) {
            return null;
        }

        DuelAction predicted = mostFrequent(followers, history);
        double confidence = (double) followers.get(predicted) / occurrences;
        return new PatternAnalysis(frequencies, List.copyOf(suffix), predicted, confidence);
    }

    private static Map<DuelAction, Integer> countFrequencies(List<DuelAction> history) {
        Map<DuelAction, Integer> counts = new EnumMap<>(DuelAction.class);
        for (DuelAction action : DuelAction.values()) {
            counts.put(action, 0);
        }
        for (DuelAction action : history) {
            counts.merge(action, 1, Integer::sum);
        }
        return counts;
    }

    /**
     * Highest count wins; ties go to the action played most recently.
     */
    private static DuelAction mostFrequent(Map<DuelAction, Integer> counts, List<DuelAction> history) {
        DuelAction best = null;
        int bestCount = -1;
        int bestRecency = -1;
        for (Map.Entry<DuelAction, Integer> entry : counts.entrySet()) {
            int count = entry.getValue();
            if (count <= 0) {
                continue;
            }
            int recency = history.lastIndexOf(entry.getKey());
            if (count > bestCount || (count == bestCount && recency > bestRecency)) {
                best = entry.getKey();
                bestCount = count;
                bestRecency = recency;
            }
        }
        return best;
    }
}
