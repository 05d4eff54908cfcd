package com.stakeduel.opponent;

import com.stakeduel.model.DuelAction;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.stakeduel.model.DuelAction.PAPER;
import static com.stakeduel.model.DuelAction.ROCK;
import static com.stakeduel.model.DuelAction.SCISSORS;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PatternRecognizerTest {

    private final PatternRecognizer patternRecognizer = new PatternRecognizer();

    @Test
    void emptyHistoryHasNoPrediction() {
        PatternAnalysis analysis = patternRecognizer.analyze(List.of());

        assertNull(analysis.predicted());
        assertEquals(0.0, analysis.confidence());
        assertFalse(analysis.hasPrediction());
        assertEquals(0, analysis.frequencies().get(ROCK));
    }

    @Test
    void repeatingCycleIsPredictedWithFullConfidence() {
        List<DuelAction> history = List.of(ROCK, PAPER, SCISSORS, ROCK, PAPER, SCISSORS, ROCK, PAPER);

        PatternAnalysis analysis = patternRecognizer.analyze(history);

        assertEquals(SCISSORS, analysis.predicted());
        assertEquals(1.0, analysis.confidence(), 1e-9);
        assertEquals(List.of(SCISSORS, ROCK, PAPER), analysis.pattern());
    }

    @Test
    void constantPlayerIsPredictedFromLongestSuffix() {
        PatternAnalysis analysis = patternRecognizer.analyze(List.of(ROCK, ROCK, ROCK, ROCK, ROCK));

        assertEquals(ROCK, analysis.predicted());
        assertEquals(1.0, analysis.confidence(), 1e-9);
        assertEquals(3, analysis.pattern().size());
    }

    @Test
    void conflictingFollowersLowerConfidence() {
        // "R P" was followed by S twice and by R once; "R R P" never occurred before.
        List<DuelAction> history = List.of(
                SCISSORS, ROCK, PAPER, SCISSORS, PAPER, ROCK, PAPER,
                SCISSORS, ROCK, PAPER, ROCK, ROCK, PAPER
        );

        PatternAnalysis analysis = patternRecognizer.analyze(history);

        assertEquals(SCISSORS, analysis.predicted());
        assertEquals(List.of(ROCK, PAPER), analysis.pattern());
        assertEquals(2.0 / 3.0, analysis.confidence(), 1e-9);
    }

    @Test
    void fallsBackToMostFrequentActionWithoutRepeatingSuffix() {
        PatternAnalysis analysis = patternRecognizer.analyze(List.of(PAPER, PAPER, ROCK));

        assertEquals(PAPER, analysis.predicted());
        assertTrue(analysis.pattern().isEmpty());
        // share 2/3 scales to (2/3 - 1/3) / (2/3) = 0.5
        assertEquals(0.5, analysis.confidence(), 1e-9);
    }

    @Test
    void uniformMixWithoutPatternHasZeroConfidence() {
        PatternAnalysis analysis = patternRecognizer.analyze(List.of(ROCK, PAPER, SCISSORS));

        assertEquals(0.0, analysis.confidence(), 1e-9);
        assertFalse(analysis.hasPrediction());
        assertEquals(SCISSORS, analysis.predicted());
    }
}
