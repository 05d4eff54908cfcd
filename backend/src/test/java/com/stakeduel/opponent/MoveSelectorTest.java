package com.stakeduel.opponent;

import com.stakeduel.config.OpponentProperties;
import com.stakeduel.model.DuelAction;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.SplittableRandom;
import java.util.random.RandomGenerator;

import static com.stakeduel.model.DuelAction.PAPER;
import static com.stakeduel.model.DuelAction.ROCK;
import static com.stakeduel.model.DuelAction.SCISSORS;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MoveSelectorTest {

    private static final OpponentProperties.Difficulty HARD = new OpponentProperties.Difficulty(0.95, 0.02);
    private static final OpponentProperties.Difficulty EASY = new OpponentProperties.Difficulty(0.60, 0.10);

    private final MoveSelector moveSelector = new MoveSelector(0.05);

    @Test
    void noPredictionYieldsUniformDistribution() {
        PatternAnalysis none = new PatternAnalysis(Map.of(), List.of(), null, 0.0);

        ActionDistribution distribution = moveSelector.distribution(none, HARD, 1.0);

        for (DuelAction action : DuelAction.values()) {
            assertEquals(1.0 / 3.0, distribution.probability(action), 1e-9);
        }
    }

    @Test
    void positiveBiasFavoursCounterToPrediction() {
        PatternAnalysis rock = prediction(ROCK, 1.0);

        ActionDistribution pressed = moveSelector.distribution(rock, HARD, 1.0);
        ActionDistribution neutral = moveSelector.distribution(rock, HARD, 0.0);

        assertTrue(pressed.probability(PAPER) > 0.9);
        assertTrue(pressed.probability(PAPER) > neutral.probability(PAPER));
    }

    @Test
    void negativeBiasPullsTowardsUniform() {
        ActionDistribution restrained = moveSelector.distribution(prediction(ROCK, 1.0), HARD, -1.0);

        assertTrue(restrained.probability(PAPER) < 0.34);
        assertTrue(restrained.probability(SCISSORS) > 0.3);
    }

    @Test
    void randomnessFloorKeepsEveryActionPossible() {
        ActionDistribution distribution = moveSelector.distribution(prediction(ROCK, 1.0), HARD, 1.0);

        for (DuelAction action : DuelAction.values()) {
            assertTrue(distribution.probability(action) > 0.0);
        }
    }

    @Test
    void lowerDifficultyConfidencePlaysCounterLessOften() {
        PatternAnalysis rock = prediction(ROCK, 1.0);

        double hard = moveSelector.distribution(rock, HARD, 0.5).probability(PAPER);
        double easy = moveSelector.distribution(rock, EASY, 0.5).probability(PAPER);

        assertTrue(easy < hard);
    }

    @Test
    void probabilitiesSumToOne() {
        ActionDistribution distribution = moveSelector.distribution(prediction(SCISSORS, 0.7), EASY, 0.3);

        double total = 0.0;
        for (DuelAction action : DuelAction.values()) {
            total += distribution.probability(action);
        }
        assertEquals(1.0, total, 1e-9);
    }

    @Test
    void selectionFollowsDistribution() {
        ActionDistribution distribution = moveSelector.distribution(prediction(ROCK, 1.0), HARD, 1.0);
        RandomGenerator random = new SplittableRandom(42L);

        int paper = 0;
        int samples = 20_000;
        for (int i = 0; i < samples; i++) {
            if (moveSelector.select(distribution, random) == PAPER) {
                paper++;
            }
        }
        assertEquals(distribution.probability(PAPER), (double) paper / samples, 0.02);
    }

    private static PatternAnalysis prediction(DuelAction action, double confidence) {
        return new PatternAnalysis(Map.of(), List.of(), action, confidence);
    }
}
