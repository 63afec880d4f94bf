package com.repo.profiler.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Pinned constants. These are empirical calibrations, so the test guards
 * against accidental edits rather than asserting correctness.
 */
class ScoringWeightsTest {

    private static final double EPSILON = 1e-9;

    @Test
    void testBlendsSumToOne() {
        assertEquals(1.0, ScoringWeights.Skill.BACKEND_COMPOSITION + ScoringWeights.Skill.BACKEND_PYTHON
                + ScoringWeights.Skill.BACKEND_QUALITY, EPSILON);
        assertEquals(1.0, ScoringWeights.Skill.ARCHITECTURE_DEPTH + ScoringWeights.Skill.ARCHITECTURE_QUALITY
                + ScoringWeights.Skill.ARCHITECTURE_SIZE, EPSILON);
        assertEquals(1.0, ScoringWeights.Devtools.CLI_WEIGHT + ScoringWeights.Devtools.ADVANCED_WEIGHT
                + ScoringWeights.Devtools.TESTING_WEIGHT + ScoringWeights.Devtools.QUALITY_WEIGHT, EPSILON);
        assertEquals(1.0, ScoringWeights.Friction.ML_AI + ScoringWeights.Friction.ML_DATA
                + ScoringWeights.Friction.ML_BACKEND + ScoringWeights.Friction.ML_QUALITY, EPSILON);
        assertEquals(1.0, ScoringWeights.Capability.PLUGIN_BACKEND + ScoringWeights.Capability.PLUGIN_ARCHITECTURE
                + ScoringWeights.Capability.PLUGIN_DEVTOOLS, EPSILON);
    }

    @Test
    void testPinnedThresholds() {
        assertEquals(0.5, ScoringWeights.Prediction.SKILL_GAP_THRESHOLD);
        assertEquals(0.7, ScoringWeights.Prediction.LOW_RISK_SUCCESS);
        assertEquals(0.4, ScoringWeights.Prediction.MEDIUM_RISK_SUCCESS);
        assertEquals(2000.0, ScoringWeights.Skill.ARCHITECTURE_SIZE_REFERENCE_KB);
        assertEquals(0.2, ScoringWeights.Skill.AI_LIBRARY_BONUS);
    }

    @Test
    void testFrontendLanguagesHaveFixedOrder() {
        assertEquals(List.of("JavaScript", "TypeScript", "HTML", "CSS"), ScoringWeights.Skill.FRONTEND_LANGUAGE_NAMES);
    }

    @Test
    void testRiskLevels() {
        assertEquals(RiskLevel.LOW, RiskLevel.forSuccess(0.71));
        assertEquals(RiskLevel.MEDIUM, RiskLevel.forSuccess(0.7));
        assertEquals(RiskLevel.HIGH, RiskLevel.forSuccess(0.4));
    }
}
