package com.repo.profiler.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Terminal output of the pipeline: skill, style, friction and capability
 * scoring plus gaps, recommendations and per-project predictions.
 */
public record PredictiveProfile(
        SkillVector skillVector,
        CodeStyleProfile codeStyleProfile,
        FrictionProfile frictionProfile,
        CapabilityAssessment capabilityAssessment,

        /** Dimension to gap size (1 - score), largest first */
        Map<String, Double> skillGaps,

        List<LearningRecommendation> learningRecommendations,

        /** Inferred tool-building aptitude; not part of the skill vector */
        double devtoolsSkill,

        /** Library category label to number of libraries in it */
        Map<String, Integer> libraryCategories,

        /** Project type tag to prediction, for every known project type */
        Map<String, ProjectPrediction> projectPredictions,

        Metadata metadata) {

    public static final String MODEL_VERSION = "2.0.0";
    public static final String DATA_SOURCE = "static_analysis_only";

    public PredictiveProfile {
        skillGaps = frozen(skillGaps);
        learningRecommendations = learningRecommendations == null ? List.of() : List.copyOf(learningRecommendations);
        libraryCategories = frozen(libraryCategories);
        projectPredictions = frozen(projectPredictions);
    }

    public record Metadata(
            String modelVersion,
            int basedOnRepos,
            String dataSource,
            String analysisTimestamp) {
    }

    private static <V> Map<String, V> frozen(Map<String, V> map) {
        if (map == null)
            return Map.of();
        return Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
}
