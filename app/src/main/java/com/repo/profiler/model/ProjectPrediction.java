package com.repo.profiler.model;

import java.util.List;

/**
 * Predicted outcome of a project of one type for this developer.
 */
public record ProjectPrediction(
        String projectType,
        double successLikelihood,
        double frictionScore,
        RiskLevel riskLevel,

        /** Human-readable warnings, e.g. a steep learning curve */
        List<String> tensionPoints,

        /** Skills below the level the project type needs */
        List<String> skillGaps) {

    public ProjectPrediction {
        tensionPoints = tensionPoints == null ? List.of() : List.copyOf(tensionPoints);
        skillGaps = skillGaps == null ? List.of() : List.copyOf(skillGaps);
    }
}
