package com.repo.profiler.model;

import java.util.List;

/**
 * A suggested growth area with the friction the developer would face.
 */
public record LearningRecommendation(
        String area,
        Priority priority,
        double friction,
        String rationale,
        List<String> suggestedTech,
        double estimatedFriction) {

    public LearningRecommendation {
        suggestedTech = suggestedTech == null ? List.of() : List.copyOf(suggestedTech);
    }
}
