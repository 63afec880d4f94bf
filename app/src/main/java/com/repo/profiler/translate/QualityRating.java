package com.repo.profiler.translate;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.repo.profiler.core.ProfilerConfig;

/**
 * Rating bucket for average estimated test coverage.
 */
public enum QualityRating {
    EXCELLENT("excellent"),
    GOOD("good"),
    FAIR("fair"),
    NEEDS_IMPROVEMENT("needs_improvement");

    private final String label;

    QualityRating(String label) {
        this.label = label;
    }

    /**
     * Rate an average coverage percentage.
     */
    public static QualityRating of(double avgCoverage, ProfilerConfig config) {
        if (avgCoverage > config.getQualityExcellent())
            return EXCELLENT;
        if (avgCoverage > config.getQualityGood())
            return GOOD;
        if (avgCoverage > config.getQualityFair())
            return FAIR;
        return NEEDS_IMPROVEMENT;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Resolve a label. Older documents spell the lowest bucket with a space.
     */
    @JsonCreator
    public static QualityRating fromLabel(String label) {
        String normalized = label == null ? "" : label.strip().replace(' ', '_');
        for (QualityRating value : values()) {
            if (value.label.equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        return NEEDS_IMPROVEMENT;
    }
}
