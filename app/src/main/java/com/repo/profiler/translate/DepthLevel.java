package com.repo.profiler.translate;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.repo.profiler.core.ProfilerConfig;

/**
 * Coarse technical depth level derived from repository size.
 */
public enum DepthLevel {
    ADVANCED("advanced"),
    INTERMEDIATE("intermediate"),
    BEGINNER("beginner");

    private final String label;

    DepthLevel(String label) {
        this.label = label;
    }

    public static DepthLevel of(double depthScore, ProfilerConfig config) {
        if (depthScore > config.getDepthAdvanced())
            return ADVANCED;
        if (depthScore > config.getDepthIntermediate())
            return INTERMEDIATE;
        return BEGINNER;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static DepthLevel fromLabel(String label) {
        for (DepthLevel value : values()) {
            if (value.label.equalsIgnoreCase(label == null ? "" : label.strip())) {
                return value;
            }
        }
        return BEGINNER;
    }
}
