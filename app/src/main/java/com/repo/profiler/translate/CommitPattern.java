package com.repo.profiler.translate;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.repo.profiler.core.ProfilerConfig;

/**
 * How often a developer commits.
 */
public enum CommitPattern {
    DAILY("daily"),
    REGULAR("regular"),
    WEEKLY("weekly"),
    SPORADIC("sporadic");

    private final String label;

    CommitPattern(String label) {
        this.label = label;
    }

    /**
     * Bucket a commits-per-week frequency. Cutoffs are exclusive, so exactly
     * 5.0 is regular rather than daily.
     */
    public static CommitPattern of(double frequency, ProfilerConfig config) {
        if (frequency > config.getDailyFrequency())
            return DAILY;
        if (frequency > config.getRegularFrequency())
            return REGULAR;
        if (frequency > config.getWeeklyFrequency())
            return WEEKLY;
        return SPORADIC;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Resolve a label, falling back to the lowest bucket for unknown text.
     */
    @JsonCreator
    public static CommitPattern fromLabel(String label) {
        for (CommitPattern value : values()) {
            if (value.label.equalsIgnoreCase(label == null ? "" : label.strip())) {
                return value;
            }
        }
        return SPORADIC;
    }
}
