package com.repo.profiler.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Urgency tier of a learning recommendation.
 */
public enum Priority {
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
