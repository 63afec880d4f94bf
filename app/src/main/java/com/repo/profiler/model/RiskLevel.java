package com.repo.profiler.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RiskLevel {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String label;

    RiskLevel(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static RiskLevel forSuccess(double successLikelihood) {
        if (successLikelihood > ScoringWeights.Prediction.LOW_RISK_SUCCESS)
            return LOW;
        if (successLikelihood > ScoringWeights.Prediction.MEDIUM_RISK_SUCCESS)
            return MEDIUM;
        return HIGH;
    }
}
