package com.repo.profiler.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Project types the model can score, with the friction field that governs each
 * and the minimum skill levels it needs.
 */
public enum ProjectType {
    API_SERVICE("api_service", null, Map.of()),
    CLI_TOOL("cli_tool", "python_typing_friction", Map.of()),
    DATA_PIPELINE("data_pipeline", null, Map.of()),
    ML_MODEL("ml_model", "ml_project_friction",
            thresholds(SkillVector.AI_ML, 0.4, SkillVector.DATA, 0.4)),
    FRONTEND_APP("frontend_app", "react_friction",
            thresholds(SkillVector.FRONTEND, 0.5, SkillVector.ARCHITECTURE, 0.4)),
    FULLSTACK_APP("fullstack_app", "fullstack_friction",
            thresholds(SkillVector.FRONTEND, 0.5, SkillVector.BACKEND, 0.6, SkillVector.ARCHITECTURE, 0.5)),
    INFRASTRUCTURE("infrastructure", "devops_friction",
            thresholds(SkillVector.CLOUD_INFRASTRUCTURE, 0.4, SkillVector.BACKEND, 0.5)),
    PLUGIN_SYSTEM("plugin_system", null, Map.of());

    private final String tag;
    private final String frictionField;
    private final Map<String, Double> gapThresholds;

    ProjectType(String tag, String frictionField, Map<String, Double> gapThresholds) {
        this.tag = tag;
        this.frictionField = frictionField;
        this.gapThresholds = gapThresholds;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    /**
     * Friction profile field relevant to this project type, if any.
     */
    public Optional<String> frictionField() {
        return Optional.ofNullable(frictionField);
    }

    /**
     * Skill dimension to minimum score, in reporting order.
     */
    public Map<String, Double> gapThresholds() {
        return gapThresholds;
    }

    public static Optional<ProjectType> fromTag(String tag) {
        return Arrays.stream(values())
                .filter(t -> t.tag.equalsIgnoreCase(tag == null ? "" : tag.strip()))
                .findFirst();
    }

    private static Map<String, Double> thresholds(Object... pairs) {
        Map<String, Double> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < pairs.length; i += 2) {
            map.put((String) pairs[i], (Double) pairs[i + 1]);
        }
        return Collections.unmodifiableMap(map);
    }
}
