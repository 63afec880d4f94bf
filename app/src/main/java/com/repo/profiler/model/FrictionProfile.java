package com.repo.profiler.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Adoption friction per technology. Lower means easier to pick up.
 */
public record FrictionProfile(
        double reactFriction,
        double vueFriction,
        double typescriptFriction,
        double pythonTypingFriction,
        double mlProjectFriction,
        double devopsFriction,
        double microservicesFriction,
        double fullstackFriction,
        double mobileFriction) {

    /**
     * Serialized field name to score, in declaration order.
     */
    public Map<String, Double> asMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        map.put("react_friction", reactFriction);
        map.put("vue_friction", vueFriction);
        map.put("typescript_friction", typescriptFriction);
        map.put("python_typing_friction", pythonTypingFriction);
        map.put("ml_project_friction", mlProjectFriction);
        map.put("devops_friction", devopsFriction);
        map.put("microservices_friction", microservicesFriction);
        map.put("fullstack_friction", fullstackFriction);
        map.put("mobile_friction", mobileFriction);
        return map;
    }
}
