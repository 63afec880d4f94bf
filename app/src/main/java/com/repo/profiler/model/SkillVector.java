package com.repo.profiler.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Normalized skill scores across six domains, each in [0,1].
 */
public record SkillVector(
        double backend,
        double frontend,
        double data,
        double aiMl,
        double cloudInfrastructure,
        double architecture) {

    public static final String BACKEND = "backend";
    public static final String FRONTEND = "frontend";
    public static final String DATA = "data";
    public static final String AI_ML = "ai_ml";
    public static final String CLOUD_INFRASTRUCTURE = "cloud_infrastructure";
    public static final String ARCHITECTURE = "architecture";

    /**
     * Dimension name to score, in declaration order.
     */
    public Map<String, Double> asMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        map.put(BACKEND, backend);
        map.put(FRONTEND, frontend);
        map.put(DATA, data);
        map.put(AI_ML, aiMl);
        map.put(CLOUD_INFRASTRUCTURE, cloudInfrastructure);
        map.put(ARCHITECTURE, architecture);
        return map;
    }

    /**
     * Score for a dimension name; unknown names score 0.
     */
    public double score(String dimension) {
        return asMap().getOrDefault(dimension, 0.0);
    }
}
