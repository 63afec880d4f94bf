package com.repo.profiler.core;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Configuration for developer profiling.
 * Loaded from profiler.yaml in the given directory or uses the pinned defaults.
 */
public class ProfilerConfig {

    public static final String CONFIG_FILE_NAME = "profiler.yaml";

    // Structural caps
    public static final int DEFAULT_MAX_LIBRARIES = 30;
    public static final int DEFAULT_MAX_FILE_TYPES = 20;
    public static final int DEFAULT_MAX_COMMITS = 100;

    // Commit frequency cutoffs (commits per week, exclusive)
    public static final double DEFAULT_DAILY_FREQUENCY = 5.0;
    public static final double DEFAULT_REGULAR_FREQUENCY = 2.0;
    public static final double DEFAULT_WEEKLY_FREQUENCY = 0.5;

    // Technical depth
    public static final double DEFAULT_DEPTH_REFERENCE_KB = 500.0;
    public static final double DEFAULT_DEPTH_ADVANCED = 0.7;
    public static final double DEFAULT_DEPTH_INTERMEDIATE = 0.4;

    // Quality rating cutoffs (average coverage percent, exclusive)
    public static final double DEFAULT_QUALITY_EXCELLENT = 70.0;
    public static final double DEFAULT_QUALITY_GOOD = 40.0;
    public static final double DEFAULT_QUALITY_FAIR = 20.0;

    public static final double DEFAULT_MIN_SKILL_SCORE = 0.05;

    private int maxLibraries = DEFAULT_MAX_LIBRARIES;
    private int maxFileTypes = DEFAULT_MAX_FILE_TYPES;
    private int maxCommits = DEFAULT_MAX_COMMITS;

    private double dailyFrequency = DEFAULT_DAILY_FREQUENCY;
    private double regularFrequency = DEFAULT_REGULAR_FREQUENCY;
    private double weeklyFrequency = DEFAULT_WEEKLY_FREQUENCY;

    private double depthReferenceKb = DEFAULT_DEPTH_REFERENCE_KB;
    private double depthAdvanced = DEFAULT_DEPTH_ADVANCED;
    private double depthIntermediate = DEFAULT_DEPTH_INTERMEDIATE;

    private double qualityExcellent = DEFAULT_QUALITY_EXCELLENT;
    private double qualityGood = DEFAULT_QUALITY_GOOD;
    private double qualityFair = DEFAULT_QUALITY_FAIR;

    private double minSkillScore = DEFAULT_MIN_SKILL_SCORE;

    /**
     * Load configuration from YAML file or return defaults.
     */
    public static ProfilerConfig load(Path configDir) {
        ProfilerConfig config = new ProfilerConfig();
        Path configFile = configDir.resolve(CONFIG_FILE_NAME);

        if (Files.exists(configFile)) {
            try (InputStream is = Files.newInputStream(configFile)) {
                Yaml yaml = new Yaml();
                Object data = yaml.load(is);
                if (data instanceof Map<?, ?> map) {
                    config.parseYaml(asMap(map));
                }
                System.out.println("Loaded configuration from: " + configFile);
            } catch (IOException | RuntimeException e) {
                // SnakeYAML reports malformed documents as unchecked YAMLException
                System.err.println("Warning: Could not read config file, using defaults: " + e.getMessage());
                return new ProfilerConfig();
            }
        }
        return config;
    }

    /**
     * Default configuration.
     */
    public static ProfilerConfig defaults() {
        return new ProfilerConfig();
    }

    private void parseYaml(Map<String, Object> data) {
        Map<String, Object> caps = section(data, "caps");
        maxLibraries = getInt(caps, "libraries", maxLibraries);
        maxFileTypes = getInt(caps, "file_types", maxFileTypes);
        maxCommits = getInt(caps, "commits", maxCommits);

        Map<String, Object> thresholds = section(data, "thresholds");

        Map<String, Object> pattern = section(thresholds, "commit_pattern");
        dailyFrequency = getDouble(pattern, "daily", dailyFrequency);
        regularFrequency = getDouble(pattern, "regular", regularFrequency);
        weeklyFrequency = getDouble(pattern, "weekly", weeklyFrequency);

        Map<String, Object> depth = section(thresholds, "depth");
        depthReferenceKb = getDouble(depth, "reference_kb", depthReferenceKb);
        depthAdvanced = getDouble(depth, "advanced", depthAdvanced);
        depthIntermediate = getDouble(depth, "intermediate", depthIntermediate);

        Map<String, Object> quality = section(thresholds, "quality");
        qualityExcellent = getDouble(quality, "excellent", qualityExcellent);
        qualityGood = getDouble(quality, "good", qualityGood);
        qualityFair = getDouble(quality, "fair", qualityFair);

        Map<String, Object> skills = section(thresholds, "skills");
        minSkillScore = getDouble(skills, "min_score", minSkillScore);
    }

    private static Map<String, Object> section(Map<String, Object> parent, String key) {
        Object val = parent.get(key);
        if (val instanceof Map<?, ?> map) {
            return asMap(map);
        }
        return Map.of();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Map<?, ?> map) {
        return (Map<String, Object>) map;
    }

    private int getInt(Map<String, Object> map, String key, int defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number)
            return ((Number) val).intValue();
        return defaultVal;
    }

    private double getDouble(Map<String, Object> map, String key, double defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number)
            return ((Number) val).doubleValue();
        return defaultVal;
    }

    // === Getters ===

    // Caps
    public int getMaxLibraries() {
        return maxLibraries;
    }

    public int getMaxFileTypes() {
        return maxFileTypes;
    }

    public int getMaxCommits() {
        return maxCommits;
    }

    // Commit pattern
    public double getDailyFrequency() {
        return dailyFrequency;
    }

    public double getRegularFrequency() {
        return regularFrequency;
    }

    public double getWeeklyFrequency() {
        return weeklyFrequency;
    }

    // Depth
    public double getDepthReferenceKb() {
        return depthReferenceKb;
    }

    public double getDepthAdvanced() {
        return depthAdvanced;
    }

    public double getDepthIntermediate() {
        return depthIntermediate;
    }

    // Quality
    public double getQualityExcellent() {
        return qualityExcellent;
    }

    public double getQualityGood() {
        return qualityGood;
    }

    public double getQualityFair() {
        return qualityFair;
    }

    public double getMinSkillScore() {
        return minSkillScore;
    }
}
