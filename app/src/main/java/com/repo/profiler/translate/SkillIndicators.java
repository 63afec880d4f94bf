package com.repo.profiler.translate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Indicator sets for coarse skill scoring. A skill area scores the fraction of
 * its indicators found among the developer's library and framework names.
 */
public final class SkillIndicators {

    public static final String DEVTOOLS_AUTOMATION = "devtools_automation";
    public static final String AI_ML = "ai_ml";
    public static final String PLUGIN_DEVELOPMENT = "plugin_development";
    public static final String WEB_DEVELOPMENT = "web_development";
    public static final String MOBILE_DEVELOPMENT = "mobile_development";
    public static final String CLOUD_DEVOPS = "cloud_devops";
    public static final String DATA_ENGINEERING = "data_engineering";
    public static final String CYBERSECURITY = "cybersecurity";

    /** Skill area to indicator names (lower case), in reporting order */
    public static final Map<String, Set<String>> INDICATORS;

    static {
        Map<String, Set<String>> indicators = new LinkedHashMap<>();
        indicators.put(DEVTOOLS_AUTOMATION,
                Set.of("pytest", "git", "github", "docker", "validation", "scaffold"));
        indicators.put(AI_ML,
                Set.of("ollama", "claude", "llm", "ai", "ml"));
        indicators.put(PLUGIN_DEVELOPMENT,
                Set.of("plugin", "marketplace", "cli", "tools"));
        indicators.put(WEB_DEVELOPMENT,
                Set.of("react", "vue", "angular", "express", "django", "flask",
                        "fastapi", "nextjs", "nestjs", "rails"));
        indicators.put(MOBILE_DEVELOPMENT,
                Set.of("react-native", "flutter", "swift", "kotlin", "ionic"));
        indicators.put(CLOUD_DEVOPS,
                Set.of("docker", "kubernetes", "terraform", "aws", "azure", "gcp",
                        "ansible", "jenkins", "github-actions"));
        indicators.put(DATA_ENGINEERING,
                Set.of("spark", "hadoop", "airflow", "kafka", "dask", "beam"));
        indicators.put(CYBERSECURITY,
                Set.of("cryptography", "pycrypto", "requests", "scapy", "nmap"));
        INDICATORS = Collections.unmodifiableMap(indicators);
    }

    private SkillIndicators() {
    }
}
