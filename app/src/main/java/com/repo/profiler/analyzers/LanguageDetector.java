package com.repo.profiler.analyzers;

import com.repo.profiler.core.ProfilerConfig;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Counts language usage from file extension mentions.
 */
public class LanguageDetector implements SignalDetector<Map<String, Integer>> {

    /** Language name to extension pattern, in reporting order */
    public static final Map<String, Pattern> LANGUAGE_PATTERNS = buildPatterns();

    private static Map<String, Pattern> buildPatterns() {
        Map<String, Pattern> patterns = new LinkedHashMap<>();
        patterns.put("Python", ext("\\.py\\b"));
        patterns.put("JavaScript", ext("\\.js\\b"));
        patterns.put("TypeScript", ext("\\.ts\\b"));
        patterns.put("Shell", ext("\\.sh\\b"));
        patterns.put("JSON", ext("\\.json\\b"));
        patterns.put("Markdown", ext("\\.md\\b"));
        patterns.put("YAML", ext("\\.yml\\b|\\.yaml\\b"));
        patterns.put("HTML", ext("\\.html\\b"));
        patterns.put("CSS", ext("\\.css\\b"));
        return Collections.unmodifiableMap(patterns);
    }

    private static Pattern ext(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    @Override
    public Map<String, Integer> detect(String content, ProfilerConfig config) {
        Map<String, Integer> languages = new LinkedHashMap<>();
        for (Map.Entry<String, Pattern> entry : LANGUAGE_PATTERNS.entrySet()) {
            int matches = SignalDetector.countMatches(entry.getValue(), content);
            if (matches > 0) {
                languages.put(entry.getKey(), matches);
            }
        }
        return languages;
    }
}
