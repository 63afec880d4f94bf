package com.repo.profiler.analyzers;

import com.repo.profiler.core.ProfilerConfig;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Detects frameworks and tooling by signature patterns.
 */
public class FrameworkDetector implements SignalDetector<List<String>> {

    public static final Map<String, Pattern> FRAMEWORK_SIGNATURES = buildSignatures();

    private static Map<String, Pattern> buildSignatures() {
        Map<String, Pattern> signatures = new LinkedHashMap<>();
        signatures.put("pytest", sig("\\bpytest\\b"));
        signatures.put("GitHub Actions", sig("\\.github/workflows"));
        signatures.put("Git", sig("\\bgit\\b"));
        signatures.put("Docker", sig("\\bdocker\\b"));
        signatures.put("Claude Code", sig("\\bclaude.code\\b|claude-plugin"));
        signatures.put("Ollama", sig("\\bollama\\b"));
        signatures.put("MCP", sig("\\bmcp\\b"));
        return Collections.unmodifiableMap(signatures);
    }

    private static Pattern sig(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    @Override
    public List<String> detect(String content, ProfilerConfig config) {
        return FRAMEWORK_SIGNATURES.entrySet().stream()
                .filter(e -> e.getValue().matcher(content).find())
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
    }
}
