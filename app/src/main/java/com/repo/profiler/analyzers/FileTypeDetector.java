package com.repo.profiler.analyzers;

import com.repo.profiler.core.ProfilerConfig;
import com.repo.profiler.core.Scores;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds a histogram of dotted file suffixes.
 */
public class FileTypeDetector implements SignalDetector<Map<String, Integer>> {

    private static final Pattern EXTENSION_PATTERN = Pattern.compile("\\.([a-zA-Z0-9]+)\\b");

    @Override
    public Map<String, Integer> detect(String content, ProfilerConfig config) {
        Map<String, Integer> fileTypes = new LinkedHashMap<>();
        Matcher matcher = EXTENSION_PATTERN.matcher(content);
        while (matcher.find()) {
            fileTypes.merge(matcher.group(1).toLowerCase(Locale.ROOT), 1, Integer::sum);
        }
        return Scores.topDescending(fileTypes, config.getMaxFileTypes());
    }
}
