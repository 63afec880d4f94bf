package com.repo.profiler.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Heuristic signals extracted from a single repository.
 * This is the common per-repository format consumed by the aggregation stages.
 */
public record RepositoryAnalysis(
        /** Repository name */
        String name,

        /** Language name to extension occurrence count */
        Map<String, Integer> languages,

        /** Library name to reference count, highest first */
        Map<String, Integer> libraries,

        /** Detected framework names, alphabetical */
        List<String> frameworks,

        /** Commit timestamps in order of appearance */
        List<CommitStamp> commits,

        /** Content size in kilobytes */
        double sizeKb,

        /** Lower-cased file extension to occurrence count, highest first */
        Map<String, Integer> fileTypes,

        /** Estimated test coverage percentage (0-100) */
        double testCoverage) {

    public RepositoryAnalysis {
        name = name == null ? "" : name;
        languages = frozen(languages);
        libraries = frozen(libraries);
        frameworks = frameworks == null ? List.of() : List.copyOf(frameworks);
        commits = commits == null ? List.of() : List.copyOf(commits);
        fileTypes = frozen(fileTypes);
    }

    /**
     * Create an analysis with no detected signals.
     */
    public static RepositoryAnalysis empty(String name) {
        return new RepositoryAnalysis(name, Map.of(), Map.of(), List.of(), List.of(), 0.0, Map.of(), 0.0);
    }

    private static Map<String, Integer> frozen(Map<String, Integer> map) {
        if (map == null)
            return Map.of();
        return Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
}
