package com.repo.profiler.analyzers;

import com.repo.profiler.core.ProfilerConfig;
import com.repo.profiler.core.Scores;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Counts library references from import statements and dependency manifests.
 */
public class LibraryDetector implements SignalDetector<Map<String, Integer>> {

    // import foo / from foo.bar
    private static final Pattern IMPORT_PATTERN = Pattern.compile(
            "(?:import|from)\\s+([a-zA-Z0-9_.-]+)");

    private static final List<Pattern> DEPENDENCY_PATTERNS = List.of(
            // package.json style: "name": "1.2.3" (optionally ^ or ~)
            Pattern.compile("\"([a-zA-Z0-9_-]+)\":\\s*\"[\\^~]?\\d+\\.\\d+\\.\\d+\""),
            // requirements style: name==1.2.3 or "name>=1.2.3"
            Pattern.compile("(?m)(?:^|[\\s\"'])([a-zA-Z0-9_-]+)\\s*(?:==|>=|~=|<=)\\s*\\d+\\.\\d+\\.\\d+"));

    /** Names too common to say anything about a developer */
    public static final Set<String> STOPLIST = Set.of("sys", "os", "io", "re");

    public static final int MIN_NAME_LENGTH = 3;

    @Override
    public Map<String, Integer> detect(String content, ProfilerConfig config) {
        Map<String, Integer> libraries = new LinkedHashMap<>();

        Matcher imports = IMPORT_PATTERN.matcher(content);
        while (imports.find()) {
            libraries.merge(firstSegment(imports.group(1)), 1, Integer::sum);
        }

        for (Pattern pattern : DEPENDENCY_PATTERNS) {
            Matcher deps = pattern.matcher(content);
            while (deps.find()) {
                libraries.merge(deps.group(1), 1, Integer::sum);
            }
        }

        libraries.keySet().removeIf(lib -> lib.length() < MIN_NAME_LENGTH || STOPLIST.contains(lib));
        return Scores.topDescending(libraries, config.getMaxLibraries());
    }

    private String firstSegment(String name) {
        int dot = name.indexOf('.');
        return dot >= 0 ? name.substring(0, dot) : name;
    }
}
