package com.repo.profiler.analyzers;

import com.repo.profiler.core.ProfilerConfig;
import com.repo.profiler.core.Scores;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Estimates test coverage as the ratio of test indicators to code files.
 * This is a density heuristic, not measured line coverage.
 */
public class TestCoverageEstimator implements SignalDetector<Double> {

    // Test naming, test directories and assertion keywords
    private static final List<Pattern> TEST_INDICATORS = List.of(
            indicator("\\btest[_-]"),
            indicator("[_-]test\\."),
            indicator("\\.test\\."),
            indicator("\\bspec/"),
            indicator("\\btest/"),
            indicator("\\btesting\\b"),
            indicator("\\bassert\\b"),
            indicator("\\bpytest\\b"));

    private static final Pattern CODE_FILE_PATTERN = Pattern.compile("\\.(py|js|ts|sh)\\b");

    public static final double MAX_COVERAGE = 100.0;

    private static Pattern indicator(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    @Override
    public Double detect(String content, ProfilerConfig config) {
        int codeFiles = SignalDetector.countMatches(CODE_FILE_PATTERN, content);
        if (codeFiles == 0) {
            return 0.0;
        }

        int testMatches = 0;
        for (Pattern pattern : TEST_INDICATORS) {
            testMatches += SignalDetector.countMatches(pattern, content);
        }

        double coverage = Math.min(((double) testMatches / codeFiles) * 100, MAX_COVERAGE);
        return Scores.round(coverage, 2);
    }
}
