package com.repo.profiler.analyzers;

import com.repo.profiler.core.CommitStamp;
import com.repo.profiler.core.ProfilerConfig;
import com.repo.profiler.core.RepositoryAnalysis;
import com.repo.profiler.core.RepositoryRecord;
import com.repo.profiler.core.Scores;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Runs every signal detector over one repository section.
 * Deterministic and side-effect free.
 */
public class RepositoryAnalyzer {

    private final ProfilerConfig config;
    private final LanguageDetector languageDetector = new LanguageDetector();
    private final LibraryDetector libraryDetector = new LibraryDetector();
    private final FrameworkDetector frameworkDetector = new FrameworkDetector();
    private final CommitTimestampExtractor commitExtractor = new CommitTimestampExtractor();
    private final FileTypeDetector fileTypeDetector = new FileTypeDetector();
    private final TestCoverageEstimator coverageEstimator = new TestCoverageEstimator();

    public RepositoryAnalyzer(ProfilerConfig config) {
        this.config = config;
    }

    public RepositoryAnalyzer() {
        this(ProfilerConfig.defaults());
    }

    public RepositoryAnalysis analyze(RepositoryRecord record) {
        String content = record.content();

        Map<String, Integer> languages = languageDetector.detect(content, config);
        Map<String, Integer> libraries = libraryDetector.detect(content, config);
        List<String> frameworks = frameworkDetector.detect(content, config);
        List<CommitStamp> commits = commitExtractor.detect(content, config);
        Map<String, Integer> fileTypes = fileTypeDetector.detect(content, config);
        double testCoverage = coverageEstimator.detect(content, config);

        return new RepositoryAnalysis(
                record.name(),
                languages,
                libraries,
                frameworks,
                commits,
                sizeKb(content),
                fileTypes,
                testCoverage);
    }

    /**
     * Analyze records in order.
     */
    public List<RepositoryAnalysis> analyzeAll(List<RepositoryRecord> records) {
        return records.stream()
                .map(this::analyze)
                .toList();
    }

    private double sizeKb(String content) {
        return Scores.round(content.getBytes(StandardCharsets.UTF_8).length / 1024.0, 2);
    }
}
