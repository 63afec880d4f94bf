package com.repo.profiler.translate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Normalized developer summary derived from a filtered profile.
 * Percentages and ratios rather than raw counts.
 */
public record TranslatedProfile(
        /** Language name to share of all language mentions, in percent */
        Map<String, Double> languages,

        /** Library name to total reference count, highest first */
        Map<String, Integer> libraries,

        /** Framework name to number of repositories using it, highest first */
        Map<String, Integer> frameworks,

        Habits habits,
        TechnicalDepth technicalDepth,
        Composition composition,

        /** Coarse skill area to score; areas at or below the noise floor are absent */
        Map<String, Double> skills,

        Quality quality,
        Metadata metadata) {

    public TranslatedProfile {
        languages = frozen(languages);
        libraries = frozen(libraries);
        frameworks = frozen(frameworks);
        skills = frozen(skills);
        habits = habits == null ? Habits.zero() : habits;
        technicalDepth = technicalDepth == null ? TechnicalDepth.zero() : technicalDepth;
        composition = composition == null ? Composition.zero() : composition;
        quality = quality == null ? Quality.zero() : quality;
        metadata = metadata == null ? new Metadata(0, 0, "") : metadata;
    }

    /**
     * Commit cadence.
     */
    public record Habits(
            /** Commits per week over the observed span */
            double frequency,

            /** 1 / (1 + stdev of gaps in days); higher is more regular */
            double consistency,

            double avgCommitSizeKb,
            CommitPattern commitPattern) {

        public static Habits zero() {
            return new Habits(0.0, 0.0, 0.0, CommitPattern.SPORADIC);
        }
    }

    public record TechnicalDepth(
            double depthScore,
            double avgRepoSize,
            double maxRepoSize,
            DepthLevel level) {

        public static TechnicalDepth zero() {
            return new TechnicalDepth(0.0, 0.0, 0.0, DepthLevel.BEGINNER);
        }
    }

    /**
     * Fractions of categorized file types. Buckets overlap in membership but the
     * fractions are normalized by their combined total.
     */
    public record Composition(
            double frontend,
            double backend,
            double data) {

        public static Composition zero() {
            return new Composition(0.0, 0.0, 0.0);
        }
    }

    public record Quality(
            double avgTestCoverage,
            double qualityScore,
            QualityRating rating) {

        public static Quality zero() {
            return new Quality(0.0, 0.0, QualityRating.NEEDS_IMPROVEMENT);
        }
    }

    public record Metadata(
            int totalRepositories,
            int totalCommits,
            String analysisTimestamp) {
    }

    private static <V> Map<String, V> frozen(Map<String, V> map) {
        if (map == null)
            return Map.of();
        return Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
}
