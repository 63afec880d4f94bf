package com.repo.profiler.translate;

import com.repo.profiler.core.CommitStamp;
import com.repo.profiler.core.ProfilerConfig;
import com.repo.profiler.core.RepositoryAnalysis;
import com.repo.profiler.core.Scores;
import com.repo.profiler.filter.FilteredProfile;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Translates a filtered profile into normalized percentages, ranked lists,
 * habit, depth, composition and quality metrics, and coarse skill scores.
 *
 * Every aggregation tolerates an empty profile and returns zero values.
 */
public class DeveloperTranslator {

    public static final double SECONDS_PER_DAY = 86_400.0;
    public static final double SECONDS_PER_WEEK = 604_800.0;

    // File-type buckets; membership may overlap
    public static final Set<String> FRONTEND_TYPES = Set.of("html", "css", "scss", "sass", "jsx", "tsx", "vue", "md");
    public static final Set<String> BACKEND_TYPES = Set.of("py", "sh", "js", "ts", "json", "yml", "yaml");
    public static final Set<String> DATA_TYPES = Set.of("json", "csv", "xml");

    private final ProfilerConfig config;
    private final Clock clock;

    public DeveloperTranslator(ProfilerConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    public DeveloperTranslator(ProfilerConfig config) {
        this(config, Clock.systemDefaultZone());
    }

    public DeveloperTranslator() {
        this(ProfilerConfig.defaults());
    }

    public TranslatedProfile translate(FilteredProfile filtered) {
        List<RepositoryAnalysis> repos = filtered.repositories();

        return new TranslatedProfile(
                aggregateLanguages(repos),
                aggregateLibraries(repos),
                aggregateFrameworks(repos),
                analyzeHabits(repos),
                analyzeDepth(repos),
                analyzeComposition(repos),
                scoreSkills(repos),
                analyzeQuality(repos),
                new TranslatedProfile.Metadata(
                        repos.size(),
                        filtered.totalCommits(),
                        LocalDateTime.now(clock).toString()));
    }

    Map<String, Double> aggregateLanguages(List<RepositoryAnalysis> repos) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (RepositoryAnalysis repo : repos) {
            repo.languages().forEach((lang, count) -> counts.merge(lang, count, Integer::sum));
        }

        long total = counts.values().stream().mapToLong(Integer::longValue).sum();
        Map<String, Double> percentages = new LinkedHashMap<>();
        if (total == 0) {
            return percentages;
        }
        counts.forEach((lang, count) -> percentages.put(lang, Scores.round(count * 100.0 / total, 2)));
        return percentages;
    }

    Map<String, Integer> aggregateLibraries(List<RepositoryAnalysis> repos) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (RepositoryAnalysis repo : repos) {
            repo.libraries().forEach((lib, count) -> counts.merge(lib, count, Integer::sum));
        }
        return Scores.rankDescending(counts);
    }

    Map<String, Integer> aggregateFrameworks(List<RepositoryAnalysis> repos) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (RepositoryAnalysis repo : repos) {
            for (String framework : repo.frameworks()) {
                counts.merge(framework, 1, Integer::sum);
            }
        }
        return Scores.rankDescending(counts);
    }

    TranslatedProfile.Habits analyzeHabits(List<RepositoryAnalysis> repos) {
        List<Long> timestamps = new ArrayList<>();
        double weightedSize = 0.0;
        int sizedCommits = 0;

        for (RepositoryAnalysis repo : repos) {
            for (CommitStamp commit : repo.commits()) {
                timestamps.add(commit.timestamp());
            }
            int commits = repo.commits().size();
            if (commits > 0) {
                // Weighting size / commits by commits leaves the repository size
                weightedSize += repo.sizeKb();
                sizedCommits += commits;
            }
        }
        timestamps.sort(null);

        double frequency = 0.0;
        if (timestamps.size() >= 2) {
            double spanWeeks = (timestamps.get(timestamps.size() - 1) - timestamps.get(0)) / SECONDS_PER_WEEK;
            frequency = timestamps.size() / Math.max(spanWeeks, 1.0);
        }

        double consistency = 0.0;
        if (timestamps.size() >= 3) {
            List<Double> gapsInDays = new ArrayList<>();
            for (int i = 1; i < timestamps.size(); i++) {
                gapsInDays.add((timestamps.get(i) - timestamps.get(i - 1)) / SECONDS_PER_DAY);
            }
            consistency = 1.0 / (1.0 + Scores.sampleStdev(gapsInDays));
        }

        double avgCommitSize = sizedCommits > 0 ? weightedSize / sizedCommits : 0.0;

        return new TranslatedProfile.Habits(
                Scores.round(frequency, 2),
                Scores.round(consistency, 3),
                Scores.round(avgCommitSize, 2),
                CommitPattern.of(frequency, config));
    }

    TranslatedProfile.TechnicalDepth analyzeDepth(List<RepositoryAnalysis> repos) {
        if (repos.isEmpty()) {
            return TranslatedProfile.TechnicalDepth.zero();
        }
        List<Double> sizes = repos.stream().map(RepositoryAnalysis::sizeKb).toList();
        double avgSize = Scores.mean(sizes);
        double maxSize = sizes.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        double depthScore = Math.min(avgSize / config.getDepthReferenceKb(), 1.0);

        return new TranslatedProfile.TechnicalDepth(
                Scores.round(depthScore, 3),
                Scores.round(avgSize, 2),
                Scores.round(maxSize, 2),
                DepthLevel.of(depthScore, config));
    }

    TranslatedProfile.Composition analyzeComposition(List<RepositoryAnalysis> repos) {
        long frontend = 0;
        long backend = 0;
        long data = 0;

        for (RepositoryAnalysis repo : repos) {
            for (Map.Entry<String, Integer> entry : repo.fileTypes().entrySet()) {
                String type = entry.getKey();
                int count = entry.getValue();
                if (FRONTEND_TYPES.contains(type))
                    frontend += count;
                if (BACKEND_TYPES.contains(type))
                    backend += count;
                if (DATA_TYPES.contains(type))
                    data += count;
            }
        }

        long total = frontend + backend + data;
        if (total == 0) {
            return TranslatedProfile.Composition.zero();
        }
        return new TranslatedProfile.Composition(
                Scores.round((double) frontend / total, 3),
                Scores.round((double) backend / total, 3),
                Scores.round((double) data / total, 3));
    }

    Map<String, Double> scoreSkills(List<RepositoryAnalysis> repos) {
        Set<String> combined = new HashSet<>();
        for (RepositoryAnalysis repo : repos) {
            repo.libraries().keySet().forEach(lib -> combined.add(lib.toLowerCase(Locale.ROOT)));
            repo.frameworks().forEach(fw -> combined.add(fw.toLowerCase(Locale.ROOT)));
        }

        Map<String, Double> skills = new LinkedHashMap<>();
        for (Map.Entry<String, Set<String>> area : SkillIndicators.INDICATORS.entrySet()) {
            Set<String> indicators = area.getValue();
            long hits = indicators.stream().filter(combined::contains).count();
            double score = (double) hits / Math.max(indicators.size(), 1);
            if (score > config.getMinSkillScore()) {
                skills.put(area.getKey(), Scores.round(score, 3));
            }
        }
        return skills;
    }

    TranslatedProfile.Quality analyzeQuality(List<RepositoryAnalysis> repos) {
        if (repos.isEmpty()) {
            return TranslatedProfile.Quality.zero();
        }
        double avgCoverage = Scores.mean(repos.stream().map(RepositoryAnalysis::testCoverage).toList());
        double qualityScore = Math.min(avgCoverage / 100.0, 1.0);

        return new TranslatedProfile.Quality(
                Scores.round(avgCoverage, 2),
                Scores.round(qualityScore, 3),
                QualityRating.of(avgCoverage, config));
    }
}
