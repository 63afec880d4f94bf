package com.repo.profiler;

import com.repo.profiler.analyzers.RepositoryAnalyzer;
import com.repo.profiler.core.ProfilerConfig;
import com.repo.profiler.core.RepositoryAnalysis;
import com.repo.profiler.core.RepositoryRecord;
import com.repo.profiler.dump.DumpParser;
import com.repo.profiler.filter.FilteredProfile;
import com.repo.profiler.filter.FilteredProfileBuilder;
import com.repo.profiler.model.PredictiveModeler;
import com.repo.profiler.model.PredictiveProfile;
import com.repo.profiler.model.ProjectPrediction;
import com.repo.profiler.report.ProfileJsonWriter;
import com.repo.profiler.translate.DeveloperTranslator;
import com.repo.profiler.translate.TranslatedProfile;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * Wires the five stages together: dump text to repository records, records to
 * analyses, analyses to a filtered profile, then translation and modelling.
 * Each stage can also be run on its own to resume from an intermediate file.
 */
public class ProfilePipeline {

    private final DumpParser parser;
    private final RepositoryAnalyzer analyzer;
    private final FilteredProfileBuilder filteredBuilder;
    private final DeveloperTranslator translator;
    private final PredictiveModeler modeler;

    public ProfilePipeline(ProfilerConfig config, Clock clock) {
        this.parser = new DumpParser();
        this.analyzer = new RepositoryAnalyzer(config);
        this.filteredBuilder = new FilteredProfileBuilder();
        this.translator = new DeveloperTranslator(config, clock);
        this.modeler = new PredictiveModeler();
    }

    public ProfilePipeline(ProfilerConfig config) {
        this(config, Clock.systemDefaultZone());
    }

    /**
     * Result of a full run, one value per persisted stage.
     */
    public record Result(
            FilteredProfile filtered,
            TranslatedProfile translated,
            PredictiveProfile predictive) {
    }

    public List<RepositoryRecord> parse(String dump) {
        return parser.parse(dump);
    }

    public List<RepositoryRecord> parse(Path dumpFile) throws IOException {
        return parser.parse(dumpFile);
    }

    public FilteredProfile filter(List<RepositoryRecord> records) {
        List<RepositoryAnalysis> analyses = analyzer.analyzeAll(records);
        return filteredBuilder.build(analyses);
    }

    public TranslatedProfile translate(FilteredProfile filtered) {
        return translator.translate(filtered);
    }

    public PredictiveProfile model(TranslatedProfile translated) {
        return modeler.model(translated);
    }

    /**
     * Prediction for a single project type. Tags match case-insensitively; an
     * unknown tag gets a neutral prediction.
     */
    public ProjectPrediction predict(String projectType, TranslatedProfile translated) {
        return modeler.predictProjectSuccess(projectType, translated);
    }

    public Result run(String dump) {
        FilteredProfile filtered = filter(parse(dump));
        TranslatedProfile translated = translate(filtered);
        return new Result(filtered, translated, model(translated));
    }

    public Result run(Path dumpFile) throws IOException {
        FilteredProfile filtered = filter(parse(dumpFile));
        TranslatedProfile translated = translate(filtered);
        return new Result(filtered, translated, model(translated));
    }

    /**
     * Write every stage output of a run into one directory.
     */
    public void write(Result result, Path outputDir, ProfileJsonWriter writer) throws IOException {
        writer.writeFiltered(result.filtered(), outputDir);
        writer.writeTranslated(result.translated(), outputDir);
        writer.writePredictive(result.predictive(), outputDir);
    }
}
