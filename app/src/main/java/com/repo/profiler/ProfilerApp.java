package com.repo.profiler;

import com.repo.profiler.core.ProfilerConfig;
import com.repo.profiler.filter.FilteredProfile;
import com.repo.profiler.model.PredictiveProfile;
import com.repo.profiler.report.ConsoleReport;
import com.repo.profiler.report.ProfileJsonReader;
import com.repo.profiler.report.ProfileJsonWriter;
import com.repo.profiler.translate.TranslatedProfile;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Developer Profiler - builds a predictive developer profile from a repository dump.
 *
 * Usage: java -jar app.jar --dump <file> [--output <dir>] [--config <dir>] [--project <type>]
 */
public class ProfilerApp {

    public static void main(String[] args) {
        System.out.println("=== Developer Profiler ===");

        CliArgs cliArgs = parseArgs(args);
        if (cliArgs == null) {
            printUsage();
            System.exit(1);
        }

        try {
            new ProfilerApp().run(cliArgs);
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    private static void printUsage() {
        System.err.println("""
                Usage: java -jar app.jar --dump <file> [--output <dir>] [--config <dir>] [--project <type>]

                Input (exactly one):
                  --dump <file>        Repository dump text to run the full pipeline on
                  --filtered <file>    Resume from a filtered.json (translate and model)
                  --translated <file>  Resume from a translated.json (model only)

                Options:
                  --output <dir>       Output directory for JSON files (default: current directory)
                  --config <dir>       Directory containing profiler.yaml (default: built-in values)
                  --project <type>     Print the prediction for one project type, e.g. api_service
                """);
    }

    record CliArgs(
            Path dumpFile,
            Path filteredFile,
            Path translatedFile,
            Path outputDir,
            Path configDir,
            String projectType) {
    }

    static CliArgs parseArgs(String[] args) {
        Path dumpFile = null;
        Path filteredFile = null;
        Path translatedFile = null;
        Path outputDir = Path.of(".");
        Path configDir = null;
        String projectType = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--dump" -> {
                    if (i + 1 < args.length)
                        dumpFile = Path.of(args[++i]);
                }
                case "--filtered" -> {
                    if (i + 1 < args.length)
                        filteredFile = Path.of(args[++i]);
                }
                case "--translated" -> {
                    if (i + 1 < args.length)
                        translatedFile = Path.of(args[++i]);
                }
                case "--output" -> {
                    if (i + 1 < args.length)
                        outputDir = Path.of(args[++i]);
                }
                case "--config" -> {
                    if (i + 1 < args.length)
                        configDir = Path.of(args[++i]);
                }
                case "--project" -> {
                    if (i + 1 < args.length)
                        projectType = args[++i];
                }
                default -> System.err.println("Ignoring unknown argument: " + args[i]);
            }
        }

        int inputs = (dumpFile != null ? 1 : 0) + (filteredFile != null ? 1 : 0) + (translatedFile != null ? 1 : 0);
        if (inputs != 1) {
            return null;
        }
        return new CliArgs(dumpFile, filteredFile, translatedFile, outputDir, configDir, projectType);
    }

    void run(CliArgs args) throws Exception {
        ProfilerConfig config = args.configDir() != null
                ? ProfilerConfig.load(args.configDir())
                : ProfilerConfig.defaults();

        ProfilePipeline pipeline = new ProfilePipeline(config);
        ProfileJsonReader reader = new ProfileJsonReader();
        ProfileJsonWriter writer = new ProfileJsonWriter();
        ConsoleReport report = new ConsoleReport();
        Files.createDirectories(args.outputDir());

        TranslatedProfile translated;
        if (args.translatedFile() != null) {
            System.out.println("\n>>> LOADING TRANSLATED PROFILE <<<");
            translated = reader.readTranslated(args.translatedFile());
        } else {
            FilteredProfile filtered;
            if (args.filteredFile() != null) {
                System.out.println("\n>>> LOADING FILTERED PROFILE <<<");
                filtered = reader.readFiltered(args.filteredFile());
            } else {
                System.out.println("\n>>> PHASE 1: PARSING AND ANALYZING DUMP <<<");
                filtered = pipeline.filter(pipeline.parse(args.dumpFile()));
                writer.writeFiltered(filtered, args.outputDir());
            }
            report.printFilteredSummary(filtered);

            System.out.println("\n>>> PHASE 2: TRANSLATING PROFILE <<<");
            translated = pipeline.translate(filtered);
            writer.writeTranslated(translated, args.outputDir());
            report.printTranslatedSummary(translated);
        }

        System.out.println("\n>>> PHASE 3: PREDICTIVE MODELLING <<<");
        PredictiveProfile predictive = pipeline.model(translated);
        writer.writePredictive(predictive, args.outputDir());
        report.printPredictiveSummary(predictive);

        if (args.projectType() != null) {
            report.printProjectPrediction(pipeline.predict(args.projectType(), translated));
        }
    }
}
