package com.repo.profiler;

import com.repo.profiler.core.ProfilerConfig;
import com.repo.profiler.dump.DumpParser;
import com.repo.profiler.model.ProjectPrediction;
import com.repo.profiler.model.RiskLevel;
import com.repo.profiler.report.ProfileJsonWriter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProfilePipelineTest {

    @TempDir
    Path tempDir;

    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);
    private final ProfilePipeline pipeline = new ProfilePipeline(ProfilerConfig.defaults(), clock);

    static String sampleDump() {
        String banner = DumpParser.BANNER;
        return "GitHub Repositories Dump\nUser: octo\n" + banner + "\n\n"
                + banner + "\nREPOSITORY: web\n" + banner + "\n"
                + "\n" + banner + "\nFILE: app.py\n" + banner + "\nprint('hello')\n"
                + "\n" + banner + "\nFILE: requirements.txt\n" + banner + "\n\"flask==2.0.0\"\n"
                + banner + "\nREPOSITORY: scripts\n" + banner + "\n"
                + "\n" + banner + "\nFILE: deploy.sh\n" + banner + "\ndocker build .\n"
                + "# 2024-01-01T09:00:00 2024-01-02T09:00:00 2024-01-04T09:00:00\n";
    }

    @Test
    void testFullRun() {
        ProfilePipeline.Result result = pipeline.run(sampleDump());

        assertEquals(2, result.filtered().repositories().size());
        assertEquals(Map.of("Python", 1), result.filtered().repositories().get(0).languages());
        assertTrue(result.filtered().repositories().get(0).libraries().containsKey("flask"));
        assertEquals(List.of("Docker"), result.filtered().repositories().get(1).frameworks());
        assertEquals(3, result.filtered().totalCommits());

        assertEquals(2, result.translated().metadata().totalRepositories());
        assertEquals(2, result.predictive().metadata().basedOnRepos());
        assertEquals(8, result.predictive().projectPredictions().size());
    }

    @Test
    void testEmptyDumpStillProducesProfiles() {
        ProfilePipeline.Result result = pipeline.run("");

        assertTrue(result.filtered().repositories().isEmpty());
        assertEquals(0, result.translated().metadata().totalCommits());
        assertEquals(8, result.predictive().projectPredictions().size());
    }

    @Test
    void testWritesAllStagesByteIdentically() throws IOException {
        Path dump = tempDir.resolve("dump.txt");
        Files.writeString(dump, sampleDump());
        ProfileJsonWriter writer = new ProfileJsonWriter();

        pipeline.write(pipeline.run(dump), tempDir.resolve("first"), writer);
        pipeline.write(pipeline.run(dump), tempDir.resolve("second"), writer);

        for (String name : List.of(ProfileJsonWriter.FILTERED_FILE_NAME, ProfileJsonWriter.TRANSLATED_FILE_NAME,
                ProfileJsonWriter.PREDICTIVE_FILE_NAME)) {
            assertArrayEquals(
                    Files.readAllBytes(tempDir.resolve("first").resolve(name)),
                    Files.readAllBytes(tempDir.resolve("second").resolve(name)),
                    name + " should be stable across runs");
        }
    }

    @Test
    void testPredictMatchesTagsIgnoringCase() {
        ProfilePipeline.Result result = pipeline.run(sampleDump());

        ProjectPrediction upper = pipeline.predict("API_SERVICE", result.translated());

        assertEquals(result.predictive().projectPredictions().get("api_service").successLikelihood(),
                upper.successLikelihood());
        assertEquals(result.predictive().projectPredictions().get("api_service").skillGaps(), upper.skillGaps());
        assertEquals("api_service", upper.projectType());
    }

    @Test
    void testPredictUnknownTagIsNeutral() {
        ProjectPrediction prediction = pipeline.predict("game_engine", pipeline.run(sampleDump()).translated());

        assertEquals(0.5, prediction.successLikelihood());
        assertEquals(0.5, prediction.frictionScore());
        assertEquals(RiskLevel.MEDIUM, prediction.riskLevel());
        assertTrue(prediction.skillGaps().isEmpty());
    }

    @Test
    void testMissingDumpFails() {
        assertThrows(IOException.class, () -> pipeline.run(tempDir.resolve("missing.txt")));
    }
}
