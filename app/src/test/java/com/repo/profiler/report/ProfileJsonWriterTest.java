package com.repo.profiler.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.repo.profiler.core.CommitStamp;
import com.repo.profiler.core.RepositoryAnalysis;
import com.repo.profiler.filter.FilteredProfile;
import com.repo.profiler.model.PredictiveModeler;
import com.repo.profiler.model.PredictiveProfile;
import com.repo.profiler.translate.CommitPattern;
import com.repo.profiler.translate.DepthLevel;
import com.repo.profiler.translate.QualityRating;
import com.repo.profiler.translate.TranslatedProfile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProfileJsonWriterTest {

    @TempDir
    Path tempDir;

    private final ProfileJsonWriter writer = new ProfileJsonWriter();
    private final ObjectMapper mapper = new ObjectMapper();

    static TranslatedProfile sampleTranslated() {
        Map<String, Integer> libraries = new LinkedHashMap<>();
        libraries.put("zeta", 5);
        libraries.put("alpha", 2);

        return new TranslatedProfile(
                Map.of("Python", 100.0),
                libraries,
                Map.of("Docker", 1),
                new TranslatedProfile.Habits(2.5, 0.333, 12.5, CommitPattern.REGULAR),
                new TranslatedProfile.TechnicalDepth(0.25, 125.0, 200.0, DepthLevel.BEGINNER),
                new TranslatedProfile.Composition(0.1, 0.8, 0.1),
                Map.of("devtools_automation", 0.167),
                new TranslatedProfile.Quality(12.0, 0.12, QualityRating.NEEDS_IMPROVEMENT),
                new TranslatedProfile.Metadata(1, 4, "2024-05-01T12:00"));
    }

    @Test
    void testTranslatedUsesSnakeCaseAndLabels() throws IOException {
        Path file = writer.writeTranslated(sampleTranslated(), tempDir);

        assertEquals(ProfileJsonWriter.TRANSLATED_FILE_NAME, file.getFileName().toString());
        JsonNode root = mapper.readTree(file.toFile());
        assertEquals(12.5, root.path("habits").path("avg_commit_size_kb").asDouble());
        assertEquals("regular", root.path("habits").path("commit_pattern").asText());
        assertEquals(125.0, root.path("technical_depth").path("avg_repo_size").asDouble());
        assertEquals("needs_improvement", root.path("quality").path("rating").asText());
        assertEquals(1, root.path("metadata").path("total_repositories").asInt());
    }

    @Test
    void testMapOrderIsPreserved() throws IOException {
        JsonNode root = mapper.readTree(writer.toJson(sampleTranslated()));

        List<String> names = fieldNames(root.path("libraries"));
        assertEquals(List.of("zeta", "alpha"), names);
    }

    @Test
    void testFilteredShape() throws IOException {
        RepositoryAnalysis repo = new RepositoryAnalysis("tool", Map.of("Shell", 2), Map.of("click", 1),
                List.of("Git"), List.of(new CommitStamp("2024-01-01T00:00:00", 1704067200L)), 1.5,
                Map.of("sh", 2), 25.0);
        FilteredProfile filtered = new FilteredProfile(List.of(repo), 1, List.of("2024-01-01T00:00:00"));

        JsonNode root = mapper.readTree(writer.writeFiltered(filtered, tempDir).toFile());

        JsonNode first = root.path("repositories").get(0);
        assertEquals("tool", first.path("name").asText());
        assertEquals(1.5, first.path("size_kb").asDouble());
        assertEquals(2, first.path("file_types").path("sh").asInt());
        assertEquals(25.0, first.path("test_coverage").asDouble());
        assertEquals(1704067200L, first.path("commits").get(0).path("timestamp").asLong());
        assertEquals(1, root.path("total_commits").asInt());
        assertEquals("2024-01-01T00:00:00", root.path("commit_dates").get(0).asText());
    }

    @Test
    void testPredictiveShape() throws IOException {
        PredictiveProfile predictive = new PredictiveModeler().model(sampleTranslated());

        JsonNode root = mapper.readTree(writer.writePredictive(predictive, tempDir.resolve("nested")).toFile());

        assertTrue(root.path("skill_vector").has("cloud_infrastructure"));
        assertTrue(root.path("code_style_profile").has("type_safety_preference"));
        assertTrue(root.path("friction_profile").has("python_typing_friction"));
        assertTrue(root.path("capability_assessment").has("plugin_system"));
        assertTrue(root.has("devtools_skill"));
        assertEquals("2.0.0", root.path("metadata").path("model_version").asText());
        assertEquals("static_analysis_only", root.path("metadata").path("data_source").asText());
        JsonNode api = root.path("project_predictions").path("api_service");
        assertEquals("api_service", api.path("project_type").asText());
        assertTrue(List.of("low", "medium", "high").contains(api.path("risk_level").asText()));
        assertTrue(api.path("tension_points").isArray());
    }

    @Test
    void testRepeatedWritesAreByteIdentical() throws IOException {
        PredictiveProfile predictive = new PredictiveModeler().model(sampleTranslated());

        byte[] first = Files.readAllBytes(writer.writePredictive(predictive, tempDir.resolve("a")));
        byte[] second = Files.readAllBytes(writer.writePredictive(predictive, tempDir.resolve("b")));

        assertArrayEquals(first, second);
    }

    private static List<String> fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }
}
