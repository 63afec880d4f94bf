package com.repo.profiler.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.repo.profiler.core.CommitStamp;
import com.repo.profiler.core.RepositoryAnalysis;
import com.repo.profiler.filter.FilteredProfile;
import com.repo.profiler.translate.CommitPattern;
import com.repo.profiler.translate.DepthLevel;
import com.repo.profiler.translate.QualityRating;
import com.repo.profiler.translate.TranslatedProfile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads intermediate profiles back from JSON so the pipeline can resume
 * mid-way.
 *
 * Reading is lenient: a missing or mistyped field takes its zero value, a
 * mapping given as a list counts each entry once, and unknown enum labels fall
 * back to the lowest bucket. Repository sizes are also accepted under their
 * older {@code _kb} suffixed keys. Only unreadable files and malformed JSON fail.
 */
public class ProfileJsonReader {

    private final ObjectMapper mapper = new ObjectMapper();

    public FilteredProfile readFiltered(Path file) throws IOException {
        return readFiltered(Files.readString(file));
    }

    public FilteredProfile readFiltered(String json) throws IOException {
        JsonNode root = mapper.readTree(json);
        if (root == null || !root.isObject()) {
            return FilteredProfile.empty();
        }

        List<RepositoryAnalysis> repos = new ArrayList<>();
        for (JsonNode repo : root.path("repositories")) {
            if (repo.isObject()) {
                repos.add(toAnalysis(repo));
            }
        }

        int totalCommits = root.has("total_commits")
                ? root.path("total_commits").asInt(0)
                : repos.stream().mapToInt(r -> r.commits().size()).sum();

        return new FilteredProfile(repos, totalCommits, stringList(root.path("commit_dates")));
    }

    public TranslatedProfile readTranslated(Path file) throws IOException {
        return readTranslated(Files.readString(file));
    }

    public TranslatedProfile readTranslated(String json) throws IOException {
        JsonNode root = mapper.readTree(json);
        if (root == null || !root.isObject()) {
            root = mapper.createObjectNode();
        }

        JsonNode habits = root.path("habits");
        JsonNode depth = root.path("technical_depth");
        JsonNode composition = root.path("composition");
        JsonNode quality = root.path("quality");
        JsonNode metadata = root.path("metadata");

        return new TranslatedProfile(
                doubleMap(root.path("languages")),
                intMap(root.path("libraries")),
                intMap(root.path("frameworks")),
                new TranslatedProfile.Habits(
                        habits.path("frequency").asDouble(0.0),
                        habits.path("consistency").asDouble(0.0),
                        habits.path("avg_commit_size_kb").asDouble(0.0),
                        CommitPattern.fromLabel(habits.path("commit_pattern").asText(""))),
                new TranslatedProfile.TechnicalDepth(
                        depth.path("depth_score").asDouble(0.0),
                        field(depth, "avg_repo_size", "avg_repo_size_kb").asDouble(0.0),
                        field(depth, "max_repo_size", "max_repo_size_kb").asDouble(0.0),
                        DepthLevel.fromLabel(depth.path("level").asText(""))),
                new TranslatedProfile.Composition(
                        composition.path("frontend").asDouble(0.0),
                        composition.path("backend").asDouble(0.0),
                        composition.path("data").asDouble(0.0)),
                doubleMap(root.path("skills")),
                new TranslatedProfile.Quality(
                        quality.path("avg_test_coverage").asDouble(0.0),
                        quality.path("quality_score").asDouble(0.0),
                        QualityRating.fromLabel(quality.path("rating").asText(""))),
                new TranslatedProfile.Metadata(
                        metadata.path("total_repositories").asInt(0),
                        metadata.path("total_commits").asInt(0),
                        metadata.path("analysis_timestamp").asText("")));
    }

    private RepositoryAnalysis toAnalysis(JsonNode repo) {
        List<CommitStamp> commits = new ArrayList<>();
        for (JsonNode commit : repo.path("commits")) {
            if (commit.isObject()) {
                commits.add(new CommitStamp(
                        commit.path("date").asText(""),
                        commit.path("timestamp").asLong(0L)));
            }
        }

        return new RepositoryAnalysis(
                repo.path("name").asText(""),
                intMap(repo.path("languages")),
                intMap(repo.path("libraries")),
                stringList(repo.path("frameworks")),
                commits,
                repo.path("size_kb").asDouble(0.0),
                intMap(repo.path("file_types")),
                repo.path("test_coverage").asDouble(0.0));
    }

    /** The named field, or the alias when only the alias is present */
    static JsonNode field(JsonNode node, String name, String alias) {
        return node.has(name) ? node.path(name) : node.path(alias);
    }

    static Map<String, Integer> intMap(JsonNode node) {
        Map<String, Integer> map = new LinkedHashMap<>();
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                map.put(field.getKey(), field.getValue().asInt(0));
            }
        } else if (node.isArray()) {
            for (JsonNode entry : node) {
                if (entry.isValueNode()) {
                    map.merge(entry.asText(), 1, Integer::sum);
                }
            }
        }
        return map;
    }

    static Map<String, Double> doubleMap(JsonNode node) {
        Map<String, Double> map = new LinkedHashMap<>();
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                map.put(field.getKey(), field.getValue().asDouble(0.0));
            }
        } else if (node.isArray()) {
            for (JsonNode entry : node) {
                if (entry.isValueNode()) {
                    map.merge(entry.asText(), 1.0, Double::sum);
                }
            }
        }
        return map;
    }

    static List<String> stringList(JsonNode node) {
        List<String> list = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode entry : node) {
                if (entry.isValueNode()) {
                    list.add(entry.asText());
                }
            }
        } else if (node.isObject()) {
            node.fieldNames().forEachRemaining(list::add);
        }
        return list;
    }
}
