package com.repo.profiler.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.repo.profiler.filter.FilteredProfile;
import com.repo.profiler.model.PredictiveProfile;
import com.repo.profiler.translate.TranslatedProfile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes pipeline outputs as pretty-printed JSON with snake_case field names.
 * Map and list order is preserved, so equal inputs give byte-identical files.
 */
public class ProfileJsonWriter {

    public static final String FILTERED_FILE_NAME = "filtered.json";
    public static final String TRANSLATED_FILE_NAME = "translated.json";
    public static final String PREDICTIVE_FILE_NAME = "predictive.json";

    private final ObjectMapper mapper;

    public ProfileJsonWriter() {
        this.mapper = createMapper();
    }

    static ObjectMapper createMapper() {
        return new ObjectMapper()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    public Path writeFiltered(FilteredProfile profile, Path outputDir) throws IOException {
        return write(profile, outputDir.resolve(FILTERED_FILE_NAME));
    }

    public Path writeTranslated(TranslatedProfile profile, Path outputDir) throws IOException {
        return write(profile, outputDir.resolve(TRANSLATED_FILE_NAME));
    }

    public Path writePredictive(PredictiveProfile profile, Path outputDir) throws IOException {
        return write(profile, outputDir.resolve(PREDICTIVE_FILE_NAME));
    }

    /**
     * Render any pipeline value as JSON text.
     */
    public String toJson(Object value) throws JsonProcessingException {
        return mapper.writeValueAsString(value);
    }

    private Path write(Object value, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, toJson(value) + "\n", StandardCharsets.UTF_8);
        System.out.println("JSON written to: " + target.toAbsolutePath());
        return target;
    }
}
