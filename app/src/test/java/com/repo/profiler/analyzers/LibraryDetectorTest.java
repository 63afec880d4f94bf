package com.repo.profiler.analyzers;

import com.repo.profiler.core.ProfilerConfig;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LibraryDetectorTest {

    private final LibraryDetector detector = new LibraryDetector();
    private final ProfilerConfig config = ProfilerConfig.defaults();

    @Test
    void testImportsUseFirstSegment() {
        Map<String, Integer> libs = detector.detect(
                "import numpy\nfrom collections.abc import Mapping\nimport numpy.linalg", config);

        assertEquals(2, libs.get("numpy"));
        assertEquals(1, libs.get("collections"));
        assertEquals(1, libs.get("Mapping"));
    }

    @Test
    void testStoplistAndShortNames() {
        Map<String, Integer> libs = detector.detect("import os\nimport sys\nimport re\nimport io\nimport np", config);

        assertTrue(libs.isEmpty(), "Stoplisted and two-letter names are dropped: " + libs);
    }

    @Test
    void testPackageJsonDependencies() {
        String manifest = """
                {
                  "dependencies": {
                    "react": "^18.2.0",
                    "lodash": "~4.17.21",
                    "express": "4.18.2"
                  }
                }
                """;

        Map<String, Integer> libs = detector.detect(manifest, config);

        assertEquals(List.of("react", "lodash", "express"), List.copyOf(libs.keySet()));
    }

    @Test
    void testRequirementsSpecifiers() {
        Map<String, Integer> libs = detector.detect("requests==2.31.0\npandas>=2.0.3\nrich ~= 13.7.0\n", config);

        assertEquals(Map.of("requests", 1, "pandas", 1, "rich", 1), libs);
    }

    @Test
    void testUpperBoundSpecifiers() {
        Map<String, Integer> libs = detector.detect("numpy<=1.26.0\n\"pandas<=2.1.0\"\n", config);

        assertEquals(Map.of("numpy", 1, "pandas", 1), libs);
    }

    @Test
    void testComparisonsWithoutVersionAreIgnored() {
        Map<String, Integer> libs = detector.detect("if count == 3:\n    total >= 10", config);

        assertTrue(libs.isEmpty());
    }

    @Test
    void testLibraryCap() {
        StringBuilder content = new StringBuilder();
        for (int i = 10; i < 45; i++) {
            content.append("import lib").append(i).append('\n');
        }
        content.append("import lib44\n");

        Map<String, Integer> libs = detector.detect(content.toString(), config);

        assertEquals(ProfilerConfig.DEFAULT_MAX_LIBRARIES, libs.size());
        assertEquals("lib44", libs.keySet().iterator().next(), "Most referenced library ranks first");
    }
}
