package com.repo.profiler.report;

import com.repo.profiler.model.PredictiveModeler;
import com.repo.profiler.model.PredictiveProfile;
import com.repo.profiler.model.ProjectPrediction;
import com.repo.profiler.model.RiskLevel;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleReportTest {

    @Test
    void testPredictiveSummarySections() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        ConsoleReport report = new ConsoleReport(new PrintStream(buffer, true, StandardCharsets.UTF_8));
        PredictiveProfile predictive = new PredictiveModeler().model(ProfileJsonWriterTest.sampleTranslated());

        report.printPredictiveSummary(predictive);

        String output = buffer.toString(StandardCharsets.UTF_8);
        assertTrue(output.contains("SKILL VECTOR:"));
        assertTrue(output.contains("FRICTION PROFILE (lower = easier):"));
        assertTrue(output.contains("PROJECT PREDICTIONS:"));
        assertTrue(output.contains("backend......"), "Labels are dot-padded");
    }

    @Test
    void testTranslatedSummary() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        new ConsoleReport(new PrintStream(buffer, true, StandardCharsets.UTF_8))
                .printTranslatedSummary(ProfileJsonWriterTest.sampleTranslated());

        String output = buffer.toString(StandardCharsets.UTF_8);
        assertTrue(output.contains("Top Languages: [Python]"));
        assertTrue(output.contains("Commit Pattern: regular"));
        assertTrue(output.contains("Technical Level: beginner"));
    }

    @Test
    void testProjectPredictionIgnoresDefaultLocale() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        ConsoleReport report = new ConsoleReport(new PrintStream(buffer, true, StandardCharsets.UTF_8));
        ProjectPrediction prediction = new ProjectPrediction("cli_tool", 0.5, 0.25, RiskLevel.MEDIUM,
                List.of("Low test coverage may impact production quality"), List.of());

        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.GERMANY);
        try {
            report.printProjectPrediction(prediction);
        } finally {
            Locale.setDefault(previous);
        }

        String output = buffer.toString(StandardCharsets.UTF_8);
        assertTrue(output.contains("=== PROJECT: cli_tool ==="));
        assertTrue(output.contains("Success likelihood: 0.500"), output);
        assertTrue(output.contains("Friction:           0.250"), output);
        assertTrue(output.contains("  ! Low test coverage"));
    }

    @Test
    void testBarWidth() {
        assertEquals("", ConsoleReport.bar(0.0));
        assertEquals("##########", ConsoleReport.bar(0.5));
        assertEquals(20, ConsoleReport.bar(3.0).length());
        assertEquals(30, ConsoleReport.padDots("ai_ml").length());
    }
}
