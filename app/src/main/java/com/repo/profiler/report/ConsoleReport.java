package com.repo.profiler.report;

import com.repo.profiler.filter.FilteredProfile;
import com.repo.profiler.model.LearningRecommendation;
import com.repo.profiler.model.PredictiveProfile;
import com.repo.profiler.model.ProjectPrediction;
import com.repo.profiler.translate.TranslatedProfile;

import java.io.PrintStream;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Human-readable stage summaries with score bars.
 */
public class ConsoleReport {

    private static final int BAR_WIDTH = 20;
    private static final int LABEL_WIDTH = 30;

    private final PrintStream out;

    public ConsoleReport(PrintStream out) {
        this.out = out;
    }

    public ConsoleReport() {
        this(System.out);
    }

    public void printFilteredSummary(FilteredProfile profile) {
        out.printf(Locale.ROOT, "Filtered %d repositories, %d commits%n",
                profile.repositories().size(), profile.totalCommits());
    }

    public void printTranslatedSummary(TranslatedProfile profile) {
        List<String> topLanguages = profile.languages().keySet().stream().limit(3).toList();

        out.println("\nDeveloper Profile Summary:");
        out.println("  Top Languages: " + topLanguages);
        out.println("  Primary Skills: " + List.copyOf(profile.skills().keySet()));
        out.println("  Commit Pattern: " + profile.habits().commitPattern().label());
        out.println("  Technical Level: " + profile.technicalDepth().level().label());
        out.printf(Locale.ROOT, "  Composition - Frontend: %.3f, Backend: %.3f, Data: %.3f%n",
                profile.composition().frontend(),
                profile.composition().backend(),
                profile.composition().data());
    }

    public void printPredictiveSummary(PredictiveProfile profile) {
        String rule = "=".repeat(70);
        out.println("\n" + rule);
        out.println("PREDICTIVE PROFILE");
        out.println(rule + "\n");

        out.println("SKILL VECTOR:");
        profile.skillVector().asMap().forEach(this::printBar);
        out.println();
        printBar("devtools (inferred)", profile.devtoolsSkill());

        out.println("\nCODE STYLE PROFILE:");
        printBar("type_safety_preference", profile.codeStyleProfile().typeSafetyPreference());
        printBar("functional_vs_oop", profile.codeStyleProfile().functionalVsOop());
        printBar("language_diversity", profile.codeStyleProfile().languageDiversity());
        printBar("complexity_tolerance", profile.codeStyleProfile().complexityTolerance());

        out.println("\nFRICTION PROFILE (lower = easier):");
        profile.frictionProfile().asMap().forEach(this::printBar);

        out.println("\nPROJECT PREDICTIONS:");
        for (ProjectPrediction prediction : profile.projectPredictions().values()) {
            out.printf(Locale.ROOT, "  %s %.3f  risk: %s%n",
                    padDots(prediction.projectType()),
                    prediction.successLikelihood(),
                    prediction.riskLevel().label());
        }

        Map<String, Double> gaps = profile.skillGaps();
        if (!gaps.isEmpty()) {
            out.println("\nSKILL GAPS (growth opportunities):");
            gaps.forEach((gap, severity) -> out.printf(Locale.ROOT, "  %s: gap of %.3f%n", gap, severity));
        }

        if (!profile.learningRecommendations().isEmpty()) {
            out.println("\nRECOMMENDED LEARNING PATH:");
            for (LearningRecommendation rec : profile.learningRecommendations()) {
                out.printf(Locale.ROOT, "  %s: friction %.2f%n", rec.area(), rec.friction());
                out.println("     -> " + String.join(", ", rec.suggestedTech()));
            }
        }
    }

    public void printProjectPrediction(ProjectPrediction prediction) {
        out.println("\n=== PROJECT: " + prediction.projectType() + " ===");
        out.printf(Locale.ROOT, "  Success likelihood: %.3f%n", prediction.successLikelihood());
        out.printf(Locale.ROOT, "  Friction:           %.3f%n", prediction.frictionScore());
        out.println("  Risk:               " + prediction.riskLevel().label());
        prediction.tensionPoints().forEach(t -> out.println("  ! " + t));
        prediction.skillGaps().forEach(g -> out.println("  - " + g));
    }

    private void printBar(String label, double score) {
        out.printf(Locale.ROOT, "  %s %.3f %s%n", padDots(label), score, bar(score));
    }

    static String bar(double score) {
        int filled = (int) (Math.max(0.0, Math.min(score, 1.0)) * BAR_WIDTH);
        return "#".repeat(filled);
    }

    static String padDots(String label) {
        if (label.length() >= LABEL_WIDTH) {
            return label;
        }
        return label + ".".repeat(LABEL_WIDTH - label.length());
    }
}
