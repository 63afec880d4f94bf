package com.repo.profiler.model;

import com.repo.profiler.core.Scores;
import com.repo.profiler.rules.LearningPathRuleEngine;
import com.repo.profiler.translate.SkillIndicators;
import com.repo.profiler.translate.TranslatedProfile;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static com.repo.profiler.model.ScoringWeights.Capability;
import static com.repo.profiler.model.ScoringWeights.Devtools;
import static com.repo.profiler.model.ScoringWeights.Friction;
import static com.repo.profiler.model.ScoringWeights.Prediction;
import static com.repo.profiler.model.ScoringWeights.Skill;
import static com.repo.profiler.model.ScoringWeights.Style;

/**
 * Predictive model over a translated profile.
 *
 * Scoring is a chain of weighted sums: skill vector and code style feed the
 * friction profile; skill vector and devtools skill feed the capability
 * assessment. Every score is clamped to [0,1] and rounded to three places
 * before it is used downstream.
 */
public class PredictiveModeler {

    private static final int PLACES = 3;

    private final LearningPathRuleEngine ruleEngine;

    public PredictiveModeler(LearningPathRuleEngine ruleEngine) {
        this.ruleEngine = ruleEngine;
    }

    public PredictiveModeler() {
        this(new LearningPathRuleEngine());
    }

    /**
     * Generate the complete predictive profile.
     */
    public PredictiveProfile model(TranslatedProfile profile) {
        SkillVector skills = computeSkillVector(profile);
        CodeStyleProfile style = computeCodeStyle(profile);
        FrictionProfile friction = computeFriction(profile, skills, style);
        double devtools = inferDevtoolsSkill(profile);
        CapabilityAssessment capabilities = computeCapabilities(profile, skills, devtools);

        Map<String, ProjectPrediction> predictions = new LinkedHashMap<>();
        for (ProjectType type : ProjectType.values()) {
            predictions.put(type.tag(), predictProjectSuccess(type.tag(), profile, skills, capabilities, friction));
        }

        return new PredictiveProfile(
                skills,
                style,
                friction,
                capabilities,
                identifySkillGaps(skills),
                recommendLearningPath(skills, friction),
                devtools,
                categorizeLibraries(profile),
                predictions,
                new PredictiveProfile.Metadata(
                        PredictiveProfile.MODEL_VERSION,
                        profile.metadata().totalRepositories(),
                        PredictiveProfile.DATA_SOURCE,
                        profile.metadata().analysisTimestamp()));
    }

    public SkillVector computeSkillVector(TranslatedProfile profile) {
        TranslatedProfile.Composition comp = profile.composition();
        Map<String, Double> langs = profile.languages();
        Map<String, Double> skills = profile.skills();
        double quality = profile.quality().qualityScore();
        TranslatedProfile.TechnicalDepth depth = profile.technicalDepth();

        double pythonShare = langs.getOrDefault("Python", 0.0) / 100;
        double backend = comp.backend() * Skill.BACKEND_COMPOSITION
                + pythonShare * Skill.BACKEND_PYTHON
                + quality * Skill.BACKEND_QUALITY;

        double frontendShare = 0.0;
        for (String lang : Skill.FRONTEND_LANGUAGE_NAMES) {
            frontendShare += langs.getOrDefault(lang, 0.0);
        }
        double frontend = comp.frontend() * Skill.FRONTEND_COMPOSITION
                + (frontendShare / 100) * Skill.FRONTEND_LANGUAGES;

        double data = comp.data() * Skill.DATA_COMPOSITION
                + skills.getOrDefault(SkillIndicators.DATA_ENGINEERING, 0.0) * Skill.DATA_ENGINEERING;

        boolean hasAiLibs = containsAny(profile.libraries().keySet(), Skill.AI_LIBRARIES);
        double aiMl = skills.getOrDefault(SkillIndicators.AI_ML, 0.0) + (hasAiLibs ? Skill.AI_LIBRARY_BONUS : 0.0);

        double cloud = skills.getOrDefault(SkillIndicators.CLOUD_DEVOPS, 0.0);

        double architecture = depth.depthScore() * Skill.ARCHITECTURE_DEPTH
                + quality * Skill.ARCHITECTURE_QUALITY
                + Math.min(depth.avgRepoSize() / Skill.ARCHITECTURE_SIZE_REFERENCE_KB, 1.0) * Skill.ARCHITECTURE_SIZE;

        return new SkillVector(
                unit(backend),
                unit(frontend),
                unit(data),
                unit(aiMl),
                unit(cloud),
                unit(architecture));
    }

    public CodeStyleProfile computeCodeStyle(TranslatedProfile profile) {
        Map<String, Double> langs = profile.languages();
        Set<String> libs = profile.libraries().keySet();

        double typeSafety = langs.getOrDefault("TypeScript", 0.0) / Style.TYPESCRIPT_SATURATION
                + (containsAny(libs, Style.TYPING_LIBRARIES) ? Style.TYPING_LIBRARY_BONUS : 0.0);

        long functionalLibs = countIn(libs, Style.FUNCTIONAL_LIBRARIES);
        double functionalVsOop = functionalLibs > Style.FUNCTIONAL_LIBRARY_THRESHOLD
                ? Style.FUNCTIONAL_VALUE
                : Style.OOP_VALUE;

        long languageCount = langs.values().stream()
                .filter(share -> share > Style.DIVERSITY_MIN_SHARE)
                .count();
        double diversity = languageCount / Style.DIVERSITY_SATURATION;

        return new CodeStyleProfile(
                unit(typeSafety),
                unit(functionalVsOop),
                unit(diversity),
                unit(profile.technicalDepth().depthScore()));
    }

    public FrictionProfile computeFriction(TranslatedProfile profile, SkillVector skills, CodeStyleProfile style) {
        double types = style.typeSafetyPreference();
        double complexity = style.complexityTolerance();
        double diversity = style.languageDiversity();
        double quality = profile.quality().qualityScore();

        return new FrictionProfile(
                friction(skills.frontend() * Friction.REACT_FRONTEND
                        + types * Friction.REACT_TYPES
                        + complexity * Friction.REACT_COMPLEXITY),
                friction(skills.frontend() * Friction.VUE_FRONTEND
                        + diversity * Friction.VUE_DIVERSITY),
                friction(types * Friction.TYPESCRIPT_TYPES
                        + skills.frontend() * Friction.TYPESCRIPT_FRONTEND
                        + complexity * Friction.TYPESCRIPT_COMPLEXITY),
                friction(types * Friction.PYTHON_TYPING_TYPES
                        + skills.backend() * Friction.PYTHON_TYPING_BACKEND),
                friction(skills.aiMl() * Friction.ML_AI
                        + skills.data() * Friction.ML_DATA
                        + skills.backend() * Friction.ML_BACKEND
                        + quality * Friction.ML_QUALITY),
                friction(skills.cloudInfrastructure() * Friction.DEVOPS_CLOUD
                        + skills.backend() * Friction.DEVOPS_BACKEND),
                friction(skills.architecture() * Friction.MICROSERVICES_ARCHITECTURE
                        + skills.backend() * Friction.MICROSERVICES_BACKEND
                        + skills.cloudInfrastructure() * Friction.MICROSERVICES_CLOUD),
                friction(skills.frontend() * Friction.FULLSTACK_FRONTEND
                        + skills.backend() * Friction.FULLSTACK_BACKEND
                        + skills.architecture() * Friction.FULLSTACK_ARCHITECTURE),
                friction(skills.frontend() * Friction.MOBILE_FRONTEND
                        + diversity * Friction.MOBILE_DIVERSITY
                        + skills.architecture() * Friction.MOBILE_ARCHITECTURE));
    }

    /**
     * Tool-building aptitude from CLI, advanced-pattern and testing libraries
     * plus test discipline.
     */
    public double inferDevtoolsSkill(TranslatedProfile profile) {
        Set<String> libs = profile.libraries().keySet();

        double cli = Math.min(countIn(libs, Devtools.CLI_LIBRARIES) / Devtools.CLI_SATURATION, 1.0);
        double advanced = Math.min(countIn(libs, Devtools.ADVANCED_LIBRARIES) / Devtools.ADVANCED_SATURATION, 1.0);
        double testing = Math.min(countIn(libs, Devtools.TESTING_LIBRARIES) / Devtools.TESTING_SATURATION, 1.0);

        return unit(cli * Devtools.CLI_WEIGHT
                + advanced * Devtools.ADVANCED_WEIGHT
                + testing * Devtools.TESTING_WEIGHT
                + profile.quality().qualityScore() * Devtools.QUALITY_WEIGHT);
    }

    public CapabilityAssessment computeCapabilities(TranslatedProfile profile, SkillVector skills, double devtools) {
        double quality = profile.quality().qualityScore();

        return new CapabilityAssessment(
                unit(skills.backend() * Capability.API_BACKEND
                        + skills.architecture() * Capability.API_ARCHITECTURE
                        + quality * Capability.API_QUALITY),
                unit(skills.backend() * Capability.CLI_BACKEND
                        + devtools * Capability.CLI_DEVTOOLS
                        + quality * Capability.CLI_QUALITY),
                unit(skills.data() * Capability.PIPELINE_DATA
                        + skills.backend() * Capability.PIPELINE_BACKEND
                        + skills.architecture() * Capability.PIPELINE_ARCHITECTURE),
                unit(skills.aiMl() * Capability.ML_AI
                        + skills.data() * Capability.ML_DATA
                        + quality * Capability.ML_QUALITY),
                unit(skills.frontend() * Capability.FRONTEND_FRONTEND
                        + quality * Capability.FRONTEND_QUALITY),
                unit(skills.frontend() * Capability.FULLSTACK_FRONTEND
                        + skills.backend() * Capability.FULLSTACK_BACKEND
                        + skills.architecture() * Capability.FULLSTACK_ARCHITECTURE),
                unit(skills.cloudInfrastructure() * Capability.INFRA_CLOUD
                        + skills.backend() * Capability.INFRA_BACKEND
                        + skills.architecture() * Capability.INFRA_ARCHITECTURE),
                unit(skills.backend() * Capability.PLUGIN_BACKEND
                        + skills.architecture() * Capability.PLUGIN_ARCHITECTURE
                        + devtools * Capability.PLUGIN_DEVTOOLS));
    }

    /**
     * Dimensions below the gap threshold, as 1 - score, largest gap first.
     */
    public Map<String, Double> identifySkillGaps(SkillVector skills) {
        Map<String, Double> gaps = new LinkedHashMap<>();
        skills.asMap().forEach((dimension, score) -> {
            if (score < Prediction.SKILL_GAP_THRESHOLD) {
                gaps.put(dimension, Scores.round(1.0 - score, PLACES));
            }
        });

        List<Map.Entry<String, Double>> entries = new ArrayList<>(gaps.entrySet());
        entries.sort((a, b) -> Double.compare(b.getValue(), a.getValue()));

        Map<String, Double> sorted = new LinkedHashMap<>();
        entries.forEach(e -> sorted.put(e.getKey(), e.getValue()));
        return sorted;
    }

    public List<LearningRecommendation> recommendLearningPath(SkillVector skills, FrictionProfile friction) {
        return ruleEngine.evaluate(skills, friction);
    }

    /**
     * Predict the outcome of a project type for this profile.
     */
    public ProjectPrediction predictProjectSuccess(String projectType, TranslatedProfile profile) {
        SkillVector skills = computeSkillVector(profile);
        CodeStyleProfile style = computeCodeStyle(profile);
        FrictionProfile friction = computeFriction(profile, skills, style);
        CapabilityAssessment capabilities = computeCapabilities(profile, skills, inferDevtoolsSkill(profile));
        return predictProjectSuccess(projectType, profile, skills, capabilities, friction);
    }

    ProjectPrediction predictProjectSuccess(String projectType, TranslatedProfile profile, SkillVector skills,
            CapabilityAssessment capabilities, FrictionProfile friction) {
        ProjectType type = ProjectType.fromTag(projectType).orElse(null);

        double success = type != null ? capabilities.scoreFor(type) : Prediction.NEUTRAL_SCORE;
        double relevantFriction = type == null ? Prediction.NEUTRAL_SCORE
                : type.frictionField()
                        .map(field -> friction.asMap().get(field))
                        .orElse(Prediction.NEUTRAL_SCORE);

        List<String> tensions = new ArrayList<>();
        if (success < Prediction.TENSION_LOW_SUCCESS) {
            tensions.add(String.format(Locale.ROOT,
                    "Low capability match (%.2f) - significant skill gap", success));
        }
        if (relevantFriction > Prediction.TENSION_HIGH_FRICTION) {
            tensions.add(String.format(Locale.ROOT,
                    "High friction (%.2f) - steep learning curve", relevantFriction));
        }
        if (profile.quality().qualityScore() < Prediction.TENSION_LOW_QUALITY) {
            tensions.add("Low test coverage may impact production quality");
        }

        List<String> gaps = new ArrayList<>();
        if (type != null) {
            type.gapThresholds().forEach((dimension, needed) -> {
                double score = skills.score(dimension);
                if (score < needed) {
                    gaps.add(String.format(Locale.ROOT, "%s: %.2f (needs ≥%s)", dimension, score, needed));
                }
            });
        }

        return new ProjectPrediction(
                type != null ? type.tag() : projectType,
                Scores.round(success, PLACES),
                Scores.round(relevantFriction, PLACES),
                RiskLevel.forSuccess(success),
                tensions,
                gaps);
    }

    /**
     * Count the developer's libraries per purpose category, in category order.
     * Categories without libraries are omitted.
     */
    public Map<String, Integer> categorizeLibraries(TranslatedProfile profile) {
        Map<LibraryCategory, Integer> counts = new LinkedHashMap<>();
        for (String lib : profile.libraries().keySet()) {
            counts.merge(LibraryCategory.classify(lib), 1, Integer::sum);
        }

        Map<String, Integer> categories = new LinkedHashMap<>();
        for (LibraryCategory category : LibraryCategory.values()) {
            if (counts.containsKey(category)) {
                categories.put(category.label(), counts.get(category));
            }
        }
        return categories;
    }

    private static double unit(double value) {
        return Scores.round(Scores.clampUnit(value), PLACES);
    }

    private static double friction(double blend) {
        return unit(1.0 - blend);
    }

    private static boolean containsAny(Set<String> names, Set<String> indicators) {
        return countIn(names, indicators) > 0;
    }

    private static long countIn(Set<String> names, Set<String> indicators) {
        return names.stream()
                .filter(name -> indicators.contains(name.toLowerCase(Locale.ROOT)))
                .count();
    }
}
