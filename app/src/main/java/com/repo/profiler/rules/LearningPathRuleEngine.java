package com.repo.profiler.rules;

import com.repo.profiler.model.FrictionProfile;
import com.repo.profiler.model.LearningRecommendation;
import com.repo.profiler.model.Priority;
import com.repo.profiler.model.SkillVector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/**
 * Threshold-based rule engine for learning-path recommendations.
 * Every rule whose condition holds contributes one recommendation, in priority
 * order.
 */
public class LearningPathRuleEngine {

    /** React is suggested over Vue below this React friction */
    public static final double REACT_FRICTION_CUTOFF = 0.6;

    /**
     * Functional interface for rule conditions.
     */
    @FunctionalInterface
    public interface RuleCondition {
        boolean evaluate(EvaluationContext ctx);

        default RuleCondition and(RuleCondition other) {
            return ctx -> evaluate(ctx) && other.evaluate(ctx);
        }
    }

    /**
     * A recommendation rule with priority.
     */
    public record RecommendationRule(
            String name,
            int priority,
            RuleCondition condition,
            Function<EvaluationContext, LearningRecommendation> recommendation) {
    }

    /**
     * Context for rule evaluation.
     */
    public record EvaluationContext(
            SkillVector skills,
            FrictionProfile friction) {

        public double skill(String dimension) {
            return skills.score(dimension);
        }
    }

    private final List<RecommendationRule> rules;

    /**
     * Create engine with the default growth rules.
     */
    public LearningPathRuleEngine() {
        this(buildDefaultRules());
    }

    /**
     * Create engine with custom rules.
     */
    public LearningPathRuleEngine(List<RecommendationRule> customRules) {
        this.rules = new ArrayList<>(customRules);
        this.rules.sort(Comparator.comparingInt(RecommendationRule::priority));
    }

    /**
     * Evaluate all rules and collect the recommendations of those that match.
     */
    public List<LearningRecommendation> evaluate(EvaluationContext ctx) {
        List<LearningRecommendation> recommendations = new ArrayList<>();
        for (RecommendationRule rule : rules) {
            if (rule.condition().evaluate(ctx)) {
                recommendations.add(rule.recommendation().apply(ctx));
            }
        }
        return recommendations;
    }

    public List<LearningRecommendation> evaluate(SkillVector skills, FrictionProfile friction) {
        return evaluate(new EvaluationContext(skills, friction));
    }

    public List<RecommendationRule> getRules() {
        return Collections.unmodifiableList(rules);
    }

    public void addRule(RecommendationRule rule) {
        rules.add(rule);
        rules.sort(Comparator.comparingInt(RecommendationRule::priority));
    }

    private static List<RecommendationRule> buildDefaultRules() {
        List<RecommendationRule> defaultRules = new ArrayList<>();

        // Strong backend, weak frontend: fullstack opportunity
        defaultRules.add(new RecommendationRule(
                "FRONTEND_DEVELOPMENT",
                0,
                threshold(SkillVector.BACKEND, ">", 0.6)
                        .and(threshold(SkillVector.FRONTEND, "<", 0.3)),
                ctx -> {
                    double friction = ctx.friction().reactFriction();
                    return new LearningRecommendation(
                            "Frontend Development",
                            Priority.HIGH,
                            friction,
                            "Strong backend provides foundation for fullstack capability",
                            List.of(friction < REACT_FRICTION_CUTOFF ? "React" : "Vue", "TypeScript", "Tailwind CSS"),
                            friction);
                }));

        // Data skills without AI/ML: ML opportunity
        defaultRules.add(new RecommendationRule(
                "AI_ML_ENGINEERING",
                1,
                threshold(SkillVector.DATA, ">", 0.4)
                        .and(threshold(SkillVector.AI_ML, "<", 0.3)),
                ctx -> new LearningRecommendation(
                        "AI/ML Engineering",
                        Priority.MEDIUM,
                        ctx.friction().mlProjectFriction(),
                        "Data skills provide foundation for ML work",
                        List.of("OpenAI API", "LangChain", "Vector DBs"),
                        ctx.friction().mlProjectFriction())));

        // Strong backend without deployment skills
        defaultRules.add(new RecommendationRule(
                "CLOUD_INFRASTRUCTURE",
                2,
                threshold(SkillVector.BACKEND, ">", 0.6)
                        .and(threshold(SkillVector.CLOUD_INFRASTRUCTURE, "<", 0.2)),
                ctx -> new LearningRecommendation(
                        "Cloud Infrastructure",
                        Priority.MEDIUM,
                        ctx.friction().devopsFriction(),
                        "Backend expertise needs cloud deployment skills",
                        List.of("Docker", "AWS/Vercel", "CI/CD"),
                        ctx.friction().devopsFriction())));

        return defaultRules;
    }

    /**
     * Create a condition comparing one skill dimension against a threshold.
     */
    public static RuleCondition threshold(String dimension, String operator, double threshold) {
        return ctx -> {
            double value = ctx.skill(dimension);
            return switch (operator) {
                case ">" -> value > threshold;
                case ">=" -> value >= threshold;
                case "<" -> value < threshold;
                case "<=" -> value <= threshold;
                case "==" -> value == threshold;
                default -> false;
            };
        };
    }
}
