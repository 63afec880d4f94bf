package com.repo.profiler.rules;

import com.repo.profiler.model.FrictionProfile;
import com.repo.profiler.model.LearningRecommendation;
import com.repo.profiler.model.Priority;
import com.repo.profiler.model.SkillVector;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LearningPathRuleEngineTest {

    private final LearningPathRuleEngine engine = new LearningPathRuleEngine();

    private static FrictionProfile friction(double react) {
        return new FrictionProfile(react, 0.5, 0.5, 0.5, 0.45, 0.35, 0.5, 0.5, 0.5);
    }

    @Test
    void testFrontendGrowthForBackendDeveloper() {
        // Condition: backend > 0.6 && frontend < 0.3, with cloud skills present
        List<LearningRecommendation> recs = engine.evaluate(
                new SkillVector(0.7, 0.2, 0.1, 0.1, 0.5, 0.5), friction(0.55));

        assertEquals(1, recs.size());
        LearningRecommendation rec = recs.get(0);
        assertEquals("Frontend Development", rec.area());
        assertEquals(Priority.HIGH, rec.priority());
        assertEquals(0.55, rec.friction());
        assertEquals(0.55, rec.estimatedFriction());
        assertEquals(List.of("React", "TypeScript", "Tailwind CSS"), rec.suggestedTech());
    }

    @Test
    void testVueSuggestedAtReactFrictionCutoff() {
        List<LearningRecommendation> recs = engine.evaluate(
                new SkillVector(0.7, 0.2, 0.1, 0.1, 0.5, 0.5),
                friction(LearningPathRuleEngine.REACT_FRICTION_CUTOFF));

        assertEquals("Vue", recs.get(0).suggestedTech().get(0));
    }

    @Test
    void testAllRulesFireInPriorityOrder() {
        List<LearningRecommendation> recs = engine.evaluate(
                new SkillVector(0.7, 0.1, 0.5, 0.1, 0.1, 0.5), friction(0.5));

        assertEquals(List.of("Frontend Development", "AI/ML Engineering", "Cloud Infrastructure"),
                recs.stream().map(LearningRecommendation::area).toList());
        assertEquals(0.45, recs.get(1).friction(), "ML path carries ML project friction");
        assertEquals(0.35, recs.get(2).friction(), "Cloud path carries devops friction");
        assertEquals(Priority.MEDIUM, recs.get(2).priority());
    }

    @Test
    void testThresholdsAreExclusive() {
        List<LearningRecommendation> recs = engine.evaluate(
                new SkillVector(0.6, 0.3, 0.4, 0.3, 0.2, 0.5), friction(0.5));

        assertTrue(recs.isEmpty());
    }

    @Test
    void testCustomRuleRunsByPriority() {
        engine.addRule(new LearningPathRuleEngine.RecommendationRule(
                "ARCHITECTURE",
                -1,
                LearningPathRuleEngine.threshold(SkillVector.ARCHITECTURE, "<=", 0.5),
                ctx -> new LearningRecommendation("Architecture", Priority.LOW, 0.1, "Grow system design",
                        List.of("DDD"), 0.1)));

        List<LearningRecommendation> recs = engine.evaluate(
                new SkillVector(0.7, 0.1, 0.1, 0.1, 0.5, 0.5), friction(0.5));

        assertEquals("Architecture", recs.get(0).area());
        assertEquals("ARCHITECTURE", engine.getRules().get(0).name());
        assertEquals(4, engine.getRules().size());
    }

    @Test
    void testUnknownOperatorNeverMatches() {
        LearningPathRuleEngine.RuleCondition condition = LearningPathRuleEngine.threshold(SkillVector.BACKEND, "!=", 0.0);

        assertFalse(condition.evaluate(new LearningPathRuleEngine.EvaluationContext(
                new SkillVector(0.9, 0, 0, 0, 0, 0), friction(0.5))));
    }
}
