package com.repo.profiler.model;

import java.util.List;
import java.util.Set;

/**
 * Pinned weights, thresholds and indicator sets of the predictive model.
 * The values are empirical calibrations; change them here, not in the scoring code.
 */
public final class ScoringWeights {

    private ScoringWeights() {
    }

    // --- SKILL VECTOR ---
    public static final class Skill {
        public static final double BACKEND_COMPOSITION = 0.5;
        public static final double BACKEND_PYTHON = 0.3;
        public static final double BACKEND_QUALITY = 0.2;

        public static final double FRONTEND_COMPOSITION = 0.7;
        public static final double FRONTEND_LANGUAGES = 0.3;

        public static final double DATA_COMPOSITION = 0.5;
        public static final double DATA_ENGINEERING = 0.5;

        /** Flat bonus when a hosted-model SDK appears among the libraries */
        public static final double AI_LIBRARY_BONUS = 0.2;

        public static final double ARCHITECTURE_DEPTH = 0.5;
        public static final double ARCHITECTURE_QUALITY = 0.3;
        public static final double ARCHITECTURE_SIZE = 0.2;
        public static final double ARCHITECTURE_SIZE_REFERENCE_KB = 2000.0;

        /** Summed in declaration order */
        public static final List<String> FRONTEND_LANGUAGE_NAMES = List.of("JavaScript", "TypeScript", "HTML", "CSS");
        public static final Set<String> AI_LIBRARIES = Set.of("openai", "anthropic", "langchain");

        private Skill() {
        }
    }

    // --- CODE STYLE ---
    public static final class Style {
        /** TypeScript share (percent) that saturates type-safety preference */
        public static final double TYPESCRIPT_SATURATION = 50.0;
        public static final double TYPING_LIBRARY_BONUS = 0.3;
        public static final Set<String> TYPING_LIBRARIES = Set.of("typing", "mypy", "pydantic");

        public static final Set<String> FUNCTIONAL_LIBRARIES = Set.of("functools", "itertools", "map", "filter", "reduce");
        public static final int FUNCTIONAL_LIBRARY_THRESHOLD = 2;
        public static final double FUNCTIONAL_VALUE = 0.3;
        public static final double OOP_VALUE = 0.7;

        /** A language counts toward diversity above this share (percent) */
        public static final double DIVERSITY_MIN_SHARE = 1.0;
        public static final double DIVERSITY_SATURATION = 6.0;

        private Style() {
        }
    }

    // --- FRICTION (each is 1 - blend) ---
    public static final class Friction {
        public static final double REACT_FRONTEND = 0.4;
        public static final double REACT_TYPES = 0.3;
        public static final double REACT_COMPLEXITY = 0.3;

        public static final double VUE_FRONTEND = 0.6;
        public static final double VUE_DIVERSITY = 0.4;

        public static final double TYPESCRIPT_TYPES = 0.5;
        public static final double TYPESCRIPT_FRONTEND = 0.3;
        public static final double TYPESCRIPT_COMPLEXITY = 0.2;

        public static final double PYTHON_TYPING_TYPES = 0.6;
        public static final double PYTHON_TYPING_BACKEND = 0.4;

        public static final double ML_AI = 0.4;
        public static final double ML_DATA = 0.3;
        public static final double ML_BACKEND = 0.2;
        public static final double ML_QUALITY = 0.1;

        public static final double DEVOPS_CLOUD = 0.6;
        public static final double DEVOPS_BACKEND = 0.4;

        public static final double MICROSERVICES_ARCHITECTURE = 0.4;
        public static final double MICROSERVICES_BACKEND = 0.3;
        public static final double MICROSERVICES_CLOUD = 0.3;

        public static final double FULLSTACK_FRONTEND = 0.4;
        public static final double FULLSTACK_BACKEND = 0.4;
        public static final double FULLSTACK_ARCHITECTURE = 0.2;

        public static final double MOBILE_FRONTEND = 0.5;
        public static final double MOBILE_DIVERSITY = 0.3;
        public static final double MOBILE_ARCHITECTURE = 0.2;

        private Friction() {
        }
    }

    // --- DEVTOOLS SKILL ---
    public static final class Devtools {
        public static final double CLI_WEIGHT = 0.35;
        public static final double ADVANCED_WEIGHT = 0.25;
        public static final double TESTING_WEIGHT = 0.25;
        public static final double QUALITY_WEIGHT = 0.15;

        public static final Set<String> CLI_LIBRARIES = Set.of("argparse", "click", "typer", "rich", "colorama");
        public static final double CLI_SATURATION = 2.0;

        public static final Set<String> ADVANCED_LIBRARIES = Set.of(
                "functools", "itertools", "collections", "heapq", "lru_cache", "cache", "deque");
        public static final double ADVANCED_SATURATION = 4.0;

        public static final Set<String> TESTING_LIBRARIES = Set.of("pytest", "unittest", "mock");
        public static final double TESTING_SATURATION = 2.0;

        private Devtools() {
        }
    }

    // --- CAPABILITY ---
    public static final class Capability {
        public static final double API_BACKEND = 0.5;
        public static final double API_ARCHITECTURE = 0.3;
        public static final double API_QUALITY = 0.2;

        public static final double CLI_BACKEND = 0.4;
        public static final double CLI_DEVTOOLS = 0.4;
        public static final double CLI_QUALITY = 0.2;

        public static final double PIPELINE_DATA = 0.4;
        public static final double PIPELINE_BACKEND = 0.4;
        public static final double PIPELINE_ARCHITECTURE = 0.2;

        public static final double ML_AI = 0.5;
        public static final double ML_DATA = 0.3;
        public static final double ML_QUALITY = 0.2;

        public static final double FRONTEND_FRONTEND = 0.7;
        public static final double FRONTEND_QUALITY = 0.3;

        public static final double FULLSTACK_FRONTEND = 0.3;
        public static final double FULLSTACK_BACKEND = 0.4;
        public static final double FULLSTACK_ARCHITECTURE = 0.3;

        public static final double INFRA_CLOUD = 0.5;
        public static final double INFRA_BACKEND = 0.3;
        public static final double INFRA_ARCHITECTURE = 0.2;

        public static final double PLUGIN_BACKEND = 0.4;
        public static final double PLUGIN_ARCHITECTURE = 0.3;
        public static final double PLUGIN_DEVTOOLS = 0.3;

        private Capability() {
        }
    }

    // --- GAPS, RISK AND TENSIONS ---
    public static final class Prediction {
        /** Skill-vector dimensions below this are reported as gaps */
        public static final double SKILL_GAP_THRESHOLD = 0.5;

        public static final double LOW_RISK_SUCCESS = 0.7;
        public static final double MEDIUM_RISK_SUCCESS = 0.4;

        public static final double TENSION_LOW_SUCCESS = 0.4;
        public static final double TENSION_HIGH_FRICTION = 0.6;
        public static final double TENSION_LOW_QUALITY = 0.5;

        /** Used when a project type has no capability or friction mapping */
        public static final double NEUTRAL_SCORE = 0.5;

        private Prediction() {
        }
    }
}
