package com.repo.profiler.model;

/**
 * Coding style inferred from language and library choices.
 */
public record CodeStyleProfile(
        /** TypeScript share plus typed-Python tooling */
        double typeSafetyPreference,

        /** 0 = functional, 1 = object-oriented */
        double functionalVsOop,

        /** Polyglot tendency */
        double languageDiversity,

        /** Comfort with large code bases */
        double complexityTolerance) {
}
