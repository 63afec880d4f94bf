package com.repo.profiler.core;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Numeric helpers shared by the scoring stages: rounding, clamping and
 * stable frequency ranking.
 */
public final class Scores {

    private Scores() {
    }

    /**
     * Round half-up to the given number of decimal places.
     */
    public static double round(double value, int places) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return 0.0;
        }
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
    }

    public static double clamp(double value, double min, double max) {
        if (Double.isNaN(value))
            return min;
        return Math.max(min, Math.min(max, value));
    }

    public static double clampUnit(double value) {
        return clamp(value, 0.0, 1.0);
    }

    /**
     * Sort a count map descending by value. Entries with equal counts keep the
     * order in which they were first inserted.
     */
    public static <K> Map<K, Integer> rankDescending(Map<K, Integer> counts) {
        return topDescending(counts, Integer.MAX_VALUE);
    }

    /**
     * Sort a count map descending by value and keep at most {@code limit} entries.
     */
    public static <K> Map<K, Integer> topDescending(Map<K, Integer> counts, int limit) {
        List<Map.Entry<K, Integer>> entries = new ArrayList<>(counts.entrySet());
        // List.sort is a stable merge sort
        entries.sort((a, b) -> Integer.compare(b.getValue(), a.getValue()));

        Map<K, Integer> ranked = new LinkedHashMap<>();
        for (Map.Entry<K, Integer> entry : entries) {
            if (ranked.size() >= Math.max(limit, 0)) {
                break;
            }
            ranked.put(entry.getKey(), entry.getValue());
        }
        return Collections.unmodifiableMap(ranked);
    }

    /**
     * Arithmetic mean, 0 for an empty list.
     */
    public static double mean(List<Double> values) {
        if (values.isEmpty())
            return 0.0;
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    /**
     * Sample standard deviation (n - 1 denominator), 0 for fewer than two values.
     */
    public static double sampleStdev(List<Double> values) {
        if (values.size() < 2)
            return 0.0;
        double mean = mean(values);
        double squares = 0;
        for (double v : values) {
            squares += (v - mean) * (v - mean);
        }
        return Math.sqrt(squares / (values.size() - 1));
    }
}
