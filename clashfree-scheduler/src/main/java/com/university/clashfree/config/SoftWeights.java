package com.university.clashfree.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Weights of the soft cost terms. A weight of zero switches its term off.
 */
public final class SoftWeights {

    public static final String GAP = "gap_penalty";
    public static final String IMBALANCE = "imbalance_penalty";
    public static final String SELF_STUDY = "selfstudy_bonus";
    public static final String BREAK = "break_bonus";
    public static final String CLUSTER = "cluster_bonus";
    public static final String PREFERENCE = "preference_penalty";
    public static final String SPREAD = "spread_penalty";
    public static final String EXAM_SPACING = "exam_spacing_penalty";

    public static final List<String> NAMES = List.of(
            GAP, IMBALANCE, SELF_STUDY, BREAK, CLUSTER, PREFERENCE, SPREAD, EXAM_SPACING);

    private static final SoftWeights DEFAULTS = new SoftWeights(defaultValues());

    private final Map<String, Double> weights;

    private SoftWeights(Map<String, Double> weights) {
        this.weights = Collections.unmodifiableMap(new LinkedHashMap<>(weights));
    }

    private static Map<String, Double> defaultValues() {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put(GAP, 1.0);
        values.put(IMBALANCE, 0.5);
        values.put(SELF_STUDY, 2.0);
        values.put(BREAK, 0.5);
        values.put(CLUSTER, 0.25);
        values.put(PREFERENCE, 1.0);
        values.put(SPREAD, 1.0);
        values.put(EXAM_SPACING, 1.0);
        return values;
    }

    public static SoftWeights defaults() {
        return DEFAULTS;
    }

    /** All terms switched off; only hard constraints matter. */
    public static SoftWeights none() {
        Map<String, Double> values = new LinkedHashMap<>();
        NAMES.forEach(name -> values.put(name, 0.0));
        return new SoftWeights(values);
    }

    /**
     * Defaults overridden by the given entries.
     *
     * @throws IllegalArgumentException on an unknown name or a negative weight
     */
    public static SoftWeights fromMap(Map<String, Double> overrides) {
        return DEFAULTS.with(overrides);
    }

    public SoftWeights with(Map<String, Double> overrides) {
        Map<String, Double> values = new LinkedHashMap<>(weights);
        if (overrides != null) {
            overrides.forEach((name, value) -> {
                if (!NAMES.contains(name)) {
                    throw new IllegalArgumentException("Unknown soft weight '" + name + "', expected one of " + NAMES);
                }
                if (value == null || value < 0 || value.isNaN()) {
                    throw new IllegalArgumentException("Soft weight '" + name + "' must be non-negative, got " + value);
                }
                values.put(name, value);
            });
        }
        return new SoftWeights(values);
    }

    public SoftWeights with(String name, double value) {
        return with(Map.of(name, value));
    }

    public double get(String name) {
        Double value = weights.get(name);
        if (value == null) {
            throw new IllegalArgumentException("Unknown soft weight '" + name + "'");
        }
        return value;
    }

    public Map<String, Double> asMap() {
        return weights;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SoftWeights && weights.equals(((SoftWeights) o).weights);
    }

    @Override
    public int hashCode() {
        return weights.hashCode();
    }

    @Override
    public String toString() {
        return weights.toString();
    }
}
