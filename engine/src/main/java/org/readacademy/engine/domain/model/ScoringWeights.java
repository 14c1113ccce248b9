package org.readacademy.engine.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable scoring weights for the priority tuple.
 * Supplied with the calendar configuration at cycle start.
 */
public final class ScoringWeights {

    public static final String SIBLING_BONUS = "sibling_bonus";
    public static final String COMPLETENESS_BONUS = "completeness_bonus";
    public static final String DISTANCE_WEIGHT = "distance_weight";
    public static final String URGENCY_WEIGHT = "urgency_weight";

    private static final Map<String, Integer> DEFAULTS;

    static {
        Map<String, Integer> defaults = new LinkedHashMap<>();
        defaults.put(SIBLING_BONUS, 3000);
        defaults.put(COMPLETENESS_BONUS, 1000);
        defaults.put(DISTANCE_WEIGHT, 10);
        defaults.put(URGENCY_WEIGHT, 1);
        DEFAULTS = Collections.unmodifiableMap(defaults);
    }

    private final Map<String, Integer> values;

    private ScoringWeights(Map<String, Integer> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Creates weights from configuration. Missing keys fall back to defaults.
     *
     * @throws IllegalArgumentException for an unrecognized key or a negative weight
     */
    public static ScoringWeights fromMap(Map<String, Integer> values) {
        Objects.requireNonNull(values, "values must not be null");
        Map<String, Integer> merged = new LinkedHashMap<>(DEFAULTS);
        for (Map.Entry<String, Integer> entry : values.entrySet()) {
            if (!DEFAULTS.containsKey(entry.getKey())) {
                throw new IllegalArgumentException("Unknown scoring weight: " + entry.getKey());
            }
            Integer value = entry.getValue();
            if (value == null || value < 0) {
                throw new IllegalArgumentException(
                        "Scoring weight " + entry.getKey() + " must be a non-negative integer: " + value);
            }
            merged.put(entry.getKey(), value);
        }
        return new ScoringWeights(merged);
    }

    public static ScoringWeights defaults() {
        return new ScoringWeights(DEFAULTS);
    }

    public int get(String key) {
        Integer value = values.get(key);
        if (value == null) {
            throw new IllegalArgumentException("Unknown scoring weight: " + key);
        }
        return value;
    }

    public int getSiblingBonus() {
        return get(SIBLING_BONUS);
    }

    public int getCompletenessBonus() {
        return get(COMPLETENESS_BONUS);
    }

    public int getDistanceWeight() {
        return get(DISTANCE_WEIGHT);
    }

    public int getUrgencyWeight() {
        return get(URGENCY_WEIGHT);
    }

    public Map<String, Integer> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "ScoringWeights" + values;
    }
}
