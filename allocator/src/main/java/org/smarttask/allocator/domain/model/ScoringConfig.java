package org.smarttask.allocator.domain.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable configuration for match scoring weights.
 */
public final class ScoringConfig {

    private final Map<String, Double> values;

    public static final String SKILL_LEVEL_MULTIPLIER = "skill_level_multiplier";
    public static final String WORKLOAD_PENALTY_WEIGHT = "workload_penalty_weight";

    public static final double DEFAULT_SKILL_LEVEL_MULTIPLIER = 10.0;
    public static final double DEFAULT_WORKLOAD_PENALTY_WEIGHT = 20.0;

    private ScoringConfig(Map<String, Double> values) {
        this.values = Collections.unmodifiableMap(new HashMap<>(values));
    }

    /**
     * Creates a ScoringConfig from a map of key-value pairs.
     * Missing keys fall back to the defaults.
     */
    public static ScoringConfig fromMap(Map<String, Double> values) {
        Objects.requireNonNull(values, "values must not be null");
        return new ScoringConfig(values);
    }

    public static ScoringConfig defaults() {
        Map<String, Double> defaults = new HashMap<>();
        defaults.put(SKILL_LEVEL_MULTIPLIER, DEFAULT_SKILL_LEVEL_MULTIPLIER);
        defaults.put(WORKLOAD_PENALTY_WEIGHT, DEFAULT_WORKLOAD_PENALTY_WEIGHT);
        return new ScoringConfig(defaults);
    }

    public double getOrDefault(String key, double defaultValue) {
        return values.getOrDefault(key, defaultValue);
    }

    public double getSkillLevelMultiplier() {
        return getOrDefault(SKILL_LEVEL_MULTIPLIER, DEFAULT_SKILL_LEVEL_MULTIPLIER);
    }

    public double getWorkloadPenaltyWeight() {
        return getOrDefault(WORKLOAD_PENALTY_WEIGHT, DEFAULT_WORKLOAD_PENALTY_WEIGHT);
    }

    @Override
    public String toString() {
        return "ScoringConfig" + values;
    }
}
