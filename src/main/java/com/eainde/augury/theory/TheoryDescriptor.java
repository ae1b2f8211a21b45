package com.eainde.augury.theory;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declarative description of one theory: the fields it reads, how much each field
 * contributes to information completeness, and the completeness below which it refuses to run.
 *
 * <pre>
 * TheoryDescriptor.of("bazi", "Four Pillars", TheoryTier.BASIC)
 *          .required(FieldNames.BIRTH_YEAR, 0.25)
 *          .required(FieldNames.BIRTH_MONTH, 0.25)
 *          .required(FieldNames.BIRTH_DAY, 0.25)
 *          .optional(FieldNames.BIRTH_HOUR, 0.15)
 *          .minCompleteness(0.75)
 *          .birthTimeSensitive()
 *          .build();
 * </pre>
 *
 * <h3>Completeness</h3>
 * <p>{@code sum(weight of present fields) / sum(weight of all declared fields)}, clamped to [0,1].
 * A descriptor with no weighted fields is always complete. Eligibility additionally requires every
 * required field to be present.</p>
 */
public class TheoryDescriptor implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String name;
    private final String displayName;
    private final TheoryTier tier;
    private final List<String> requiredFields;
    private final List<String> optionalFields;
    private final Map<String, Double> weights;
    private final double minCompleteness;
    private final boolean birthTimeSensitive;

    private TheoryDescriptor(Builder builder) {
        this.name = builder.name;
        this.displayName = builder.displayName;
        this.tier = builder.tier;
        this.requiredFields = Collections.unmodifiableList(new ArrayList<>(builder.requiredFields));
        this.optionalFields = Collections.unmodifiableList(new ArrayList<>(builder.optionalFields));
        this.weights = Collections.unmodifiableMap(new LinkedHashMap<>(builder.weights));
        this.minCompleteness = builder.minCompleteness;
        this.birthTimeSensitive = builder.birthTimeSensitive;
    }

    // === Factory ===

    public static Builder of(String name, String displayName, TheoryTier tier) {
        return new Builder(name, displayName, tier);
    }

    // === Getters ===

    public String getName() { return name; }
    public String getDisplayName() { return displayName; }
    public TheoryTier getTier() { return tier; }
    public List<String> getRequiredFields() { return requiredFields; }
    public List<String> getOptionalFields() { return optionalFields; }
    public Map<String, Double> getWeights() { return weights; }
    public double getMinCompleteness() { return minCompleteness; }
    public boolean isBirthTimeSensitive() { return birthTimeSensitive; }

    public double weightOf(String field) {
        return weights.getOrDefault(field, 0.0);
    }

    /**
     * True when the field is one of this theory's declared inputs.
     */
    public boolean dependsOn(String field) {
        return requiredFields.contains(field) || optionalFields.contains(field);
    }

    // === Completeness ===

    public double completeness(UserInput input) {
        double total = 0.0;
        double achieved = 0.0;
        for (Map.Entry<String, Double> entry : weights.entrySet()) {
            total += entry.getValue();
            if (input.has(entry.getKey())) {
                achieved += entry.getValue();
            }
        }
        if (total <= 0.0) {
            return 1.0;
        }
        return Math.max(0.0, Math.min(1.0, achieved / total));
    }

    public List<String> missingRequired(UserInput input) {
        return requiredFields.stream().filter(f -> !input.has(f)).toList();
    }

    public boolean isEligible(UserInput input) {
        return missingRequired(input).isEmpty() && completeness(input) >= minCompleteness;
    }

    @Override
    public String toString() {
        return name + " [" + tier + "] required=" + requiredFields + " optional=" + optionalFields
                + " min=" + minCompleteness;
    }

    // ==========================================================================
    //  Builder
    // ==========================================================================

    public static class Builder {
        private final String name;
        private final String displayName;
        private final TheoryTier tier;
        private final List<String> requiredFields = new ArrayList<>();
        private final List<String> optionalFields = new ArrayList<>();
        private final Map<String, Double> weights = new LinkedHashMap<>();
        private double minCompleteness;
        private boolean birthTimeSensitive;

        private Builder(String name, String displayName, TheoryTier tier) {
            this.name = name;
            this.displayName = displayName;
            this.tier = tier;
        }

        public Builder required(String field, double weight) {
            requiredFields.add(field);
            weights.put(field, weight);
            return this;
        }

        public Builder optional(String field, double weight) {
            optionalFields.add(field);
            weights.put(field, weight);
            return this;
        }

        public Builder minCompleteness(double minCompleteness) {
            this.minCompleteness = minCompleteness;
            return this;
        }

        /** Completeness counts for less when the birth time is uncertain. */
        public Builder birthTimeSensitive() {
            this.birthTimeSensitive = true;
            return this;
        }

        public TheoryDescriptor build() {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name is required");
            }
            if (tier == null) {
                throw new IllegalArgumentException("tier is required for theory: " + name);
            }
            if (minCompleteness < 0.0 || minCompleteness > 1.0) {
                throw new IllegalArgumentException("minCompleteness must be within [0,1] for theory: " + name);
            }
            for (Map.Entry<String, Double> entry : weights.entrySet()) {
                if (entry.getValue() < 0.0 || entry.getValue() > 1.0) {
                    throw new IllegalArgumentException(
                            "Weight of " + entry.getKey() + " must be within [0,1] for theory: " + name);
                }
            }
            for (String field : requiredFields) {
                if (optionalFields.contains(field)) {
                    throw new IllegalArgumentException(
                            "Field " + field + " cannot be both required and optional for theory: " + name);
                }
            }
            return new TheoryDescriptor(this);
        }
    }
}
