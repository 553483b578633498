package com.university.clashfree.constraint;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The rules one evaluator applies: hard constraints by kind and named soft
 * terms with their weights. Built once per configuration and shared read-only.
 */
public final class ConstraintSet<S, P> {

    private final Map<ConstraintKind, HardConstraint<S, P>> hard;
    private final Map<String, WeightedTerm<S, P>> soft;

    private ConstraintSet(Builder<S, P> builder) {
        this.hard = Collections.unmodifiableMap(new EnumMap<>(builder.hard));
        this.soft = Collections.unmodifiableMap(new LinkedHashMap<>(builder.soft));
    }

    public static <S, P> Builder<S, P> builder() {
        return new Builder<>();
    }

    public Map<ConstraintKind, HardConstraint<S, P>> getHard() {
        return hard;
    }

    public Map<String, WeightedTerm<S, P>> getSoft() {
        return soft;
    }

    public boolean isHard(ConstraintKind kind) {
        return hard.containsKey(kind);
    }

    public static final class WeightedTerm<S, P> {
        private final SoftTerm<S, P> term;
        private final double weight;

        WeightedTerm(SoftTerm<S, P> term, double weight) {
            this.term = term;
            this.weight = weight;
        }

        public SoftTerm<S, P> getTerm() {
            return term;
        }

        public double getWeight() {
            return weight;
        }
    }

    public static final class Builder<S, P> {
        private final Map<ConstraintKind, HardConstraint<S, P>> hard = new EnumMap<>(ConstraintKind.class);
        private final Map<String, WeightedTerm<S, P>> soft = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder<S, P> hard(ConstraintKind kind, HardConstraint<S, P> constraint) {
            hard.put(kind, constraint);
            return this;
        }

        /** Terms with weight zero are left out entirely. */
        public Builder<S, P> soft(String name, double weight, SoftTerm<S, P> term) {
            if (weight < 0) {
                throw new IllegalArgumentException("Soft weight '" + name + "' must be non-negative");
            }
            if (weight > 0) {
                soft.put(name, new WeightedTerm<>(term, weight));
            }
            return this;
        }

        public ConstraintSet<S, P> build() {
            return new ConstraintSet<>(this);
        }
    }
}
