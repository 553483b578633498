package com.university.clashfree.constraint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of evaluating a schedule: hard violations in a stable order and the
 * weighted soft cost, with the contribution of every active term.
 */
public final class Evaluation {

    private final List<HardViolation> violations;
    private final double softCost;
    private final Map<String, Double> breakdown;

    public Evaluation(List<HardViolation> violations, double softCost, Map<String, Double> breakdown) {
        List<HardViolation> sorted = new ArrayList<>(violations);
        Collections.sort(sorted);
        this.violations = Collections.unmodifiableList(sorted);
        this.softCost = softCost;
        this.breakdown = Collections.unmodifiableMap(new LinkedHashMap<>(breakdown));
    }

    public List<HardViolation> getViolations() {
        return violations;
    }

    public double getSoftCost() {
        return softCost;
    }

    public Map<String, Double> getBreakdown() {
        return breakdown;
    }

    public boolean isFeasible() {
        return violations.isEmpty();
    }

    public List<HardViolation> violationsOf(ConstraintKind kind) {
        List<HardViolation> result = new ArrayList<>();
        for (HardViolation violation : violations) {
            if (violation.getKind() == kind) {
                result.add(violation);
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return "Evaluation{violations=" + violations.size() + ", softCost=" + softCost + ", breakdown=" + breakdown + "}";
    }
}
