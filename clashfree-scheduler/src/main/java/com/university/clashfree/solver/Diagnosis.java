package com.university.clashfree.solver;

import com.university.clashfree.constraint.ConstraintKind;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Culprits and dominant constraint of a dead end.
 */
public final class Diagnosis {

    private static final Diagnosis NONE = new Diagnosis(Collections.emptySet(), null);

    private final Set<Integer> culprits;
    private final ConstraintKind kind;

    public Diagnosis(Set<Integer> culprits, ConstraintKind kind) {
        this.culprits = Collections.unmodifiableSet(new TreeSet<>(culprits));
        this.kind = kind;
    }

    public static Diagnosis none() {
        return NONE;
    }

    public Set<Integer> getCulprits() {
        return culprits;
    }

    public ConstraintKind getKind() {
        return kind;
    }
}
