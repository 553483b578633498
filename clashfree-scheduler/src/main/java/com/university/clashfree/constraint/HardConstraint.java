package com.university.clashfree.constraint;

import java.util.List;

/**
 * A hard rule over a schedule of type {@code S} for a problem of type
 * {@code P}. Implementations are pure: they only append to {@code out}.
 */
@FunctionalInterface
public interface HardConstraint<S, P> {

    void check(S schedule, P problem, List<HardViolation> out);
}
