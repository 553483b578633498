package com.university.clashfree.constraint;

/**
 * Unweighted, non-negative penalty of a schedule. Pure.
 */
@FunctionalInterface
public interface SoftTerm<S, P> {

    double penalty(S schedule, P problem);
}
