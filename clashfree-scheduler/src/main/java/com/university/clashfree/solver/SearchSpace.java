package com.university.clashfree.solver;

import java.util.List;

/**
 * A constructive search problem as seen by {@link BacktrackingSearch}:
 * variables in a fixed order, each taking one candidate. The space owns the
 * partial assignment; the search only applies and retracts.
 *
 * @param <C> candidate value of a variable
 */
public interface SearchSpace<C> {

    int variableCount();

    String variableId(int index);

    /**
     * Candidates of variable {@code index} consistent with variables
     * {@code 0..index-1} as currently assigned, best first.
     */
    List<C> candidates(int index);

    void apply(int index, C candidate);

    void retract(int index, C candidate);

    /** Explains which assigned variables block candidates of {@code index}. */
    Diagnosis diagnose(int index);
}
