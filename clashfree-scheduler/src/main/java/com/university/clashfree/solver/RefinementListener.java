package com.university.clashfree.solver;

/**
 * Observes a refinement run. Callbacks happen on the refining thread.
 */
public interface RefinementListener {

    RefinementListener NONE = new RefinementListener() {
    };

    /** A move was committed; {@code cost} is the soft cost after it. */
    default void accepted(int step, Object move, double cost) {
    }

    /** The best cost seen so far dropped to {@code bestCost}. */
    default void improved(int step, double bestCost) {
    }
}
