package com.university.clashfree.solver;

import java.util.List;
import java.util.Random;

/**
 * Neighbourhood of a complete, feasible schedule as seen by
 * {@link RefinementSearch}.
 *
 * @param <M> move type
 * @param <S> schedule type handed out by {@link #snapshot()}
 */
public interface MoveSpace<M, S> {

    double currentCost();

    /** Up to {@code count} moves that keep the schedule free of hard violations. */
    List<M> propose(Random random, int count);

    /**
     * Soft cost the schedule would have after the move. Must not modify the
     * space; may be called from several threads at once.
     */
    double evaluate(M move);

    /**
     * Applies the move after checking it is still feasible against the
     * current schedule.
     *
     * @return false when the move was rejected and nothing changed
     */
    boolean commit(M move);

    S snapshot();
}
