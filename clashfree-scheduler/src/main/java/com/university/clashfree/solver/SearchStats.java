package com.university.clashfree.solver;

/**
 * Counters of one solver run, reported with the solution and logged.
 */
public class SearchStats {

    private long steps;
    private long backjumps;
    private long chronologicalBacktracks;
    private int maxDepth;
    private int movesProposed;
    private int movesAccepted;
    private int movesRejected;
    private int refinementSteps;
    private boolean refinementCutShort;

    public long getSteps() {
        return steps;
    }

    void step() {
        steps++;
    }

    public long getBackjumps() {
        return backjumps;
    }

    void backjump() {
        backjumps++;
    }

    public long getChronologicalBacktracks() {
        return chronologicalBacktracks;
    }

    void chronologicalBacktrack() {
        chronologicalBacktracks++;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    void reached(int depth) {
        maxDepth = Math.max(maxDepth, depth);
    }

    public int getMovesProposed() {
        return movesProposed;
    }

    void proposed(int count) {
        movesProposed += count;
    }

    public int getMovesAccepted() {
        return movesAccepted;
    }

    void accepted() {
        movesAccepted++;
    }

    public int getMovesRejected() {
        return movesRejected;
    }

    void rejected() {
        movesRejected++;
    }

    public int getRefinementSteps() {
        return refinementSteps;
    }

    void refinementStep() {
        refinementSteps++;
    }

    /** True when the deadline stopped refinement before its move budget was spent. */
    public boolean isRefinementCutShort() {
        return refinementCutShort;
    }

    void cutShort() {
        refinementCutShort = true;
    }

    /** Adds the counters of another run, e.g. the invigilation search of an exam cycle. */
    public void add(SearchStats other) {
        steps += other.steps;
        backjumps += other.backjumps;
        chronologicalBacktracks += other.chronologicalBacktracks;
        maxDepth = Math.max(maxDepth, other.maxDepth);
        movesProposed += other.movesProposed;
        movesAccepted += other.movesAccepted;
        movesRejected += other.movesRejected;
        refinementSteps += other.refinementSteps;
        refinementCutShort |= other.refinementCutShort;
    }

    @Override
    public String toString() {
        return "steps=" + steps + ", backjumps=" + backjumps + ", chronological=" + chronologicalBacktracks
                + ", maxDepth=" + maxDepth + ", moves=" + movesAccepted + "/" + movesProposed
                + ", rejected=" + movesRejected;
    }
}
