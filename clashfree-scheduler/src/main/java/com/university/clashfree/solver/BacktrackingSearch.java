package com.university.clashfree.solver;

import com.university.clashfree.constraint.ConstraintKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Depth-first assignment of every variable of a {@link SearchSpace}, driven by
 * an explicit stack of {@link DecisionPoint}s.
 * <p>
 * A dead end jumps back to the latest variable in its conflict set
 * (conflict-directed backjumping) and hands the rest of the set to that frame.
 * Once more than {@code retryBudget} jumps were made the search continues
 * chronologically, blaming every earlier variable, so it stays complete. A dead
 * end with nobody left to blame proves the problem infeasible.
 */
public class BacktrackingSearch<C> {

    private static final Logger logger = LoggerFactory.getLogger(BacktrackingSearch.class);

    private final SearchSpace<C> space;
    private final long backtrackBudget;
    private final int retryBudget;
    private final Deadline deadline;
    private final SearchStats stats = new SearchStats();

    public BacktrackingSearch(SearchSpace<C> space, long backtrackBudget, int retryBudget, Deadline deadline) {
        this.space = space;
        this.backtrackBudget = backtrackBudget;
        this.retryBudget = retryBudget;
        this.deadline = deadline;
    }

    public SearchStats getStats() {
        return stats;
    }

    /**
     * Runs the search. On success every variable is applied in the space and
     * the chosen candidates are returned in variable order.
     */
    public List<C> run() throws InfeasibleScheduleException {
        int n = space.variableCount();
        List<C> result = new ArrayList<>(n);
        if (n == 0) {
            return result;
        }
        Deque<DecisionPoint<C>> stack = new ArrayDeque<>();
        stack.push(open(0));
        ConstraintKind lastKind = null;

        while (true) {
            stats.step();
            if (stats.getSteps() > backtrackBudget) {
                logger.warn("Backtrack budget of {} steps exhausted at depth {}", backtrackBudget, stack.size());
                throw new BudgetExceededException(BudgetExceededException.Budget.BACKTRACK,
                        "No schedule found within " + backtrackBudget + " search steps");
            }
            if (deadline.isExpired()) {
                logger.warn("Time budget of {} expired at depth {}", deadline.getBudget(), stack.size());
                throw new BudgetExceededException(BudgetExceededException.Budget.TIME,
                        "No schedule found within " + deadline.getBudget());
            }

            DecisionPoint<C> top = stack.peek();
            if (top.chosen != null) {
                space.retract(top.index, top.chosen);
                top.chosen = null;
            }

            if (top.hasNext()) {
                C candidate = top.next();
                space.apply(top.index, candidate);
                top.chosen = candidate;
                if (top.index == n - 1) {
                    break;
                }
                stack.push(open(top.index + 1));
                stats.reached(stack.size());
                continue;
            }

            // dead end
            Diagnosis diagnosis = space.diagnose(top.index);
            if (diagnosis.getKind() != null) {
                lastKind = diagnosis.getKind();
            }
            TreeSet<Integer> conflicts = new TreeSet<>(top.conflicts);
            conflicts.addAll(diagnosis.getCulprits());
            boolean chronological = stats.getBackjumps() >= retryBudget;
            if (chronological) {
                for (int i = 0; i < top.index; i++) {
                    conflicts.add(i);
                }
            }
            Set<Integer> involved = new TreeSet<>(top.involved);
            involved.add(top.index);
            involved.addAll(conflicts);

            if (conflicts.isEmpty()) {
                List<String> ids = new ArrayList<>();
                for (int i : involved) {
                    ids.add(space.variableId(i));
                }
                logger.warn("Search exhausted after {} steps; no assignment for {} ({})",
                        stats.getSteps(), ids, lastKind);
                throw new InfeasibleScheduleException("No clash-free assignment exists for " + ids
                        + (lastKind == null ? "" : ": " + lastKind), lastKind, ids);
            }

            int target = conflicts.last();
            stack.pop();
            while (stack.peek().index > target) {
                DecisionPoint<C> skipped = stack.pop();
                if (skipped.chosen != null) {
                    space.retract(skipped.index, skipped.chosen);
                }
            }
            DecisionPoint<C> resume = stack.peek();
            conflicts.remove(target);
            resume.conflicts.addAll(conflicts);
            resume.involved.addAll(involved);
            if (chronological) {
                stats.chronologicalBacktrack();
            } else {
                stats.backjump();
            }
            if (logger.isDebugEnabled()) {
                logger.debug("Dead end at {} ({}), back to {}", space.variableId(top.index),
                        diagnosis.getKind(), space.variableId(target));
            }
        }

        for (DecisionPoint<C> point : stack) {
            result.add(point.chosen);
        }
        Collections.reverse(result);
        logger.debug("Assigned {} variables: {}", n, stats);
        return result;
    }

    private DecisionPoint<C> open(int index) {
        return new DecisionPoint<>(index, space.candidates(index));
    }
}
