package com.university.clashfree.solver;

import com.university.clashfree.config.SolverConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;

/**
 * Local search over a {@link MoveSpace}. Each step samples a batch of feasible
 * moves, evaluates them (in parallel when configured), and takes the cheapest,
 * the earliest proposed on ties. Improvements are always accepted; equal or
 * worse moves only with a probability that shrinks with the size of the
 * increase and with the progress of the run. The best schedule seen is
 * returned.
 */
public class RefinementSearch<M, S> {

    private static final Logger logger = LoggerFactory.getLogger(RefinementSearch.class);
    private static final double EPSILON = 1e-9;
    private static final long SEED_SALT = 0x5DEECE66DL;

    private final MoveSpace<M, S> space;
    private final SolverConfig config;
    private final Deadline deadline;
    private final RefinementListener listener;
    private final SearchStats stats;
    private final Object commitLock = new Object();

    public RefinementSearch(MoveSpace<M, S> space, SolverConfig config, Deadline deadline,
            RefinementListener listener, SearchStats stats) {
        this.space = space;
        this.config = config;
        this.deadline = deadline;
        this.listener = listener == null ? RefinementListener.NONE : listener;
        this.stats = stats;
    }

    public S run() {
        Random random = new Random(config.getSeed() ^ SEED_SALT);
        double current = space.currentCost();
        double best = current;
        S bestSnapshot = space.snapshot();
        int budget = config.getMoveBudget();
        logger.debug("Refining from soft cost {} with {} steps", current, budget);

        for (int step = 0; step < budget; step++) {
            if (deadline.isExpired()) {
                logger.info("Time budget expired after {} refinement steps; keeping best cost {}", step, best);
                stats.cutShort();
                break;
            }
            stats.refinementStep();
            List<M> moves = space.propose(random, config.getMovesPerStep());
            stats.proposed(moves.size());
            if (moves.isEmpty()) {
                continue;
            }
            double[] costs = new double[moves.size()];
            IntStream indices = IntStream.range(0, moves.size());
            if (config.isParallelRefinement()) {
                indices = indices.parallel();
            }
            indices.forEach(i -> costs[i] = space.evaluate(moves.get(i)));

            int pick = 0;
            for (int i = 1; i < costs.length; i++) {
                if (costs[i] < costs[pick] - EPSILON) {
                    pick = i;
                }
            }
            double delta = costs[pick] - current;
            if (delta >= -EPSILON && !acceptWorse(random, delta, step, budget)) {
                continue;
            }

            M move = moves.get(pick);
            boolean committed;
            synchronized (commitLock) {
                committed = space.commit(move);
            }
            if (!committed) {
                logger.warn("Move {} no longer feasible at commit, skipped", move);
                stats.rejected();
                continue;
            }
            stats.accepted();
            current = space.currentCost();
            listener.accepted(step, move, current);
            if (current < best - EPSILON) {
                best = current;
                bestSnapshot = space.snapshot();
                listener.improved(step, best);
            }
        }
        logger.debug("Refinement finished at best soft cost {} ({})", best, stats);
        return bestSnapshot;
    }

    private boolean acceptWorse(Random random, double delta, int step, int budget) {
        double progress = (double) step / budget;
        double scale = delta <= EPSILON ? 1.0 : 1.0 / (1.0 + delta);
        double probability = config.getWorseAcceptanceProbability() * (1.0 - progress) * scale;
        return random.nextDouble() < probability;
    }
}
