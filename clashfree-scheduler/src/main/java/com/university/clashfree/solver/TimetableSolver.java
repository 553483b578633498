package com.university.clashfree.solver;

import com.university.clashfree.config.SolverConfig;
import com.university.clashfree.constraint.ConstraintEvaluator;
import com.university.clashfree.constraint.Evaluation;
import com.university.clashfree.domain.Schedule;
import com.university.clashfree.domain.TimetableProblem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Builds a clash-free teaching timetable: backtracking with conflict-directed
 * backjumping finds a feasible schedule, refinement then lowers its soft
 * cost. Stateless; one instance can serve concurrent cycles.
 */
public class TimetableSolver {

    private static final Logger logger = LoggerFactory.getLogger(TimetableSolver.class);

    public TimetableSolution solve(TimetableProblem problem, SolverConfig config) throws InfeasibleScheduleException {
        return solve(problem, config, RefinementListener.NONE);
    }

    public TimetableSolution solve(TimetableProblem problem, SolverConfig config, RefinementListener listener)
            throws InfeasibleScheduleException {
        long started = System.nanoTime();
        Deadline deadline = Deadline.after(config.getTimeBudget());
        logger.info("Solving timetable: {} sessions, {} rooms, {} faculty (seed {})",
                problem.getSessions().size(), problem.getRooms().size(), problem.getFaculty().size(),
                config.getSeed());

        TimetableSearchSpace space = new TimetableSearchSpace(problem, config.getSeed());
        space.checkStaticDomains();
        BacktrackingSearch<TimetableCandidate> search = new BacktrackingSearch<>(
                space, config.getBacktrackBudget(), config.getRetryBudget(), deadline);
        search.run();
        SearchStats stats = search.getStats();
        logger.info("Feasible timetable found after {} steps ({} backjumps)", stats.getSteps(), stats.getBackjumps());

        ConstraintEvaluator<Schedule, TimetableProblem> evaluator = ConstraintEvaluator.forTimetable(config);
        Schedule schedule = space.getSchedule().copy();
        if (config.getMoveBudget() > 0 && !schedule.isEmpty()) {
            TimetableMoveSpace moves = new TimetableMoveSpace(space, evaluator);
            schedule = new RefinementSearch<>(moves, config, deadline, listener, stats).run();
        }

        Evaluation evaluation = evaluator.evaluate(schedule, problem);
        if (!evaluation.isFeasible()) {
            throw new IllegalStateException("Timetable solver produced hard violations: "
                    + evaluation.getViolations());
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        logger.info("Timetable solved in {} ms, soft cost {} {}", elapsed.toMillis(),
                evaluation.getSoftCost(), evaluation.getBreakdown());
        return new TimetableSolution(schedule, evaluation, stats, elapsed);
    }
}
