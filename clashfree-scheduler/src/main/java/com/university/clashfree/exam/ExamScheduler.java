package com.university.clashfree.exam;

import com.university.clashfree.config.SolverConfig;
import com.university.clashfree.constraint.ConstraintEvaluator;
import com.university.clashfree.constraint.Evaluation;
import com.university.clashfree.domain.ExamPlacement;
import com.university.clashfree.domain.ExamProblem;
import com.university.clashfree.domain.ExamSchedule;
import com.university.clashfree.domain.Faculty;
import com.university.clashfree.solver.BacktrackingSearch;
import com.university.clashfree.solver.BudgetExceededException;
import com.university.clashfree.solver.Deadline;
import com.university.clashfree.solver.InfeasibleScheduleException;
import com.university.clashfree.solver.RefinementListener;
import com.university.clashfree.solver.RefinementSearch;
import com.university.clashfree.solver.SearchStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Schedules the exams of a cycle in three passes: placement into the exam
 * grid and rooms (backtracking, then refinement of exam spacing), seating,
 * and invigilation. When the posts cannot be staffed, the sittings behind the
 * failure are forbidden together and the exams are placed again. Stateless.
 */
public class ExamScheduler {

    private static final Logger logger = LoggerFactory.getLogger(ExamScheduler.class);

    private final SeatingPlanner seatingPlanner = new SeatingPlanner();

    public ExamSolution schedule(ExamProblem problem, SolverConfig config) throws InfeasibleScheduleException {
        return schedule(problem, config, RefinementListener.NONE);
    }

    public ExamSolution schedule(ExamProblem problem, SolverConfig config, RefinementListener listener)
            throws InfeasibleScheduleException {
        long started = System.nanoTime();
        Deadline deadline = Deadline.after(config.getTimeBudget());
        logger.info("Scheduling {} exams over {} rooms (seed {})",
                problem.getExams().size(), problem.getRooms().size(), config.getSeed());

        ExamSearchSpace placementSpace = new ExamSearchSpace(problem, config);
        placementSpace.checkStaticDomains();
        SearchStats stats = new SearchStats();
        ExamSchedule schedule;
        int replacements = 0;
        while (true) {
            schedule = place(placementSpace, config, deadline, listener, stats);
            for (ExamPlacement placement : schedule.getPlacements()) {
                schedule.addSeats(seatingPlanner.seat(placement, problem, config.getSeatingRule()));
            }
            logger.debug("Seated {} students", schedule.getSeats().size());
            try {
                staff(schedule, problem, config, deadline, stats);
                break;
            } catch (BudgetExceededException e) {
                throw e;
            } catch (InfeasibleScheduleException e) {
                if (replacements >= config.getRetryBudget()) {
                    throw e;
                }
                replacements++;
                Set<String> examIds = examIdsOf(e.getConflictingIds());
                logger.info("Invigilators cannot cover {} as placed; placing exams again (attempt {})",
                        examIds, replacements + 1);
                placementSpace.forbid(schedule, examIds);
                placementSpace.clear();
            }
        }

        Evaluation evaluation = ConstraintEvaluator.forExams(config).evaluate(schedule, problem);
        if (!evaluation.isFeasible()) {
            throw new IllegalStateException("Exam scheduler produced hard violations: "
                    + evaluation.getViolations());
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        logger.info("Exams scheduled in {} ms, soft cost {} {}", elapsed.toMillis(),
                evaluation.getSoftCost(), evaluation.getBreakdown());
        return new ExamSolution(schedule, evaluation, stats, elapsed);
    }

    private ExamSchedule place(ExamSearchSpace placementSpace, SolverConfig config, Deadline deadline,
            RefinementListener listener, SearchStats stats) throws InfeasibleScheduleException {
        BacktrackingSearch<ExamCandidate> placementSearch = new BacktrackingSearch<>(
                placementSpace, config.getBacktrackBudget(), config.getRetryBudget(), deadline);
        placementSearch.run();
        stats.add(placementSearch.getStats());
        logger.info("Exams placed after {} steps ({} backjumps)", placementSearch.getStats().getSteps(),
                placementSearch.getStats().getBackjumps());

        ExamSchedule schedule = placementSpace.getSchedule().copy();
        if (config.getMoveBudget() > 0 && schedule.size() > 0) {
            ExamMoveSpace moves = new ExamMoveSpace(placementSpace, ConstraintEvaluator.forExamPlacement(config));
            schedule = new RefinementSearch<>(moves, config, deadline, listener, stats).run();
        }
        return schedule;
    }

    private void staff(ExamSchedule schedule, ExamProblem problem, SolverConfig config, Deadline deadline,
            SearchStats stats) throws InfeasibleScheduleException {
        InvigilationSearchSpace invigilation = new InvigilationSearchSpace(problem, schedule, config);
        invigilation.checkStaticDomains();
        BacktrackingSearch<Faculty> staffing = new BacktrackingSearch<>(
                invigilation, config.getBacktrackBudget(), config.getRetryBudget(), deadline);
        List<Faculty> chosen = staffing.run();
        for (int i = 0; i < chosen.size(); i++) {
            schedule.addInvigilator(invigilation.toAssignment(i, chosen.get(i)));
        }
        stats.add(staffing.getStats());
        logger.info("Staffed {} invigilator posts after {} steps", chosen.size(), staffing.getStats().getSteps());
    }

    /** Post ids read {@code exam/room#k}; bare exam ids pass through. */
    private static Set<String> examIdsOf(List<String> ids) {
        Set<String> examIds = new TreeSet<>();
        for (String id : ids) {
            int slash = id.indexOf('/');
            examIds.add(slash < 0 ? id : id.substring(0, slash));
        }
        return examIds;
    }
}
