package com.university.clashfree.service;

import com.university.clashfree.config.SolverConfig;
import com.university.clashfree.domain.ExamProblem;
import com.university.clashfree.domain.TimetableProblem;
import com.university.clashfree.exam.ExamScheduler;
import com.university.clashfree.exam.ExamSolution;
import com.university.clashfree.model.PlanningCycle;
import com.university.clashfree.model.PlanningRequest;
import com.university.clashfree.solver.InfeasibleScheduleException;
import com.university.clashfree.solver.TimetableSolution;
import com.university.clashfree.solver.TimetableSolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Runs planning cycles: the timetable is solved first, the exam round is
 * then scheduled around it, and the result is committed. Independent cycles
 * may run side by side on the planning executor.
 */
@Service
public class PlanningService {

    private static final Logger logger = LoggerFactory.getLogger(PlanningService.class);

    private final TimetableSolver timetableSolver;
    private final ExamScheduler examScheduler;
    private final ScheduleStore store;
    private final PlanningRequestMapper mapper;
    private final SolverConfig defaults;
    private final ThreadPoolTaskExecutor planningExecutor;

    public PlanningService(TimetableSolver timetableSolver, ExamScheduler examScheduler, ScheduleStore store,
                           PlanningRequestMapper mapper, SolverConfig defaults,
                           ThreadPoolTaskExecutor planningExecutor) {
        this.timetableSolver = timetableSolver;
        this.examScheduler = examScheduler;
        this.store = store;
        this.mapper = mapper;
        this.defaults = defaults;
        this.planningExecutor = planningExecutor;
    }

    public CycleOutcome plan(String cycleId, PlanningRequest request) throws InfeasibleScheduleException {
        TimetableProblem teaching = mapper.toTimetableProblem(request);
        ExamPlan exams = mapper.toExamPlan(request);
        SolverConfig config = mapper.toSolverConfig(request, defaults);
        return plan(cycleId, teaching, exams, config);
    }

    /**
     * @param exams null when the cycle has no exam round
     * @throws IllegalStateException when the cycle id is already committed
     */
    public CycleOutcome plan(String cycleId, TimetableProblem teaching, ExamPlan exams, SolverConfig config)
            throws InfeasibleScheduleException {
        if (store.isCommitted(cycleId)) {
            throw new IllegalStateException("Cycle " + cycleId + " is already committed");
        }
        logger.info("Planning cycle {}", cycleId);
        TimetableSolution timetable;
        try {
            timetable = timetableSolver.solve(teaching, config);
        } catch (InfeasibleScheduleException e) {
            logger.warn("Cycle {} has no feasible timetable: {} ({})", cycleId, e.getMessage(), e.getKind());
            throw e;
        }

        ExamProblem examProblem = null;
        ExamSolution examSolution = null;
        if (exams != null) {
            examProblem = exams.bind(teaching, timetable.getSchedule());
            try {
                examSolution = examScheduler.schedule(examProblem, config);
            } catch (InfeasibleScheduleException e) {
                logger.warn("Cycle {} has no feasible exam schedule: {} ({})", cycleId, e.getMessage(), e.getKind());
                throw e;
            }
        }
        PlanningCycle cycle = store.commit(cycleId, teaching, timetable, examProblem, examSolution);
        return new CycleOutcome(cycle, timetable, examSolution);
    }

    /**
     * Plans on the planning executor. An infeasible cycle completes the future
     * exceptionally with a {@link CompletionException} wrapping the cause.
     */
    public CompletableFuture<CycleOutcome> planAsync(String cycleId, PlanningRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return plan(cycleId, request);
            } catch (InfeasibleScheduleException e) {
                throw new CompletionException(e);
            }
        }, planningExecutor);
    }
}
