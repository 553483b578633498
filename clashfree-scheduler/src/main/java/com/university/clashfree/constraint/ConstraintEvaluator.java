package com.university.clashfree.constraint;

import com.university.clashfree.config.SolverConfig;
import com.university.clashfree.domain.ExamProblem;
import com.university.clashfree.domain.ExamSchedule;
import com.university.clashfree.domain.Schedule;
import com.university.clashfree.domain.TimetableProblem;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies a {@link ConstraintSet} to a schedule. Stateless and thread-safe:
 * the same schedule always yields the same {@link Evaluation}.
 */
public final class ConstraintEvaluator<S, P> {

    private final ConstraintSet<S, P> constraints;

    public ConstraintEvaluator(ConstraintSet<S, P> constraints) {
        this.constraints = constraints;
    }

    public static ConstraintEvaluator<Schedule, TimetableProblem> forTimetable(SolverConfig config) {
        return new ConstraintEvaluator<>(TimetableConstraints.create(config.getWeights()));
    }

    /** Rules that hold once exams are placed, before seats and invigilators exist. */
    public static ConstraintEvaluator<ExamSchedule, ExamProblem> forExamPlacement(SolverConfig config) {
        return new ConstraintEvaluator<>(ExamConstraints.placement(config));
    }

    public static ConstraintEvaluator<ExamSchedule, ExamProblem> forExams(SolverConfig config) {
        return new ConstraintEvaluator<>(ExamConstraints.full(config));
    }

    public ConstraintSet<S, P> getConstraints() {
        return constraints;
    }

    public Evaluation evaluate(S schedule, P problem) {
        List<HardViolation> violations = new ArrayList<>();
        constraints.getHard().forEach((kind, constraint) -> constraint.check(schedule, problem, violations));
        Map<String, Double> breakdown = new LinkedHashMap<>();
        double cost = 0;
        for (Map.Entry<String, ConstraintSet.WeightedTerm<S, P>> entry : constraints.getSoft().entrySet()) {
            double weighted = entry.getValue().getWeight() * entry.getValue().getTerm().penalty(schedule, problem);
            breakdown.put(entry.getKey(), weighted);
            cost += weighted;
        }
        return new Evaluation(violations, cost, breakdown);
    }

    /** Soft cost only; for callers that already know the schedule is feasible. */
    public double softCost(S schedule, P problem) {
        double cost = 0;
        for (ConstraintSet.WeightedTerm<S, P> term : constraints.getSoft().values()) {
            cost += term.getWeight() * term.getTerm().penalty(schedule, problem);
        }
        return cost;
    }
}
