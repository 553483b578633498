package com.university.clashfree.exam;

import com.university.clashfree.constraint.Evaluation;
import com.university.clashfree.domain.ExamSchedule;
import com.university.clashfree.solver.SearchStats;

import java.time.Duration;

/**
 * A placed, seated and staffed exam schedule with its evaluation.
 */
public class ExamSolution {

    private final ExamSchedule schedule;
    private final Evaluation evaluation;
    private final SearchStats stats;
    private final Duration elapsed;

    public ExamSolution(ExamSchedule schedule, Evaluation evaluation, SearchStats stats, Duration elapsed) {
        this.schedule = schedule;
        this.evaluation = evaluation;
        this.stats = stats;
        this.elapsed = elapsed;
    }

    public ExamSchedule getSchedule() {
        return schedule;
    }

    public Evaluation getEvaluation() {
        return evaluation;
    }

    public double getSoftCost() {
        return evaluation.getSoftCost();
    }

    public SearchStats getStats() {
        return stats;
    }

    public Duration getElapsed() {
        return elapsed;
    }
}
