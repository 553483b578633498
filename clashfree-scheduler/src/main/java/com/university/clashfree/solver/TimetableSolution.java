package com.university.clashfree.solver;

import com.university.clashfree.constraint.Evaluation;
import com.university.clashfree.domain.Schedule;

import java.time.Duration;

public class TimetableSolution {

    private final Schedule schedule;
    private final Evaluation evaluation;
    private final SearchStats stats;
    private final Duration elapsed;

    public TimetableSolution(Schedule schedule, Evaluation evaluation, SearchStats stats, Duration elapsed) {
        this.schedule = schedule;
        this.evaluation = evaluation;
        this.stats = stats;
        this.elapsed = elapsed;
    }

    public Schedule getSchedule() {
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
