package com.university.clashfree.service;

import com.university.clashfree.exam.ExamSolution;
import com.university.clashfree.model.PlanningCycle;
import com.university.clashfree.solver.TimetableSolution;

public class CycleOutcome {

    private final PlanningCycle cycle;
    private final TimetableSolution timetable;
    private final ExamSolution exams;

    public CycleOutcome(PlanningCycle cycle, TimetableSolution timetable, ExamSolution exams) {
        this.cycle = cycle;
        this.timetable = timetable;
        this.exams = exams;
    }

    public PlanningCycle getCycle() {
        return cycle;
    }

    public TimetableSolution getTimetable() {
        return timetable;
    }

    /** Null when the cycle had no exam round. */
    public ExamSolution getExams() {
        return exams;
    }
}
