package com.university.clashfree.model;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * A committed planning cycle. Written once; its entries are never updated.
 */
@Entity
@Table(name = "planning_cycle")
public class PlanningCycle {

    @Id
    private String cycleId;

    @Column(nullable = false)
    private Instant committedAt;

    private int sessionCount;

    private double timetableSoftCost;

    private int examCount;

    private Double examSoftCost;

    protected PlanningCycle() {
    }

    public PlanningCycle(String cycleId, Instant committedAt, int sessionCount, double timetableSoftCost,
                         int examCount, Double examSoftCost) {
        this.cycleId = cycleId;
        this.committedAt = committedAt;
        this.sessionCount = sessionCount;
        this.timetableSoftCost = timetableSoftCost;
        this.examCount = examCount;
        this.examSoftCost = examSoftCost;
    }

    public String getCycleId() {
        return cycleId;
    }

    public Instant getCommittedAt() {
        return committedAt;
    }

    public int getSessionCount() {
        return sessionCount;
    }

    public double getTimetableSoftCost() {
        return timetableSoftCost;
    }

    public int getExamCount() {
        return examCount;
    }

    /** Null when the cycle carried no exams. */
    public Double getExamSoftCost() {
        return examSoftCost;
    }
}
