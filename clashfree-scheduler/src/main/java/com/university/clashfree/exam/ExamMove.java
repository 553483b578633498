package com.university.clashfree.exam;

import com.university.clashfree.domain.ExamPlacement;

/**
 * Moves one exam to another sitting from its static domain.
 */
public final class ExamMove {

    private final ExamPlacement from;
    private final ExamPlacement to;

    ExamMove(ExamPlacement from, ExamPlacement to) {
        this.from = from;
        this.to = to;
    }

    public ExamPlacement getFrom() {
        return from;
    }

    public ExamPlacement getTo() {
        return to;
    }

    @Override
    public String toString() {
        return from.getId() + " " + from.getRange() + " -> " + to.getRange() + to.getRooms();
    }
}
