package com.university.clashfree.solver;

import com.university.clashfree.domain.Assignment;

import java.util.List;

/**
 * Replaces some assignments by others for the same sessions: a relocation
 * moves one session, a swap exchanges the ranges of two.
 */
public final class TimetableMove {

    public enum Type {
        RELOCATE, SWAP
    }

    private final Type type;
    private final List<Assignment> removed;
    private final List<Assignment> added;

    public TimetableMove(Type type, List<Assignment> removed, List<Assignment> added) {
        this.type = type;
        this.removed = List.copyOf(removed);
        this.added = List.copyOf(added);
    }

    public static TimetableMove relocate(Assignment from, Assignment to) {
        return new TimetableMove(Type.RELOCATE, List.of(from), List.of(to));
    }

    public static TimetableMove swap(Assignment a, Assignment b) {
        return new TimetableMove(Type.SWAP, List.of(a, b),
                List.of(a.withRange(b.getRange()), b.withRange(a.getRange())));
    }

    public Type getType() {
        return type;
    }

    public List<Assignment> getRemoved() {
        return removed;
    }

    public List<Assignment> getAdded() {
        return added;
    }

    @Override
    public String toString() {
        return type + " " + removed + " -> " + added;
    }
}
