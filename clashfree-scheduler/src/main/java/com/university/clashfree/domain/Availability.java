package com.university.clashfree.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Calendar of the slots a room or faculty member may be used in.
 */
public final class Availability {

    private enum Mode {
        ALWAYS, ONLY, EXCEPT
    }

    private static final Availability ALWAYS = new Availability(Mode.ALWAYS, Collections.emptySet());

    private final Mode mode;
    private final Set<TimeSlot> slots;

    private Availability(Mode mode, Set<TimeSlot> slots) {
        this.mode = mode;
        this.slots = slots;
    }

    public static Availability always() {
        return ALWAYS;
    }

    public static Availability only(Collection<TimeSlot> slots) {
        return new Availability(Mode.ONLY, Collections.unmodifiableSet(new TreeSet<>(slots)));
    }

    public static Availability allExcept(Collection<TimeSlot> slots) {
        if (slots == null || slots.isEmpty()) {
            return ALWAYS;
        }
        return new Availability(Mode.EXCEPT, Collections.unmodifiableSet(new TreeSet<>(slots)));
    }

    public boolean permits(TimeSlot slot) {
        switch (mode) {
            case ONLY:
                return slots.contains(slot);
            case EXCEPT:
                return !slots.contains(slot);
            default:
                return true;
        }
    }

    public boolean permits(SlotRange range) {
        if (mode == Mode.ALWAYS) {
            return true;
        }
        for (int p = range.getStart(); p < range.getEnd(); p++) {
            if (!permits(new TimeSlot(range.getDay(), p))) {
                return false;
            }
        }
        return true;
    }

    /** Slots named explicitly by this calendar; used to check them against the grid. */
    public Set<TimeSlot> getReferencedSlots() {
        return slots;
    }

    @Override
    public String toString() {
        return mode == Mode.ALWAYS ? "always" : mode.name().toLowerCase() + slots;
    }
}
