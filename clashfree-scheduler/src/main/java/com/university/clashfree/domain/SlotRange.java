package com.university.clashfree.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Consecutive periods of one day; the end is exclusive.
 */
public final class SlotRange implements Comparable<SlotRange> {

    private final int day;
    private final int start;
    private final int length;

    public SlotRange(int day, int start, int length) {
        if (day < 0 || start < 0 || length < 1) {
            throw new ModelException("Invalid slot range " + day + "/" + start + "+" + length);
        }
        this.day = day;
        this.start = start;
        this.length = length;
    }

    public static SlotRange single(TimeSlot slot) {
        return new SlotRange(slot.getDay(), slot.getPeriod(), 1);
    }

    public int getDay() {
        return day;
    }

    public int getStart() {
        return start;
    }

    public int getLength() {
        return length;
    }

    public int getEnd() {
        return start + length;
    }

    public boolean overlaps(SlotRange other) {
        return day == other.day && start < other.getEnd() && other.start < getEnd();
    }

    public boolean contains(TimeSlot slot) {
        return slot.getDay() == day && slot.getPeriod() >= start && slot.getPeriod() < getEnd();
    }

    /** First slot shared with {@code other}, or null when they do not overlap. */
    public TimeSlot firstSharedSlot(SlotRange other) {
        if (!overlaps(other)) {
            return null;
        }
        return new TimeSlot(day, Math.max(start, other.start));
    }

    public List<TimeSlot> slots() {
        List<TimeSlot> slots = new ArrayList<>(length);
        for (int p = start; p < getEnd(); p++) {
            slots.add(new TimeSlot(day, p));
        }
        return slots;
    }

    @Override
    public int compareTo(SlotRange other) {
        if (day != other.day) {
            return Integer.compare(day, other.day);
        }
        if (start != other.start) {
            return Integer.compare(start, other.start);
        }
        return Integer.compare(length, other.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SlotRange)) {
            return false;
        }
        SlotRange that = (SlotRange) o;
        return day == that.day && start == that.start && length == that.length;
    }

    @Override
    public int hashCode() {
        return Objects.hash(day, start, length);
    }

    @Override
    public String toString() {
        return "d" + day + "p" + start + "+" + length;
    }
}
