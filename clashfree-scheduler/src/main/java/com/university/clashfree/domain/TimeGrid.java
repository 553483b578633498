package com.university.clashfree.domain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * The fixed weekly grid: day labels times periods per day. Break periods (lunch
 * and the like) are part of the grid but never scheduled and never spanned by a
 * multi-period session. Immutable and safe to share between solver runs.
 */
public final class TimeGrid {

    private final List<String> days;
    private final int periodsPerDay;
    private final Set<Integer> breakPeriods;

    public TimeGrid(List<String> days, int periodsPerDay) {
        this(days, periodsPerDay, Collections.emptySet());
    }

    public TimeGrid(List<String> days, int periodsPerDay, Collection<Integer> breakPeriods) {
        if (days == null || days.isEmpty()) {
            throw new ModelException("Time grid needs at least one day");
        }
        if (periodsPerDay < 1) {
            throw new ModelException("Time grid needs at least one period per day");
        }
        if (new TreeSet<>(days).size() != days.size()) {
            throw new ModelException("Time grid day labels must be unique: " + days);
        }
        Set<Integer> breaks = new TreeSet<>(breakPeriods == null ? Collections.emptySet() : breakPeriods);
        for (Integer period : breaks) {
            if (period < 0 || period >= periodsPerDay) {
                throw new ModelException("Break period " + period + " is outside the grid");
            }
        }
        this.days = List.copyOf(days);
        this.periodsPerDay = periodsPerDay;
        this.breakPeriods = Collections.unmodifiableSet(breaks);
    }

    public List<String> getDays() {
        return days;
    }

    public int getDayCount() {
        return days.size();
    }

    public int getPeriodsPerDay() {
        return periodsPerDay;
    }

    public Set<Integer> getBreakPeriods() {
        return breakPeriods;
    }

    public int getSlotCount() {
        return days.size() * periodsPerDay;
    }

    public String dayName(int day) {
        return days.get(day);
    }

    /** Index of the day label, or -1 when the grid has no such day. */
    public int dayIndex(String label) {
        return days.indexOf(label);
    }

    public boolean isBreak(int period) {
        return breakPeriods.contains(period);
    }

    public int indexOf(int day, int period) {
        return day * periodsPerDay + period;
    }

    public int indexOf(TimeSlot slot) {
        return indexOf(slot.getDay(), slot.getPeriod());
    }

    public boolean contains(TimeSlot slot) {
        return slot.getDay() < days.size() && slot.getPeriod() < periodsPerDay;
    }

    /** True when the range lies inside the grid and touches no break period. */
    public boolean fits(SlotRange range) {
        if (range.getDay() >= days.size() || range.getEnd() > periodsPerDay) {
            return false;
        }
        for (int p = range.getStart(); p < range.getEnd(); p++) {
            if (breakPeriods.contains(p)) {
                return false;
            }
        }
        return true;
    }

    /** Every range of the given length that {@link #fits(SlotRange) fits}, in grid order. */
    public List<SlotRange> ranges(int length) {
        List<SlotRange> ranges = new ArrayList<>();
        if (length < 1 || length > periodsPerDay) {
            return ranges;
        }
        for (int day = 0; day < days.size(); day++) {
            for (int start = 0; start + length <= periodsPerDay; start++) {
                SlotRange range = new SlotRange(day, start, length);
                if (fits(range)) {
                    ranges.add(range);
                }
            }
        }
        return ranges;
    }

    public String describe(SlotRange range) {
        return dayName(range.getDay()) + " P" + (range.getStart() + 1)
                + (range.getLength() > 1 ? "-P" + range.getEnd() : "");
    }
}
