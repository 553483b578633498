package com.university.clashfree.domain;

import java.util.Objects;

/**
 * A (day, period) cell of the {@link TimeGrid}. Ordered by day, then period.
 */
public final class TimeSlot implements Comparable<TimeSlot> {

    private final int day;
    private final int period;

    public TimeSlot(int day, int period) {
        if (day < 0 || period < 0) {
            throw new ModelException("Time slot coordinates must be non-negative: " + day + "/" + period);
        }
        this.day = day;
        this.period = period;
    }

    public int getDay() {
        return day;
    }

    public int getPeriod() {
        return period;
    }

    @Override
    public int compareTo(TimeSlot other) {
        int byDay = Integer.compare(day, other.day);
        return byDay != 0 ? byDay : Integer.compare(period, other.period);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TimeSlot)) {
            return false;
        }
        TimeSlot that = (TimeSlot) o;
        return day == that.day && period == that.period;
    }

    @Override
    public int hashCode() {
        return Objects.hash(day, period);
    }

    @Override
    public String toString() {
        return "d" + day + "p" + period;
    }
}
