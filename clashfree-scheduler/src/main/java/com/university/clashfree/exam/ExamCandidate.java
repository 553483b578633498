package com.university.clashfree.exam;

import com.university.clashfree.domain.Exam;
import com.university.clashfree.domain.ExamPlacement;
import com.university.clashfree.domain.Room;
import com.university.clashfree.domain.SlotRange;

import java.util.List;

/**
 * A range of the exam grid paired with a room combination.
 */
public final class ExamCandidate {

    private final SlotRange range;
    private final List<Room> rooms;
    private final int position;
    private double pressure;
    private long tieKey;

    ExamCandidate(SlotRange range, List<Room> rooms, int position) {
        this.range = range;
        this.rooms = rooms;
        this.position = position;
    }

    public SlotRange getRange() {
        return range;
    }

    public List<Room> getRooms() {
        return rooms;
    }

    int getPosition() {
        return position;
    }

    double getPressure() {
        return pressure;
    }

    void setPressure(double pressure) {
        this.pressure = pressure;
    }

    long getTieKey() {
        return tieKey;
    }

    void setTieKey(long tieKey) {
        this.tieKey = tieKey;
    }

    public ExamPlacement toPlacement(Exam exam) {
        return new ExamPlacement(exam, range, rooms);
    }

    @Override
    public String toString() {
        return range + "" + rooms;
    }
}
