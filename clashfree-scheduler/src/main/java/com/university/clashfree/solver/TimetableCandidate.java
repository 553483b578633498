package com.university.clashfree.solver;

import com.university.clashfree.domain.Assignment;
import com.university.clashfree.domain.Faculty;
import com.university.clashfree.domain.Room;
import com.university.clashfree.domain.Session;
import com.university.clashfree.domain.SlotRange;

/**
 * One value of a session's static domain: where, when and by whom.
 */
public final class TimetableCandidate {

    private final SlotRange range;
    private final Room room;
    private final Faculty faculty;
    private final int position;
    private double pressure;
    private long tieKey;

    TimetableCandidate(SlotRange range, Room room, Faculty faculty, int position) {
        this.range = range;
        this.room = room;
        this.faculty = faculty;
        this.position = position;
    }

    public SlotRange getRange() {
        return range;
    }

    public Room getRoom() {
        return room;
    }

    public Faculty getFaculty() {
        return faculty;
    }

    /** Position in enumeration order; the last tie-breaker. */
    int getPosition() {
        return position;
    }

    /** Expected competition for the candidate's room, faculty and clash neighbours. */
    public double getPressure() {
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

    public Assignment toAssignment(Session session) {
        return new Assignment(session, range, room, faculty);
    }

    @Override
    public String toString() {
        return range + "/" + room.getId() + "/" + faculty.getId();
    }
}
