package com.university.clashfree.domain;

import java.util.Objects;

public final class Assignment {

    private final Session session;
    private final SlotRange range;
    private final Room room;
    private final Faculty faculty;

    public Assignment(Session session, SlotRange range, Room room, Faculty faculty) {
        this.session = Objects.requireNonNull(session, "session");
        this.range = Objects.requireNonNull(range, "range");
        this.room = Objects.requireNonNull(room, "room");
        this.faculty = Objects.requireNonNull(faculty, "faculty");
        if (range.getLength() != session.getDuration()) {
            throw new IllegalArgumentException("Session " + session.getId() + " needs "
                    + session.getDuration() + " periods, range has " + range.getLength());
        }
    }

    public String getId() {
        return session.getId();
    }

    public Session getSession() {
        return session;
    }

    public Section getSection() {
        return session.getSection();
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

    public boolean overlaps(Assignment other) {
        return range.overlaps(other.range);
    }

    public Assignment withRange(SlotRange newRange) {
        return new Assignment(session, newRange, room, faculty);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Assignment)) {
            return false;
        }
        Assignment that = (Assignment) o;
        return session.equals(that.session) && range.equals(that.range)
                && room.getId().equals(that.room.getId()) && faculty.getId().equals(that.faculty.getId());
    }

    @Override
    public int hashCode() {
        return Objects.hash(session, range, room.getId(), faculty.getId());
    }

    @Override
    public String toString() {
        return session.getId() + "@" + range + "/" + room.getId() + "/" + faculty.getId();
    }
}
