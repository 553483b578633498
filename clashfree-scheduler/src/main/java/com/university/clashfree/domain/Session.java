package com.university.clashfree.domain;

import java.util.Objects;

/**
 * One weekly meeting of a {@link Section}; the unit the timetable solver places.
 */
public final class Session implements Comparable<Session> {

    private final Section section;
    private final int ordinal;
    private final String id;

    public Session(Section section, int ordinal) {
        this.section = section;
        this.ordinal = ordinal;
        this.id = section.getId() + "#" + ordinal;
    }

    public String getId() {
        return id;
    }

    public Section getSection() {
        return section;
    }

    public String getSectionId() {
        return section.getId();
    }

    public int getOrdinal() {
        return ordinal;
    }

    public int getDuration() {
        return section.getDuration();
    }

    @Override
    public int compareTo(Session other) {
        return id.compareTo(other.id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Session)) {
            return false;
        }
        return id.equals(((Session) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return id;
    }
}
