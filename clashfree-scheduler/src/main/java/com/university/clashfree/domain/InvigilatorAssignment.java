package com.university.clashfree.domain;

import java.util.Objects;

public final class InvigilatorAssignment {

    private final String examId;
    private final String roomId;
    private final SlotRange range;
    private final String facultyId;

    public InvigilatorAssignment(String examId, String roomId, SlotRange range, String facultyId) {
        this.examId = Objects.requireNonNull(examId, "examId");
        this.roomId = Objects.requireNonNull(roomId, "roomId");
        this.range = Objects.requireNonNull(range, "range");
        this.facultyId = Objects.requireNonNull(facultyId, "facultyId");
    }

    public String getExamId() {
        return examId;
    }

    public String getRoomId() {
        return roomId;
    }

    public SlotRange getRange() {
        return range;
    }

    public String getFacultyId() {
        return facultyId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof InvigilatorAssignment)) {
            return false;
        }
        InvigilatorAssignment that = (InvigilatorAssignment) o;
        return examId.equals(that.examId) && roomId.equals(that.roomId)
                && range.equals(that.range) && facultyId.equals(that.facultyId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(examId, roomId, range, facultyId);
    }

    @Override
    public String toString() {
        return facultyId + "->" + examId + "/" + roomId + "@" + range;
    }
}
