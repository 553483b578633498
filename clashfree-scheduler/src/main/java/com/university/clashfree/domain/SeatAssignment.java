package com.university.clashfree.domain;

import java.util.Objects;

/**
 * One student seated for one exam. Labels look like {@code R03-LB}: row,
 * left or right bench, seat A or B on that bench.
 */
public final class SeatAssignment {

    private final String examId;
    private final String roomId;
    private final String seatLabel;
    private final String studentId;

    public SeatAssignment(String examId, String roomId, String seatLabel, String studentId) {
        this.examId = examId;
        this.roomId = roomId;
        this.seatLabel = seatLabel;
        this.studentId = studentId;
    }

    public String getExamId() {
        return examId;
    }

    public String getRoomId() {
        return roomId;
    }

    public String getSeatLabel() {
        return seatLabel;
    }

    public String getStudentId() {
        return studentId;
    }

    /** Row and bench part of the label, shared by the two seats of a bench. */
    public String getBench() {
        return seatLabel.substring(0, seatLabel.length() - 1);
    }

    /** True for the second seat of a bench. */
    public boolean isSeatB() {
        return seatLabel.endsWith("B");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SeatAssignment)) {
            return false;
        }
        SeatAssignment that = (SeatAssignment) o;
        return examId.equals(that.examId) && roomId.equals(that.roomId)
                && seatLabel.equals(that.seatLabel) && studentId.equals(that.studentId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(examId, roomId, seatLabel, studentId);
    }

    @Override
    public String toString() {
        return examId + "/" + roomId + "/" + seatLabel + "=" + studentId;
    }
}
