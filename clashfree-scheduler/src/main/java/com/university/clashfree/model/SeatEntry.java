package com.university.clashfree.model;

import com.university.clashfree.domain.SeatAssignment;
import jakarta.persistence.*;

@Entity
@Table(name = "seat_entry")
public class SeatEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String cycleId;

    @Column(nullable = false)
    private String examId;

    @Column(nullable = false)
    private String roomId;

    @Column(nullable = false)
    private String seatLabel;

    @Column(nullable = false)
    private String studentId;

    protected SeatEntry() {
    }

    public SeatEntry(String cycleId, SeatAssignment seat) {
        this.cycleId = cycleId;
        this.examId = seat.getExamId();
        this.roomId = seat.getRoomId();
        this.seatLabel = seat.getSeatLabel();
        this.studentId = seat.getStudentId();
    }

    public Long getId() {
        return id;
    }

    public String getCycleId() {
        return cycleId;
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
}
