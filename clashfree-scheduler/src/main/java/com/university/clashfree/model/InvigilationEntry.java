package com.university.clashfree.model;

import com.university.clashfree.domain.InvigilatorAssignment;
import com.university.clashfree.domain.TimeGrid;
import jakarta.persistence.*;

@Entity
@Table(name = "invigilation_entry")
public class InvigilationEntry {

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
    private String facultyId;

    @Column(name = "day_label", nullable = false)
    private String day;

    private int dayIndex;

    private int startPeriod;

    @Column(name = "slot_length")
    private int length;

    protected InvigilationEntry() {
    }

    public InvigilationEntry(String cycleId, InvigilatorAssignment post, TimeGrid grid) {
        this.cycleId = cycleId;
        this.examId = post.getExamId();
        this.roomId = post.getRoomId();
        this.facultyId = post.getFacultyId();
        this.day = grid.dayName(post.getRange().getDay());
        this.dayIndex = post.getRange().getDay();
        this.startPeriod = post.getRange().getStart();
        this.length = post.getRange().getLength();
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

    public String getFacultyId() {
        return facultyId;
    }

    public String getDay() {
        return day;
    }

    public int getDayIndex() {
        return dayIndex;
    }

    public int getStartPeriod() {
        return startPeriod;
    }

    public int getLength() {
        return length;
    }

    /** Who watches which room of which exam, and when. */
    public String dutyKey() {
        return examId + "/" + roomId + "@" + dayIndex + ":" + startPeriod + "+" + length + " " + facultyId;
    }
}
