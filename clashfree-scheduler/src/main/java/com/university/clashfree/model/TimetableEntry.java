package com.university.clashfree.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.university.clashfree.domain.Assignment;
import com.university.clashfree.domain.TimetableProblem;
import jakarta.persistence.*;

import java.util.Set;
import java.util.TreeSet;

@Entity
@Table(name = "timetable_entry")
public class TimetableEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String cycleId;

    @Column(nullable = false)
    private String sessionId;

    @Column(nullable = false)
    private String sectionId;

    @Column(nullable = false)
    private String courseId;

    @Column(nullable = false)
    private String kind;

    @Column(name = "day_label", nullable = false)
    private String day;

    @Column(nullable = false)
    private int dayIndex;

    @Column(nullable = false)
    private int startPeriod;

    @Column(name = "slot_length", nullable = false)
    private int length;

    @Column(nullable = false)
    private String roomId;

    @Column(nullable = false)
    private String facultyId;

    @JsonIgnore
    @ElementCollection(fetch = FetchType.LAZY)
    @CollectionTable(name = "timetable_entry_student", joinColumns = @JoinColumn(name = "entry_id"))
    @Column(name = "student_id")
    private Set<String> studentIds = new TreeSet<>();

    public TimetableEntry() {
    }

    public static TimetableEntry from(String cycleId, Assignment assignment, TimetableProblem problem) {
        TimetableEntry entry = new TimetableEntry();
        entry.cycleId = cycleId;
        entry.sessionId = assignment.getId();
        entry.sectionId = assignment.getSection().getId();
        entry.courseId = assignment.getSection().getCourseId();
        entry.kind = assignment.getSection().getKind().name();
        entry.day = problem.getGrid().dayName(assignment.getRange().getDay());
        entry.dayIndex = assignment.getRange().getDay();
        entry.setStartPeriod(assignment.getRange().getStart());
        entry.length = assignment.getRange().getLength();
        entry.roomId = assignment.getRoom().getId();
        entry.facultyId = assignment.getFaculty().getId();
        entry.studentIds.addAll(problem.studentsOf(entry.sectionId));
        return entry;
    }

    public Long getId() {
        return id;
    }

    public String getCycleId() {
        return cycleId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getSectionId() {
        return sectionId;
    }

    public String getCourseId() {
        return courseId;
    }

    public String getKind() {
        return kind;
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

    public String getRoomId() {
        return roomId;
    }

    public String getFacultyId() {
        return facultyId;
    }

    public Set<String> getStudentIds() {
        return studentIds;
    }

    public void setCycleId(String cycleId) {
        this.cycleId = cycleId;
    }

    public void setSessionId(String sessionId) {
        this.sessionId = sessionId;
    }

    public void setDay(String day) {
        this.day = day;
    }

    public void setDayIndex(int dayIndex) {
        this.dayIndex = dayIndex;
    }

    public void setStartPeriod(int startPeriod) {
        if (startPeriod < 0) {
            throw new IllegalArgumentException("Start period must not be negative");
        }
        this.startPeriod = startPeriod;
    }

    public void setLength(int length) {
        this.length = length;
    }

    public void setRoomId(String roomId) {
        this.roomId = roomId;
    }

    public void setFacultyId(String facultyId) {
        this.facultyId = facultyId;
    }

    /** True when both entries place the session identically. */
    public boolean samePlacement(TimetableEntry other) {
        return dayIndex == other.dayIndex
                && startPeriod == other.startPeriod
                && length == other.length
                && roomId.equals(other.roomId)
                && facultyId.equals(other.facultyId);
    }

    @Override
    public String toString() {
        return "TimetableEntry{" +
                "cycleId='" + cycleId + '\'' +
                ", sessionId='" + sessionId + '\'' +
                ", day='" + day + '\'' +
                ", startPeriod=" + startPeriod +
                ", length=" + length +
                ", roomId='" + roomId + '\'' +
                ", facultyId='" + facultyId + '\'' +
                '}';
    }
}
