package com.university.clashfree.model;

import com.university.clashfree.domain.ExamPlacement;
import com.university.clashfree.domain.ExamProblem;
import com.university.clashfree.domain.Room;
import jakarta.persistence.*;

import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "exam_entry")
public class ExamEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String cycleId;

    @Column(nullable = false)
    private String examId;

    @Column(nullable = false)
    private String courseId;

    @Column(name = "day_label", nullable = false)
    private String day;

    private int dayIndex;

    private int startPeriod;

    @Column(name = "slot_length")
    private int length;

    private int enrolledCount;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "exam_entry_room", joinColumns = @JoinColumn(name = "entry_id"))
    @OrderColumn(name = "position")
    @Column(name = "room_id")
    private List<String> roomIds = new ArrayList<>();

    protected ExamEntry() {
    }

    public static ExamEntry from(String cycleId, ExamPlacement placement, ExamProblem problem) {
        ExamEntry entry = new ExamEntry();
        entry.cycleId = cycleId;
        entry.examId = placement.getId();
        entry.courseId = placement.getExam().getCourseId();
        entry.day = problem.getGrid().dayName(placement.getRange().getDay());
        entry.dayIndex = placement.getRange().getDay();
        entry.startPeriod = placement.getRange().getStart();
        entry.length = placement.getRange().getLength();
        entry.enrolledCount = placement.getExam().getEnrolledCount();
        for (Room room : placement.getRooms()) {
            entry.roomIds.add(room.getId());
        }
        return entry;
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

    public String getCourseId() {
        return courseId;
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

    public int getEnrolledCount() {
        return enrolledCount;
    }

    public List<String> getRoomIds() {
        return roomIds;
    }

    /** Same range of the exam grid in the same rooms. */
    public boolean samePlacement(ExamEntry other) {
        return dayIndex == other.dayIndex
                && startPeriod == other.startPeriod
                && length == other.length
                && roomIds.equals(other.roomIds);
    }
}
