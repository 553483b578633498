package com.university.clashfree.service;

import com.university.clashfree.domain.Exam;
import com.university.clashfree.domain.ExamProblem;
import com.university.clashfree.domain.Faculty;
import com.university.clashfree.domain.Room;
import com.university.clashfree.domain.Schedule;
import com.university.clashfree.domain.TimeGrid;
import com.university.clashfree.domain.TimetableProblem;

import java.util.ArrayList;
import java.util.List;

/**
 * An exam round waiting for the timetable it has to respect. Rooms and
 * faculty carry calendars in exam-grid slots; when none are given the
 * teaching resources are used as they are.
 */
public class ExamPlan {

    private final TimeGrid grid;
    private final List<String> examOnlyDays;
    private final List<Exam> exams;
    private final List<Room> rooms;
    private final List<Faculty> faculty;

    public ExamPlan(TimeGrid grid, List<String> examOnlyDays, List<Exam> exams) {
        this(grid, examOnlyDays, exams, List.of(), List.of());
    }

    public ExamPlan(TimeGrid grid, List<String> examOnlyDays, List<Exam> exams,
                    List<Room> rooms, List<Faculty> faculty) {
        this.grid = grid;
        this.examOnlyDays = new ArrayList<>(examOnlyDays);
        this.exams = new ArrayList<>(exams);
        this.rooms = new ArrayList<>(rooms);
        this.faculty = new ArrayList<>(faculty);
    }

    public ExamProblem bind(TimetableProblem teaching, Schedule committed) {
        ExamProblem.Builder builder = ExamProblem.builder(grid);
        if (rooms.isEmpty() && faculty.isEmpty()) {
            builder.resourcesOf(teaching);
        } else {
            rooms.forEach(builder::room);
            faculty.forEach(builder::faculty);
        }
        builder.examOnlyDays(examOnlyDays).committedTimetable(teaching, committed);
        exams.forEach(builder::exam);
        return builder.build();
    }

    public TimeGrid getGrid() {
        return grid;
    }

    public List<Exam> getExams() {
        return exams;
    }
}
