package com.university.clashfree.service;

import com.university.clashfree.TestProblems;
import com.university.clashfree.domain.Exam;
import com.university.clashfree.domain.ExamPlacement;
import com.university.clashfree.domain.ExamProblem;
import com.university.clashfree.domain.InvigilatorAssignment;
import com.university.clashfree.domain.Room;
import com.university.clashfree.domain.SlotRange;
import com.university.clashfree.domain.TimeGrid;
import com.university.clashfree.model.ExamEntry;
import com.university.clashfree.model.InvigilationEntry;
import com.university.clashfree.model.TimetableEntry;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ScheduleDiffTest {

    private static final TimeGrid EXAM_GRID = TestProblems.grid(2, 3);
    private static final ExamProblem EXAMS = ExamProblem.builder(EXAM_GRID)
            .room(new Room("R1", 10))
            .room(new Room("R2", 10))
            .exam(Exam.builder("E1", "C1").students("s1").build())
            .exam(Exam.builder("E2", "C2").students("s2").build())
            .exam(Exam.builder("E3", "C3").students("s3").build())
            .build();

    private static TimetableEntry entry(String sessionId, int day, int start, String room, String faculty) {
        TimetableEntry entry = new TimetableEntry();
        entry.setCycleId("c");
        entry.setSessionId(sessionId);
        entry.setDay(day == 0 ? "Mon" : "Tue");
        entry.setDayIndex(day);
        entry.setStartPeriod(start);
        entry.setLength(1);
        entry.setRoomId(room);
        entry.setFacultyId(faculty);
        return entry;
    }

    @Test
    void identicalTimetablesHaveNoDifferences() {
        List<TimetableEntry> before = List.of(entry("S1#1", 0, 0, "R1", "F1"), entry("S2#1", 0, 1, "R1", "F1"));
        List<TimetableEntry> after = List.of(entry("S2#1", 0, 1, "R1", "F1"), entry("S1#1", 0, 0, "R1", "F1"));

        assertThat(ScheduleDiff.between(before, after).isEmpty()).isTrue();
    }

    @Test
    void sortsChangesIntoAddedRemovedAndMoved() {
        List<TimetableEntry> before = List.of(
                entry("S1#1", 0, 0, "R1", "F1"),
                entry("S2#1", 0, 1, "R1", "F1"),
                entry("S3#1", 1, 0, "R2", "F2"));
        List<TimetableEntry> after = List.of(
                entry("S1#1", 0, 0, "R1", "F1"),
                entry("S2#1", 1, 1, "R1", "F1"),
                entry("S3#1", 1, 0, "R2", "F3"),
                entry("S4#1", 1, 2, "R2", "F2"));

        ScheduleDiff diff = ScheduleDiff.between(before, after);

        assertThat(diff.getAdded()).extracting(TimetableEntry::getSessionId).containsExactly("S4#1");
        assertThat(diff.getRemoved()).isEmpty();
        assertThat(diff.getMoved()).extracting(ScheduleDiff.Move::getSessionId).containsExactly("S2#1", "S3#1");
        ScheduleDiff.Move moved = diff.getMoved().get(0);
        assertThat(moved.getBefore().getDayIndex()).isZero();
        assertThat(moved.getAfter().getDayIndex()).isEqualTo(1);
        assertThat(diff.isEmpty()).isFalse();
    }

    @Test
    void sessionsThatDisappearAreRemoved() {
        ScheduleDiff diff = ScheduleDiff.between(
                List.of(entry("S1#1", 0, 0, "R1", "F1"), entry("S1#2", 1, 0, "R1", "F1")),
                List.of(entry("S1#1", 0, 0, "R1", "F1")));

        assertThat(diff.getRemoved()).extracting(TimetableEntry::getSessionId).containsExactly("S1#2");
        assertThat(diff.getAdded()).isEmpty();
        assertThat(diff.getMoved()).isEmpty();
    }

    private static ExamEntry exam(String examId, int day, int start, String... rooms) {
        List<Room> placedIn = new ArrayList<>();
        for (String room : rooms) {
            placedIn.add(EXAMS.getRoom(room));
        }
        return ExamEntry.from("c", new ExamPlacement(EXAMS.getExam(examId), new SlotRange(day, start, 1), placedIn),
                EXAMS);
    }

    private static InvigilationEntry duty(String examId, String room, int day, int start, String faculty) {
        return new InvigilationEntry("c", new InvigilatorAssignment(examId, room, new SlotRange(day, start, 1), faculty),
                EXAM_GRID);
    }

    @Test
    void examsMoveWhenTheirRangeOrRoomsChange() {
        ScheduleDiff diff = ScheduleDiff.between(List.of(), List.of(),
                List.of(exam("E1", 0, 0, "R1"), exam("E2", 0, 1, "R1"), exam("E3", 1, 0, "R2")),
                List.of(exam("E1", 0, 0, "R1"), exam("E2", 0, 1, "R2"), exam("E3", 1, 2, "R2")),
                List.of(), List.of());

        assertThat(diff.getExamsMoved()).extracting(ScheduleDiff.ExamMove::getExamId).containsExactly("E2", "E3");
        assertThat(diff.getExamsMoved().get(0).getAfter().getRoomIds()).containsExactly("R2");
        assertThat(diff.getExamsMoved().get(1).getBefore().getStartPeriod()).isZero();
        assertThat(diff.getExamsMoved().get(1).getAfter().getStartPeriod()).isEqualTo(2);
        assertThat(diff.getExamsAdded()).isEmpty();
        assertThat(diff.getExamsRemoved()).isEmpty();
        assertThat(diff.getMoved()).isEmpty();
        assertThat(diff.isEmpty()).isFalse();
    }

    @Test
    void examsThatAppearOrDisappearAreAddedOrRemoved() {
        ScheduleDiff diff = ScheduleDiff.between(List.of(), List.of(),
                List.of(exam("E1", 0, 0, "R1"), exam("E2", 0, 1, "R1")),
                List.of(exam("E2", 0, 1, "R1"), exam("E3", 1, 0, "R1", "R2")),
                List.of(), List.of());

        assertThat(diff.getExamsAdded()).extracting(ExamEntry::getExamId).containsExactly("E3");
        assertThat(diff.getExamsRemoved()).extracting(ExamEntry::getExamId).containsExactly("E1");
        assertThat(diff.getExamsMoved()).isEmpty();
    }

    @Test
    void aChangedInvigilatorDropsOneDutyAndGainsAnother() {
        ScheduleDiff diff = ScheduleDiff.between(List.of(), List.of(), List.of(), List.of(),
                List.of(duty("E1", "R1", 0, 0, "F1"), duty("E2", "R1", 0, 1, "F2")),
                List.of(duty("E1", "R1", 0, 0, "F3"), duty("E2", "R1", 0, 1, "F2")));

        assertThat(diff.getDutiesRemoved()).extracting(InvigilationEntry::getFacultyId).containsExactly("F1");
        assertThat(diff.getDutiesAdded()).extracting(InvigilationEntry::getFacultyId).containsExactly("F3");
        assertThat(diff.getExamsMoved()).isEmpty();
        assertThat(diff.isEmpty()).isFalse();
    }

    @Test
    void sameExamsAndDutiesHaveNoDifferences() {
        ScheduleDiff diff = ScheduleDiff.between(List.of(), List.of(),
                List.of(exam("E1", 0, 0, "R1", "R2")), List.of(exam("E1", 0, 0, "R1", "R2")),
                List.of(duty("E1", "R1", 0, 0, "F1")), List.of(duty("E1", "R1", 0, 0, "F1")));

        assertThat(diff.isEmpty()).isTrue();
    }
}
