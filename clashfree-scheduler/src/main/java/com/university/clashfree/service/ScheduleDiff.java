package com.university.clashfree.service;

import com.university.clashfree.model.ExamEntry;
import com.university.clashfree.model.InvigilationEntry;
import com.university.clashfree.model.TimetableEntry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Differences between two cycles. Timetable sessions are keyed by session id
 * and moved when their day, start, length, room or faculty changed. Exams are
 * keyed by exam id and moved when their range or rooms changed. Invigilation
 * duties are only gained or dropped.
 */
public class ScheduleDiff {

    private final List<TimetableEntry> added;
    private final List<TimetableEntry> removed;
    private final List<Move> moved;
    private final List<ExamEntry> examsAdded;
    private final List<ExamEntry> examsRemoved;
    private final List<ExamMove> examsMoved;
    private final List<InvigilationEntry> dutiesAdded;
    private final List<InvigilationEntry> dutiesRemoved;

    private ScheduleDiff(List<TimetableEntry> added, List<TimetableEntry> removed, List<Move> moved,
            List<ExamEntry> examsAdded, List<ExamEntry> examsRemoved, List<ExamMove> examsMoved,
            List<InvigilationEntry> dutiesAdded, List<InvigilationEntry> dutiesRemoved) {
        this.added = Collections.unmodifiableList(added);
        this.removed = Collections.unmodifiableList(removed);
        this.moved = Collections.unmodifiableList(moved);
        this.examsAdded = Collections.unmodifiableList(examsAdded);
        this.examsRemoved = Collections.unmodifiableList(examsRemoved);
        this.examsMoved = Collections.unmodifiableList(examsMoved);
        this.dutiesAdded = Collections.unmodifiableList(dutiesAdded);
        this.dutiesRemoved = Collections.unmodifiableList(dutiesRemoved);
    }

    /** Timetables only. */
    public static ScheduleDiff between(Collection<TimetableEntry> before, Collection<TimetableEntry> after) {
        return between(before, after, List.of(), List.of(), List.of(), List.of());
    }

    public static ScheduleDiff between(Collection<TimetableEntry> before, Collection<TimetableEntry> after,
            Collection<ExamEntry> examsBefore, Collection<ExamEntry> examsAfter,
            Collection<InvigilationEntry> dutiesBefore, Collection<InvigilationEntry> dutiesAfter) {
        Map<String, TimetableEntry> old = new TreeMap<>();
        before.forEach(e -> old.put(e.getSessionId(), e));
        Map<String, TimetableEntry> current = new TreeMap<>();
        after.forEach(e -> current.put(e.getSessionId(), e));
        List<TimetableEntry> added = new ArrayList<>();
        List<TimetableEntry> removed = new ArrayList<>();
        List<Move> moved = new ArrayList<>();
        current.forEach((sessionId, entry) -> {
            TimetableEntry previous = old.get(sessionId);
            if (previous == null) {
                added.add(entry);
            } else if (!previous.samePlacement(entry)) {
                moved.add(new Move(sessionId, previous, entry));
            }
        });
        old.forEach((sessionId, entry) -> {
            if (!current.containsKey(sessionId)) {
                removed.add(entry);
            }
        });

        Map<String, ExamEntry> oldExams = new TreeMap<>();
        examsBefore.forEach(e -> oldExams.put(e.getExamId(), e));
        Map<String, ExamEntry> currentExams = new TreeMap<>();
        examsAfter.forEach(e -> currentExams.put(e.getExamId(), e));
        List<ExamEntry> examsAdded = new ArrayList<>();
        List<ExamEntry> examsRemoved = new ArrayList<>();
        List<ExamMove> examsMoved = new ArrayList<>();
        currentExams.forEach((examId, entry) -> {
            ExamEntry previous = oldExams.get(examId);
            if (previous == null) {
                examsAdded.add(entry);
            } else if (!previous.samePlacement(entry)) {
                examsMoved.add(new ExamMove(examId, previous, entry));
            }
        });
        oldExams.forEach((examId, entry) -> {
            if (!currentExams.containsKey(examId)) {
                examsRemoved.add(entry);
            }
        });

        Map<String, InvigilationEntry> oldDuties = new TreeMap<>();
        dutiesBefore.forEach(e -> oldDuties.put(e.dutyKey(), e));
        Map<String, InvigilationEntry> currentDuties = new TreeMap<>();
        dutiesAfter.forEach(e -> currentDuties.put(e.dutyKey(), e));
        List<InvigilationEntry> dutiesAdded = new ArrayList<>();
        List<InvigilationEntry> dutiesRemoved = new ArrayList<>();
        currentDuties.forEach((key, entry) -> {
            if (!oldDuties.containsKey(key)) {
                dutiesAdded.add(entry);
            }
        });
        oldDuties.forEach((key, entry) -> {
            if (!currentDuties.containsKey(key)) {
                dutiesRemoved.add(entry);
            }
        });

        return new ScheduleDiff(added, removed, moved, examsAdded, examsRemoved, examsMoved,
                dutiesAdded, dutiesRemoved);
    }

    public List<TimetableEntry> getAdded() {
        return added;
    }

    public List<TimetableEntry> getRemoved() {
        return removed;
    }

    public List<Move> getMoved() {
        return moved;
    }

    public List<ExamEntry> getExamsAdded() {
        return examsAdded;
    }

    public List<ExamEntry> getExamsRemoved() {
        return examsRemoved;
    }

    public List<ExamMove> getExamsMoved() {
        return examsMoved;
    }

    public List<InvigilationEntry> getDutiesAdded() {
        return dutiesAdded;
    }

    public List<InvigilationEntry> getDutiesRemoved() {
        return dutiesRemoved;
    }

    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty() && moved.isEmpty()
                && examsAdded.isEmpty() && examsRemoved.isEmpty() && examsMoved.isEmpty()
                && dutiesAdded.isEmpty() && dutiesRemoved.isEmpty();
    }

    public static class Move {

        private final String sessionId;
        private final TimetableEntry before;
        private final TimetableEntry after;

        Move(String sessionId, TimetableEntry before, TimetableEntry after) {
            this.sessionId = sessionId;
            this.before = before;
            this.after = after;
        }

        public String getSessionId() {
            return sessionId;
        }

        public TimetableEntry getBefore() {
            return before;
        }

        public TimetableEntry getAfter() {
            return after;
        }
    }

    public static class ExamMove {

        private final String examId;
        private final ExamEntry before;
        private final ExamEntry after;

        ExamMove(String examId, ExamEntry before, ExamEntry after) {
            this.examId = examId;
            this.before = before;
            this.after = after;
        }

        public String getExamId() {
            return examId;
        }

        public ExamEntry getBefore() {
            return before;
        }

        public ExamEntry getAfter() {
            return after;
        }
    }
}
