package com.university.clashfree.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * An exam sitting fixed to a range of the exam grid and one or more rooms.
 */
public final class ExamPlacement {

    private final Exam exam;
    private final SlotRange range;
    private final List<Room> rooms;

    public ExamPlacement(Exam exam, SlotRange range, List<Room> rooms) {
        this.exam = Objects.requireNonNull(exam, "exam");
        this.range = Objects.requireNonNull(range, "range");
        if (rooms == null || rooms.isEmpty()) {
            throw new IllegalArgumentException("Exam " + exam.getId() + " needs at least one room");
        }
        if (range.getLength() != exam.getDuration()) {
            throw new IllegalArgumentException("Exam " + exam.getId() + " needs "
                    + exam.getDuration() + " periods, range has " + range.getLength());
        }
        List<Room> sorted = new ArrayList<>(rooms);
        sorted.sort(Comparator.comparing(Room::getId));
        this.rooms = Collections.unmodifiableList(sorted);
    }

    public String getId() {
        return exam.getId();
    }

    public Exam getExam() {
        return exam;
    }

    public SlotRange getRange() {
        return range;
    }

    public List<Room> getRooms() {
        return rooms;
    }

    public boolean usesRoom(String roomId) {
        for (Room room : rooms) {
            if (room.getId().equals(roomId)) {
                return true;
            }
        }
        return false;
    }

    public ExamPlacement withRange(SlotRange newRange) {
        return new ExamPlacement(exam, newRange, rooms);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ExamPlacement)) {
            return false;
        }
        ExamPlacement that = (ExamPlacement) o;
        return exam.getId().equals(that.exam.getId()) && range.equals(that.range)
                && rooms.equals(that.rooms);
    }

    @Override
    public int hashCode() {
        return Objects.hash(exam.getId(), range, rooms);
    }

    @Override
    public String toString() {
        List<String> ids = new ArrayList<>();
        rooms.forEach(r -> ids.add(r.getId()));
        return exam.getId() + "@" + range + ids;
    }
}
