package com.university.clashfree.domain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Placements keyed by exam id, with their seats and invigilators.
 */
public final class ExamSchedule {

    private final Map<String, ExamPlacement> placements = new TreeMap<>();
    private final List<SeatAssignment> seats = new ArrayList<>();
    private final List<InvigilatorAssignment> invigilators = new ArrayList<>();

    public ExamPlacement put(ExamPlacement placement) {
        return placements.put(placement.getId(), placement);
    }

    public ExamPlacement remove(String examId) {
        return placements.remove(examId);
    }

    public ExamPlacement get(String examId) {
        return placements.get(examId);
    }

    public boolean contains(String examId) {
        return placements.containsKey(examId);
    }

    public int size() {
        return placements.size();
    }

    public Collection<ExamPlacement> getPlacements() {
        return Collections.unmodifiableCollection(placements.values());
    }

    public List<SeatAssignment> getSeats() {
        return Collections.unmodifiableList(seats);
    }

    public List<SeatAssignment> seatsOf(String examId) {
        List<SeatAssignment> result = new ArrayList<>();
        for (SeatAssignment seat : seats) {
            if (seat.getExamId().equals(examId)) {
                result.add(seat);
            }
        }
        return result;
    }

    public void addSeats(Collection<SeatAssignment> added) {
        seats.addAll(added);
    }

    public List<InvigilatorAssignment> getInvigilators() {
        return Collections.unmodifiableList(invigilators);
    }

    public void addInvigilator(InvigilatorAssignment post) {
        invigilators.add(post);
    }

    public boolean removeInvigilator(InvigilatorAssignment post) {
        return invigilators.remove(post);
    }

    public ExamSchedule copy() {
        ExamSchedule copy = new ExamSchedule();
        copy.placements.putAll(placements);
        copy.seats.addAll(seats);
        copy.invigilators.addAll(invigilators);
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ExamSchedule)) {
            return false;
        }
        ExamSchedule that = (ExamSchedule) o;
        return placements.equals(that.placements) && seats.equals(that.seats)
                && invigilators.equals(that.invigilators);
    }

    @Override
    public int hashCode() {
        return placements.hashCode() * 31 + seats.hashCode();
    }

    @Override
    public String toString() {
        return placements.values() + ", " + seats.size() + " seats, " + invigilators.size() + " invigilators";
    }
}
