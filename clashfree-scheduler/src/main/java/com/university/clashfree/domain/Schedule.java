package com.university.clashfree.domain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Assignments keyed by session id, in id order. Not thread-safe.
 */
public final class Schedule {

    private final Map<String, Assignment> assignments = new TreeMap<>();

    public Schedule() {
    }

    public Schedule(Collection<Assignment> initial) {
        initial.forEach(this::put);
    }

    /** Places or replaces the assignment of its session; returns the previous one. */
    public Assignment put(Assignment assignment) {
        return assignments.put(assignment.getId(), assignment);
    }

    public Assignment remove(String sessionId) {
        return assignments.remove(sessionId);
    }

    public Assignment get(String sessionId) {
        return assignments.get(sessionId);
    }

    public boolean contains(String sessionId) {
        return assignments.containsKey(sessionId);
    }

    public int size() {
        return assignments.size();
    }

    public boolean isEmpty() {
        return assignments.isEmpty();
    }

    public Collection<Assignment> getAssignments() {
        return Collections.unmodifiableCollection(assignments.values());
    }

    public List<Assignment> forFaculty(String facultyId) {
        List<Assignment> result = new ArrayList<>();
        for (Assignment a : assignments.values()) {
            if (a.getFaculty().getId().equals(facultyId)) {
                result.add(a);
            }
        }
        return result;
    }

    public int loadOf(String facultyId) {
        int load = 0;
        for (Assignment a : assignments.values()) {
            if (a.getFaculty().getId().equals(facultyId)) {
                load += a.getRange().getLength();
            }
        }
        return load;
    }

    public boolean isComplete(TimetableProblem problem) {
        for (Session session : problem.getSessions()) {
            if (!assignments.containsKey(session.getId())) {
                return false;
            }
        }
        return true;
    }

    public Schedule copy() {
        Schedule copy = new Schedule();
        copy.assignments.putAll(assignments);
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Schedule)) {
            return false;
        }
        return assignments.equals(((Schedule) o).assignments);
    }

    @Override
    public int hashCode() {
        return assignments.hashCode();
    }

    @Override
    public String toString() {
        return assignments.values().toString();
    }
}
