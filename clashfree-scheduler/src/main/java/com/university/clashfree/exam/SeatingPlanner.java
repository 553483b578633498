package com.university.clashfree.exam;

import com.university.clashfree.config.SeatingRule;
import com.university.clashfree.constraint.ConstraintKind;
import com.university.clashfree.constraint.SeatCapacity;
import com.university.clashfree.domain.Exam;
import com.university.clashfree.domain.ExamPlacement;
import com.university.clashfree.domain.ExamProblem;
import com.university.clashfree.domain.Room;
import com.university.clashfree.domain.SeatAssignment;
import com.university.clashfree.domain.SeatingDensity;
import com.university.clashfree.solver.InfeasibleScheduleException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Gives every student of a placed exam one labelled seat. Rooms are filled in
 * placement order, students in id order. Seats are labelled
 * {@code R<row>-<side><seat>}: two benches per row, sides L and R, seats A and
 * B on each bench.
 */
public class SeatingPlanner {

    public List<SeatAssignment> seat(ExamPlacement placement, ExamProblem problem, SeatingRule rule)
            throws InfeasibleScheduleException {
        Exam exam = placement.getExam();
        List<String[]> units = SeatCapacity.countsBenches(exam, rule)
                ? pairAcrossSections(exam, problem)
                : singles(exam);

        List<SeatAssignment> seats = new ArrayList<>();
        int next = 0;
        for (Room room : placement.getRooms()) {
            if (next == units.size()) {
                break;
            }
            if (SeatCapacity.countsBenches(exam, rule)) {
                int benches = room.getCapacity() / 2;
                for (int bench = 0; bench < benches && next < units.size(); bench++) {
                    String[] unit = units.get(next++);
                    seats.add(new SeatAssignment(exam.getId(), room.getId(), label(bench, 'A'), unit[0]));
                    if (unit.length == 2) {
                        seats.add(new SeatAssignment(exam.getId(), room.getId(), label(bench, 'B'), unit[1]));
                    }
                }
            } else if (exam.getDensity() == SeatingDensity.ALTERNATE) {
                int benches = (room.getCapacity() + 1) / 2;
                for (int bench = 0; bench < benches && next < units.size(); bench++) {
                    seats.add(new SeatAssignment(exam.getId(), room.getId(), label(bench, 'A'), units.get(next++)[0]));
                }
            } else {
                for (int seat = 0; seat < room.getCapacity() && next < units.size(); seat++) {
                    seats.add(new SeatAssignment(exam.getId(), room.getId(),
                            label(seat / 2, seat % 2 == 0 ? 'A' : 'B'), units.get(next++)[0]));
                }
            }
        }
        if (next < units.size()) {
            throw new InfeasibleScheduleException("Exam " + exam.getId() + " leaves " + (units.size() - next)
                    + " seating units without a place", ConstraintKind.SEATING, List.of(exam.getId()));
        }
        return seats;
    }

    static String label(int bench, char seat) {
        return String.format("R%02d-%c%c", bench / 2 + 1, bench % 2 == 0 ? 'L' : 'R', seat);
    }

    private List<String[]> singles(Exam exam) {
        List<String[]> units = new ArrayList<>();
        for (String student : exam.getStudentIds()) {
            units.add(new String[] {student});
        }
        return units;
    }

    /**
     * Pairs students of different sections, always drawing from the two
     * largest remaining sections; whoever is left sits alone.
     */
    private List<String[]> pairAcrossSections(Exam exam, ExamProblem problem) {
        Map<String, Deque<String>> bySection = new TreeMap<>();
        for (String student : exam.getStudentIds()) {
            bySection.computeIfAbsent(problem.sectionOf(exam, student), k -> new ArrayDeque<>()).add(student);
        }
        List<String[]> units = new ArrayList<>();
        while (true) {
            String first = null;
            String second = null;
            for (Map.Entry<String, Deque<String>> e : bySection.entrySet()) {
                int size = e.getValue().size();
                if (size == 0) {
                    continue;
                }
                if (first == null || size > bySection.get(first).size()) {
                    second = first;
                    first = e.getKey();
                } else if (second == null || size > bySection.get(second).size()) {
                    second = e.getKey();
                }
            }
            if (second == null) {
                break;
            }
            units.add(new String[] {bySection.get(first).poll(), bySection.get(second).poll()});
        }
        for (Deque<String> rest : bySection.values()) {
            for (String student : rest) {
                units.add(new String[] {student});
            }
        }
        return units;
    }
}
