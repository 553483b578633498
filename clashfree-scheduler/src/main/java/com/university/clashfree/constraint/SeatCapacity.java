package com.university.clashfree.constraint;

import com.university.clashfree.config.SeatingRule;
import com.university.clashfree.domain.Exam;
import com.university.clashfree.domain.ExamProblem;
import com.university.clashfree.domain.Room;
import com.university.clashfree.domain.SeatingDensity;

import java.util.Map;
import java.util.TreeMap;

/**
 * Seat supply of rooms and seat demand of exams, in the same unit. With the
 * bench-mate rule on a full-density exam the unit is a bench, otherwise a seat.
 * Rooms are laid out as benches of two seats.
 */
public final class SeatCapacity {

    private SeatCapacity() {
    }

    public static boolean countsBenches(Exam exam, SeatingRule rule) {
        return rule == SeatingRule.NO_SAME_SECTION_BENCHMATES && exam.getDensity() == SeatingDensity.FULL;
    }

    /** Students a room can take for this exam, ignoring bench-mate restrictions. */
    public static int seatLimit(Room room, SeatingDensity density) {
        return density == SeatingDensity.ALTERNATE ? (room.getCapacity() + 1) / 2 : room.getCapacity();
    }

    public static int supply(Room room, Exam exam, SeatingRule rule) {
        if (countsBenches(exam, rule)) {
            return room.getCapacity() / 2;
        }
        return seatLimit(room, exam.getDensity());
    }

    /**
     * Units the exam needs. Under the bench-mate rule at most
     * {@code min(n / 2, n - largestSection)} benches can hold a pair; every
     * other student sits alone.
     */
    public static int demand(Exam exam, ExamProblem problem, SeatingRule rule) {
        int n = exam.getEnrolledCount();
        if (!countsBenches(exam, rule)) {
            return n;
        }
        Map<String, Integer> sizes = new TreeMap<>();
        for (String student : exam.getStudentIds()) {
            sizes.merge(problem.sectionOf(exam, student), 1, Integer::sum);
        }
        int largest = 0;
        for (int size : sizes.values()) {
            largest = Math.max(largest, size);
        }
        int pairs = Math.min(n / 2, n - largest);
        return n - pairs;
    }
}
