package com.university.clashfree.exam;

import com.university.clashfree.TestProblems;
import com.university.clashfree.config.SeatingRule;
import com.university.clashfree.constraint.ConstraintKind;
import com.university.clashfree.domain.Exam;
import com.university.clashfree.domain.ExamPlacement;
import com.university.clashfree.domain.ExamProblem;
import com.university.clashfree.domain.Room;
import com.university.clashfree.domain.SeatAssignment;
import com.university.clashfree.domain.SeatingDensity;
import com.university.clashfree.domain.SlotRange;
import com.university.clashfree.solver.InfeasibleScheduleException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class SeatingPlannerTest {

    private final SeatingPlanner planner = new SeatingPlanner();

    private static ExamProblem problemOf(Exam exam) {
        return ExamProblem.builder(TestProblems.grid(1, 2)).exam(exam).build();
    }

    @Test
    void labelsRowsSidesAndSeats() {
        assertThat(SeatingPlanner.label(0, 'A')).isEqualTo("R01-LA");
        assertThat(SeatingPlanner.label(1, 'B')).isEqualTo("R01-RB");
        assertThat(SeatingPlanner.label(2, 'A')).isEqualTo("R02-LA");
        assertThat(SeatingPlanner.label(21, 'B')).isEqualTo("R11-RB");
    }

    @Test
    void fillsRoomsInOrderAndStudentsById() throws Exception {
        Exam exam = Exam.builder("E1", "C1").students("s3", "s1", "s2").build();
        ExamPlacement placement = new ExamPlacement(exam, new SlotRange(0, 0, 1),
                List.of(new Room("R1", 2), new Room("R2", 2)));

        List<SeatAssignment> seats = planner.seat(placement, problemOf(exam), SeatingRule.NONE);

        assertThat(seats).extracting(SeatAssignment::getRoomId, SeatAssignment::getSeatLabel,
                SeatAssignment::getStudentId).containsExactly(
                tuple("R1", "R01-LA", "s1"),
                tuple("R1", "R01-LB", "s2"),
                tuple("R2", "R01-LA", "s3"));
    }

    @Test
    void alternateDensityLeavesEverySecondSeatEmpty() throws Exception {
        Exam exam = Exam.builder("E1", "C1").students("a", "b", "c").density(SeatingDensity.ALTERNATE).build();
        ExamPlacement placement = new ExamPlacement(exam, new SlotRange(0, 0, 1), List.of(new Room("R1", 5)));

        List<SeatAssignment> seats = planner.seat(placement, problemOf(exam), SeatingRule.NONE);

        assertThat(seats).extracting(SeatAssignment::getSeatLabel).containsExactly("R01-LA", "R01-RA", "R02-LA");
        assertThat(seats).noneMatch(SeatAssignment::isSeatB);
    }

    @Test
    void benchMatesComeFromDifferentSections() throws Exception {
        Exam exam = Exam.builder("E1", "C1").students("a1", "a2", "a3", "a4", "b1", "b2").build();
        ExamProblem problem = ExamProblem.builder(TestProblems.grid(1, 2))
                .exam(exam)
                .studentSection("C1", "a1", "A").studentSection("C1", "a2", "A")
                .studentSection("C1", "a3", "A").studentSection("C1", "a4", "A")
                .studentSection("C1", "b1", "B").studentSection("C1", "b2", "B")
                .build();
        ExamPlacement placement = new ExamPlacement(exam, new SlotRange(0, 0, 1), List.of(new Room("R1", 8)));

        List<SeatAssignment> seats = planner.seat(placement, problem, SeatingRule.NO_SAME_SECTION_BENCHMATES);

        assertThat(seats).hasSize(6);
        assertThat(seats).extracting(SeatAssignment::getStudentId)
                .containsExactlyInAnyOrder("a1", "a2", "a3", "a4", "b1", "b2");
        Map<String, List<String>> benches = seats.stream().collect(Collectors.groupingBy(SeatAssignment::getBench,
                Collectors.mapping(s -> problem.sectionOf(exam, s.getStudentId()), Collectors.toList())));
        assertThat(benches).hasSize(4);
        benches.values().stream().filter(sections -> sections.size() == 2)
                .forEach(sections -> assertThat(sections).doesNotHaveDuplicates());
        assertThat(seats).filteredOn(SeatAssignment::isSeatB).extracting(SeatAssignment::getStudentId)
                .containsExactly("b1", "b2");
    }

    @Test
    void reportsStudentsLeftStanding() {
        Exam exam = Exam.builder("E1", "C1").students("a", "b", "c").build();
        ExamPlacement placement = new ExamPlacement(exam, new SlotRange(0, 0, 1), List.of(new Room("R1", 2)));

        assertThatThrownBy(() -> planner.seat(placement, problemOf(exam), SeatingRule.NONE))
                .isInstanceOf(InfeasibleScheduleException.class)
                .satisfies(e -> {
                    InfeasibleScheduleException ex = (InfeasibleScheduleException) e;
                    assertThat(ex.getKind()).isEqualTo(ConstraintKind.SEATING);
                    assertThat(ex.getConflictingIds()).containsExactly("E1");
                });
    }
}
