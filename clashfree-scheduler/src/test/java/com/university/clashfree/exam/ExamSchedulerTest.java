package com.university.clashfree.exam;

import com.university.clashfree.TestProblems;
import com.university.clashfree.config.InvigilationPolicy;
import com.university.clashfree.config.SeatingRule;
import com.university.clashfree.config.SolverConfig;
import com.university.clashfree.constraint.ConstraintKind;
import com.university.clashfree.domain.Availability;
import com.university.clashfree.domain.Exam;
import com.university.clashfree.domain.ExamPlacement;
import com.university.clashfree.domain.ExamProblem;
import com.university.clashfree.domain.ExamSchedule;
import com.university.clashfree.domain.Faculty;
import com.university.clashfree.domain.InvigilatorAssignment;
import com.university.clashfree.domain.Room;
import com.university.clashfree.domain.SeatAssignment;
import com.university.clashfree.domain.TimeSlot;
import com.university.clashfree.solver.InfeasibleScheduleException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class ExamSchedulerTest {

    private final ExamScheduler scheduler = new ExamScheduler();

    @Test
    void seatsAndStaffsExamsThatShareAStudent() throws Exception {
        ExamProblem problem = TestProblems.twoClashingExams();
        SolverConfig config = TestProblems.fastConfig().toBuilder().studentsPerInvigilator(3).build();

        ExamSolution solution = scheduler.schedule(problem, config);

        ExamSchedule schedule = solution.getSchedule();
        ExamPlacement first = schedule.get("E1");
        ExamPlacement second = schedule.get("E2");
        assertThat(first.getRange().overlaps(second.getRange())).isFalse();
        assertThat(schedule.getSeats()).extracting(SeatAssignment::getStudentId)
                .containsExactlyInAnyOrder("s1", "s2", "s3", "s4", "s4", "s5", "s6");
        assertThat(schedule.getInvigilators()).filteredOn(p -> p.getExamId().equals("E1")).hasSize(2);
        assertThat(schedule.getInvigilators()).filteredOn(p -> p.getExamId().equals("E2")).hasSize(1);
        assertThat(schedule.getInvigilators()).filteredOn(p -> p.getExamId().equals("E1"))
                .extracting(InvigilatorAssignment::getFacultyId)
                .doesNotContain("F1")
                .doesNotHaveDuplicates();
        assertThat(solution.getEvaluation().isFeasible()).isTrue();
    }

    @Test
    void keepsOutOfRoomsReservedForTeaching() throws Exception {
        ExamProblem problem = ExamProblem.builder(TestProblems.grid(1, 2))
                .room(new Room("R1", 10))
                .faculty(TestProblems.teacher("F1", 4))
                .exam(Exam.builder("E1", "C1").students("s1").build())
                .reserveRoom("R1", new TimeSlot(0, 0))
                .build();

        ExamSolution solution = scheduler.schedule(problem, TestProblems.fastConfig());

        assertThat(solution.getSchedule().get("E1").getRange().getStart()).isEqualTo(1);
    }

    @Test
    void reportsARoomBookedForTeachingAllWeek() {
        ExamProblem problem = ExamProblem.builder(TestProblems.grid(1, 1))
                .room(new Room("R1", 10))
                .faculty(TestProblems.teacher("F1", 4))
                .exam(Exam.builder("E1", "C1").students("s1").build())
                .reserveRoom("R1", new TimeSlot(0, 0))
                .build();

        assertThatThrownBy(() -> scheduler.schedule(problem, TestProblems.fastConfig()))
                .isInstanceOf(InfeasibleScheduleException.class)
                .extracting(e -> ((InfeasibleScheduleException) e).getKind())
                .isEqualTo(ConstraintKind.ROOM_DOUBLE_BOOKING);
    }

    @Test
    void spreadsExamsOverDaysUnderADailyLimit() throws Exception {
        SolverConfig config = TestProblems.fastConfig().toBuilder().maxExamsPerStudentPerDay(1).build();

        ExamSchedule schedule = scheduler.schedule(TestProblems.twoClashingExams(), config).getSchedule();

        assertThat(schedule.get("E1").getRange().getDay()).isNotEqualTo(schedule.get("E2").getRange().getDay());
    }

    @Test
    void reportsADailyLimitThatCannotBeMet() {
        ExamProblem problem = ExamProblem.builder(TestProblems.grid(1, 2))
                .room(new Room("R1", 10))
                .room(new Room("R2", 6))
                .faculty(TestProblems.teacher("F1", 4))
                .faculty(TestProblems.teacher("F2", 4))
                .exam(Exam.builder("E1", "C1").students("s1", "s2", "s3", "s4").build())
                .exam(Exam.builder("E2", "C2").students("s4", "s5", "s6").build())
                .build();
        SolverConfig config = TestProblems.fastConfig().toBuilder().maxExamsPerStudentPerDay(1).build();

        assertThatThrownBy(() -> scheduler.schedule(problem, config))
                .isExactlyInstanceOf(InfeasibleScheduleException.class)
                .satisfies(e -> {
                    InfeasibleScheduleException ex = (InfeasibleScheduleException) e;
                    assertThat(ex.getKind()).isEqualTo(ConstraintKind.STUDENT_DAILY_LIMIT);
                    assertThat(ex.getConflictingIds()).containsExactly("E1", "E2");
                });
    }

    @Test
    void refusesToLetInstructorsWatchTheirOwnExam() {
        assertThatThrownBy(() -> scheduler.schedule(TestProblems.examWatchedOnlyByItsInstructor(),
                TestProblems.fastConfig()))
                .isInstanceOf(InfeasibleScheduleException.class)
                .satisfies(e -> {
                    InfeasibleScheduleException ex = (InfeasibleScheduleException) e;
                    assertThat(ex.getKind()).isEqualTo(ConstraintKind.SELF_INVIGILATION);
                    assertThat(ex.getConflictingIds()).containsExactly("E1");
                });
    }

    @Test
    void minimumFirstFallsBackToTheInstructor() throws Exception {
        SolverConfig config = TestProblems.fastConfig().toBuilder()
                .invigilationPolicy(InvigilationPolicy.MINIMUM_FIRST)
                .build();

        ExamSolution solution = scheduler.schedule(TestProblems.examWatchedOnlyByItsInstructor(), config);

        assertThat(solution.getSchedule().getInvigilators()).extracting(InvigilatorAssignment::getFacultyId)
                .containsExactly("F1");
    }

    @Test
    void minimumFirstPrefersSomebodyElse() throws Exception {
        ExamProblem problem = ExamProblem.builder(TestProblems.grid(1, 1))
                .room(new Room("R1", 10))
                .faculty(TestProblems.teacher("F1", 4))
                .faculty(TestProblems.teacher("F2", 4))
                .exam(Exam.builder("E1", "C1").students("s1", "s2").build())
                .instructor("C1", "F1")
                .build();
        SolverConfig config = TestProblems.fastConfig().toBuilder()
                .invigilationPolicy(InvigilationPolicy.MINIMUM_FIRST)
                .build();

        ExamSolution solution = scheduler.schedule(problem, config);

        assertThat(solution.getSchedule().getInvigilators()).extracting(InvigilatorAssignment::getFacultyId)
                .containsExactly("F2");
    }

    @Test
    void skipsIneligibleAndBusyStaff() throws Exception {
        ExamProblem problem = ExamProblem.builder(TestProblems.grid(1, 1))
                .room(new Room("R1", 10))
                .faculty(new Faculty("F1", "F1", 4, Availability.always(), List.of(), List.of(), false))
                .faculty(TestProblems.teacher("F2", 4))
                .faculty(TestProblems.teacher("F3", 4))
                .exam(Exam.builder("E1", "C1").students("s1").build())
                .reserveFaculty("F2", new TimeSlot(0, 0))
                .build();

        ExamSolution solution = scheduler.schedule(problem, TestProblems.fastConfig());

        assertThat(solution.getSchedule().getInvigilators()).extracting(InvigilatorAssignment::getFacultyId)
                .containsExactly("F3");
    }

    @Test
    void keepsExamsApartWhenOneInvigilatorMustWatchBoth() throws Exception {
        ExamProblem problem = ExamProblem.builder(TestProblems.grid(1, 2))
                .room(new Room("R1", 10))
                .room(new Room("R2", 10))
                .faculty(TestProblems.teacher("F1", 4))
                .faculty(new Faculty("F2", "F2", 4, Availability.always(), List.of(), List.of(), false))
                .exam(Exam.builder("E1", "C1").students("s1", "s2").build())
                .exam(Exam.builder("E2", "C2").students("s3", "s4").build())
                .build();

        for (long seed = 0; seed < 20; seed++) {
            ExamSolution solution = scheduler.schedule(problem, TestProblems.fastConfig().toBuilder().seed(seed).build());

            ExamSchedule schedule = solution.getSchedule();
            assertThat(schedule.get("E1").getRange().overlaps(schedule.get("E2").getRange()))
                    .as("seed %d", seed).isFalse();
            assertThat(schedule.getInvigilators())
                    .extracting(InvigilatorAssignment::getExamId, InvigilatorAssignment::getFacultyId)
                    .as("seed %d", seed)
                    .containsExactlyInAnyOrder(tuple("E1", "F1"), tuple("E2", "F1"));
            assertThat(solution.getEvaluation().isFeasible()).isTrue();
        }
    }

    @Test
    void placesExamsAgainWhenTheLoadCapLeavesAPostEmpty() throws Exception {
        // F1 can watch one exam; F2 comes in for the second period only and teaches C1
        ExamProblem problem = ExamProblem.builder(TestProblems.grid(1, 2))
                .room(new Room("R1", 10))
                .room(new Room("R2", 10))
                .faculty(TestProblems.teacher("F1", 1))
                .faculty(new Faculty("F2", "F2", 4, Availability.only(List.of(new TimeSlot(0, 1))),
                        List.of(), List.of(), true))
                .exam(Exam.builder("E1", "C1").students("s1", "s2").build())
                .exam(Exam.builder("E2", "C2").students("s3", "s4").build())
                .instructor("C1", "F2")
                .build();

        for (long seed = 0; seed < 20; seed++) {
            ExamSolution solution = scheduler.schedule(problem, TestProblems.fastConfig().toBuilder().seed(seed).build());

            assertThat(solution.getSchedule().getInvigilators())
                    .extracting(InvigilatorAssignment::getExamId, InvigilatorAssignment::getFacultyId)
                    .as("seed %d", seed)
                    .containsExactlyInAnyOrder(tuple("E1", "F1"), tuple("E2", "F2"));
            assertThat(solution.getSchedule().get("E2").getRange().getStart()).isEqualTo(1);
            assertThat(solution.getEvaluation().isFeasible()).isTrue();
        }
    }

    @Test
    void seatsBenchMatesFromDifferentSections() throws Exception {
        ExamProblem problem = ExamProblem.builder(TestProblems.grid(1, 1))
                .room(new Room("R1", 4))
                .faculty(TestProblems.teacher("F1", 4))
                .exam(Exam.builder("E1", "C1").students("a1", "a2", "b1", "b2").build())
                .studentSection("C1", "a1", "A").studentSection("C1", "a2", "A")
                .studentSection("C1", "b1", "B").studentSection("C1", "b2", "B")
                .build();
        SolverConfig config = TestProblems.fastConfig().toBuilder()
                .seatingRule(SeatingRule.NO_SAME_SECTION_BENCHMATES)
                .build();

        ExamSolution solution = scheduler.schedule(problem, config);

        assertThat(solution.getEvaluation().isFeasible()).isTrue();
        assertThat(solution.getSchedule().getSeats())
                .extracting(SeatAssignment::getStudentId, SeatAssignment::getSeatLabel)
                .containsExactly(
                        tuple("a1", "R01-LA"),
                        tuple("b1", "R01-LB"),
                        tuple("a2", "R01-RA"),
                        tuple("b2", "R01-RB"));
    }
}
