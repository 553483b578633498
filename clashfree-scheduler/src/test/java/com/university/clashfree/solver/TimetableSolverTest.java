package com.university.clashfree.solver;

import com.university.clashfree.TestProblems;
import com.university.clashfree.config.SolverConfig;
import com.university.clashfree.constraint.ConstraintEvaluator;
import com.university.clashfree.constraint.ConstraintKind;
import com.university.clashfree.constraint.Evaluation;
import com.university.clashfree.domain.Assignment;
import com.university.clashfree.domain.Availability;
import com.university.clashfree.domain.Course;
import com.university.clashfree.domain.Faculty;
import com.university.clashfree.domain.Room;
import com.university.clashfree.domain.Schedule;
import com.university.clashfree.domain.Section;
import com.university.clashfree.domain.TimeSlot;
import com.university.clashfree.domain.TimetableProblem;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TimetableSolverTest {

    private final TimetableSolver solver = new TimetableSolver();

    @Test
    void placesSectionsSharingATeacherInDifferentPeriods() throws Exception {
        TimetableSolution solution = solver.solve(TestProblems.twoSectionsOneTeacher(), TestProblems.fastConfig());

        Schedule schedule = solution.getSchedule();
        Assignment first = schedule.get("S1#1");
        Assignment second = schedule.get("S2#1");
        assertThat(first).isNotNull();
        assertThat(second).isNotNull();
        assertThat(first.getRange().overlaps(second.getRange())).isFalse();
        assertThat(solution.getEvaluation().isFeasible()).isTrue();
    }

    @Test
    void solvesASmallWeekWithoutHardViolations() throws Exception {
        TimetableProblem problem = TestProblems.smallWeek();

        TimetableSolution solution = solver.solve(problem, TestProblems.fastConfig());

        Schedule schedule = solution.getSchedule();
        assertThat(schedule.isComplete(problem)).isTrue();
        assertThat(schedule.size()).isEqualTo(problem.getSessions().size());
        assertThat(solution.getEvaluation().getViolations()).isEmpty();
        assertThat(schedule.get("CS-LAB#1").getRoom().getId()).isEqualTo("LAB1");
        assertThat(schedule.get("ART-E#1").overlaps(schedule.get("MUS-E#1"))).isFalse();
        for (Assignment a : schedule.getAssignments()) {
            assertThat(problem.getGrid().fits(a.getRange())).isTrue();
            assertThat(a.getRoom().getCapacity()).isGreaterThanOrEqualTo(a.getSection().getEnrolledCount());
        }
    }

    @Test
    void sameSeedGivesTheSameTimetable() throws Exception {
        SolverConfig config = TestProblems.fastConfig().toBuilder().seed(7).build();

        Schedule first = solver.solve(TestProblems.smallWeek(), config).getSchedule();
        Schedule second = solver.solve(TestProblems.smallWeek(), config).getSchedule();

        assertThat(second).isEqualTo(first);
    }

    @Test
    void bestCostNeverRises() throws Exception {
        List<Double> improvements = new ArrayList<>();
        RefinementListener listener = new RefinementListener() {
            @Override
            public void improved(int step, double bestCost) {
                improvements.add(bestCost);
            }
        };

        TimetableSolution solution = solver.solve(TestProblems.smallWeek(), TestProblems.fastConfig(), listener);

        for (int i = 1; i < improvements.size(); i++) {
            assertThat(improvements.get(i)).isLessThan(improvements.get(i - 1));
        }
        if (!improvements.isEmpty()) {
            assertThat(solution.getSoftCost()).isCloseTo(improvements.get(improvements.size() - 1), within(1e-6));
        }
        assertThat(solution.getStats().getRefinementSteps()).isPositive();
    }

    @Test
    void everyAcceptedMoveKeepsTheTimetableClashFree() throws Exception {
        TimetableProblem problem = TestProblems.smallWeek();
        SolverConfig config = TestProblems.fastConfig();
        TimetableSearchSpace space = new TimetableSearchSpace(problem, config.getSeed());
        new BacktrackingSearch<>(space, config.getBacktrackBudget(), config.getRetryBudget(),
                Deadline.after(config.getTimeBudget())).run();
        ConstraintEvaluator<Schedule, TimetableProblem> evaluator = ConstraintEvaluator.forTimetable(config);
        List<Integer> accepted = new ArrayList<>();
        RefinementListener listener = new RefinementListener() {
            @Override
            public void accepted(int step, Object move, double cost) {
                Evaluation evaluation = evaluator.evaluate(space.getSchedule(), problem);
                assertThat(evaluation.getViolations()).as("after step %d", step).isEmpty();
                assertThat(evaluation.getSoftCost()).isCloseTo(cost, within(1e-6));
                accepted.add(step);
            }
        };
        SearchStats stats = new SearchStats();

        new RefinementSearch<>(new TimetableMoveSpace(space, evaluator), config,
                Deadline.after(config.getTimeBudget()), listener, stats).run();

        assertThat(accepted).hasSize(stats.getMovesAccepted());
        assertThat(stats.getRefinementSteps()).isPositive();
    }

    @Test
    void keepsSessionsInsideRoomAndTeacherCalendars() throws Exception {
        TimetableProblem problem = TimetableProblem.builder(TestProblems.grid(1, 3))
                .room(new Room("R1", 30, List.of(), Availability.only(List.of(new TimeSlot(0, 1), new TimeSlot(0, 2)))))
                .room(new Room("R2", 30))
                .faculty(new Faculty("F1", "F1", 10, Availability.allExcept(List.of(new TimeSlot(0, 1))),
                        List.of("C1"), List.of(), true))
                .faculty(new Faculty("F2", "F2", 10, Availability.only(List.of(new TimeSlot(0, 0), new TimeSlot(0, 1))),
                        List.of("C1"), List.of(), true))
                .course(new Course("C1", "Geometry"))
                .section(Section.builder("S1", "C1").enrolled(20).meetingsPerWeek(2).build())
                .section(Section.builder("S2", "C1").enrolled(20).build())
                .build();

        for (long seed = 0; seed < 10; seed++) {
            TimetableSolution solution = solver.solve(problem, TestProblems.fastConfig().toBuilder().seed(seed).build());

            assertThat(solution.getEvaluation().isFeasible()).isTrue();
            for (Assignment a : solution.getSchedule().getAssignments()) {
                assertThat(a.getRoom().getAvailability().permits(a.getRange())).as("%s seed %d", a, seed).isTrue();
                assertThat(a.getFaculty().getAvailability().permits(a.getRange())).as("%s seed %d", a, seed).isTrue();
            }
        }
    }

    @Test
    void parallelRefinementIsAsDeterministicAsSequential() throws Exception {
        SolverConfig sequential = TestProblems.fastConfig().toBuilder().seed(11).build();
        SolverConfig parallel = sequential.toBuilder().parallelRefinement(true).build();

        Schedule first = solver.solve(TestProblems.smallWeek(), parallel).getSchedule();
        Schedule second = solver.solve(TestProblems.smallWeek(), parallel).getSchedule();
        Schedule inOrder = solver.solve(TestProblems.smallWeek(), sequential).getSchedule();

        assertThat(second).isEqualTo(first);
        assertThat(inOrder).isEqualTo(first);
    }

    @Test
    void skipsRefinementWithoutAMoveBudget() throws Exception {
        SolverConfig config = TestProblems.fastConfig().toBuilder().moveBudget(0).build();

        TimetableSolution solution = solver.solve(TestProblems.smallWeek(), config);

        assertThat(solution.getStats().getRefinementSteps()).isZero();
        assertThat(solution.getEvaluation().isFeasible()).isTrue();
    }

    @Test
    void reportsTheSessionsBehindAnUnresolvableTeacherClash() {
        assertThatThrownBy(() -> solver.solve(TestProblems.sharedTeacherOneSlot(), TestProblems.fastConfig()))
                .isExactlyInstanceOf(InfeasibleScheduleException.class)
                .satisfies(e -> {
                    InfeasibleScheduleException ex = (InfeasibleScheduleException) e;
                    assertThat(ex.getKind()).isEqualTo(ConstraintKind.FACULTY_DOUBLE_BOOKING);
                    assertThat(ex.getConflictingIds()).containsExactly("A#1", "B#1");
                });
    }

    @Test
    void failsFastWhenNoRoomIsLargeEnough() {
        TimetableProblem problem = TimetableProblem.builder(TestProblems.grid(2, 3))
                .room(new Room("R1", 30))
                .faculty(TestProblems.teacher("F1", 10, "C1"))
                .course(new Course("C1", "Statistics"))
                .section(Section.builder("S1", "C1").enrolled(40).build())
                .build();

        assertThatThrownBy(() -> solver.solve(problem, TestProblems.fastConfig()))
                .isInstanceOf(InfeasibleScheduleException.class)
                .satisfies(e -> {
                    InfeasibleScheduleException ex = (InfeasibleScheduleException) e;
                    assertThat(ex.getKind()).isEqualTo(ConstraintKind.ROOM_CAPACITY);
                    assertThat(ex.getConflictingIds()).containsExactly("S1#1");
                });
    }

    @Test
    void failsFastWhenNobodyMayTeachTheCourse() {
        TimetableProblem problem = TimetableProblem.builder(TestProblems.grid(1, 2))
                .room(new Room("R1", 30))
                .faculty(TestProblems.teacher("F1", 10, "OTHER"))
                .course(new Course("OTHER", "Other"))
                .course(new Course("C1", "Statistics"))
                .section(Section.builder("S1", "C1").enrolled(10).build())
                .build();

        assertThatThrownBy(() -> solver.solve(problem, TestProblems.fastConfig()))
                .isInstanceOf(InfeasibleScheduleException.class)
                .extracting(e -> ((InfeasibleScheduleException) e).getKind())
                .isEqualTo(ConstraintKind.FACULTY_QUALIFICATION);
    }

    @Test
    void failsFastWhenATeacherCannotCarryTheSession() {
        TimetableProblem problem = TimetableProblem.builder(TestProblems.grid(1, 4))
                .room(new Room("R1", 30))
                .faculty(TestProblems.teacher("F1", 1, "C1"))
                .course(new Course("C1", "Statistics"))
                .section(Section.builder("S1", "C1").duration(2).enrolled(10).build())
                .build();

        assertThatThrownBy(() -> solver.solve(problem, TestProblems.fastConfig()))
                .isInstanceOf(InfeasibleScheduleException.class)
                .extracting(e -> ((InfeasibleScheduleException) e).getKind())
                .isEqualTo(ConstraintKind.FACULTY_OVERLOAD);
    }

    @Test
    void reportsAnExhaustedStepBudget() {
        SolverConfig config = TestProblems.fastConfig().toBuilder().backtrackBudget(1).build();

        assertThatThrownBy(() -> solver.solve(TestProblems.smallWeek(), config))
                .isInstanceOf(BudgetExceededException.class);
    }

    @Test
    void reportsAnExpiredTimeBudget() {
        SolverConfig config = TestProblems.fastConfig().toBuilder().timeBudget(Duration.ofNanos(1)).build();

        assertThatThrownBy(() -> solver.solve(TestProblems.smallWeek(), config))
                .isInstanceOf(BudgetExceededException.class)
                .satisfies(e -> {
                    BudgetExceededException ex = (BudgetExceededException) e;
                    assertThat(ex.getReason()).isEqualTo("budget_exceeded");
                    assertThat(ex.getBudget()).isEqualTo(BudgetExceededException.Budget.TIME);
                    assertThat(ex.getKind()).isNull();
                    assertThat(ex.getConflictingIds()).isEmpty();
                });
    }
}
