package com.university.clashfree.service;

import com.university.clashfree.TestProblems;
import com.university.clashfree.config.InvigilationPolicy;
import com.university.clashfree.config.SoftWeights;
import com.university.clashfree.config.SolverConfig;
import com.university.clashfree.domain.Exam;
import com.university.clashfree.domain.ModelException;
import com.university.clashfree.domain.SessionKind;
import com.university.clashfree.domain.TimeSlot;
import com.university.clashfree.domain.TimetableProblem;
import com.university.clashfree.model.PlanningRequest;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlanningRequestMapperTest {

    private final PlanningRequestMapper mapper = new PlanningRequestMapper();

    @Test
    void buildsTheTeachingProblem() {
        TimetableProblem problem = mapper.toTimetableProblem(TestProblems.request());

        assertThat(problem.getGrid().getDays()).containsExactly("Mon", "Tue");
        assertThat(problem.getRoom("R1").getAvailability().permits(new TimeSlot(0, 0))).isFalse();
        assertThat(problem.getRoom("R1").getAvailability().permits(new TimeSlot(0, 1))).isTrue();
        assertThat(problem.getFaculty("F1").getAvailability().permits(new TimeSlot(1, 2))).isFalse();
        assertThat(problem.getSection("L1").getKind()).isEqualTo(SessionKind.LAB);
        assertThat(problem.getSessions()).hasSize(3);
        assertThat(problem.studentsOf("L1")).containsExactly("s2", "s3");
    }

    @Test
    void rejectsBlockedSlotsOutsideTheTeachingGrid() {
        PlanningRequest request = TestProblems.request();
        request.getRooms().get(1).setUnavailable(List.of(new PlanningRequest.Slot("Sun", 0)));

        assertThatThrownBy(() -> mapper.toTimetableProblem(request))
                .isInstanceOf(ModelException.class)
                .satisfies(e -> assertThat(((ModelException) e).getProblems())
                        .containsExactly("Unavailable slot Sun/0 of room LAB is outside the grid"));
    }

    @Test
    void requiresATeachingGrid() {
        PlanningRequest request = TestProblems.request();
        request.setGrid(null);

        assertThatThrownBy(() -> mapper.toTimetableProblem(request))
                .isInstanceOf(ModelException.class)
                .hasMessage("A teaching grid with at least one day is required");
    }

    @Test
    void takesExamStudentsFromTheCourseWhenNoneAreListed() {
        ExamPlan plan = mapper.toExamPlan(TestProblems.request());

        assertThat(plan.getGrid().getDays()).containsExactly("Wed");
        assertThat(plan.getExams()).extracting(Exam::getId).containsExactly("EX1", "EX2");
        assertThat(plan.getExams().get(0).getStudentIds()).containsExactly("s1", "s2");
        assertThat(plan.getExams().get(1).getStudentIds()).containsExactly("s3");
    }

    @Test
    void hasNoExamPlanWithoutExams() {
        PlanningRequest request = TestProblems.request();
        request.setExams(null);

        assertThat(mapper.toExamPlan(request)).isNull();
    }

    @Test
    void rejectsAnExamNobodySits() {
        PlanningRequest request = TestProblems.request();
        request.getExams().setExams(List.of(new PlanningRequest.ExamSpec("EX9", "C9", 1)));

        assertThatThrownBy(() -> mapper.toExamPlan(request))
                .isInstanceOf(ModelException.class)
                .hasMessage("Exam EX9 has no students");
    }

    @Test
    void layersSettingsOverTheDefaults() {
        SolverConfig defaults = TestProblems.fastConfig();
        PlanningRequest request = TestProblems.request();
        assertThat(mapper.toSolverConfig(request, defaults)).isSameAs(defaults);

        PlanningRequest.Settings settings = new PlanningRequest.Settings();
        settings.setSeed(9L);
        settings.setTimeBudgetSeconds(5);
        settings.setWeights(Map.of(SoftWeights.GAP, 4.0));
        settings.setInvigilationPolicy(InvigilationPolicy.MINIMUM_FIRST);
        request.setSettings(settings);

        SolverConfig config = mapper.toSolverConfig(request, defaults);

        assertThat(config.getSeed()).isEqualTo(9L);
        assertThat(config.getTimeBudget()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.getWeights().get(SoftWeights.GAP)).isEqualTo(4.0);
        assertThat(config.getWeights().get(SoftWeights.SELF_STUDY))
                .isEqualTo(defaults.getWeights().get(SoftWeights.SELF_STUDY));
        assertThat(config.getInvigilationPolicy()).isEqualTo(InvigilationPolicy.MINIMUM_FIRST);
        assertThat(config.getMoveBudget()).isEqualTo(defaults.getMoveBudget());
    }

    @Test
    void reportsInvalidSettingsAsAModelProblem() {
        PlanningRequest request = TestProblems.request();
        PlanningRequest.Settings settings = new PlanningRequest.Settings();
        settings.setMinInvigilatorsPerRoom(0);
        request.setSettings(settings);

        assertThatThrownBy(() -> mapper.toSolverConfig(request, TestProblems.fastConfig()))
                .isInstanceOf(ModelException.class)
                .hasMessageStartingWith("Invalid solver settings");
    }
}
