package com.university.clashfree.service;

import com.university.clashfree.TestProblems;
import com.university.clashfree.constraint.ConstraintKind;
import com.university.clashfree.domain.ExamProblem;
import com.university.clashfree.domain.TimetableProblem;
import com.university.clashfree.exam.ExamScheduler;
import com.university.clashfree.exam.ExamSolution;
import com.university.clashfree.model.PlanningCycle;
import com.university.clashfree.model.PlanningRequest;
import com.university.clashfree.solver.InfeasibleScheduleException;
import com.university.clashfree.solver.TimetableSolution;
import com.university.clashfree.solver.TimetableSolver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PlanningServiceTest {

    @Mock
    private ScheduleStore store;

    private ThreadPoolTaskExecutor executor;
    private PlanningService service;

    @BeforeEach
    void setUp() {
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.initialize();
        service = new PlanningService(new TimetableSolver(), new ExamScheduler(), store,
                new PlanningRequestMapper(), TestProblems.fastConfig(), executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    private static PlanningCycle cycle(String id) {
        return new PlanningCycle(id, Instant.now(), 0, 0.0, 0, null);
    }

    @Test
    void solvesTheTimetableThenTheExamsAndCommitsBoth() throws Exception {
        when(store.commit(eq("c1"), any(), any(), any(), any())).thenReturn(cycle("c1"));

        CycleOutcome outcome = service.plan("c1", TestProblems.request());

        assertThat(outcome.getCycle().getCycleId()).isEqualTo("c1");
        assertThat(outcome.getTimetable().getSchedule().size()).isEqualTo(3);
        assertThat(outcome.getExams()).isNotNull();
        assertThat(outcome.getExams().getSchedule().getPlacements()).hasSize(2);
        assertThat(outcome.getExams().getSchedule().getInvigilators())
                .allMatch(post -> !post.getFacultyId().equals("F1"));

        ArgumentCaptor<ExamProblem> exams = ArgumentCaptor.forClass(ExamProblem.class);
        verify(store).commit(eq("c1"), any(TimetableProblem.class), any(TimetableSolution.class),
                exams.capture(), any(ExamSolution.class));
        assertThat(exams.getValue().getExamOnlyDays()).containsExactly("Wed");
    }

    @Test
    void commitsATimetableWithoutAnExamRound() throws Exception {
        when(store.commit(eq("c2"), any(), any(), isNull(), isNull())).thenReturn(cycle("c2"));

        CycleOutcome outcome = service.plan("c2", TestProblems.twoSectionsOneTeacher(), null,
                TestProblems.fastConfig());

        assertThat(outcome.getExams()).isNull();
        verify(store).commit(eq("c2"), any(), any(), isNull(), isNull());
    }

    @Test
    void refusesACycleThatIsAlreadyCommitted() {
        when(store.isCommitted("c1")).thenReturn(true);

        assertThatThrownBy(() -> service.plan("c1", TestProblems.request()))
                .isInstanceOf(IllegalStateException.class);
        verify(store, never()).commit(anyString(), any(), any(), any(), any());
    }

    @Test
    void commitsNothingWhenTheTimetableIsInfeasible() {
        assertThatThrownBy(() -> service.plan("c3", TestProblems.sharedTeacherOneSlot(), null,
                TestProblems.fastConfig()))
                .isInstanceOf(InfeasibleScheduleException.class)
                .extracting(e -> ((InfeasibleScheduleException) e).getKind())
                .isEqualTo(ConstraintKind.FACULTY_DOUBLE_BOOKING);
        verify(store, never()).commit(anyString(), any(), any(), any(), any());
    }

    @Test
    void plansInTheBackground() throws Exception {
        when(store.commit(eq("c4"), any(), any(), any(), any())).thenReturn(cycle("c4"));

        CycleOutcome outcome = service.planAsync("c4", TestProblems.request()).get();

        assertThat(outcome.getCycle().getCycleId()).isEqualTo("c4");
    }

    @Test
    void backgroundPlanningFailsWithTheInfeasibility() {
        PlanningRequest request = TestProblems.request();
        request.getSections().get(0).setEnrolledCount(100);

        CompletableFuture<CycleOutcome> future = service.planAsync("c5", request);

        assertThat(future).failsWithin(Duration.ofSeconds(30))
                .withThrowableOfType(ExecutionException.class)
                .withCauseInstanceOf(InfeasibleScheduleException.class);
    }
}
