package com.university.clashfree;

import com.university.clashfree.config.SolverConfig;
import com.university.clashfree.model.TimetableEntry;
import com.university.clashfree.service.CycleOutcome;
import com.university.clashfree.service.PlanningService;
import com.university.clashfree.service.ScheduleStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {"scheduler.move-budget=200", "scheduler.time-budget=20s"})
class ClashFreeSchedulerApplicationTest {

    @Autowired
    private PlanningService planningService;

    @Autowired
    private ScheduleStore store;

    @Autowired
    private SolverConfig solverConfig;

    @Test
    void bindsTheSolverDefaults() {
        assertThat(solverConfig.getSeed()).isEqualTo(42L);
        assertThat(solverConfig.getMoveBudget()).isEqualTo(200);
    }

    @Test
    void plansTwoCyclesSideBySideAndCommitsThem() throws Exception {
        CompletableFuture<CycleOutcome> spring = planningService.planAsync("spring", TestProblems.request());
        CompletableFuture<CycleOutcome> autumn = planningService.planAsync("autumn", TestProblems.request());

        CompletableFuture.allOf(spring, autumn).get(60, TimeUnit.SECONDS);

        assertThat(store.isCommitted("spring")).isTrue();
        assertThat(store.isCommitted("autumn")).isTrue();
        assertThat(store.timetable("spring")).hasSize(3);
        assertThat(store.timetableForStudent("spring", "s2")).extracting(TimetableEntry::getSectionId)
                .containsExactlyInAnyOrder("S1", "S1", "L1");
        assertThat(store.exams("spring")).hasSize(2);
        assertThat(store.seats("autumn")).hasSize(3);
        assertThat(store.diff("spring", "autumn").isEmpty()).isTrue();
    }
}
