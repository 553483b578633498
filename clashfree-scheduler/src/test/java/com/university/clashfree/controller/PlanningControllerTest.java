package com.university.clashfree.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.university.clashfree.TestProblems;
import com.university.clashfree.constraint.ConstraintKind;
import com.university.clashfree.domain.ModelException;
import com.university.clashfree.model.PlanningCycle;
import com.university.clashfree.model.PlanningRequest;
import com.university.clashfree.service.CycleOutcome;
import com.university.clashfree.service.PlanningService;
import com.university.clashfree.solver.BudgetExceededException;
import com.university.clashfree.solver.InfeasibleScheduleException;
import com.university.clashfree.solver.TimetableSolution;
import com.university.clashfree.solver.TimetableSolver;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.time.Instant;
import java.util.List;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(PlanningController.class)
class PlanningControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private PlanningService planningService;

    private ResultActions postPlan(String cycleId) throws Exception {
        return mockMvc.perform(post("/api/cycles/{cycleId}/plan", cycleId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(TestProblems.request())));
    }

    @Test
    void returnsTheCommittedCycle() throws Exception {
        TimetableSolution timetable = new TimetableSolver()
                .solve(TestProblems.twoSectionsOneTeacher(), TestProblems.fastConfig());
        PlanningCycle cycle = new PlanningCycle("c1", Instant.now(), 2, timetable.getSoftCost(), 0, null);
        when(planningService.plan(eq("c1"), any(PlanningRequest.class)))
                .thenReturn(new CycleOutcome(cycle, timetable, null));

        postPlan("c1")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.cycle.cycleId").value("c1"))
                .andExpect(jsonPath("$.cycle.sessionCount").value(2))
                .andExpect(jsonPath("$.timetableStats.steps").exists())
                .andExpect(jsonPath("$.examStats").doesNotExist());
    }

    @Test
    void answersAMalformedModelWithBadRequest() throws Exception {
        when(planningService.plan(eq("c1"), any(PlanningRequest.class)))
                .thenThrow(new ModelException(List.of("Duplicate room id R1", "Unknown section S9")));

        postPlan("c1")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.problems", hasSize(2)));
    }

    @Test
    void answersAnInfeasibleCycleWithTheConflict() throws Exception {
        when(planningService.plan(eq("c1"), any(PlanningRequest.class)))
                .thenThrow(new InfeasibleScheduleException("No slot left for S2#1",
                        ConstraintKind.STUDENT_CLASH, List.of("S2#1", "S1#1")));

        postPlan("c1")
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.status").value("infeasible"))
                .andExpect(jsonPath("$.reason").value(InfeasibleScheduleException.INFEASIBLE))
                .andExpect(jsonPath("$.kind").value("STUDENT_CLASH"))
                .andExpect(jsonPath("$.conflictingIds", contains("S1#1", "S2#1")));
    }

    @Test
    void reportsAnExhaustedBudget() throws Exception {
        when(planningService.plan(eq("c1"), any(PlanningRequest.class)))
                .thenThrow(new BudgetExceededException(BudgetExceededException.Budget.TIME, "Out of time"));

        postPlan("c1")
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.reason").value(BudgetExceededException.BUDGET_EXCEEDED))
                .andExpect(jsonPath("$.conflictingIds", hasSize(0)));
    }

    @Test
    void refusesToReplanACommittedCycle() throws Exception {
        when(planningService.plan(eq("c1"), any(PlanningRequest.class)))
                .thenThrow(new IllegalStateException("Cycle c1 is already committed"));

        postPlan("c1")
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("Cycle c1 is already committed"));
    }
}
