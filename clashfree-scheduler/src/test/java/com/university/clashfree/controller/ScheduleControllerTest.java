package com.university.clashfree.controller;

import com.university.clashfree.model.TimetableEntry;
import com.university.clashfree.service.ScheduleDiff;
import com.university.clashfree.service.ScheduleStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.NoSuchElementException;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ScheduleController.class)
class ScheduleControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ScheduleStore store;

    private static TimetableEntry entry(String sessionId, String facultyId) {
        TimetableEntry entry = new TimetableEntry();
        entry.setCycleId("c1");
        entry.setSessionId(sessionId);
        entry.setDay("Mon");
        entry.setDayIndex(0);
        entry.setStartPeriod(1);
        entry.setLength(1);
        entry.setRoomId("R1");
        entry.setFacultyId(facultyId);
        return entry;
    }

    @Test
    void listsTheWholeTimetable() throws Exception {
        when(store.isCommitted("c1")).thenReturn(true);
        when(store.timetable("c1")).thenReturn(List.of(entry("S1#1", "F1"), entry("S2#1", "F2")));

        mockMvc.perform(get("/api/cycles/c1/timetable"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].sessionId").value("S1#1"));
    }

    @Test
    void filtersTheTimetableByFaculty() throws Exception {
        when(store.isCommitted("c1")).thenReturn(true);
        when(store.timetableForFaculty("c1", "F2")).thenReturn(List.of(entry("S2#1", "F2")));

        mockMvc.perform(get("/api/cycles/c1/timetable").param("facultyId", "F2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].facultyId").value("F2"));
        verify(store, never()).timetable("c1");
    }

    @Test
    void answersUnknownCyclesWithNotFound() throws Exception {
        mockMvc.perform(get("/api/cycles/nope/exams"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Unknown cycle nope"));
        mockMvc.perform(get("/api/cycles/nope/seats"))
                .andExpect(status().isNotFound());
    }

    @Test
    void showsTheDiffBetweenCycles() throws Exception {
        when(store.diff("c1", "c2")).thenReturn(ScheduleDiff.between(
                List.of(entry("S1#1", "F1")),
                List.of(entry("S1#1", "F2"), entry("S3#1", "F1"))));

        mockMvc.perform(get("/api/cycles/c1/diff/c2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.added[0].sessionId").value("S3#1"))
                .andExpect(jsonPath("$.removed", hasSize(0)))
                .andExpect(jsonPath("$.moved[0].sessionId").value("S1#1"))
                .andExpect(jsonPath("$.moved[0].after.facultyId").value("F2"))
                .andExpect(jsonPath("$.examsMoved", hasSize(0)))
                .andExpect(jsonPath("$.dutiesAdded", hasSize(0)));
    }

    @Test
    void answersADiffWithAnUnknownCycleWithNotFound() throws Exception {
        when(store.diff("c1", "c9")).thenThrow(new NoSuchElementException("Unknown cycle c9"));

        mockMvc.perform(get("/api/cycles/c1/diff/c9"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Unknown cycle c9"));
    }
}
