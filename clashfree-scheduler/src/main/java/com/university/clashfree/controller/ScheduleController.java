package com.university.clashfree.controller;

import com.university.clashfree.model.TimetableEntry;
import com.university.clashfree.service.ScheduleStore;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Read-only views of committed cycles.
 */
@RestController
@RequestMapping("/api/cycles")
public class ScheduleController {

    private final ScheduleStore store;

    public ScheduleController(ScheduleStore store) {
        this.store = store;
    }

    @GetMapping("/{cycleId}/timetable")
    public ResponseEntity<?> timetable(@PathVariable String cycleId,
                                       @RequestParam(required = false) String facultyId,
                                       @RequestParam(required = false) String roomId,
                                       @RequestParam(required = false) String studentId,
                                       @RequestParam(required = false) String day) {
        if (!store.isCommitted(cycleId)) {
            return unknownCycle(cycleId);
        }
        List<TimetableEntry> entries;
        if (facultyId != null) {
            entries = store.timetableForFaculty(cycleId, facultyId);
        } else if (roomId != null) {
            entries = store.timetableForRoom(cycleId, roomId);
        } else if (studentId != null) {
            entries = store.timetableForStudent(cycleId, studentId);
        } else if (day != null) {
            entries = store.timetableForDay(cycleId, day);
        } else {
            entries = store.timetable(cycleId);
        }
        return ResponseEntity.ok(entries);
    }

    @GetMapping("/{cycleId}/exams")
    public ResponseEntity<?> exams(@PathVariable String cycleId) {
        if (!store.isCommitted(cycleId)) {
            return unknownCycle(cycleId);
        }
        return ResponseEntity.ok(store.exams(cycleId));
    }

    @GetMapping("/{cycleId}/seats")
    public ResponseEntity<?> seats(@PathVariable String cycleId, @RequestParam(required = false) String studentId) {
        if (!store.isCommitted(cycleId)) {
            return unknownCycle(cycleId);
        }
        return ResponseEntity.ok(studentId == null ? store.seats(cycleId) : store.seatsOf(cycleId, studentId));
    }

    @GetMapping("/{cycleId}/invigilation")
    public ResponseEntity<?> invigilation(@PathVariable String cycleId,
                                          @RequestParam(required = false) String facultyId) {
        if (!store.isCommitted(cycleId)) {
            return unknownCycle(cycleId);
        }
        return ResponseEntity.ok(facultyId == null
                ? store.invigilation(cycleId)
                : store.invigilationOf(cycleId, facultyId));
    }

    @GetMapping("/{fromCycle}/diff/{toCycle}")
    public ResponseEntity<?> diff(@PathVariable String fromCycle, @PathVariable String toCycle) {
        try {
            return ResponseEntity.ok(store.diff(fromCycle, toCycle));
        } catch (NoSuchElementException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of(
                "status", "error",
                "message", e.getMessage()
            ));
        }
    }

    private ResponseEntity<?> unknownCycle(String cycleId) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of(
            "status", "error",
            "message", "Unknown cycle " + cycleId
        ));
    }
}
