package com.university.clashfree.controller;

import com.university.clashfree.domain.ModelException;
import com.university.clashfree.model.PlanningRequest;
import com.university.clashfree.service.CycleOutcome;
import com.university.clashfree.service.PlanningService;
import com.university.clashfree.solver.InfeasibleScheduleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/cycles")
public class PlanningController {

    private static final Logger logger = LoggerFactory.getLogger(PlanningController.class);

    private final PlanningService planningService;

    public PlanningController(PlanningService planningService) {
        this.planningService = planningService;
    }

    @PostMapping("/{cycleId}/plan")
    public ResponseEntity<?> plan(@PathVariable String cycleId, @RequestBody PlanningRequest request) {
        try {
            CycleOutcome outcome = planningService.plan(cycleId, request);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", "success");
            body.put("message", "Cycle " + cycleId + " planned and committed");
            body.put("cycle", outcome.getCycle());
            body.put("timetableStats", outcome.getTimetable().getStats());
            if (outcome.getExams() != null) {
                body.put("examStats", outcome.getExams().getStats());
            }
            return ResponseEntity.ok(body);
        } catch (ModelException e) {
            return ResponseEntity.badRequest().body(Map.of(
                "status", "error",
                "message", e.getMessage(),
                "problems", e.getProblems()
            ));
        } catch (InfeasibleScheduleException e) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", "infeasible");
            body.put("reason", e.getReason());
            body.put("message", e.getMessage());
            body.put("kind", e.getKind());
            body.put("conflictingIds", e.getConflictingIds());
            return ResponseEntity.unprocessableEntity().body(body);
        } catch (IllegalStateException e) {
            logger.warn("Rejected plan for cycle {}: {}", cycleId, e.getMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                "status", "error",
                "message", e.getMessage()
            ));
        }
    }
}
