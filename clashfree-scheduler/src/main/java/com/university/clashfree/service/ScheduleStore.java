package com.university.clashfree.service;

import com.university.clashfree.domain.Assignment;
import com.university.clashfree.domain.ExamPlacement;
import com.university.clashfree.domain.ExamProblem;
import com.university.clashfree.domain.InvigilatorAssignment;
import com.university.clashfree.domain.SeatAssignment;
import com.university.clashfree.domain.TimetableProblem;
import com.university.clashfree.exam.ExamSolution;
import com.university.clashfree.model.ExamEntry;
import com.university.clashfree.model.InvigilationEntry;
import com.university.clashfree.model.PlanningCycle;
import com.university.clashfree.model.SeatEntry;
import com.university.clashfree.model.TimetableEntry;
import com.university.clashfree.repository.ExamEntryRepository;
import com.university.clashfree.repository.InvigilationEntryRepository;
import com.university.clashfree.repository.PlanningCycleRepository;
import com.university.clashfree.repository.SeatEntryRepository;
import com.university.clashfree.repository.TimetableRepository;
import com.university.clashfree.solver.TimetableSolution;
import jakarta.transaction.Transactional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Committed planning cycles. A cycle is written once and never changed;
 * everything else here only reads.
 */
@Service
@Transactional
public class ScheduleStore {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleStore.class);

    private final PlanningCycleRepository cycleRepository;
    private final TimetableRepository timetableRepository;
    private final ExamEntryRepository examRepository;
    private final SeatEntryRepository seatRepository;
    private final InvigilationEntryRepository invigilationRepository;

    public ScheduleStore(PlanningCycleRepository cycleRepository, TimetableRepository timetableRepository,
                         ExamEntryRepository examRepository, SeatEntryRepository seatRepository,
                         InvigilationEntryRepository invigilationRepository) {
        this.cycleRepository = cycleRepository;
        this.timetableRepository = timetableRepository;
        this.examRepository = examRepository;
        this.seatRepository = seatRepository;
        this.invigilationRepository = invigilationRepository;
    }

    /**
     * Stores a solved cycle.
     *
     * @param examProblem null together with {@code exams} when the cycle has no exam round
     * @throws IllegalStateException when the cycle id was committed before
     */
    public PlanningCycle commit(String cycleId, TimetableProblem teaching, TimetableSolution timetable,
                                ExamProblem examProblem, ExamSolution exams) {
        if (cycleRepository.existsById(cycleId)) {
            throw new IllegalStateException("Cycle " + cycleId + " is already committed");
        }
        PlanningCycle cycle = cycleRepository.save(new PlanningCycle(cycleId, Instant.now(),
                timetable.getSchedule().size(), timetable.getSoftCost(),
                exams == null ? 0 : exams.getSchedule().size(),
                exams == null ? null : exams.getEvaluation().getSoftCost()));

        List<TimetableEntry> entries = new ArrayList<>();
        for (Assignment assignment : timetable.getSchedule().getAssignments()) {
            entries.add(TimetableEntry.from(cycleId, assignment, teaching));
        }
        timetableRepository.saveAll(entries);

        if (exams != null) {
            List<ExamEntry> examEntries = new ArrayList<>();
            for (ExamPlacement placement : exams.getSchedule().getPlacements()) {
                examEntries.add(ExamEntry.from(cycleId, placement, examProblem));
            }
            examRepository.saveAll(examEntries);
            List<SeatEntry> seats = new ArrayList<>();
            for (SeatAssignment seat : exams.getSchedule().getSeats()) {
                seats.add(new SeatEntry(cycleId, seat));
            }
            seatRepository.saveAll(seats);
            List<InvigilationEntry> duties = new ArrayList<>();
            for (InvigilatorAssignment post : exams.getSchedule().getInvigilators()) {
                duties.add(new InvigilationEntry(cycleId, post, examProblem.getGrid()));
            }
            invigilationRepository.saveAll(duties);
        }
        logger.info("Committed cycle {}: {} sessions, {} exams", cycleId, cycle.getSessionCount(),
                cycle.getExamCount());
        return cycle;
    }

    public boolean isCommitted(String cycleId) {
        return cycleRepository.existsById(cycleId);
    }

    public Optional<PlanningCycle> findCycle(String cycleId) {
        return cycleRepository.findById(cycleId);
    }

    public List<TimetableEntry> timetable(String cycleId) {
        return timetableRepository.findByCycleIdOrderByDayIndexAscStartPeriodAscSessionIdAsc(cycleId);
    }

    public List<TimetableEntry> timetableForFaculty(String cycleId, String facultyId) {
        return timetableRepository.findByCycleIdAndFacultyIdOrderByDayIndexAscStartPeriodAsc(cycleId, facultyId);
    }

    public List<TimetableEntry> timetableForRoom(String cycleId, String roomId) {
        return timetableRepository.findByCycleIdAndRoomIdOrderByDayIndexAscStartPeriodAsc(cycleId, roomId);
    }

    public List<TimetableEntry> timetableForStudent(String cycleId, String studentId) {
        return timetableRepository.findForStudent(cycleId, studentId);
    }

    public List<TimetableEntry> timetableForDay(String cycleId, String day) {
        return timetableRepository.findByCycleIdAndDayOrderByStartPeriodAscSessionIdAsc(cycleId, day);
    }

    public List<ExamEntry> exams(String cycleId) {
        return examRepository.findByCycleIdOrderByDayIndexAscStartPeriodAscExamIdAsc(cycleId);
    }

    public List<SeatEntry> seats(String cycleId) {
        return seatRepository.findByCycleIdOrderByExamIdAscRoomIdAscSeatLabelAsc(cycleId);
    }

    public List<SeatEntry> seatsOf(String cycleId, String studentId) {
        return seatRepository.findByCycleIdAndStudentIdOrderByExamIdAsc(cycleId, studentId);
    }

    public List<InvigilationEntry> invigilation(String cycleId) {
        return invigilationRepository.findByCycleIdOrderByDayIndexAscStartPeriodAscExamIdAsc(cycleId);
    }

    public List<InvigilationEntry> invigilationOf(String cycleId, String facultyId) {
        return invigilationRepository.findByCycleIdAndFacultyIdOrderByDayIndexAscStartPeriodAsc(cycleId, facultyId);
    }

    /**
     * @throws NoSuchElementException when either cycle was never committed
     */
    public ScheduleDiff diff(String fromCycle, String toCycle) {
        for (String cycleId : List.of(fromCycle, toCycle)) {
            if (!cycleRepository.existsById(cycleId)) {
                throw new NoSuchElementException("Unknown cycle " + cycleId);
            }
        }
        return ScheduleDiff.between(timetable(fromCycle), timetable(toCycle), exams(fromCycle), exams(toCycle),
                invigilation(fromCycle), invigilation(toCycle));
    }
}
