package com.university.clashfree.service;

import com.university.clashfree.config.SolverConfig;
import com.university.clashfree.domain.Availability;
import com.university.clashfree.domain.Course;
import com.university.clashfree.domain.Exam;
import com.university.clashfree.domain.Faculty;
import com.university.clashfree.domain.ModelException;
import com.university.clashfree.domain.Room;
import com.university.clashfree.domain.Section;
import com.university.clashfree.domain.TimeGrid;
import com.university.clashfree.domain.TimeSlot;
import com.university.clashfree.domain.TimetableProblem;
import com.university.clashfree.model.PlanningRequest;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Turns a {@link PlanningRequest} into solver input. Malformed requests fail
 * with a {@link ModelException} before anything is solved.
 */
@Component
public class PlanningRequestMapper {

    public TimetableProblem toTimetableProblem(PlanningRequest request) {
        TimeGrid grid = grid(request.getGrid(), "teaching");
        TimetableProblem.Builder builder = TimetableProblem.builder(grid);
        List<String> errors = new ArrayList<>();
        for (Room room : rooms(request, grid, true, errors)) {
            builder.room(room);
        }
        for (Faculty member : faculty(request, grid, true, errors)) {
            builder.faculty(member);
        }
        if (!errors.isEmpty()) {
            throw new ModelException(errors);
        }
        for (PlanningRequest.CourseSpec course : request.getCourses()) {
            builder.course(new Course(course.getId(), course.getName(), course.getInstructorIds()));
        }
        for (PlanningRequest.SectionSpec spec : request.getSections()) {
            builder.section(Section.builder(spec.getId(), spec.getCourseId())
                    .kind(spec.getKind())
                    .duration(spec.getDuration())
                    .meetingsPerWeek(spec.getMeetingsPerWeek())
                    .requiredTags(spec.getRequiredTags())
                    .enrolled(spec.getEnrolledCount())
                    .qualified(spec.getQualifiedFacultyIds())
                    .exclusionGroup(spec.getExclusionGroup())
                    .build());
        }
        for (PlanningRequest.EnrollmentSpec enrollment : request.getEnrollments()) {
            builder.enroll(enrollment.getStudentId(), enrollment.getSectionId());
        }
        return builder.build();
    }

    /**
     * The exam round of the request, or null when it has none. Calendars are
     * translated to the exam grid by day label; slots on days or periods the
     * exam grid lacks are dropped.
     */
    public ExamPlan toExamPlan(PlanningRequest request) {
        PlanningRequest.ExamRound round = request.getExams();
        if (round == null || round.getExams() == null || round.getExams().isEmpty()) {
            return null;
        }
        TimeGrid grid = grid(round.getGrid(), "exam");
        List<String> errors = new ArrayList<>();
        List<Room> rooms = rooms(request, grid, false, errors);
        List<Faculty> faculty = faculty(request, grid, false, errors);
        List<Exam> exams = new ArrayList<>();
        for (PlanningRequest.ExamSpec spec : round.getExams()) {
            Set<String> students = new TreeSet<>(spec.getStudentIds());
            if (students.isEmpty()) {
                students.addAll(studentsOfCourse(request, spec.getCourseId()));
            }
            if (students.isEmpty()) {
                errors.add("Exam " + spec.getId() + " has no students");
                continue;
            }
            exams.add(Exam.builder(spec.getId(), spec.getCourseId())
                    .duration(spec.getDuration())
                    .students(students)
                    .density(spec.getDensity())
                    .requiredTags(spec.getRequiredTags())
                    .build());
        }
        if (!errors.isEmpty()) {
            throw new ModelException(errors);
        }
        return new ExamPlan(grid, round.getExamOnlyDays(), exams, rooms, faculty);
    }

    /** Request settings layered over the configured defaults. */
    public SolverConfig toSolverConfig(PlanningRequest request, SolverConfig defaults) {
        PlanningRequest.Settings settings = request.getSettings();
        if (settings == null) {
            return defaults;
        }
        SolverConfig.Builder builder = defaults.toBuilder();
        try {
            if (settings.getWeights() != null && !settings.getWeights().isEmpty()) {
                builder.weights(defaults.getWeights().with(settings.getWeights()));
            }
            if (settings.getSeed() != null) {
                builder.seed(settings.getSeed());
            }
            if (settings.getTimeBudgetSeconds() != null) {
                builder.timeBudget(Duration.ofSeconds(settings.getTimeBudgetSeconds()));
            }
            if (settings.getMoveBudget() != null) {
                builder.moveBudget(settings.getMoveBudget());
            }
            if (settings.getSeatingRule() != null) {
                builder.seatingRule(settings.getSeatingRule());
            }
            if (settings.getInvigilationPolicy() != null) {
                builder.invigilationPolicy(settings.getInvigilationPolicy());
            }
            if (settings.getAllowInstructorInvigilation() != null) {
                builder.allowInstructorInvigilation(settings.getAllowInstructorInvigilation());
            }
            if (settings.getMinInvigilatorsPerRoom() != null) {
                builder.minInvigilatorsPerRoom(settings.getMinInvigilatorsPerRoom());
            }
            if (settings.getStudentsPerInvigilator() != null) {
                builder.studentsPerInvigilator(settings.getStudentsPerInvigilator());
            }
            if (settings.getMaxExamsPerStudentPerDay() != null) {
                builder.maxExamsPerStudentPerDay(settings.getMaxExamsPerStudentPerDay());
            }
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new ModelException("Invalid solver settings: " + e.getMessage());
        }
    }

    private TimeGrid grid(PlanningRequest.Grid spec, String which) {
        if (spec == null || spec.getDays() == null || spec.getDays().isEmpty()) {
            throw new ModelException("A " + which + " grid with at least one day is required");
        }
        return new TimeGrid(spec.getDays(), spec.getPeriodsPerDay(), spec.getBreakPeriods());
    }

    private List<Room> rooms(PlanningRequest request, TimeGrid grid, boolean strict, List<String> errors) {
        List<Room> rooms = new ArrayList<>();
        for (PlanningRequest.RoomSpec spec : request.getRooms()) {
            Availability availability = blocked(spec.getUnavailable(), grid, strict, "room " + spec.getId(), errors);
            rooms.add(new Room(spec.getId(), spec.getCapacity(), spec.getTags(), availability));
        }
        return rooms;
    }

    private List<Faculty> faculty(PlanningRequest request, TimeGrid grid, boolean strict, List<String> errors) {
        List<Faculty> faculty = new ArrayList<>();
        for (PlanningRequest.FacultySpec spec : request.getFaculty()) {
            Availability availability = blocked(spec.getUnavailable(), grid, strict,
                    "faculty " + spec.getId(), errors);
            faculty.add(new Faculty(spec.getId(), spec.getName(), spec.getMaxLoad(), availability,
                    spec.getQualifications(), spec.getPreferredDays(), spec.isInvigilationEligible()));
        }
        return faculty;
    }

    private Availability blocked(List<PlanningRequest.Slot> slots, TimeGrid grid, boolean strict, String owner,
                                 List<String> errors) {
        if (slots == null || slots.isEmpty()) {
            return Availability.always();
        }
        List<TimeSlot> blocked = new ArrayList<>();
        for (PlanningRequest.Slot slot : slots) {
            int day = grid.dayIndex(slot.getDay());
            boolean inGrid = day >= 0 && slot.getPeriod() >= 0 && slot.getPeriod() < grid.getPeriodsPerDay();
            if (inGrid) {
                blocked.add(new TimeSlot(day, slot.getPeriod()));
            } else if (strict) {
                errors.add("Unavailable slot " + slot.getDay() + "/" + slot.getPeriod() + " of " + owner
                        + " is outside the grid");
            }
        }
        return Availability.allExcept(blocked);
    }

    private Set<String> studentsOfCourse(PlanningRequest request, String courseId) {
        Set<String> sectionIds = new TreeSet<>();
        for (PlanningRequest.SectionSpec section : request.getSections()) {
            if (courseId != null && courseId.equals(section.getCourseId())) {
                sectionIds.add(section.getId());
            }
        }
        Set<String> students = new TreeSet<>();
        for (PlanningRequest.EnrollmentSpec enrollment : request.getEnrollments()) {
            if (sectionIds.contains(enrollment.getSectionId())) {
                students.add(enrollment.getStudentId());
            }
        }
        return students;
    }
}
