package com.university.clashfree.constraint;

import com.university.clashfree.config.SeatingRule;
import com.university.clashfree.config.SoftWeights;
import com.university.clashfree.config.SolverConfig;
import com.university.clashfree.domain.Cohort;
import com.university.clashfree.domain.Exam;
import com.university.clashfree.domain.ExamPlacement;
import com.university.clashfree.domain.ExamProblem;
import com.university.clashfree.domain.ExamSchedule;
import com.university.clashfree.domain.Faculty;
import com.university.clashfree.domain.InvigilatorAssignment;
import com.university.clashfree.domain.Room;
import com.university.clashfree.domain.SeatAssignment;
import com.university.clashfree.domain.SeatingDensity;
import com.university.clashfree.domain.SlotRange;
import com.university.clashfree.domain.TimeSlot;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import static com.university.clashfree.constraint.TimetableConstraints.firstBlocked;
import static com.university.clashfree.constraint.TimetableConstraints.firstSlot;

/**
 * Rules of an exam schedule. The placement set covers where and when exams
 * sit; the full set adds seating and invigilation.
 */
public final class ExamConstraints {

    private ExamConstraints() {
    }

    public static ConstraintSet<ExamSchedule, ExamProblem> placement(SolverConfig config) {
        return placementRules(config).build();
    }

    public static ConstraintSet<ExamSchedule, ExamProblem> full(SolverConfig config) {
        ConstraintSet.Builder<ExamSchedule, ExamProblem> rules = placementRules(config)
                .hard(ConstraintKind.SEATING, ExamConstraints::seating)
                .hard(ConstraintKind.FACULTY_DOUBLE_BOOKING, ExamConstraints::invigilatorDoubleBooking)
                .hard(ConstraintKind.FACULTY_OVERLOAD, ExamConstraints::invigilatorOverload)
                .hard(ConstraintKind.INVIGILATOR_COVERAGE, (s, p, out) -> coverage(s, p, config, out));
        if (config.getSeatingRule() == SeatingRule.NO_SAME_SECTION_BENCHMATES) {
            rules.hard(ConstraintKind.SEATING_ADJACENCY, ExamConstraints::benchMates);
        }
        if (config.isInstructorExclusionHard()) {
            rules.hard(ConstraintKind.SELF_INVIGILATION, ExamConstraints::selfInvigilation);
        }
        return rules.build();
    }

    private static ConstraintSet.Builder<ExamSchedule, ExamProblem> placementRules(SolverConfig config) {
        SeatingRule rule = config.getSeatingRule();
        ConstraintSet.Builder<ExamSchedule, ExamProblem> rules = ConstraintSet.<ExamSchedule, ExamProblem>builder()
                .hard(ConstraintKind.ROOM_CAPACITY, (s, p, out) -> roomCapacity(s, p, rule, out))
                .hard(ConstraintKind.ROOM_CAPABILITY, ExamConstraints::roomCapability)
                .hard(ConstraintKind.ROOM_DOUBLE_BOOKING, ExamConstraints::roomDoubleBooking)
                .hard(ConstraintKind.AVAILABILITY, ExamConstraints::availability)
                .hard(ConstraintKind.STUDENT_CLASH, ExamConstraints::studentClashes)
                .soft(SoftWeights.EXAM_SPACING, config.getWeights().get(SoftWeights.EXAM_SPACING),
                        ExamConstraints::spacing);
        if (config.getMaxExamsPerStudentPerDay() > 0) {
            int max = config.getMaxExamsPerStudentPerDay();
            rules.hard(ConstraintKind.STUDENT_DAILY_LIMIT, (s, p, out) -> dailyLimit(s, p, max, out));
        }
        return rules;
    }

    /** Posts needed in one room: the configured minimum, or more for a large room. */
    public static int requiredInvigilators(int seated, SolverConfig config) {
        int byRatio = config.getStudentsPerInvigilator() > 0
                ? (seated + config.getStudentsPerInvigilator() - 1) / config.getStudentsPerInvigilator()
                : 0;
        return Math.max(config.getMinInvigilatorsPerRoom(), byRatio);
    }

    // ---- placement ----

    static void roomCapacity(ExamSchedule schedule, ExamProblem problem, SeatingRule rule, List<HardViolation> out) {
        for (ExamPlacement placement : schedule.getPlacements()) {
            Exam exam = placement.getExam();
            int supply = 0;
            for (Room room : placement.getRooms()) {
                supply += SeatCapacity.supply(room, exam, rule);
            }
            int demand = SeatCapacity.demand(exam, problem, rule);
            if (supply < demand) {
                out.add(new HardViolation(ConstraintKind.ROOM_CAPACITY, List.of(exam.getId()),
                        roomIds(placement), firstSlot(placement.getRange()),
                        "rooms offer " + supply + " places for a demand of " + demand));
            }
        }
    }

    static void roomCapability(ExamSchedule schedule, ExamProblem problem, List<HardViolation> out) {
        for (ExamPlacement placement : schedule.getPlacements()) {
            for (Room room : placement.getRooms()) {
                if (!room.hasTags(placement.getExam().getRequiredTags())) {
                    out.add(new HardViolation(ConstraintKind.ROOM_CAPABILITY, List.of(placement.getId()),
                            room.getId(), firstSlot(placement.getRange()),
                            room.getId() + " lacks " + placement.getExam().getRequiredTags()));
                }
            }
        }
    }

    static void roomDoubleBooking(ExamSchedule schedule, ExamProblem problem, List<HardViolation> out) {
        List<ExamPlacement> placements = new ArrayList<>(schedule.getPlacements());
        for (int i = 0; i < placements.size(); i++) {
            ExamPlacement a = placements.get(i);
            for (int j = i + 1; j < placements.size(); j++) {
                ExamPlacement b = placements.get(j);
                if (!a.getRange().overlaps(b.getRange())) {
                    continue;
                }
                for (Room room : a.getRooms()) {
                    if (b.usesRoom(room.getId())) {
                        out.add(new HardViolation(ConstraintKind.ROOM_DOUBLE_BOOKING, List.of(a.getId(), b.getId()),
                                room.getId(), a.getRange().firstSharedSlot(b.getRange()),
                                room.getId() + " hosts two exams at once"));
                    }
                }
            }
            for (Room room : a.getRooms()) {
                for (TimeSlot slot : a.getRange().slots()) {
                    if (problem.isRoomReserved(room.getId(), slot)) {
                        out.add(new HardViolation(ConstraintKind.ROOM_DOUBLE_BOOKING, List.of(a.getId()),
                                room.getId(), slot, room.getId() + " is taken by teaching"));
                        break;
                    }
                }
            }
        }
    }

    static void availability(ExamSchedule schedule, ExamProblem problem, List<HardViolation> out) {
        for (ExamPlacement placement : schedule.getPlacements()) {
            SlotRange range = placement.getRange();
            if (!problem.getGrid().fits(range)) {
                out.add(new HardViolation(ConstraintKind.AVAILABILITY, List.of(placement.getId()), "grid",
                        firstSlot(range), range + " leaves the exam grid or spans a break"));
            }
            for (Room room : placement.getRooms()) {
                TimeSlot blocked = firstBlocked(room.getAvailability(), range);
                if (blocked != null) {
                    out.add(new HardViolation(ConstraintKind.AVAILABILITY, List.of(placement.getId()),
                            room.getId(), blocked, room.getId() + " is unavailable"));
                }
            }
        }
        for (InvigilatorAssignment post : schedule.getInvigilators()) {
            Faculty member = problem.getFaculty(post.getFacultyId());
            if (member == null) {
                continue;
            }
            TimeSlot blocked = firstBlocked(member.getAvailability(), post.getRange());
            if (blocked != null) {
                out.add(new HardViolation(ConstraintKind.AVAILABILITY, List.of(post.getExamId()),
                        member.getId(), blocked, member.getId() + " is unavailable"));
            }
        }
    }

    static void studentClashes(ExamSchedule schedule, ExamProblem problem, List<HardViolation> out) {
        List<ExamPlacement> placements = new ArrayList<>(schedule.getPlacements());
        for (int i = 0; i < placements.size(); i++) {
            for (int j = i + 1; j < placements.size(); j++) {
                ExamPlacement a = placements.get(i);
                ExamPlacement b = placements.get(j);
                if (a.getRange().overlaps(b.getRange())
                        && problem.getClashGraph().adjacent(a.getId(), b.getId())) {
                    String student = TimetableConstraints.firstShared(
                            a.getExam().getStudentIds(), b.getExam().getStudentIds());
                    out.add(new HardViolation(ConstraintKind.STUDENT_CLASH, List.of(a.getId(), b.getId()),
                            student, a.getRange().firstSharedSlot(b.getRange()),
                            "exams " + a.getId() + " and " + b.getId() + " share students at the same time"));
                }
            }
        }
    }

    static void dailyLimit(ExamSchedule schedule, ExamProblem problem, int max, List<HardViolation> out) {
        problem.getExamsByStudent().forEach((student, examIds) -> {
            Map<Integer, List<String>> byDay = new TreeMap<>();
            for (String examId : examIds) {
                ExamPlacement placement = schedule.get(examId);
                if (placement != null) {
                    byDay.computeIfAbsent(placement.getRange().getDay(), d -> new ArrayList<>()).add(examId);
                }
            }
            byDay.forEach((day, ids) -> {
                if (ids.size() > max) {
                    out.add(new HardViolation(ConstraintKind.STUDENT_DAILY_LIMIT, ids, student,
                            new TimeSlot(day, 0), student + " sits " + ids.size() + " exams on "
                            + problem.getGrid().dayName(day) + ", at most " + max + " allowed"));
                }
            });
        });
    }

    // ---- seating ----

    static void seating(ExamSchedule schedule, ExamProblem problem, List<HardViolation> out) {
        for (ExamPlacement placement : schedule.getPlacements()) {
            Exam exam = placement.getExam();
            TimeSlot at = firstSlot(placement.getRange());
            Map<String, Integer> timesSeated = new TreeMap<>();
            Map<String, Integer> perRoom = new TreeMap<>();
            Set<String> labels = new TreeSet<>();
            for (SeatAssignment seat : schedule.seatsOf(exam.getId())) {
                timesSeated.merge(seat.getStudentId(), 1, Integer::sum);
                perRoom.merge(seat.getRoomId(), 1, Integer::sum);
                if (!placement.usesRoom(seat.getRoomId())) {
                    out.add(new HardViolation(ConstraintKind.SEATING, List.of(exam.getId()), seat.getRoomId(), at,
                            seat.getStudentId() + " is seated in a room the exam does not use"));
                }
                if (!labels.add(seat.getRoomId() + "/" + seat.getSeatLabel())) {
                    out.add(new HardViolation(ConstraintKind.SEATING, List.of(exam.getId()), seat.getRoomId(), at,
                            "seat " + seat.getSeatLabel() + " is given twice"));
                }
                if (exam.getDensity() == SeatingDensity.ALTERNATE && seat.isSeatB()) {
                    out.add(new HardViolation(ConstraintKind.SEATING, List.of(exam.getId()), seat.getRoomId(), at,
                            "seat " + seat.getSeatLabel() + " must stay empty"));
                }
            }
            for (String student : exam.getStudentIds()) {
                int count = timesSeated.getOrDefault(student, 0);
                if (count != 1) {
                    out.add(new HardViolation(ConstraintKind.SEATING, List.of(exam.getId()), student, at,
                            student + " holds " + count + " seats"));
                }
            }
            for (String student : timesSeated.keySet()) {
                if (!exam.getStudentIds().contains(student)) {
                    out.add(new HardViolation(ConstraintKind.SEATING, List.of(exam.getId()), student, at,
                            student + " is not enrolled"));
                }
            }
            for (Room room : placement.getRooms()) {
                int seated = perRoom.getOrDefault(room.getId(), 0);
                int limit = SeatCapacity.seatLimit(room, exam.getDensity());
                if (seated > limit) {
                    out.add(new HardViolation(ConstraintKind.SEATING, List.of(exam.getId()), room.getId(), at,
                            seated + " students seated where " + limit + " fit"));
                }
            }
        }
    }

    static void benchMates(ExamSchedule schedule, ExamProblem problem, List<HardViolation> out) {
        for (ExamPlacement placement : schedule.getPlacements()) {
            Exam exam = placement.getExam();
            Map<String, List<SeatAssignment>> benches = new TreeMap<>();
            for (SeatAssignment seat : schedule.seatsOf(exam.getId())) {
                benches.computeIfAbsent(seat.getRoomId() + "/" + seat.getBench(), k -> new ArrayList<>()).add(seat);
            }
            benches.forEach((bench, seats) -> {
                if (seats.size() == 2) {
                    String a = problem.sectionOf(exam, seats.get(0).getStudentId());
                    String b = problem.sectionOf(exam, seats.get(1).getStudentId());
                    if (a.equals(b)) {
                        out.add(new HardViolation(ConstraintKind.SEATING_ADJACENCY, List.of(exam.getId()),
                                seats.get(0).getRoomId(), firstSlot(placement.getRange()),
                                seats.get(0).getStudentId() + " and " + seats.get(1).getStudentId()
                                + " of section " + a + " share bench " + bench));
                    }
                }
            });
        }
    }

    // ---- invigilation ----

    static void invigilatorDoubleBooking(ExamSchedule schedule, ExamProblem problem, List<HardViolation> out) {
        List<InvigilatorAssignment> posts = sortedPosts(schedule.getInvigilators());
        for (int i = 0; i < posts.size(); i++) {
            InvigilatorAssignment a = posts.get(i);
            for (int j = i + 1; j < posts.size(); j++) {
                InvigilatorAssignment b = posts.get(j);
                if (a.getFacultyId().equals(b.getFacultyId()) && a.getRange().overlaps(b.getRange())) {
                    out.add(new HardViolation(ConstraintKind.FACULTY_DOUBLE_BOOKING,
                            new TreeSet<>(List.of(a.getExamId(), b.getExamId())), a.getFacultyId(),
                            a.getRange().firstSharedSlot(b.getRange()),
                            a.getFacultyId() + " watches two rooms at once"));
                }
            }
            for (TimeSlot slot : a.getRange().slots()) {
                if (problem.isFacultyReserved(a.getFacultyId(), slot)) {
                    out.add(new HardViolation(ConstraintKind.FACULTY_DOUBLE_BOOKING, List.of(a.getExamId()),
                            a.getFacultyId(), slot, a.getFacultyId() + " teaches at that time"));
                    break;
                }
            }
        }
    }

    static void invigilatorOverload(ExamSchedule schedule, ExamProblem problem, List<HardViolation> out) {
        Map<String, Integer> load = new TreeMap<>();
        Map<String, Set<String>> exams = new TreeMap<>();
        for (InvigilatorAssignment post : schedule.getInvigilators()) {
            load.merge(post.getFacultyId(), post.getRange().getLength(), Integer::sum);
            exams.computeIfAbsent(post.getFacultyId(), k -> new TreeSet<>()).add(post.getExamId());
        }
        load.forEach((facultyId, periods) -> {
            Faculty member = problem.getFaculty(facultyId);
            if (member != null && periods > member.getMaxLoad()) {
                out.add(new HardViolation(ConstraintKind.FACULTY_OVERLOAD, exams.get(facultyId), facultyId, null,
                        facultyId + " invigilates " + periods + " periods, at most " + member.getMaxLoad()));
            }
        });
    }

    static void selfInvigilation(ExamSchedule schedule, ExamProblem problem, List<HardViolation> out) {
        for (InvigilatorAssignment post : schedule.getInvigilators()) {
            Exam exam = problem.getExam(post.getExamId());
            if (exam != null && problem.isInstructor(post.getFacultyId(), exam)) {
                out.add(new HardViolation(ConstraintKind.SELF_INVIGILATION, List.of(exam.getId()),
                        post.getFacultyId(), firstSlot(post.getRange()),
                        post.getFacultyId() + " teaches " + exam.getCourseId() + " and may not invigilate it"));
            }
        }
    }

    static void coverage(ExamSchedule schedule, ExamProblem problem, SolverConfig config, List<HardViolation> out) {
        Map<String, Integer> staffed = new TreeMap<>();
        for (InvigilatorAssignment post : schedule.getInvigilators()) {
            ExamPlacement placement = schedule.get(post.getExamId());
            Faculty member = problem.getFaculty(post.getFacultyId());
            if (placement == null || !placement.usesRoom(post.getRoomId())
                    || !placement.getRange().equals(post.getRange())) {
                out.add(new HardViolation(ConstraintKind.INVIGILATOR_COVERAGE, List.of(post.getExamId()),
                        post.getRoomId(), firstSlot(post.getRange()), post + " does not match a sitting"));
                continue;
            }
            if (member == null || !member.isInvigilationEligible()) {
                out.add(new HardViolation(ConstraintKind.INVIGILATOR_COVERAGE, List.of(post.getExamId()),
                        post.getFacultyId(), firstSlot(post.getRange()),
                        post.getFacultyId() + " is not eligible to invigilate"));
                continue;
            }
            staffed.merge(post.getExamId() + "/" + post.getRoomId(), 1, Integer::sum);
        }
        for (ExamPlacement placement : schedule.getPlacements()) {
            Map<String, Integer> seated = new TreeMap<>();
            for (SeatAssignment seat : schedule.seatsOf(placement.getId())) {
                seated.merge(seat.getRoomId(), 1, Integer::sum);
            }
            for (Room room : placement.getRooms()) {
                int students = seated.getOrDefault(room.getId(), 0);
                if (students == 0) {
                    continue;
                }
                int required = requiredInvigilators(students, config);
                int have = staffed.getOrDefault(placement.getId() + "/" + room.getId(), 0);
                if (have < required) {
                    out.add(new HardViolation(ConstraintKind.INVIGILATOR_COVERAGE, List.of(placement.getId()),
                            room.getId(), firstSlot(placement.getRange()),
                            room.getId() + " has " + have + " of " + required + " invigilators"));
                }
            }
        }
    }

    // ---- soft ----

    /**
     * Per cohort and day: one point for each exam beyond the first, one more
     * for each pair sat back to back.
     */
    static double spacing(ExamSchedule schedule, ExamProblem problem) {
        double total = 0;
        for (Cohort cohort : problem.getCohorts()) {
            Map<Integer, List<SlotRange>> byDay = new TreeMap<>();
            for (String examId : cohort.getActivityIds()) {
                ExamPlacement placement = schedule.get(examId);
                if (placement != null) {
                    byDay.computeIfAbsent(placement.getRange().getDay(), d -> new ArrayList<>())
                            .add(placement.getRange());
                }
            }
            int points = 0;
            for (List<SlotRange> ranges : byDay.values()) {
                ranges.sort(Comparator.naturalOrder());
                points += ranges.size() - 1;
                for (int i = 1; i < ranges.size(); i++) {
                    if (ranges.get(i).getStart() <= ranges.get(i - 1).getEnd()) {
                        points++;
                    }
                }
            }
            total += points * cohort.getSize();
        }
        return total;
    }

    private static List<InvigilatorAssignment> sortedPosts(Collection<InvigilatorAssignment> posts) {
        List<InvigilatorAssignment> sorted = new ArrayList<>(posts);
        sorted.sort(Comparator.comparing(InvigilatorAssignment::getFacultyId)
                .thenComparing(InvigilatorAssignment::getRange)
                .thenComparing(InvigilatorAssignment::getExamId)
                .thenComparing(InvigilatorAssignment::getRoomId));
        return sorted;
    }

    private static String roomIds(ExamPlacement placement) {
        List<String> ids = new ArrayList<>();
        placement.getRooms().forEach(r -> ids.add(r.getId()));
        return String.join("+", ids);
    }
}
