package com.university.clashfree.constraint;

import com.university.clashfree.config.SoftWeights;
import com.university.clashfree.domain.Assignment;
import com.university.clashfree.domain.Availability;
import com.university.clashfree.domain.ClashReason;
import com.university.clashfree.domain.Cohort;
import com.university.clashfree.domain.Faculty;
import com.university.clashfree.domain.Schedule;
import com.university.clashfree.domain.Section;
import com.university.clashfree.domain.SlotRange;
import com.university.clashfree.domain.TimeGrid;
import com.university.clashfree.domain.TimeSlot;
import com.university.clashfree.domain.TimetableProblem;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Hard rules and soft terms of a teaching timetable.
 */
public final class TimetableConstraints {

    private TimetableConstraints() {
    }

    public static ConstraintSet<Schedule, TimetableProblem> create(SoftWeights weights) {
        return ConstraintSet.<Schedule, TimetableProblem>builder()
                .hard(ConstraintKind.ROOM_CAPACITY, TimetableConstraints::roomCapacity)
                .hard(ConstraintKind.ROOM_CAPABILITY, TimetableConstraints::roomCapability)
                .hard(ConstraintKind.ROOM_DOUBLE_BOOKING, (s, p, out) ->
                        doubleBookings(s, ConstraintKind.ROOM_DOUBLE_BOOKING, a -> a.getRoom().getId(), out))
                .hard(ConstraintKind.FACULTY_DOUBLE_BOOKING, (s, p, out) ->
                        doubleBookings(s, ConstraintKind.FACULTY_DOUBLE_BOOKING, a -> a.getFaculty().getId(), out))
                .hard(ConstraintKind.FACULTY_OVERLOAD, TimetableConstraints::facultyOverload)
                .hard(ConstraintKind.FACULTY_QUALIFICATION, TimetableConstraints::facultyQualification)
                .hard(ConstraintKind.STUDENT_CLASH, TimetableConstraints::studentClashes)
                .hard(ConstraintKind.ELECTIVE_CLASH, TimetableConstraints::electiveClashes)
                .hard(ConstraintKind.AVAILABILITY, TimetableConstraints::availability)
                .soft(SoftWeights.GAP, weights.get(SoftWeights.GAP), TimetableConstraints::gaps)
                .soft(SoftWeights.IMBALANCE, weights.get(SoftWeights.IMBALANCE), TimetableConstraints::imbalance)
                .soft(SoftWeights.SELF_STUDY, weights.get(SoftWeights.SELF_STUDY), TimetableConstraints::fullDays)
                .soft(SoftWeights.BREAK, weights.get(SoftWeights.BREAK), TimetableConstraints::backToBack)
                .soft(SoftWeights.CLUSTER, weights.get(SoftWeights.CLUSTER), TimetableConstraints::fragmentation)
                .soft(SoftWeights.PREFERENCE, weights.get(SoftWeights.PREFERENCE), TimetableConstraints::offDays)
                .soft(SoftWeights.SPREAD, weights.get(SoftWeights.SPREAD), TimetableConstraints::sameDayMeetings)
                .build();
    }

    // ---- hard ----

    static void roomCapacity(Schedule schedule, TimetableProblem problem, List<HardViolation> out) {
        for (Assignment a : schedule.getAssignments()) {
            int enrolled = a.getSection().getEnrolledCount();
            if (a.getRoom().getCapacity() < enrolled) {
                out.add(new HardViolation(ConstraintKind.ROOM_CAPACITY, List.of(a.getId()), a.getRoom().getId(),
                        firstSlot(a.getRange()), enrolled + " students do not fit into " + a.getRoom().getId()
                        + " (capacity " + a.getRoom().getCapacity() + ")"));
            }
        }
    }

    static void roomCapability(Schedule schedule, TimetableProblem problem, List<HardViolation> out) {
        for (Assignment a : schedule.getAssignments()) {
            Set<String> required = a.getSection().getRequiredTags();
            if (!a.getRoom().hasTags(required)) {
                out.add(new HardViolation(ConstraintKind.ROOM_CAPABILITY, List.of(a.getId()), a.getRoom().getId(),
                        firstSlot(a.getRange()), a.getRoom().getId() + " lacks " + required));
            }
        }
    }

    static void doubleBookings(Schedule schedule, ConstraintKind kind, Function<Assignment, String> resource,
            List<HardViolation> out) {
        Map<String, List<Assignment>> byResource = new TreeMap<>();
        for (Assignment a : schedule.getAssignments()) {
            byResource.computeIfAbsent(resource.apply(a), k -> new ArrayList<>()).add(a);
        }
        byResource.forEach((id, list) -> {
            for (int i = 0; i < list.size(); i++) {
                for (int j = i + 1; j < list.size(); j++) {
                    Assignment a = list.get(i);
                    Assignment b = list.get(j);
                    if (a.overlaps(b)) {
                        out.add(new HardViolation(kind, List.of(a.getId(), b.getId()), id,
                                a.getRange().firstSharedSlot(b.getRange()), id + " is booked twice"));
                    }
                }
            }
        });
    }

    static void facultyOverload(Schedule schedule, TimetableProblem problem, List<HardViolation> out) {
        Map<String, List<Assignment>> byFaculty = new TreeMap<>();
        for (Assignment a : schedule.getAssignments()) {
            byFaculty.computeIfAbsent(a.getFaculty().getId(), k -> new ArrayList<>()).add(a);
        }
        byFaculty.forEach((id, list) -> {
            int load = 0;
            List<String> ids = new ArrayList<>();
            for (Assignment a : list) {
                load += a.getRange().getLength();
                ids.add(a.getId());
            }
            int max = list.get(0).getFaculty().getMaxLoad();
            if (load > max) {
                out.add(new HardViolation(ConstraintKind.FACULTY_OVERLOAD, ids, id, null,
                        id + " teaches " + load + " periods, at most " + max + " allowed"));
            }
        });
    }

    static void facultyQualification(Schedule schedule, TimetableProblem problem, List<HardViolation> out) {
        for (Assignment a : schedule.getAssignments()) {
            if (!problem.isQualified(a.getFaculty(), a.getSection())) {
                out.add(new HardViolation(ConstraintKind.FACULTY_QUALIFICATION, List.of(a.getId()),
                        a.getFaculty().getId(), firstSlot(a.getRange()),
                        a.getFaculty().getId() + " may not teach " + a.getSection().getId()));
            }
        }
    }

    static void studentClashes(Schedule schedule, TimetableProblem problem, List<HardViolation> out) {
        forOverlappingPairs(schedule, (a, b) -> {
            String sectionA = a.getSection().getId();
            String sectionB = b.getSection().getId();
            String resource = null;
            if (sectionA.equals(sectionB)) {
                resource = sectionA;
            } else if (problem.getClashGraph().reasons(sectionA, sectionB).contains(ClashReason.SHARED_STUDENT)) {
                resource = firstShared(problem.studentsOf(sectionA), problem.studentsOf(sectionB));
            }
            if (resource != null) {
                out.add(new HardViolation(ConstraintKind.STUDENT_CLASH, List.of(a.getId(), b.getId()), resource,
                        a.getRange().firstSharedSlot(b.getRange()),
                        sectionA + " and " + sectionB + " share students at the same time"));
            }
        });
    }

    static void electiveClashes(Schedule schedule, TimetableProblem problem, List<HardViolation> out) {
        forOverlappingPairs(schedule, (a, b) -> {
            Section sa = a.getSection();
            Section sb = b.getSection();
            if (problem.getClashGraph().reasons(sa.getId(), sb.getId()).contains(ClashReason.ELECTIVE_GROUP)) {
                out.add(new HardViolation(ConstraintKind.ELECTIVE_CLASH, List.of(a.getId(), b.getId()),
                        sa.getExclusionGroup(), a.getRange().firstSharedSlot(b.getRange()),
                        "electives " + sa.getId() + " and " + sb.getId() + " of group "
                        + sa.getExclusionGroup() + " overlap"));
            }
        });
    }

    static void availability(Schedule schedule, TimetableProblem problem, List<HardViolation> out) {
        TimeGrid grid = problem.getGrid();
        for (Assignment a : schedule.getAssignments()) {
            SlotRange range = a.getRange();
            if (!grid.fits(range)) {
                out.add(new HardViolation(ConstraintKind.AVAILABILITY, List.of(a.getId()), "grid",
                        firstSlot(range), range + " leaves the grid or spans a break"));
            }
            TimeSlot roomSlot = firstBlocked(a.getRoom().getAvailability(), range);
            if (roomSlot != null) {
                out.add(new HardViolation(ConstraintKind.AVAILABILITY, List.of(a.getId()), a.getRoom().getId(),
                        roomSlot, a.getRoom().getId() + " is unavailable"));
            }
            TimeSlot facultySlot = firstBlocked(a.getFaculty().getAvailability(), range);
            if (facultySlot != null) {
                out.add(new HardViolation(ConstraintKind.AVAILABILITY, List.of(a.getId()), a.getFaculty().getId(),
                        facultySlot, a.getFaculty().getId() + " is unavailable"));
            }
        }
    }

    // ---- soft ----

    /** Idle non-break periods between a cohort's first and last class of a day. */
    static double gaps(Schedule schedule, TimetableProblem problem) {
        TimeGrid grid = problem.getGrid();
        double total = 0;
        for (Cohort cohort : problem.getCohorts()) {
            boolean[][] busy = cohortDays(schedule, cohort, grid);
            int idle = 0;
            for (boolean[] day : busy) {
                int first = -1;
                int last = -1;
                for (int p = 0; p < day.length; p++) {
                    if (day[p]) {
                        if (first < 0) {
                            first = p;
                        }
                        last = p;
                    }
                }
                for (int p = first + 1; first >= 0 && p < last; p++) {
                    if (!day[p] && !grid.isBreak(p)) {
                        idle++;
                    }
                }
            }
            total += idle * cohort.getSize();
        }
        return total;
    }

    /** Pairs of sessions a cohort attends back to back with no free period between. */
    static double backToBack(Schedule schedule, TimetableProblem problem) {
        double total = 0;
        Map<String, List<Assignment>> bySection = bySection(schedule);
        for (Cohort cohort : problem.getCohorts()) {
            Map<Integer, List<SlotRange>> byDay = new TreeMap<>();
            for (String sectionId : cohort.getActivityIds()) {
                for (Assignment a : bySection.getOrDefault(sectionId, List.of())) {
                    byDay.computeIfAbsent(a.getRange().getDay(), d -> new ArrayList<>()).add(a.getRange());
                }
            }
            int adjacent = 0;
            for (List<SlotRange> ranges : byDay.values()) {
                ranges.sort(Comparator.naturalOrder());
                for (int i = 1; i < ranges.size(); i++) {
                    if (ranges.get(i).getStart() == ranges.get(i - 1).getEnd()) {
                        adjacent++;
                    }
                }
            }
            total += adjacent * cohort.getSize();
        }
        return total;
    }

    /** Student-days without a single free teaching period, so no room for self-study. */
    static double fullDays(Schedule schedule, TimetableProblem problem) {
        TimeGrid grid = problem.getGrid();
        double total = 0;
        for (Cohort cohort : problem.getCohorts()) {
            boolean[][] busy = cohortDays(schedule, cohort, grid);
            int full = 0;
            for (boolean[] day : busy) {
                boolean free = false;
                for (int p = 0; p < day.length && !free; p++) {
                    free = !day[p] && !grid.isBreak(p);
                }
                if (!free) {
                    full++;
                }
            }
            total += full * cohort.getSize();
        }
        return total;
    }

    /** Population variance of teaching load over all faculty. */
    static double imbalance(Schedule schedule, TimetableProblem problem) {
        List<Faculty> faculty = new ArrayList<>(problem.getFaculty());
        if (faculty.size() < 2) {
            return 0;
        }
        Map<String, Integer> loads = new TreeMap<>();
        for (Assignment a : schedule.getAssignments()) {
            loads.merge(a.getFaculty().getId(), a.getRange().getLength(), Integer::sum);
        }
        double mean = 0;
        for (Faculty f : faculty) {
            mean += loads.getOrDefault(f.getId(), 0);
        }
        mean /= faculty.size();
        double variance = 0;
        for (Faculty f : faculty) {
            double d = loads.getOrDefault(f.getId(), 0) - mean;
            variance += d * d;
        }
        return variance / faculty.size();
    }

    /** Extra teaching blocks per faculty day beyond the first. */
    static double fragmentation(Schedule schedule, TimetableProblem problem) {
        int periods = problem.getGrid().getPeriodsPerDay();
        Map<String, boolean[]> busy = new TreeMap<>();
        for (Assignment a : schedule.getAssignments()) {
            boolean[] day = busy.computeIfAbsent(a.getFaculty().getId() + "@" + a.getRange().getDay(),
                    k -> new boolean[periods]);
            for (int p = a.getRange().getStart(); p < a.getRange().getEnd() && p < periods; p++) {
                day[p] = true;
            }
        }
        double total = 0;
        for (boolean[] day : busy.values()) {
            int blocks = 0;
            for (int p = 0; p < day.length; p++) {
                if (day[p] && (p == 0 || !day[p - 1])) {
                    blocks++;
                }
            }
            total += Math.max(0, blocks - 1);
        }
        return total;
    }

    static double offDays(Schedule schedule, TimetableProblem problem) {
        TimeGrid grid = problem.getGrid();
        double total = 0;
        for (Assignment a : schedule.getAssignments()) {
            if (!a.getFaculty().prefersDay(grid.dayName(a.getRange().getDay()))) {
                total++;
            }
        }
        return total;
    }

    /** Meetings of one section beyond the first on the same day. */
    static double sameDayMeetings(Schedule schedule, TimetableProblem problem) {
        Map<String, Integer> perSectionDay = new TreeMap<>();
        for (Assignment a : schedule.getAssignments()) {
            perSectionDay.merge(a.getSection().getId() + "@" + a.getRange().getDay(), 1, Integer::sum);
        }
        double total = 0;
        for (int count : perSectionDay.values()) {
            total += count - 1;
        }
        return total;
    }

    // ---- helpers ----

    interface PairVisitor {
        void visit(Assignment a, Assignment b);
    }

    /** Visits each unordered pair of overlapping assignments once, lower id first. */
    static void forOverlappingPairs(Schedule schedule, PairVisitor visitor) {
        Map<Integer, List<Assignment>> byDay = new TreeMap<>();
        for (Assignment a : schedule.getAssignments()) {
            byDay.computeIfAbsent(a.getRange().getDay(), d -> new ArrayList<>()).add(a);
        }
        for (List<Assignment> list : byDay.values()) {
            for (int i = 0; i < list.size(); i++) {
                for (int j = i + 1; j < list.size(); j++) {
                    if (list.get(i).overlaps(list.get(j))) {
                        visitor.visit(list.get(i), list.get(j));
                    }
                }
            }
        }
    }

    static Map<String, List<Assignment>> bySection(Schedule schedule) {
        Map<String, List<Assignment>> bySection = new TreeMap<>();
        for (Assignment a : schedule.getAssignments()) {
            bySection.computeIfAbsent(a.getSection().getId(), k -> new ArrayList<>()).add(a);
        }
        return bySection;
    }

    private static boolean[][] cohortDays(Schedule schedule, Cohort cohort, TimeGrid grid) {
        boolean[][] busy = new boolean[grid.getDayCount()][grid.getPeriodsPerDay()];
        for (Assignment a : schedule.getAssignments()) {
            if (!cohort.getActivityIds().contains(a.getSection().getId())) {
                continue;
            }
            SlotRange r = a.getRange();
            for (int p = r.getStart(); p < r.getEnd() && p < grid.getPeriodsPerDay(); p++) {
                if (r.getDay() < grid.getDayCount()) {
                    busy[r.getDay()][p] = true;
                }
            }
        }
        return busy;
    }

    static TimeSlot firstSlot(SlotRange range) {
        return new TimeSlot(range.getDay(), range.getStart());
    }

    static TimeSlot firstBlocked(Availability availability, SlotRange range) {
        for (TimeSlot slot : range.slots()) {
            if (!availability.permits(slot)) {
                return slot;
            }
        }
        return null;
    }

    static String firstShared(Set<String> a, Set<String> b) {
        for (String s : new TreeSet<>(a)) {
            if (b.contains(s)) {
                return s;
            }
        }
        return null;
    }
}
