package com.university.clashfree.exam;

import com.university.clashfree.config.InvigilationPolicy;
import com.university.clashfree.config.SolverConfig;
import com.university.clashfree.constraint.ConstraintKind;
import com.university.clashfree.constraint.ExamConstraints;
import com.university.clashfree.constraint.Occupancy;
import com.university.clashfree.domain.ExamPlacement;
import com.university.clashfree.domain.ExamProblem;
import com.university.clashfree.domain.ExamSchedule;
import com.university.clashfree.domain.Faculty;
import com.university.clashfree.domain.InvigilatorAssignment;
import com.university.clashfree.domain.Room;
import com.university.clashfree.domain.SeatAssignment;
import com.university.clashfree.domain.SlotRange;
import com.university.clashfree.domain.TimeSlot;
import com.university.clashfree.solver.Diagnosis;
import com.university.clashfree.solver.InfeasibleScheduleException;
import com.university.clashfree.solver.SearchSpace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Invigilator posts of a seated exam schedule as search variables, each
 * taking one faculty member. Eligibility, calendars, teaching reservations,
 * the load cap for a single post and the instructor exclusion are settled in
 * the static pools; overlapping posts and the cumulative load are checked as
 * the search goes.
 */
class InvigilationSearchSpace implements SearchSpace<Faculty> {

    /** Filters in the order a pool is narrowed; an emptied pool is blamed on the last one anybody reached. */
    private static final ConstraintKind[] STAGES = {
        ConstraintKind.INVIGILATOR_COVERAGE,
        ConstraintKind.AVAILABILITY,
        ConstraintKind.FACULTY_DOUBLE_BOOKING,
        ConstraintKind.FACULTY_OVERLOAD,
        ConstraintKind.SELF_INVIGILATION,
    };

    private final ExamProblem problem;
    private final boolean instructorsLast;
    private final List<InvigilationPost> order;
    private final Map<String, Integer> positions = new HashMap<>();
    private final Map<String, List<Faculty>> pools = new HashMap<>();
    private final Map<String, ConstraintKind> emptiedBy = new TreeMap<>();
    private final Occupancy occupancy;
    private final Map<String, List<String>> held = new HashMap<>();

    InvigilationSearchSpace(ExamProblem problem, ExamSchedule seated, SolverConfig config) {
        this.problem = problem;
        this.instructorsLast = config.getInvigilationPolicy() == InvigilationPolicy.MINIMUM_FIRST
                && !config.isAllowInstructorInvigilation();
        this.occupancy = new Occupancy(problem.getGrid());

        List<InvigilationPost> posts = new ArrayList<>();
        for (ExamPlacement placement : seated.getPlacements()) {
            Map<String, Integer> perRoom = new TreeMap<>();
            for (SeatAssignment seat : seated.seatsOf(placement.getId())) {
                perRoom.merge(seat.getRoomId(), 1, Integer::sum);
            }
            for (Room room : placement.getRooms()) {
                int students = perRoom.getOrDefault(room.getId(), 0);
                if (students == 0) {
                    continue;
                }
                int required = ExamConstraints.requiredInvigilators(students, config);
                for (int k = 0; k < required; k++) {
                    InvigilationPost post = new InvigilationPost(placement.getExam(), room.getId(),
                            placement.getRange(), k);
                    pools.put(post.getId(), pool(post, config));
                    posts.add(post);
                }
            }
        }
        posts.sort(Comparator
                .comparingInt((InvigilationPost p) -> pools.get(p.getId()).size())
                .thenComparing(InvigilationPost::getId));
        this.order = Collections.unmodifiableList(posts);
        for (int i = 0; i < order.size(); i++) {
            positions.put(order.get(i).getId(), i);
        }
    }

    private List<Faculty> pool(InvigilationPost post, SolverConfig config) {
        boolean excludeInstructors = config.isInstructorExclusionHard();
        SlotRange range = post.getRange();
        List<Faculty> pool = new ArrayList<>();
        int furthest = -1;
        for (Faculty member : problem.getFaculty()) {
            int stage;
            if (!member.isInvigilationEligible()) {
                stage = 0;
            } else if (!member.getAvailability().permits(range)) {
                stage = 1;
            } else if (reserved(member, range)) {
                stage = 2;
            } else if (member.getMaxLoad() < range.getLength()) {
                stage = 3;
            } else if (excludeInstructors && problem.isInstructor(member.getId(), post.getExam())) {
                stage = 4;
            } else {
                pool.add(member);
                continue;
            }
            furthest = Math.max(furthest, stage);
        }
        if (pool.isEmpty()) {
            emptiedBy.put(post.getId(), STAGES[Math.max(furthest, 0)]);
        }
        return pool;
    }

    private boolean reserved(Faculty member, SlotRange range) {
        for (TimeSlot slot : range.slots()) {
            if (problem.isFacultyReserved(member.getId(), slot)) {
                return true;
            }
        }
        return false;
    }

    void checkStaticDomains() throws InfeasibleScheduleException {
        if (emptiedBy.isEmpty()) {
            return;
        }
        Map.Entry<String, ConstraintKind> first = emptiedBy.entrySet().iterator().next();
        String examId = first.getKey().substring(0, first.getKey().indexOf('/'));
        throw new InfeasibleScheduleException("Nobody can take invigilator post " + first.getKey() + ": "
                + first.getValue(), first.getValue(), List.of(examId));
    }

    @Override
    public int variableCount() {
        return order.size();
    }

    @Override
    public String variableId(int index) {
        return order.get(index).getId();
    }

    /** Free members of the pool, least loaded first; instructors last under the minimum-first policy. */
    @Override
    public List<Faculty> candidates(int index) {
        InvigilationPost post = order.get(index);
        List<Faculty> result = new ArrayList<>();
        for (Faculty member : pools.get(post.getId())) {
            if (fits(member, post.getRange())) {
                result.add(member);
            }
        }
        Comparator<Faculty> byLoad = Comparator
                .comparingInt((Faculty f) -> occupancy.facultyLoad(f.getId()))
                .thenComparing(Faculty::getId);
        if (instructorsLast) {
            byLoad = Comparator.comparing((Faculty f) -> problem.isInstructor(f.getId(), post.getExam()))
                    .thenComparing(byLoad);
        }
        result.sort(byLoad);
        return result;
    }

    private boolean fits(Faculty member, SlotRange range) {
        return occupancy.facultyOccupant(member.getId(), range) == null
                && occupancy.facultyLoad(member.getId()) + range.getLength() <= member.getMaxLoad();
    }

    @Override
    public void apply(int index, Faculty member) {
        InvigilationPost post = order.get(index);
        occupancy.occupyFaculty(member.getId(), post.getRange(), post.getId());
        held.computeIfAbsent(member.getId(), k -> new ArrayList<>()).add(post.getId());
    }

    @Override
    public void retract(int index, Faculty member) {
        InvigilationPost post = order.get(index);
        occupancy.releaseFaculty(member.getId(), post.getRange(), post.getId());
        held.get(member.getId()).remove(post.getId());
    }

    @Override
    public Diagnosis diagnose(int index) {
        InvigilationPost post = order.get(index);
        Set<Integer> culprits = new TreeSet<>();
        Map<ConstraintKind, Integer> counts = new EnumMap<>(ConstraintKind.class);
        for (Faculty member : pools.get(post.getId())) {
            String occupant = occupancy.facultyOccupant(member.getId(), post.getRange());
            if (occupant != null) {
                culprits.add(positions.get(occupant));
                counts.merge(ConstraintKind.FACULTY_DOUBLE_BOOKING, 1, Integer::sum);
            } else if (occupancy.facultyLoad(member.getId()) + post.getRange().getLength() > member.getMaxLoad()) {
                for (String postId : held.getOrDefault(member.getId(), List.of())) {
                    culprits.add(positions.get(postId));
                }
                counts.merge(ConstraintKind.FACULTY_OVERLOAD, 1, Integer::sum);
            }
        }
        ConstraintKind dominant = null;
        for (Map.Entry<ConstraintKind, Integer> e : counts.entrySet()) {
            if (dominant == null || e.getValue() > counts.get(dominant)) {
                dominant = e.getKey();
            }
        }
        return new Diagnosis(culprits, dominant);
    }

    InvigilatorAssignment toAssignment(int index, Faculty member) {
        InvigilationPost post = order.get(index);
        return new InvigilatorAssignment(post.getExam().getId(), post.getRoomId(), post.getRange(), member.getId());
    }
}
