package com.university.clashfree.exam;

import com.university.clashfree.config.SolverConfig;
import com.university.clashfree.constraint.ConstraintKind;
import com.university.clashfree.constraint.ExamConstraints;
import com.university.clashfree.constraint.Occupancy;
import com.university.clashfree.constraint.SeatCapacity;
import com.university.clashfree.domain.ClashGraph;
import com.university.clashfree.domain.Exam;
import com.university.clashfree.domain.ExamPlacement;
import com.university.clashfree.domain.ExamProblem;
import com.university.clashfree.domain.ExamSchedule;
import com.university.clashfree.domain.Faculty;
import com.university.clashfree.domain.Room;
import com.university.clashfree.domain.SeatAssignment;
import com.university.clashfree.domain.SlotRange;
import com.university.clashfree.domain.TimeSlot;
import com.university.clashfree.solver.Diagnosis;
import com.university.clashfree.solver.InfeasibleScheduleException;
import com.university.clashfree.solver.SearchSpace;
import com.university.clashfree.solver.TieBreak;

import java.util.ArrayList;
import java.util.Collection;
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
 * Exams as search variables, each taking a range of the exam grid and a
 * minimal room combination. Teaching reservations, room tags, room calendars
 * and seat supply are settled in the static domains; room double booking,
 * student clashes and the daily exam limit are checked against the
 * {@link Occupancy} and per-student day counts of the partial schedule.
 * <p>
 * Each sitting also demands invigilator posts. Per grid slot the posts of the
 * placed exams may not outnumber the eligible faculty free at that slot, and
 * combinations of sittings that staffing proved impossible are never
 * placed together again.
 */
public class ExamSearchSpace implements SearchSpace<ExamCandidate> {

    private static final Comparator<ExamCandidate> RANKING = Comparator
            .comparingDouble(ExamCandidate::getPressure)
            .thenComparingLong(ExamCandidate::getTieKey)
            .thenComparingInt(ExamCandidate::getPosition);

    private static final ConstraintKind[] STAFFING_STAGES = {
        ConstraintKind.INVIGILATOR_COVERAGE,
        ConstraintKind.AVAILABILITY,
        ConstraintKind.FACULTY_DOUBLE_BOOKING,
        ConstraintKind.FACULTY_OVERLOAD,
        ConstraintKind.SELF_INVIGILATION,
    };

    private final ExamProblem problem;
    private final int maxPerDay;
    private final List<Exam> order;
    private final Map<String, Integer> positions = new HashMap<>();
    private final Map<String, List<ExamCandidate>> domains = new HashMap<>();
    private final Map<String, ConstraintKind> emptiedBy = new TreeMap<>();
    private final Occupancy occupancy;
    private final Map<String, int[]> examsPerDay = new HashMap<>();
    private final ExamSchedule schedule = new ExamSchedule();
    private final SeatingPlanner seatingPlanner = new SeatingPlanner();
    private final Map<String, Map<List<String>, Integer>> posts = new HashMap<>();
    private final int[] supplyAt;
    private final int[] postsAt;
    private final Map<String, List<Map<String, String>>> forbidden = new HashMap<>();

    public ExamSearchSpace(ExamProblem problem, SolverConfig config) {
        this.problem = problem;
        this.maxPerDay = config.getMaxExamsPerStudentPerDay();
        this.occupancy = new Occupancy(problem.getGrid());
        this.supplyAt = invigilatorSupply();
        this.postsAt = new int[problem.getGrid().getSlotCount()];
        for (Exam exam : problem.getExams()) {
            domains.put(exam.getId(), staticDomain(exam, config));
        }
        ClashGraph graph = problem.getClashGraph();
        List<Exam> exams = new ArrayList<>(problem.getExams());
        exams.sort(Comparator
                .comparingInt((Exam e) -> domains.get(e.getId()).size())
                .thenComparingInt(e -> -graph.degree(e.getId()))
                .thenComparingInt(e -> -e.getEnrolledCount())
                .thenComparing(Exam::getId));
        this.order = Collections.unmodifiableList(exams);
        for (int i = 0; i < order.size(); i++) {
            positions.put(order.get(i).getId(), i);
        }
        rank(config.getSeed());
    }

    private List<ExamCandidate> staticDomain(Exam exam, SolverConfig config) {
        List<ExamCandidate> domain = new ArrayList<>();
        List<SlotRange> ranges = problem.getGrid().ranges(exam.getDuration());
        if (ranges.isEmpty()) {
            emptiedBy.put(exam.getId(), ConstraintKind.AVAILABILITY);
            return domain;
        }
        List<Room> rooms = new ArrayList<>();
        for (Room room : problem.getRooms()) {
            if (room.hasTags(exam.getRequiredTags())) {
                rooms.add(room);
            }
        }
        if (rooms.isEmpty()) {
            emptiedBy.put(exam.getId(), ConstraintKind.ROOM_CAPABILITY);
            return domain;
        }
        int demand = SeatCapacity.demand(exam, problem, config.getSeatingRule());
        List<List<Room>> combos = RoomCombinations.minimal(rooms,
                r -> SeatCapacity.supply(r, exam, config.getSeatingRule()), demand,
                config.getMaxRoomsPerExam(), config.getRoomCombinationLimit());
        if (combos.isEmpty()) {
            emptiedBy.put(exam.getId(), ConstraintKind.ROOM_CAPACITY);
            return domain;
        }
        Map<List<String>, Integer> demanded = new HashMap<>();
        for (List<Room> combo : combos) {
            int needed = postsFor(exam, combo, ranges.get(0), config);
            if (needed >= 0) {
                demanded.put(roomIds(combo), needed);
            }
        }
        if (demanded.isEmpty()) {
            emptiedBy.put(exam.getId(), ConstraintKind.SEATING);
            return domain;
        }
        posts.put(exam.getId(), demanded);
        boolean reservedOnly = false;
        int understaffedBy = -2;
        int position = 0;
        for (SlotRange range : ranges) {
            int[] staff = invigilatorPool(exam, range, config);
            for (List<Room> combo : combos) {
                Integer needed = demanded.get(roomIds(combo));
                if (needed == null || !available(combo, range)) {
                    continue;
                }
                if (reserved(combo, range)) {
                    reservedOnly = true;
                    continue;
                }
                if (needed > staff[0]) {
                    understaffedBy = Math.max(understaffedBy, staff[1]);
                    continue;
                }
                domain.add(new ExamCandidate(range, combo, position++));
            }
        }
        if (domain.isEmpty()) {
            emptiedBy.put(exam.getId(), understaffedBy > -2 ? STAFFING_STAGES[Math.max(understaffedBy, 0)]
                    : reservedOnly ? ConstraintKind.ROOM_DOUBLE_BOOKING : ConstraintKind.AVAILABILITY);
        }
        return domain;
    }

    /** Posts the seating of this room combination needs, or -1 when the students cannot be seated in it. */
    private int postsFor(Exam exam, List<Room> combo, SlotRange range, SolverConfig config) {
        List<SeatAssignment> seats;
        try {
            seats = seatingPlanner.seat(new ExamPlacement(exam, range, combo), problem, config.getSeatingRule());
        } catch (InfeasibleScheduleException e) {
            return -1;
        }
        Map<String, Integer> perRoom = new HashMap<>();
        for (SeatAssignment seat : seats) {
            perRoom.merge(seat.getRoomId(), 1, Integer::sum);
        }
        int total = 0;
        for (int seated : perRoom.values()) {
            total += ExamConstraints.requiredInvigilators(seated, config);
        }
        return total;
    }

    /**
     * Faculty who could take one of this exam's posts over the whole range,
     * filtered in the order the invigilation pools are, and the furthest
     * filter anybody was turned away by.
     */
    private int[] invigilatorPool(Exam exam, SlotRange range, SolverConfig config) {
        int count = 0;
        int furthest = -1;
        for (Faculty member : problem.getFaculty()) {
            int stage;
            if (!member.isInvigilationEligible()) {
                stage = 0;
            } else if (!member.getAvailability().permits(range)) {
                stage = 1;
            } else if (facultyReserved(member, range.slots())) {
                stage = 2;
            } else if (member.getMaxLoad() < range.getLength()) {
                stage = 3;
            } else if (config.isInstructorExclusionHard() && problem.isInstructor(member.getId(), exam)) {
                stage = 4;
            } else {
                count++;
                continue;
            }
            furthest = Math.max(furthest, stage);
        }
        return new int[] {count, furthest};
    }

    private int[] invigilatorSupply() {
        int[] supply = new int[problem.getGrid().getSlotCount()];
        for (int day = 0; day < problem.getGrid().getDayCount(); day++) {
            for (int period = 0; period < problem.getGrid().getPeriodsPerDay(); period++) {
                TimeSlot slot = new TimeSlot(day, period);
                for (Faculty member : problem.getFaculty()) {
                    if (member.isInvigilationEligible() && member.getMaxLoad() > 0
                            && member.getAvailability().permits(slot)
                            && !facultyReserved(member, List.of(slot))) {
                        supply[problem.getGrid().indexOf(day, period)]++;
                    }
                }
            }
        }
        return supply;
    }

    private boolean facultyReserved(Faculty member, List<TimeSlot> slots) {
        for (TimeSlot slot : slots) {
            if (problem.isFacultyReserved(member.getId(), slot)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> roomIds(List<Room> rooms) {
        List<String> ids = new ArrayList<>(rooms.size());
        for (Room room : rooms) {
            ids.add(room.getId());
        }
        return ids;
    }

    private int postsOf(Exam exam, List<Room> rooms) {
        return posts.get(exam.getId()).getOrDefault(roomIds(rooms), 0);
    }

    private static String signature(SlotRange range, List<Room> rooms) {
        return range + " " + roomIds(rooms);
    }

    /**
     * Never again places the given exams together the way {@code failed} has
     * them. Used when their invigilator posts could not be staffed.
     */
    void forbid(ExamSchedule failed, Collection<String> examIds) {
        Map<String, String> combination = new TreeMap<>();
        for (String examId : examIds) {
            ExamPlacement placement = failed.get(examId);
            if (placement != null) {
                combination.put(examId, signature(placement.getRange(), placement.getRooms()));
            }
        }
        if (combination.isEmpty()) {
            return;
        }
        for (String examId : combination.keySet()) {
            forbidden.computeIfAbsent(examId, k -> new ArrayList<>()).add(combination);
        }
    }

    /** The forbidden combination this sitting would complete, or null. */
    private Map<String, String> completes(Exam exam, SlotRange range, List<Room> rooms) {
        List<Map<String, String>> combinations = forbidden.get(exam.getId());
        if (combinations == null) {
            return null;
        }
        String own = signature(range, rooms);
        for (Map<String, String> combination : combinations) {
            if (!own.equals(combination.get(exam.getId()))) {
                continue;
            }
            boolean complete = true;
            for (Map.Entry<String, String> e : combination.entrySet()) {
                if (e.getKey().equals(exam.getId())) {
                    continue;
                }
                ExamPlacement placed = schedule.get(e.getKey());
                if (placed == null || !e.getValue().equals(signature(placed.getRange(), placed.getRooms()))) {
                    complete = false;
                    break;
                }
            }
            if (complete) {
                return combination;
            }
        }
        return null;
    }

    /** Releases every placed exam so the search can start over. */
    void clear() {
        for (ExamPlacement placement : new ArrayList<>(schedule.getPlacements())) {
            release(placement);
        }
    }

    private boolean available(List<Room> combo, SlotRange range) {
        for (Room room : combo) {
            if (!room.getAvailability().permits(range)) {
                return false;
            }
        }
        return true;
    }

    private boolean reserved(List<Room> combo, SlotRange range) {
        for (Room room : combo) {
            for (TimeSlot slot : range.slots()) {
                if (problem.isRoomReserved(room.getId(), slot)) {
                    return true;
                }
            }
        }
        return false;
    }

    public void checkStaticDomains() throws InfeasibleScheduleException {
        if (emptiedBy.isEmpty()) {
            return;
        }
        Map.Entry<String, ConstraintKind> first = emptiedBy.entrySet().iterator().next();
        throw new InfeasibleScheduleException("Exam " + first.getKey() + " has no possible sitting: "
                + first.getValue(), first.getValue(), List.of(first.getKey()));
    }

    /** Pressure from rooms and from clashing exams wanting the same slots. */
    private void rank(long seed) {
        int slots = problem.getGrid().getSlotCount();
        Map<String, double[]> roomDemand = new HashMap<>();
        Map<String, double[]> examDemand = new HashMap<>();
        for (Exam exam : order) {
            List<ExamCandidate> domain = domains.get(exam.getId());
            if (domain.isEmpty()) {
                continue;
            }
            double weight = 1.0 / domain.size();
            double[] own = examDemand.computeIfAbsent(exam.getId(), k -> new double[slots]);
            for (ExamCandidate c : domain) {
                for (int i : slotIndices(c.getRange())) {
                    own[i] += weight;
                    for (Room room : c.getRooms()) {
                        roomDemand.computeIfAbsent(room.getId(), k -> new double[slots])[i] += weight;
                    }
                }
            }
        }
        double[] none = new double[slots];
        for (Exam exam : order) {
            Set<String> neighbours = problem.getClashGraph().neighbors(exam.getId());
            for (ExamCandidate c : domains.get(exam.getId())) {
                double pressure = 0;
                for (int i : slotIndices(c.getRange())) {
                    for (Room room : c.getRooms()) {
                        pressure += roomDemand.getOrDefault(room.getId(), none)[i];
                    }
                    for (String neighbour : neighbours) {
                        pressure += examDemand.getOrDefault(neighbour, none)[i];
                    }
                }
                c.setPressure(pressure);
                c.setTieKey(TieBreak.key(seed, exam.getId(), c.getPosition()));
            }
            domains.get(exam.getId()).sort(RANKING);
        }
    }

    private int[] slotIndices(SlotRange range) {
        int[] indices = new int[range.getLength()];
        for (int p = 0; p < indices.length; p++) {
            indices[p] = problem.getGrid().indexOf(range.getDay(), range.getStart() + p);
        }
        return indices;
    }

    @Override
    public int variableCount() {
        return order.size();
    }

    @Override
    public String variableId(int index) {
        return order.get(index).getId();
    }

    @Override
    public List<ExamCandidate> candidates(int index) {
        Exam exam = order.get(index);
        List<ExamCandidate> result = new ArrayList<>();
        for (ExamCandidate c : domains.get(exam.getId())) {
            if (fits(exam, c.getRange(), c.getRooms())) {
                result.add(c);
            }
        }
        return result;
    }

    @Override
    public void apply(int index, ExamCandidate candidate) {
        occupy(candidate.toPlacement(order.get(index)));
    }

    @Override
    public void retract(int index, ExamCandidate candidate) {
        release(candidate.toPlacement(order.get(index)));
    }

    @Override
    public Diagnosis diagnose(int index) {
        Exam exam = order.get(index);
        Set<Integer> culprits = new TreeSet<>();
        Map<ConstraintKind, Integer> counts = new EnumMap<>(ConstraintKind.class);
        for (ExamCandidate c : domains.get(exam.getId())) {
            ConstraintKind kind = blame(exam, c, culprits);
            if (kind != null) {
                counts.merge(kind, 1, Integer::sum);
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

    private ConstraintKind blame(Exam exam, ExamCandidate c, Set<Integer> culprits) {
        SlotRange range = c.getRange();
        for (Room room : c.getRooms()) {
            String occupant = occupancy.roomOccupant(room.getId(), range);
            if (occupant != null) {
                culprits.add(positions.get(occupant));
                return ConstraintKind.ROOM_DOUBLE_BOOKING;
            }
        }
        for (String neighbour : problem.getClashGraph().neighbors(exam.getId())) {
            String occupant = occupancy.groupOccupant(neighbour, range);
            if (occupant != null) {
                culprits.add(positions.get(occupant));
                return ConstraintKind.STUDENT_CLASH;
            }
        }
        if (maxPerDay > 0) {
            for (String student : exam.getStudentIds()) {
                if (countOn(student, range.getDay()) >= maxPerDay) {
                    for (String other : problem.examsOf(student)) {
                        ExamPlacement placed = schedule.get(other);
                        if (placed != null && placed.getRange().getDay() == range.getDay()) {
                            culprits.add(positions.get(other));
                        }
                    }
                    return ConstraintKind.STUDENT_DAILY_LIMIT;
                }
            }
        }
        int needed = postsOf(exam, c.getRooms());
        for (int i : slotIndices(range)) {
            if (postsAt[i] + needed > supplyAt[i]) {
                for (ExamPlacement placed : schedule.getPlacements()) {
                    if (placed.getRange().overlaps(range)) {
                        culprits.add(positions.get(placed.getId()));
                    }
                }
                return ConstraintKind.INVIGILATOR_COVERAGE;
            }
        }
        Map<String, String> combination = completes(exam, range, c.getRooms());
        if (combination != null) {
            for (String other : combination.keySet()) {
                if (!other.equals(exam.getId())) {
                    culprits.add(positions.get(other));
                }
            }
            return ConstraintKind.INVIGILATOR_COVERAGE;
        }
        return null;
    }

    /** True when the sitting clashes with nothing currently placed. */
    public boolean fits(Exam exam, SlotRange range, List<Room> rooms) {
        for (Room room : rooms) {
            if (occupancy.roomOccupant(room.getId(), range) != null) {
                return false;
            }
        }
        for (String neighbour : problem.getClashGraph().neighbors(exam.getId())) {
            if (occupancy.groupOccupant(neighbour, range) != null) {
                return false;
            }
        }
        if (maxPerDay > 0) {
            for (String student : exam.getStudentIds()) {
                if (countOn(student, range.getDay()) >= maxPerDay) {
                    return false;
                }
            }
        }
        int needed = postsOf(exam, rooms);
        for (int i : slotIndices(range)) {
            if (postsAt[i] + needed > supplyAt[i]) {
                return false;
            }
        }
        return completes(exam, range, rooms) == null;
    }

    private int countOn(String student, int day) {
        int[] counts = examsPerDay.get(student);
        return counts == null ? 0 : counts[day];
    }

    void occupy(ExamPlacement placement) {
        schedule.put(placement);
        SlotRange range = placement.getRange();
        for (Room room : placement.getRooms()) {
            occupancy.occupyRoom(room.getId(), range, placement.getId());
        }
        occupancy.occupyGroup(placement.getId(), range, placement.getId());
        for (String student : placement.getExam().getStudentIds()) {
            examsPerDay.computeIfAbsent(student, k -> new int[problem.getGrid().getDayCount()])[range.getDay()]++;
        }
        int needed = postsOf(placement.getExam(), placement.getRooms());
        for (int i : slotIndices(range)) {
            postsAt[i] += needed;
        }
    }

    void release(ExamPlacement placement) {
        schedule.remove(placement.getId());
        SlotRange range = placement.getRange();
        for (Room room : placement.getRooms()) {
            occupancy.releaseRoom(room.getId(), range, placement.getId());
        }
        occupancy.releaseGroup(placement.getId(), range, placement.getId());
        for (String student : placement.getExam().getStudentIds()) {
            examsPerDay.get(student)[range.getDay()]--;
        }
        int needed = postsOf(placement.getExam(), placement.getRooms());
        for (int i : slotIndices(range)) {
            postsAt[i] -= needed;
        }
    }

    List<ExamCandidate> staticDomain(String examId) {
        return Collections.unmodifiableList(domains.get(examId));
    }

    ExamProblem getProblem() {
        return problem;
    }

    /** The live schedule; copy before keeping it. */
    ExamSchedule getSchedule() {
        return schedule;
    }
}
