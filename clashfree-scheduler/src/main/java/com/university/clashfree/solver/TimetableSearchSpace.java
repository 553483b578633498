package com.university.clashfree.solver;

import com.university.clashfree.constraint.ConstraintKind;
import com.university.clashfree.constraint.Occupancy;
import com.university.clashfree.domain.Assignment;
import com.university.clashfree.domain.ClashGraph;
import com.university.clashfree.domain.ClashReason;
import com.university.clashfree.domain.Faculty;
import com.university.clashfree.domain.Room;
import com.university.clashfree.domain.Schedule;
import com.university.clashfree.domain.Section;
import com.university.clashfree.domain.Session;
import com.university.clashfree.domain.SlotRange;
import com.university.clashfree.domain.TimeGrid;
import com.university.clashfree.domain.TimetableProblem;

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
 * Sessions of a {@link TimetableProblem} as search variables.
 * <p>
 * Static domains (range x room x faculty) are built once from the rules that
 * do not depend on other sessions: capacity, room tags, qualification, break
 * periods and calendars. Variables are ordered by domain size, then clash
 * degree, then enrollment. Candidates are ranked by demand pressure: how much
 * the other sessions are expected to want the same room, faculty member and
 * clash neighbours over the same slots. The rules that do depend on other
 * sessions are checked against an {@link Occupancy} kept in step with the
 * partial schedule.
 */
public class TimetableSearchSpace implements SearchSpace<TimetableCandidate> {

    private static final Comparator<TimetableCandidate> RANKING = Comparator
            .comparingDouble(TimetableCandidate::getPressure)
            .thenComparingLong(TimetableCandidate::getTieKey)
            .thenComparingInt(TimetableCandidate::getPosition);

    private final TimetableProblem problem;
    private final List<Session> order;
    private final Map<String, Integer> positions = new HashMap<>();
    private final Map<String, List<TimetableCandidate>> domains = new HashMap<>();
    private final Map<String, ConstraintKind> emptiedBy = new TreeMap<>();
    private final Occupancy occupancy;
    private final Schedule schedule = new Schedule();

    public TimetableSearchSpace(TimetableProblem problem, long seed) {
        this.problem = problem;
        this.occupancy = new Occupancy(problem.getGrid());
        for (Session session : problem.getSessions()) {
            domains.put(session.getId(), staticDomain(session));
        }
        ClashGraph graph = problem.getClashGraph();
        List<Session> sessions = new ArrayList<>(problem.getSessions());
        sessions.sort(Comparator
                .comparingInt((Session s) -> domains.get(s.getId()).size())
                .thenComparingInt(s -> -graph.degree(s.getSectionId()))
                .thenComparingInt(s -> -s.getSection().getEnrolledCount())
                .thenComparing(Session::getId));
        this.order = Collections.unmodifiableList(sessions);
        for (int i = 0; i < order.size(); i++) {
            positions.put(order.get(i).getId(), i);
        }
        rank(seed);
    }

    // ---- static domains ----

    private List<TimetableCandidate> staticDomain(Session session) {
        Section section = session.getSection();
        TimeGrid grid = problem.getGrid();
        List<SlotRange> ranges = grid.ranges(session.getDuration());
        List<TimetableCandidate> domain = new ArrayList<>();
        if (ranges.isEmpty()) {
            emptiedBy.put(session.getId(), ConstraintKind.AVAILABILITY);
            return domain;
        }
        List<Room> rooms = new ArrayList<>();
        boolean anyLargeEnough = false;
        for (Room room : problem.getRooms()) {
            if (room.getCapacity() >= section.getEnrolledCount()) {
                anyLargeEnough = true;
                if (room.hasTags(section.getRequiredTags())) {
                    rooms.add(room);
                }
            }
        }
        if (rooms.isEmpty()) {
            emptiedBy.put(session.getId(),
                    anyLargeEnough ? ConstraintKind.ROOM_CAPABILITY : ConstraintKind.ROOM_CAPACITY);
            return domain;
        }
        List<Faculty> qualified = problem.qualifiedFaculty(section);
        if (qualified.isEmpty()) {
            emptiedBy.put(session.getId(), ConstraintKind.FACULTY_QUALIFICATION);
            return domain;
        }
        List<Faculty> teachers = new ArrayList<>();
        for (Faculty member : qualified) {
            if (member.getMaxLoad() >= session.getDuration()) {
                teachers.add(member);
            }
        }
        if (teachers.isEmpty()) {
            emptiedBy.put(session.getId(), ConstraintKind.FACULTY_OVERLOAD);
            return domain;
        }
        int position = 0;
        for (SlotRange range : ranges) {
            for (Room room : rooms) {
                if (!room.getAvailability().permits(range)) {
                    continue;
                }
                for (Faculty member : teachers) {
                    if (member.getAvailability().permits(range)) {
                        domain.add(new TimetableCandidate(range, room, member, position++));
                    }
                }
            }
        }
        if (domain.isEmpty()) {
            emptiedBy.put(session.getId(), ConstraintKind.AVAILABILITY);
        }
        return domain;
    }

    /**
     * Fails fast when some session cannot be placed even in an empty
     * timetable, naming the rule that left it without candidates.
     */
    public void checkStaticDomains() throws InfeasibleScheduleException {
        if (emptiedBy.isEmpty()) {
            return;
        }
        Map.Entry<String, ConstraintKind> first = emptiedBy.entrySet().iterator().next();
        Session session = session(first.getKey());
        throw new InfeasibleScheduleException("Session " + first.getKey() + " of section "
                + session.getSectionId() + " has no possible placement: " + first.getValue(),
                first.getValue(), List.of(first.getKey()));
    }

    private void rank(long seed) {
        int slots = problem.getGrid().getSlotCount();
        Map<String, double[]> roomDemand = new HashMap<>();
        Map<String, double[]> facultyDemand = new HashMap<>();
        Map<String, double[]> sectionDemand = new HashMap<>();
        for (Session session : order) {
            List<TimetableCandidate> domain = domains.get(session.getId());
            if (domain.isEmpty()) {
                continue;
            }
            double weight = 1.0 / domain.size();
            for (TimetableCandidate c : domain) {
                double[] room = roomDemand.computeIfAbsent(c.getRoom().getId(), k -> new double[slots]);
                double[] faculty = facultyDemand.computeIfAbsent(c.getFaculty().getId(), k -> new double[slots]);
                double[] section = sectionDemand.computeIfAbsent(session.getSectionId(), k -> new double[slots]);
                for (int i : slotIndices(c.getRange())) {
                    room[i] += weight;
                    faculty[i] += weight;
                    section[i] += weight;
                }
            }
        }
        double[] none = new double[slots];
        for (Session session : order) {
            Set<String> neighbours = problem.getClashGraph().neighbors(session.getSectionId());
            for (TimetableCandidate c : domains.get(session.getId())) {
                double pressure = 0;
                double[] room = roomDemand.getOrDefault(c.getRoom().getId(), none);
                double[] faculty = facultyDemand.getOrDefault(c.getFaculty().getId(), none);
                for (int i : slotIndices(c.getRange())) {
                    pressure += room[i] + faculty[i];
                    for (String neighbour : neighbours) {
                        pressure += sectionDemand.getOrDefault(neighbour, none)[i];
                    }
                }
                c.setPressure(pressure);
                c.setTieKey(TieBreak.key(seed, session.getId(), c.getPosition()));
            }
            domains.get(session.getId()).sort(RANKING);
        }
    }

    private int[] slotIndices(SlotRange range) {
        int[] indices = new int[range.getLength()];
        for (int p = 0; p < indices.length; p++) {
            indices[p] = problem.getGrid().indexOf(range.getDay(), range.getStart() + p);
        }
        return indices;
    }

    // ---- SearchSpace ----

    @Override
    public int variableCount() {
        return order.size();
    }

    @Override
    public String variableId(int index) {
        return order.get(index).getId();
    }

    @Override
    public List<TimetableCandidate> candidates(int index) {
        Session session = order.get(index);
        List<TimetableCandidate> result = new ArrayList<>();
        for (TimetableCandidate c : domains.get(session.getId())) {
            if (fits(session, c.getRange(), c.getRoom(), c.getFaculty())) {
                result.add(c);
            }
        }
        return result;
    }

    @Override
    public void apply(int index, TimetableCandidate candidate) {
        occupy(candidate.toAssignment(order.get(index)));
    }

    @Override
    public void retract(int index, TimetableCandidate candidate) {
        release(candidate.toAssignment(order.get(index)));
    }

    @Override
    public Diagnosis diagnose(int index) {
        Session session = order.get(index);
        Set<Integer> culprits = new TreeSet<>();
        Map<ConstraintKind, Integer> counts = new EnumMap<>(ConstraintKind.class);
        for (TimetableCandidate c : domains.get(session.getId())) {
            ConstraintKind kind = blame(session, c, culprits);
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

    /** Adds to {@code culprits} the sessions that block the candidate; returns the rule, or null if it fits. */
    private ConstraintKind blame(Session session, TimetableCandidate c, Set<Integer> culprits) {
        SlotRange range = c.getRange();
        String occupant = occupancy.roomOccupant(c.getRoom().getId(), range);
        if (occupant != null) {
            culprits.add(positions.get(occupant));
            return ConstraintKind.ROOM_DOUBLE_BOOKING;
        }
        occupant = occupancy.facultyOccupant(c.getFaculty().getId(), range);
        if (occupant != null) {
            culprits.add(positions.get(occupant));
            return ConstraintKind.FACULTY_DOUBLE_BOOKING;
        }
        occupant = occupancy.groupOccupant(session.getSectionId(), range);
        if (occupant != null) {
            culprits.add(positions.get(occupant));
            return ConstraintKind.STUDENT_CLASH;
        }
        ClashGraph graph = problem.getClashGraph();
        for (String neighbour : graph.neighbors(session.getSectionId())) {
            occupant = occupancy.groupOccupant(neighbour, range);
            if (occupant != null) {
                culprits.add(positions.get(occupant));
                return graph.reasons(session.getSectionId(), neighbour).contains(ClashReason.SHARED_STUDENT)
                        ? ConstraintKind.STUDENT_CLASH : ConstraintKind.ELECTIVE_CLASH;
            }
        }
        Faculty faculty = c.getFaculty();
        if (occupancy.facultyLoad(faculty.getId()) + range.getLength() > faculty.getMaxLoad()) {
            for (Assignment a : schedule.forFaculty(faculty.getId())) {
                culprits.add(positions.get(a.getId()));
            }
            return ConstraintKind.FACULTY_OVERLOAD;
        }
        return null;
    }

    // ---- shared with moves ----

    /** True when the placement clashes with nothing currently in the schedule. */
    public boolean fits(Session session, SlotRange range, Room room, Faculty faculty) {
        if (occupancy.roomOccupant(room.getId(), range) != null
                || occupancy.facultyOccupant(faculty.getId(), range) != null
                || occupancy.facultyLoad(faculty.getId()) + range.getLength() > faculty.getMaxLoad()
                || occupancy.groupOccupant(session.getSectionId(), range) != null) {
            return false;
        }
        for (String neighbour : problem.getClashGraph().neighbors(session.getSectionId())) {
            if (occupancy.groupOccupant(neighbour, range) != null) {
                return false;
            }
        }
        return true;
    }

    /** True when the placement respects the rules that do not depend on other sessions. */
    public boolean staticallyAllowed(Assignment assignment) {
        SlotRange range = assignment.getRange();
        return problem.getGrid().fits(range)
                && assignment.getRoom().getAvailability().permits(range)
                && assignment.getFaculty().getAvailability().permits(range);
    }

    void occupy(Assignment a) {
        schedule.put(a);
        occupancy.occupyRoom(a.getRoom().getId(), a.getRange(), a.getId());
        occupancy.occupyFaculty(a.getFaculty().getId(), a.getRange(), a.getId());
        occupancy.occupyGroup(a.getSession().getSectionId(), a.getRange(), a.getId());
    }

    void release(Assignment a) {
        schedule.remove(a.getId());
        occupancy.releaseRoom(a.getRoom().getId(), a.getRange(), a.getId());
        occupancy.releaseFaculty(a.getFaculty().getId(), a.getRange(), a.getId());
        occupancy.releaseGroup(a.getSession().getSectionId(), a.getRange(), a.getId());
    }

    public List<TimetableCandidate> staticDomain(String sessionId) {
        return Collections.unmodifiableList(domains.get(sessionId));
    }

    public Session session(String sessionId) {
        return order.get(positions.get(sessionId));
    }

    public List<Session> getOrder() {
        return order;
    }

    public TimetableProblem getProblem() {
        return problem;
    }

    /** The live schedule; callers that keep it must {@link Schedule#copy() copy} it. */
    public Schedule getSchedule() {
        return schedule;
    }
}
