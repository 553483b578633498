package com.university.clashfree.constraint;

import com.university.clashfree.domain.SlotRange;
import com.university.clashfree.domain.TimeGrid;

import java.util.HashMap;
import java.util.Map;

/**
 * Slot holders per resource for one partial schedule. Not thread-safe.
 */
public final class Occupancy {

    private final TimeGrid grid;
    private final Map<String, String[]> rooms;
    private final Map<String, String[]> faculty;
    private final Map<String, String[]> groups;
    private final Map<String, Integer> load;

    public Occupancy(TimeGrid grid) {
        this.grid = grid;
        this.rooms = new HashMap<>();
        this.faculty = new HashMap<>();
        this.groups = new HashMap<>();
        this.load = new HashMap<>();
    }

    public TimeGrid getGrid() {
        return grid;
    }

    // ---- rooms ----

    /** First occupant of the room over the range, or null when it is free. */
    public String roomOccupant(String roomId, SlotRange range) {
        return firstOccupant(rooms, roomId, range);
    }

    public void occupyRoom(String roomId, SlotRange range, String occupant) {
        fill(rooms, roomId, range, occupant);
    }

    public void releaseRoom(String roomId, SlotRange range, String occupant) {
        clear(rooms, roomId, range, occupant);
    }

    // ---- faculty ----

    public String facultyOccupant(String facultyId, SlotRange range) {
        return firstOccupant(faculty, facultyId, range);
    }

    public void occupyFaculty(String facultyId, SlotRange range, String occupant) {
        fill(faculty, facultyId, range, occupant);
        load.merge(facultyId, range.getLength(), Integer::sum);
    }

    public void releaseFaculty(String facultyId, SlotRange range, String occupant) {
        clear(faculty, facultyId, range, occupant);
        load.merge(facultyId, -range.getLength(), Integer::sum);
    }

    public int facultyLoad(String facultyId) {
        return load.getOrDefault(facultyId, 0);
    }

    // ---- clash groups ----

    public String groupOccupant(String groupId, SlotRange range) {
        return firstOccupant(groups, groupId, range);
    }

    public void occupyGroup(String groupId, SlotRange range, String occupant) {
        fill(groups, groupId, range, occupant);
    }

    public void releaseGroup(String groupId, SlotRange range, String occupant) {
        clear(groups, groupId, range, occupant);
    }

    // ---- internals ----

    private String firstOccupant(Map<String, String[]> table, String id, SlotRange range) {
        String[] slots = table.get(id);
        if (slots == null) {
            return null;
        }
        for (int p = range.getStart(); p < range.getEnd(); p++) {
            String occupant = slots[grid.indexOf(range.getDay(), p)];
            if (occupant != null) {
                return occupant;
            }
        }
        return null;
    }

    private void fill(Map<String, String[]> table, String id, SlotRange range, String occupant) {
        String[] slots = table.computeIfAbsent(id, k -> new String[grid.getSlotCount()]);
        for (int p = range.getStart(); p < range.getEnd(); p++) {
            slots[grid.indexOf(range.getDay(), p)] = occupant;
        }
    }

    private void clear(Map<String, String[]> table, String id, SlotRange range, String occupant) {
        String[] slots = table.get(id);
        if (slots == null) {
            return;
        }
        for (int p = range.getStart(); p < range.getEnd(); p++) {
            int index = grid.indexOf(range.getDay(), p);
            if (occupant.equals(slots[index])) {
                slots[index] = null;
            }
        }
    }
}
