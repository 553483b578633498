package com.university.clashfree.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

public final class Room {

    private final String id;
    private final int capacity;
    private final Set<String> tags;
    private final Availability availability;

    public Room(String id, int capacity) {
        this(id, capacity, Collections.emptySet(), Availability.always());
    }

    public Room(String id, int capacity, Collection<String> tags, Availability availability) {
        if (id == null || id.isBlank()) {
            throw new ModelException("Room id is required");
        }
        if (capacity < 1) {
            throw new ModelException("Room " + id + " must have a positive capacity, got " + capacity);
        }
        this.id = id;
        this.capacity = capacity;
        this.tags = Collections.unmodifiableSet(new TreeSet<>(tags == null ? Collections.emptySet() : tags));
        this.availability = availability == null ? Availability.always() : availability;
    }

    public String getId() {
        return id;
    }

    public int getCapacity() {
        return capacity;
    }

    public Set<String> getTags() {
        return tags;
    }

    public Availability getAvailability() {
        return availability;
    }

    public boolean hasTags(Collection<String> required) {
        return tags.containsAll(required);
    }

    @Override
    public String toString() {
        return id + "(" + capacity + ")";
    }
}
