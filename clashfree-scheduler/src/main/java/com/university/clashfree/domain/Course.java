package com.university.clashfree.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

public final class Course {

    private final String id;
    private final String name;
    private final Set<String> instructorIds;

    public Course(String id, String name) {
        this(id, name, Collections.emptySet());
    }

    public Course(String id, String name, Collection<String> instructorIds) {
        if (id == null || id.isBlank()) {
            throw new ModelException("Course id is required");
        }
        this.id = id;
        this.name = name == null || name.isBlank() ? id : name;
        this.instructorIds = Collections.unmodifiableSet(
                new TreeSet<>(instructorIds == null ? Collections.emptySet() : instructorIds));
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Set<String> getInstructorIds() {
        return instructorIds;
    }

    @Override
    public String toString() {
        return id;
    }
}
