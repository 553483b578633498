package com.university.clashfree.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * A teaching staff member. {@code maxLoad} counts grid slots per week;
 * qualifications are course ids the member may teach when a section does not
 * list its qualified faculty explicitly.
 */
public final class Faculty {

    private final String id;
    private final String name;
    private final int maxLoad;
    private final Availability availability;
    private final Set<String> qualifications;
    private final Set<String> preferredDays;
    private final boolean invigilationEligible;

    public Faculty(String id, int maxLoad) {
        this(id, id, maxLoad, Availability.always(), Collections.emptySet(), Collections.emptySet(), true);
    }

    public Faculty(String id, String name, int maxLoad, Availability availability,
            Collection<String> qualifications, Collection<String> preferredDays, boolean invigilationEligible) {
        if (id == null || id.isBlank()) {
            throw new ModelException("Faculty id is required");
        }
        if (maxLoad < 0) {
            throw new ModelException("Faculty " + id + " has a negative max load");
        }
        this.id = id;
        this.name = name == null || name.isBlank() ? id : name;
        this.maxLoad = maxLoad;
        this.availability = availability == null ? Availability.always() : availability;
        this.qualifications = Collections.unmodifiableSet(
                new TreeSet<>(qualifications == null ? Collections.emptySet() : qualifications));
        this.preferredDays = Collections.unmodifiableSet(
                new TreeSet<>(preferredDays == null ? Collections.emptySet() : preferredDays));
        this.invigilationEligible = invigilationEligible;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public int getMaxLoad() {
        return maxLoad;
    }

    public Availability getAvailability() {
        return availability;
    }

    public Set<String> getQualifications() {
        return qualifications;
    }

    public Set<String> getPreferredDays() {
        return preferredDays;
    }

    public boolean isInvigilationEligible() {
        return invigilationEligible;
    }

    public boolean prefersDay(String dayLabel) {
        return preferredDays.isEmpty() || preferredDays.contains(dayLabel);
    }

    @Override
    public String toString() {
        return id;
    }
}
