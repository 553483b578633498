package com.university.clashfree.domain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Students who attend exactly the same activities.
 */
public final class Cohort {

    private final Set<String> activityIds;
    private final int size;

    public Cohort(Set<String> activityIds, int size) {
        this.activityIds = Collections.unmodifiableSet(new TreeSet<>(activityIds));
        this.size = size;
    }

    public static List<Cohort> group(Map<String, ? extends Collection<String>> activitiesByStudent) {
        Map<String, Set<String>> byKey = new TreeMap<>();
        Map<String, Integer> counts = new TreeMap<>();
        for (Collection<String> activities : activitiesByStudent.values()) {
            if (activities.isEmpty()) {
                continue;
            }
            Set<String> sorted = new TreeSet<>(activities);
            String key = String.join("|", sorted);
            byKey.putIfAbsent(key, sorted);
            counts.merge(key, 1, Integer::sum);
        }
        List<Cohort> cohorts = new ArrayList<>(byKey.size());
        byKey.forEach((key, activities) -> cohorts.add(new Cohort(activities, counts.get(key))));
        return Collections.unmodifiableList(cohorts);
    }

    public Set<String> getActivityIds() {
        return activityIds;
    }

    public int getSize() {
        return size;
    }

    @Override
    public String toString() {
        return size + "x" + activityIds;
    }
}
