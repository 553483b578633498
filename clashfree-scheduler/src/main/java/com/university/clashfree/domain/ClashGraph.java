package com.university.clashfree.domain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Undirected graph of activities (sections or exams) that must never overlap in
 * time. Built once per planning cycle from enrollments and elective baskets;
 * nodes are plain ids so the activities themselves hold no references to each
 * other.
 */
public final class ClashGraph {

    private final Map<String, Map<String, Set<ClashReason>>> adjacency;

    private ClashGraph(Map<String, Map<String, Set<ClashReason>>> adjacency) {
        this.adjacency = adjacency;
    }

    /**
     * @param nodes            every activity id, including those without edges
     * @param nodesByStudent   student id to the activities they attend
     * @param groupByNode      activity id to its exclusion group; may be empty
     */
    public static ClashGraph build(Collection<String> nodes,
            Map<String, ? extends Collection<String>> nodesByStudent,
            Map<String, String> groupByNode) {
        Map<String, Map<String, Set<ClashReason>>> adjacency = new TreeMap<>();
        for (String node : nodes) {
            adjacency.put(node, new TreeMap<>());
        }
        for (Collection<String> attended : nodesByStudent.values()) {
            List<String> list = List.copyOf(attended);
            for (int i = 0; i < list.size(); i++) {
                for (int j = i + 1; j < list.size(); j++) {
                    link(adjacency, list.get(i), list.get(j), ClashReason.SHARED_STUDENT);
                }
            }
        }
        Map<String, List<String>> byGroup = new TreeMap<>();
        groupByNode.forEach((node, group) -> {
            if (group != null) {
                byGroup.computeIfAbsent(group, g -> new ArrayList<>()).add(node);
            }
        });
        for (List<String> members : byGroup.values()) {
            Collections.sort(members);
            for (int i = 0; i < members.size(); i++) {
                for (int j = i + 1; j < members.size(); j++) {
                    link(adjacency, members.get(i), members.get(j), ClashReason.ELECTIVE_GROUP);
                }
            }
        }
        Map<String, Map<String, Set<ClashReason>>> frozen = new TreeMap<>();
        adjacency.forEach((node, edges) -> {
            Map<String, Set<ClashReason>> copy = new TreeMap<>();
            edges.forEach((other, reasons) -> copy.put(other, Collections.unmodifiableSet(reasons)));
            frozen.put(node, Collections.unmodifiableMap(copy));
        });
        return new ClashGraph(Collections.unmodifiableMap(frozen));
    }

    private static void link(Map<String, Map<String, Set<ClashReason>>> adjacency,
            String a, String b, ClashReason reason) {
        if (a.equals(b)) {
            return;
        }
        adjacency.computeIfAbsent(a, k -> new TreeMap<>())
                .computeIfAbsent(b, k -> EnumSet.noneOf(ClashReason.class)).add(reason);
        adjacency.computeIfAbsent(b, k -> new TreeMap<>())
                .computeIfAbsent(a, k -> EnumSet.noneOf(ClashReason.class)).add(reason);
    }

    /** Neighbours of {@code node} in id order; empty for unknown nodes. */
    public Set<String> neighbors(String node) {
        Map<String, Set<ClashReason>> edges = adjacency.get(node);
        return edges == null ? Collections.emptySet() : edges.keySet();
    }

    public boolean adjacent(String a, String b) {
        return !reasons(a, b).isEmpty();
    }

    public Set<ClashReason> reasons(String a, String b) {
        Map<String, Set<ClashReason>> edges = adjacency.get(a);
        if (edges == null) {
            return Collections.emptySet();
        }
        Set<ClashReason> reasons = edges.get(b);
        return reasons == null ? Collections.emptySet() : reasons;
    }

    public int degree(String node) {
        return neighbors(node).size();
    }

    public Set<String> nodes() {
        return adjacency.keySet();
    }
}
