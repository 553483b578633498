package com.university.clashfree.solver;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

final class DecisionPoint<C> {

    final int index;
    final List<C> candidates;
    int cursor;
    C chosen;
    final Set<Integer> conflicts = new TreeSet<>();
    final Set<Integer> involved = new TreeSet<>();

    DecisionPoint(int index, List<C> candidates) {
        this.index = index;
        this.candidates = candidates;
    }

    boolean hasNext() {
        return cursor < candidates.size();
    }

    C next() {
        return candidates.get(cursor++);
    }
}
