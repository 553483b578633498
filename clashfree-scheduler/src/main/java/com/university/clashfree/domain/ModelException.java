package com.university.clashfree.domain;

import java.util.List;

/**
 * Raised when the input snapshot is malformed or inconsistent (dangling ids,
 * duplicate ids, impossible values). Always raised before any solving starts.
 */
public class ModelException extends RuntimeException {

    private final List<String> problems;

    public ModelException(String message) {
        this(List.of(message));
    }

    public ModelException(List<String> problems) {
        super(problems.size() == 1 ? problems.get(0)
                : problems.size() + " model problems: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
