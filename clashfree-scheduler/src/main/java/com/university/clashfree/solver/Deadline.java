package com.university.clashfree.solver;

import java.time.Duration;

/**
 * Cooperative time limit, polled by the searches between steps.
 */
public final class Deadline {

    private final long expiresAtNanos;
    private final Duration budget;

    private Deadline(long expiresAtNanos, Duration budget) {
        this.expiresAtNanos = expiresAtNanos;
        this.budget = budget;
    }

    public static Deadline after(Duration budget) {
        return new Deadline(System.nanoTime() + budget.toNanos(), budget);
    }

    public boolean isExpired() {
        return System.nanoTime() - expiresAtNanos >= 0;
    }

    public Duration remaining() {
        long left = expiresAtNanos - System.nanoTime();
        return left > 0 ? Duration.ofNanos(left) : Duration.ZERO;
    }

    public Duration getBudget() {
        return budget;
    }
}
