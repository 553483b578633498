package com.university.clashfree.domain;

/**
 * How densely an exam fills a bench of two seats.
 */
public enum SeatingDensity {
    /** Both seats of a bench. */
    FULL,
    /** Seat A only; seat B stays empty. */
    ALTERNATE
}
