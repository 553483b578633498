package com.university.clashfree.config;

/**
 * Which rule gives way when the only faculty left for an invigilation post
 * teach the course being examined.
 */
public enum InvigilationPolicy {
    /** Instructors never invigilate their own exam; a short pool makes the cycle infeasible. */
    EXCLUSION_FIRST,
    /** Every post is filled; instructors are used only after everyone else. */
    MINIMUM_FIRST
}
