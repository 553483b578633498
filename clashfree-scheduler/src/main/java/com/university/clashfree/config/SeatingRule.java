package com.university.clashfree.config;

/**
 * Anti-cheating rule applied when students are seated.
 */
public enum SeatingRule {
    NONE,
    /** Two students on one bench must come from different sections. */
    NO_SAME_SECTION_BENCHMATES
}
