package com.university.clashfree.domain;

public enum ClashReason {
    /** At least one student attends both. */
    SHARED_STUDENT,
    /** Electives of the same basket; a student may pick either. */
    ELECTIVE_GROUP
}
