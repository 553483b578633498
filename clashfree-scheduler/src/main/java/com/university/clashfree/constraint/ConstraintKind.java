package com.university.clashfree.constraint;

public enum ConstraintKind {
    ROOM_CAPACITY,
    ROOM_CAPABILITY,
    ROOM_DOUBLE_BOOKING,
    FACULTY_DOUBLE_BOOKING,
    FACULTY_OVERLOAD,
    FACULTY_QUALIFICATION,
    STUDENT_CLASH,
    ELECTIVE_CLASH,
    AVAILABILITY,
    STUDENT_DAILY_LIMIT,
    SEATING,
    SEATING_ADJACENCY,
    SELF_INVIGILATION,
    INVIGILATOR_COVERAGE
}
