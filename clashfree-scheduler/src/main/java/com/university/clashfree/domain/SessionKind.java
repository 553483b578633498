package com.university.clashfree.domain;

public enum SessionKind {
    LECTURE,
    TUTORIAL,
    LAB,
    SELF_STUDY
}
