package com.university.clashfree.domain;

public final class Enrollment {

    private final String studentId;
    private final String sectionId;

    public Enrollment(String studentId, String sectionId) {
        if (studentId == null || studentId.isBlank() || sectionId == null || sectionId.isBlank()) {
            throw new ModelException("Enrollment needs both a student id and a section id");
        }
        this.studentId = studentId;
        this.sectionId = sectionId;
    }

    public String getStudentId() {
        return studentId;
    }

    public String getSectionId() {
        return sectionId;
    }

    @Override
    public String toString() {
        return studentId + "->" + sectionId;
    }
}
