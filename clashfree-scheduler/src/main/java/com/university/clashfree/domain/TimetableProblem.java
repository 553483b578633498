package com.university.clashfree.domain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Fully resolved input of one planning cycle: the grid, rooms, faculty,
 * courses, sections and enrollments, plus the structures derived from them once
 * (sessions, clash graph, student cohorts). Immutable; created through
 * {@link Builder}, which rejects dangling or duplicate ids with a
 * {@link ModelException}.
 */
public final class TimetableProblem {

    private final TimeGrid grid;
    private final Map<String, Room> rooms;
    private final Map<String, Faculty> faculty;
    private final Map<String, Course> courses;
    private final Map<String, Section> sections;
    private final List<Enrollment> enrollments;
    private final List<Session> sessions;
    private final Map<String, Set<String>> studentsBySection;
    private final ClashGraph clashGraph;
    private final List<Cohort> cohorts;

    private TimetableProblem(Builder builder, Map<String, Set<String>> studentsBySection,
            Map<String, Set<String>> sectionsByStudent) {
        this.grid = builder.grid;
        this.rooms = Collections.unmodifiableMap(new TreeMap<>(builder.rooms));
        this.faculty = Collections.unmodifiableMap(new TreeMap<>(builder.faculty));
        this.courses = Collections.unmodifiableMap(new TreeMap<>(builder.courses));
        this.sections = Collections.unmodifiableMap(new TreeMap<>(builder.sections));
        this.enrollments = List.copyOf(builder.enrollments);
        this.studentsBySection = Collections.unmodifiableMap(studentsBySection);

        List<Session> all = new ArrayList<>();
        for (Section section : this.sections.values()) {
            all.addAll(section.sessions());
        }
        Collections.sort(all);
        this.sessions = Collections.unmodifiableList(all);

        Map<String, String> groups = new TreeMap<>();
        for (Section section : this.sections.values()) {
            if (section.getExclusionGroup() != null) {
                groups.put(section.getId(), section.getExclusionGroup());
            }
        }
        this.clashGraph = ClashGraph.build(this.sections.keySet(), sectionsByStudent, groups);
        this.cohorts = Cohort.group(sectionsByStudent);
    }

    public static Builder builder(TimeGrid grid) {
        return new Builder(grid);
    }

    public TimeGrid getGrid() {
        return grid;
    }

    public Collection<Room> getRooms() {
        return rooms.values();
    }

    public Room getRoom(String id) {
        return rooms.get(id);
    }

    public Collection<Faculty> getFaculty() {
        return faculty.values();
    }

    public Faculty getFaculty(String id) {
        return faculty.get(id);
    }

    public Collection<Course> getCourses() {
        return courses.values();
    }

    public Course getCourse(String id) {
        return courses.get(id);
    }

    public Collection<Section> getSections() {
        return sections.values();
    }

    public Section getSection(String id) {
        return sections.get(id);
    }

    public List<Enrollment> getEnrollments() {
        return enrollments;
    }

    public List<Session> getSessions() {
        return sessions;
    }

    public Set<String> studentsOf(String sectionId) {
        return studentsBySection.getOrDefault(sectionId, Collections.emptySet());
    }

    public ClashGraph getClashGraph() {
        return clashGraph;
    }

    public List<Cohort> getCohorts() {
        return cohorts;
    }

    /**
     * A section listing qualified faculty accepts exactly those; otherwise any
     * faculty member qualified for its course.
     */
    public boolean isQualified(Faculty member, Section section) {
        if (!section.getQualifiedFacultyIds().isEmpty()) {
            return section.getQualifiedFacultyIds().contains(member.getId());
        }
        return member.getQualifications().contains(section.getCourseId());
    }

    public List<Faculty> qualifiedFaculty(Section section) {
        List<Faculty> qualified = new ArrayList<>();
        for (Faculty member : faculty.values()) {
            if (isQualified(member, section)) {
                qualified.add(member);
            }
        }
        return qualified;
    }

    public static final class Builder {

        private final TimeGrid grid;
        private final Map<String, Room> rooms = new LinkedHashMap<>();
        private final Map<String, Faculty> faculty = new LinkedHashMap<>();
        private final Map<String, Course> courses = new LinkedHashMap<>();
        private final Map<String, Section> sections = new LinkedHashMap<>();
        private final List<Enrollment> enrollments = new ArrayList<>();
        private final List<String> problems = new ArrayList<>();

        private Builder(TimeGrid grid) {
            this.grid = grid;
        }

        public Builder room(Room room) {
            if (rooms.putIfAbsent(room.getId(), room) != null) {
                problems.add("Duplicate room id " + room.getId());
            }
            return this;
        }

        public Builder faculty(Faculty member) {
            if (faculty.putIfAbsent(member.getId(), member) != null) {
                problems.add("Duplicate faculty id " + member.getId());
            }
            return this;
        }

        public Builder course(Course course) {
            if (courses.putIfAbsent(course.getId(), course) != null) {
                problems.add("Duplicate course id " + course.getId());
            }
            return this;
        }

        public Builder section(Section section) {
            if (sections.putIfAbsent(section.getId(), section) != null) {
                problems.add("Duplicate section id " + section.getId());
            }
            return this;
        }

        public Builder enroll(String studentId, String sectionId) {
            return enrollment(new Enrollment(studentId, sectionId));
        }

        public Builder enrollment(Enrollment enrollment) {
            enrollments.add(enrollment);
            return this;
        }

        public TimetableProblem build() {
            List<String> errors = new ArrayList<>(problems);
            if (grid == null) {
                throw new ModelException("A time grid is required");
            }
            for (Room room : rooms.values()) {
                checkCalendar(errors, "room " + room.getId(), room.getAvailability());
            }
            for (Faculty member : faculty.values()) {
                checkCalendar(errors, "faculty " + member.getId(), member.getAvailability());
                for (String course : member.getQualifications()) {
                    if (!courses.containsKey(course)) {
                        errors.add("Faculty " + member.getId() + " is qualified for unknown course " + course);
                    }
                }
                for (String day : member.getPreferredDays()) {
                    if (grid.dayIndex(day) < 0) {
                        errors.add("Faculty " + member.getId() + " prefers unknown day " + day);
                    }
                }
            }
            for (Course course : courses.values()) {
                for (String instructor : course.getInstructorIds()) {
                    if (!faculty.containsKey(instructor)) {
                        errors.add("Course " + course.getId() + " names unknown instructor " + instructor);
                    }
                }
            }
            for (Section section : sections.values()) {
                if (!courses.containsKey(section.getCourseId())) {
                    errors.add("Section " + section.getId() + " belongs to unknown course " + section.getCourseId());
                }
                for (String facultyId : section.getQualifiedFacultyIds()) {
                    if (!faculty.containsKey(facultyId)) {
                        errors.add("Section " + section.getId() + " lists unknown faculty " + facultyId);
                    }
                }
                if (section.getDuration() > grid.getPeriodsPerDay()) {
                    errors.add("Section " + section.getId() + " lasts " + section.getDuration()
                            + " periods but a day has " + grid.getPeriodsPerDay());
                }
            }

            Map<String, Set<String>> studentsBySection = new TreeMap<>();
            Map<String, Set<String>> sectionsByStudent = new TreeMap<>();
            for (Enrollment enrollment : enrollments) {
                if (!sections.containsKey(enrollment.getSectionId())) {
                    errors.add("Student " + enrollment.getStudentId() + " is enrolled in unknown section "
                            + enrollment.getSectionId());
                    continue;
                }
                studentsBySection.computeIfAbsent(enrollment.getSectionId(), k -> new TreeSet<>())
                        .add(enrollment.getStudentId());
                sectionsByStudent.computeIfAbsent(enrollment.getStudentId(), k -> new TreeSet<>())
                        .add(enrollment.getSectionId());
            }
            studentsBySection.forEach((sectionId, students) -> {
                Section section = sections.get(sectionId);
                if (students.size() > section.getEnrolledCount()) {
                    errors.add("Section " + sectionId + " declares " + section.getEnrolledCount()
                            + " students but " + students.size() + " are enrolled");
                }
            });

            if (!errors.isEmpty()) {
                throw new ModelException(errors);
            }
            Map<String, Set<String>> frozenStudents = new TreeMap<>();
            studentsBySection.forEach((k, v) -> frozenStudents.put(k, Collections.unmodifiableSet(v)));
            return new TimetableProblem(this, frozenStudents, sectionsByStudent);
        }

        private void checkCalendar(List<String> errors, String owner, Availability availability) {
            for (TimeSlot slot : availability.getReferencedSlots()) {
                if (!grid.contains(slot)) {
                    errors.add("Availability of " + owner + " names slot " + slot + " outside the grid");
                }
            }
        }
    }
}
