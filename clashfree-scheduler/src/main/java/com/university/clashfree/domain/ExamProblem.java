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
 * Input of the exam scheduler. Rooms and faculty are usually the ones of the
 * teaching problem; a committed timetable contributes busy reservations, the
 * instructors of each course and the section every student sits in.
 * <p>
 * The exam grid may differ from the teaching grid. Teaching reservations are
 * carried over by day label and period, except on exam-only days. Room and
 * faculty calendars are read against the exam grid as given.
 */
public final class ExamProblem {

    private final TimeGrid grid;
    private final Map<String, Room> rooms;
    private final Map<String, Faculty> faculty;
    private final Map<String, Exam> exams;
    private final Set<String> examOnlyDays;
    private final Map<String, Set<TimeSlot>> roomReservations;
    private final Map<String, Set<TimeSlot>> facultyReservations;
    private final Map<String, Set<String>> instructorsByCourse;
    private final Map<String, Map<String, String>> sectionByCourseAndStudent;
    private final Map<String, Set<String>> examsByStudent;
    private final ClashGraph clashGraph;
    private final List<Cohort> cohorts;

    private ExamProblem(Builder builder, Map<String, Set<String>> examsByStudent) {
        this.grid = builder.grid;
        this.rooms = Collections.unmodifiableMap(new TreeMap<>(builder.rooms));
        this.faculty = Collections.unmodifiableMap(new TreeMap<>(builder.faculty));
        this.exams = Collections.unmodifiableMap(new TreeMap<>(builder.exams));
        this.examOnlyDays = Collections.unmodifiableSet(new TreeSet<>(builder.examOnlyDays));
        this.roomReservations = freeze(builder.roomReservations);
        this.facultyReservations = freeze(builder.facultyReservations);
        this.instructorsByCourse = freeze(builder.instructorsByCourse);
        Map<String, Map<String, String>> sections = new TreeMap<>();
        builder.sectionByCourseAndStudent.forEach((course, byStudent) ->
                sections.put(course, Collections.unmodifiableMap(new TreeMap<>(byStudent))));
        this.sectionByCourseAndStudent = Collections.unmodifiableMap(sections);
        this.examsByStudent = freeze(examsByStudent);
        this.clashGraph = ClashGraph.build(this.exams.keySet(), examsByStudent, Collections.emptyMap());
        this.cohorts = Cohort.group(examsByStudent);
    }

    private static <T> Map<String, Set<T>> freeze(Map<String, Set<T>> source) {
        Map<String, Set<T>> frozen = new TreeMap<>();
        source.forEach((k, v) -> frozen.put(k, Collections.unmodifiableSet(new TreeSet<>(v))));
        return Collections.unmodifiableMap(frozen);
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

    public Collection<Exam> getExams() {
        return exams.values();
    }

    public Exam getExam(String id) {
        return exams.get(id);
    }

    public Set<String> getExamOnlyDays() {
        return examOnlyDays;
    }

    public Map<String, Set<TimeSlot>> getRoomReservations() {
        return roomReservations;
    }

    public Map<String, Set<TimeSlot>> getFacultyReservations() {
        return facultyReservations;
    }

    public boolean isRoomReserved(String roomId, TimeSlot slot) {
        return roomReservations.getOrDefault(roomId, Collections.emptySet()).contains(slot);
    }

    public boolean isFacultyReserved(String facultyId, TimeSlot slot) {
        return facultyReservations.getOrDefault(facultyId, Collections.emptySet()).contains(slot);
    }

    public Set<String> instructorsOf(String courseId) {
        return instructorsByCourse.getOrDefault(courseId, Collections.emptySet());
    }

    public boolean isInstructor(String facultyId, Exam exam) {
        return instructorsOf(exam.getCourseId()).contains(facultyId);
    }

    /**
     * Section the student attends in the exam's course. Students with no known
     * section form a group of their own.
     */
    public String sectionOf(Exam exam, String studentId) {
        Map<String, String> byStudent = sectionByCourseAndStudent.get(exam.getCourseId());
        String section = byStudent == null ? null : byStudent.get(studentId);
        return section == null ? "student:" + studentId : section;
    }

    public Set<String> examsOf(String studentId) {
        return examsByStudent.getOrDefault(studentId, Collections.emptySet());
    }

    public Map<String, Set<String>> getExamsByStudent() {
        return examsByStudent;
    }

    public ClashGraph getClashGraph() {
        return clashGraph;
    }

    public List<Cohort> getCohorts() {
        return cohorts;
    }

    public static final class Builder {

        private final TimeGrid grid;
        private final Map<String, Room> rooms = new LinkedHashMap<>();
        private final Map<String, Faculty> faculty = new LinkedHashMap<>();
        private final Map<String, Exam> exams = new LinkedHashMap<>();
        private final Set<String> examOnlyDays = new TreeSet<>();
        private final Map<String, Set<TimeSlot>> roomReservations = new TreeMap<>();
        private final Map<String, Set<TimeSlot>> facultyReservations = new TreeMap<>();
        private final Map<String, Set<String>> instructorsByCourse = new TreeMap<>();
        private final Map<String, Map<String, String>> sectionByCourseAndStudent = new TreeMap<>();
        private final List<String> problems = new ArrayList<>();
        private TimetableProblem teaching;
        private Schedule committed;

        private Builder(TimeGrid grid) {
            this.grid = grid;
        }

        /** Takes over every room and faculty member of the teaching problem. */
        public Builder resourcesOf(TimetableProblem problem) {
            problem.getRooms().forEach(this::room);
            problem.getFaculty().forEach(this::faculty);
            return this;
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

        public Builder exam(Exam exam) {
            if (exams.putIfAbsent(exam.getId(), exam) != null) {
                problems.add("Duplicate exam id " + exam.getId());
            }
            return this;
        }

        public Builder examOnlyDay(String dayLabel) {
            examOnlyDays.add(dayLabel);
            return this;
        }

        public Builder examOnlyDays(Collection<String> dayLabels) {
            if (dayLabels != null) {
                examOnlyDays.addAll(dayLabels);
            }
            return this;
        }

        public Builder reserveRoom(String roomId, TimeSlot slot) {
            roomReservations.computeIfAbsent(roomId, k -> new TreeSet<>()).add(slot);
            return this;
        }

        public Builder reserveFaculty(String facultyId, TimeSlot slot) {
            facultyReservations.computeIfAbsent(facultyId, k -> new TreeSet<>()).add(slot);
            return this;
        }

        public Builder instructor(String courseId, String facultyId) {
            instructorsByCourse.computeIfAbsent(courseId, k -> new TreeSet<>()).add(facultyId);
            return this;
        }

        public Builder studentSection(String courseId, String studentId, String sectionId) {
            sectionByCourseAndStudent.computeIfAbsent(courseId, k -> new TreeMap<>()).putIfAbsent(studentId, sectionId);
            return this;
        }

        /**
         * Imposes a committed timetable: its rooms and faculty become busy in
         * the matching exam slots, its teachers become instructors of their
         * courses and its enrollments define the section of each student.
         * Reservations are resolved in {@link #build()}, once every exam-only
         * day is known.
         */
        public Builder committedTimetable(TimetableProblem problem, Schedule schedule) {
            this.teaching = problem;
            this.committed = schedule;
            for (Course course : problem.getCourses()) {
                for (String instructorId : course.getInstructorIds()) {
                    instructor(course.getId(), instructorId);
                }
            }
            for (Assignment assignment : schedule.getAssignments()) {
                instructor(assignment.getSection().getCourseId(), assignment.getFaculty().getId());
            }
            for (Enrollment enrollment : problem.getEnrollments()) {
                Section section = problem.getSection(enrollment.getSectionId());
                studentSection(section.getCourseId(), enrollment.getStudentId(), section.getId());
            }
            return this;
        }

        private void imposeTeaching() {
            TimeGrid teachingGrid = teaching.getGrid();
            for (Assignment assignment : committed.getAssignments()) {
                String label = teachingGrid.dayName(assignment.getRange().getDay());
                int examDay = grid.dayIndex(label);
                if (examDay < 0 || examOnlyDays.contains(label)) {
                    continue;
                }
                for (TimeSlot slot : assignment.getRange().slots()) {
                    if (slot.getPeriod() >= grid.getPeriodsPerDay()) {
                        continue;
                    }
                    TimeSlot examSlot = new TimeSlot(examDay, slot.getPeriod());
                    reserveRoom(assignment.getRoom().getId(), examSlot);
                    reserveFaculty(assignment.getFaculty().getId(), examSlot);
                }
            }
        }

        public ExamProblem build() {
            if (grid == null) {
                throw new ModelException("An exam grid is required");
            }
            List<String> errors = new ArrayList<>(problems);
            for (String day : examOnlyDays) {
                if (grid.dayIndex(day) < 0) {
                    errors.add("Exam-only day " + day + " is not part of the exam grid");
                }
            }
            for (Exam exam : exams.values()) {
                if (exam.getDuration() > grid.getPeriodsPerDay()) {
                    errors.add("Exam " + exam.getId() + " lasts " + exam.getDuration()
                            + " periods but a day has " + grid.getPeriodsPerDay());
                }
            }
            if (teaching != null) {
                imposeTeaching();
            }
            checkReservations(errors, "room", roomReservations, rooms.keySet());
            checkReservations(errors, "faculty", facultyReservations, faculty.keySet());
            if (!errors.isEmpty()) {
                throw new ModelException(errors);
            }

            Map<String, Set<String>> examsByStudent = new TreeMap<>();
            for (Exam exam : exams.values()) {
                for (String student : exam.getStudentIds()) {
                    examsByStudent.computeIfAbsent(student, k -> new TreeSet<>()).add(exam.getId());
                }
            }
            return new ExamProblem(this, examsByStudent);
        }

        private void checkReservations(List<String> errors, String kind,
                Map<String, Set<TimeSlot>> reservations, Set<String> known) {
            reservations.forEach((id, slots) -> {
                if (!known.contains(id)) {
                    errors.add("Reservation for unknown " + kind + " " + id);
                }
                for (TimeSlot slot : slots) {
                    if (!grid.contains(slot)) {
                        errors.add("Reservation of " + kind + " " + id + " at " + slot + " is outside the exam grid");
                    }
                }
            });
        }
    }
}
