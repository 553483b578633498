package com.university.clashfree;

import com.university.clashfree.config.SoftWeights;
import com.university.clashfree.config.SolverConfig;
import com.university.clashfree.domain.Availability;
import com.university.clashfree.domain.Course;
import com.university.clashfree.domain.Exam;
import com.university.clashfree.domain.ExamProblem;
import com.university.clashfree.domain.Faculty;
import com.university.clashfree.domain.Room;
import com.university.clashfree.domain.Section;
import com.university.clashfree.domain.SessionKind;
import com.university.clashfree.domain.TimeGrid;
import com.university.clashfree.domain.TimetableProblem;
import com.university.clashfree.model.PlanningRequest;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Small problems shared by the tests.
 */
public final class TestProblems {

    public static final List<String> WEEK = List.of("Mon", "Tue", "Wed", "Thu", "Fri");

    private TestProblems() {
    }

    public static TimeGrid grid(int days, int periods) {
        return new TimeGrid(WEEK.subList(0, days), periods);
    }

    public static Faculty teacher(String id, int maxLoad, String... courses) {
        return new Faculty(id, id, maxLoad, Availability.always(), List.of(courses), Set.of(), true);
    }

    /** Quick deterministic config; the refinement still runs. */
    public static SolverConfig fastConfig() {
        return SolverConfig.builder()
                .moveBudget(200)
                .timeBudget(Duration.ofSeconds(20))
                .build();
    }

    /** Two sections of one course taught by the only teacher in a one-day, two-period week. */
    public static TimetableProblem twoSectionsOneTeacher() {
        return TimetableProblem.builder(grid(1, 2))
                .room(new Room("R1", 30))
                .faculty(teacher("F1", 10, "C1"))
                .course(new Course("C1", "Calculus"))
                .section(Section.builder("S1", "C1").enrolled(20).build())
                .section(Section.builder("S2", "C1").enrolled(20).build())
                .build();
    }

    /**
     * Sections A and B can only use their own room and share the only teacher,
     * in a week of one period: a faculty clash nothing can resolve.
     */
    public static TimetableProblem sharedTeacherOneSlot() {
        return TimetableProblem.builder(grid(1, 1))
                .room(new Room("R1", 30, List.of("lab"), Availability.always()))
                .room(new Room("R2", 30, List.of("hall"), Availability.always()))
                .faculty(teacher("F1", 10, "C1"))
                .course(new Course("C1", "Chemistry"))
                .section(Section.builder("A", "C1").enrolled(10).requiredTags("lab").build())
                .section(Section.builder("B", "C1").enrolled(10).requiredTags("hall").build())
                .build();
    }

    /**
     * Three days of five periods with period 2 as a break: lectures meeting
     * twice, a two-period lab, an elective pair and twenty students shared
     * across courses.
     */
    public static TimetableProblem smallWeek() {
        TimetableProblem.Builder builder = TimetableProblem.builder(new TimeGrid(WEEK.subList(0, 3), 5, List.of(2)))
                .room(new Room("HALL", 60))
                .room(new Room("R101", 30))
                .room(new Room("LAB1", 25, List.of("lab"), Availability.always()))
                .faculty(new Faculty("ADA", "Ada", 8, Availability.always(), List.of("MATH", "CS"),
                        List.of("Mon", "Tue"), true))
                .faculty(new Faculty("BOB", "Bob", 8, Availability.always(), List.of("PHYS", "CS"),
                        List.of(), true))
                .faculty(new Faculty("CAM", "Cam", 6, Availability.always(), List.of("ART", "MUS", "MATH"),
                        List.of(), true))
                .course(new Course("MATH", "Mathematics", List.of("ADA")))
                .course(new Course("PHYS", "Physics", List.of("BOB")))
                .course(new Course("CS", "Computing"))
                .course(new Course("ART", "Art"))
                .course(new Course("MUS", "Music"))
                .section(Section.builder("MATH-L", "MATH").enrolled(50).meetingsPerWeek(2).build())
                .section(Section.builder("PHYS-L", "PHYS").enrolled(50).meetingsPerWeek(2).build())
                .section(Section.builder("CS-LAB", "CS").kind(SessionKind.LAB).duration(2)
                        .requiredTags("lab").enrolled(20).build())
                .section(Section.builder("ART-E", "ART").enrolled(25).exclusionGroup("elective").build())
                .section(Section.builder("MUS-E", "MUS").enrolled(25).exclusionGroup("elective").build());
        for (int i = 1; i <= 20; i++) {
            String student = String.format("st%02d", i);
            builder.enroll(student, "MATH-L").enroll(student, "PHYS-L").enroll(student, "CS-LAB");
            builder.enroll(student, i % 2 == 0 ? "ART-E" : "MUS-E");
        }
        return builder.build();
    }

    /** One exam whose only possible invigilator teaches the course. */
    public static ExamProblem examWatchedOnlyByItsInstructor() {
        return ExamProblem.builder(grid(1, 2))
                .room(new Room("R1", 40))
                .faculty(teacher("F1", 10))
                .exam(Exam.builder("E1", "C1").students("s1", "s2", "s3").build())
                .instructor("C1", "F1")
                .build();
    }

    /** Two exams sharing a student, two rooms, three invigilators over two days. */
    public static ExamProblem twoClashingExams() {
        return ExamProblem.builder(grid(2, 2))
                .room(new Room("R1", 10))
                .room(new Room("R2", 6))
                .faculty(teacher("F1", 4))
                .faculty(teacher("F2", 4))
                .faculty(teacher("F3", 4))
                .exam(Exam.builder("E1", "C1").students("s1", "s2", "s3", "s4").build())
                .exam(Exam.builder("E2", "C2").students("s4", "s5", "s6").build())
                .instructor("C1", "F1")
                .build();
    }

    public static SolverConfig noSoftCost() {
        return fastConfig().toBuilder().weights(SoftWeights.none()).build();
    }

    /**
     * Two teaching days of three periods, a lecture meeting twice and a lab,
     * and an exam round on an extra Wednesday. EX1 takes its students from
     * the enrollments of C1.
     */
    public static PlanningRequest request() {
        PlanningRequest request = new PlanningRequest();
        request.setGrid(new PlanningRequest.Grid(List.of("Mon", "Tue"), 3, List.of()));

        PlanningRequest.RoomSpec hall = new PlanningRequest.RoomSpec("R1", 30, List.of());
        hall.setUnavailable(List.of(new PlanningRequest.Slot("Mon", 0)));
        PlanningRequest.RoomSpec lab = new PlanningRequest.RoomSpec("LAB", 20, List.of("lab"));
        request.setRooms(List.of(hall, lab));

        PlanningRequest.FacultySpec lecturer = new PlanningRequest.FacultySpec("F1", 6, List.of("C1", "C2"));
        lecturer.setUnavailable(List.of(new PlanningRequest.Slot("Tue", 2)));
        request.setFaculty(List.of(lecturer,
                new PlanningRequest.FacultySpec("F2", 4, List.of()),
                new PlanningRequest.FacultySpec("F3", 4, List.of())));

        request.setCourses(List.of(new PlanningRequest.CourseSpec("C1", "Algebra"),
                new PlanningRequest.CourseSpec("C2", "Chemistry")));
        PlanningRequest.SectionSpec lecture = new PlanningRequest.SectionSpec("S1", "C1", 20);
        lecture.setMeetingsPerWeek(2);
        PlanningRequest.SectionSpec practical = new PlanningRequest.SectionSpec("L1", "C2", 10);
        practical.setKind(SessionKind.LAB);
        practical.setRequiredTags(List.of("lab"));
        request.setSections(List.of(lecture, practical));
        request.setEnrollments(List.of(
                new PlanningRequest.EnrollmentSpec("s1", "S1"),
                new PlanningRequest.EnrollmentSpec("s2", "S1"),
                new PlanningRequest.EnrollmentSpec("s2", "L1"),
                new PlanningRequest.EnrollmentSpec("s3", "L1")));

        PlanningRequest.ExamRound round = new PlanningRequest.ExamRound();
        round.setGrid(new PlanningRequest.Grid(List.of("Wed"), 2, List.of()));
        round.setExamOnlyDays(List.of("Wed"));
        PlanningRequest.ExamSpec chemistry = new PlanningRequest.ExamSpec("EX2", "C2", 1);
        chemistry.setStudentIds(List.of("s3"));
        round.setExams(List.of(new PlanningRequest.ExamSpec("EX1", "C1", 1), chemistry));
        request.setExams(round);
        return request;
    }
}
