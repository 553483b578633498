package com.university.clashfree.model;

import com.university.clashfree.config.InvigilationPolicy;
import com.university.clashfree.config.SeatingRule;
import com.university.clashfree.domain.SeatingDensity;
import com.university.clashfree.domain.SessionKind;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON body of a planning run: the teaching grid and its resources, the
 * sections to place, enrollments, an optional exam round and solver overrides.
 * Slots are given by day label and zero-based period.
 */
public class PlanningRequest {

    private Grid grid;
    private List<RoomSpec> rooms = new ArrayList<>();
    private List<FacultySpec> faculty = new ArrayList<>();
    private List<CourseSpec> courses = new ArrayList<>();
    private List<SectionSpec> sections = new ArrayList<>();
    private List<EnrollmentSpec> enrollments = new ArrayList<>();
    private ExamRound exams;
    private Settings settings;

    public PlanningRequest() {
    }

    public Grid getGrid() {
        return grid;
    }

    public void setGrid(Grid grid) {
        this.grid = grid;
    }

    public List<RoomSpec> getRooms() {
        return rooms;
    }

    public void setRooms(List<RoomSpec> rooms) {
        this.rooms = rooms;
    }

    public List<FacultySpec> getFaculty() {
        return faculty;
    }

    public void setFaculty(List<FacultySpec> faculty) {
        this.faculty = faculty;
    }

    public List<CourseSpec> getCourses() {
        return courses;
    }

    public void setCourses(List<CourseSpec> courses) {
        this.courses = courses;
    }

    public List<SectionSpec> getSections() {
        return sections;
    }

    public void setSections(List<SectionSpec> sections) {
        this.sections = sections;
    }

    public List<EnrollmentSpec> getEnrollments() {
        return enrollments;
    }

    public void setEnrollments(List<EnrollmentSpec> enrollments) {
        this.enrollments = enrollments;
    }

    public ExamRound getExams() {
        return exams;
    }

    public void setExams(ExamRound exams) {
        this.exams = exams;
    }

    public Settings getSettings() {
        return settings;
    }

    public void setSettings(Settings settings) {
        this.settings = settings;
    }

    public static class Grid {
        private List<String> days = new ArrayList<>();
        private int periodsPerDay;
        private List<Integer> breakPeriods = new ArrayList<>();

        public Grid() {
        }

        public Grid(List<String> days, int periodsPerDay, List<Integer> breakPeriods) {
            this.days = days;
            this.periodsPerDay = periodsPerDay;
            this.breakPeriods = breakPeriods;
        }

        public List<String> getDays() {
            return days;
        }

        public void setDays(List<String> days) {
            this.days = days;
        }

        public int getPeriodsPerDay() {
            return periodsPerDay;
        }

        public void setPeriodsPerDay(int periodsPerDay) {
            this.periodsPerDay = periodsPerDay;
        }

        public List<Integer> getBreakPeriods() {
            return breakPeriods;
        }

        public void setBreakPeriods(List<Integer> breakPeriods) {
            this.breakPeriods = breakPeriods;
        }
    }

    public static class Slot {
        private String day;
        private int period;

        public Slot() {
        }

        public Slot(String day, int period) {
            this.day = day;
            this.period = period;
        }

        public String getDay() {
            return day;
        }

        public void setDay(String day) {
            this.day = day;
        }

        public int getPeriod() {
            return period;
        }

        public void setPeriod(int period) {
            this.period = period;
        }
    }

    public static class RoomSpec {
        private String id;
        private int capacity;
        private List<String> tags = new ArrayList<>();
        private List<Slot> unavailable = new ArrayList<>();

        public RoomSpec() {
        }

        public RoomSpec(String id, int capacity, List<String> tags) {
            this.id = id;
            this.capacity = capacity;
            this.tags = tags;
        }

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public int getCapacity() {
            return capacity;
        }

        public void setCapacity(int capacity) {
            this.capacity = capacity;
        }

        public List<String> getTags() {
            return tags;
        }

        public void setTags(List<String> tags) {
            this.tags = tags;
        }

        public List<Slot> getUnavailable() {
            return unavailable;
        }

        public void setUnavailable(List<Slot> unavailable) {
            this.unavailable = unavailable;
        }
    }

    public static class FacultySpec {
        private String id;
        private String name;
        private int maxLoad;
        private List<String> qualifications = new ArrayList<>();
        private List<String> preferredDays = new ArrayList<>();
        private List<Slot> unavailable = new ArrayList<>();
        private boolean invigilationEligible = true;

        public FacultySpec() {
        }

        public FacultySpec(String id, int maxLoad, List<String> qualifications) {
            this.id = id;
            this.maxLoad = maxLoad;
            this.qualifications = qualifications;
        }

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public int getMaxLoad() {
            return maxLoad;
        }

        public void setMaxLoad(int maxLoad) {
            this.maxLoad = maxLoad;
        }

        public List<String> getQualifications() {
            return qualifications;
        }

        public void setQualifications(List<String> qualifications) {
            this.qualifications = qualifications;
        }

        public List<String> getPreferredDays() {
            return preferredDays;
        }

        public void setPreferredDays(List<String> preferredDays) {
            this.preferredDays = preferredDays;
        }

        public List<Slot> getUnavailable() {
            return unavailable;
        }

        public void setUnavailable(List<Slot> unavailable) {
            this.unavailable = unavailable;
        }

        public boolean isInvigilationEligible() {
            return invigilationEligible;
        }

        public void setInvigilationEligible(boolean invigilationEligible) {
            this.invigilationEligible = invigilationEligible;
        }
    }

    public static class CourseSpec {
        private String id;
        private String name;
        private List<String> instructorIds = new ArrayList<>();

        public CourseSpec() {
        }

        public CourseSpec(String id, String name) {
            this.id = id;
            this.name = name;
        }

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public List<String> getInstructorIds() {
            return instructorIds;
        }

        public void setInstructorIds(List<String> instructorIds) {
            this.instructorIds = instructorIds;
        }
    }

    public static class SectionSpec {
        private String id;
        private String courseId;
        private SessionKind kind = SessionKind.LECTURE;
        private int duration = 1;
        private int meetingsPerWeek = 1;
        private List<String> requiredTags = new ArrayList<>();
        private int enrolledCount;
        private List<String> qualifiedFacultyIds = new ArrayList<>();
        private String exclusionGroup;

        public SectionSpec() {
        }

        public SectionSpec(String id, String courseId, int enrolledCount) {
            this.id = id;
            this.courseId = courseId;
            this.enrolledCount = enrolledCount;
        }

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getCourseId() {
            return courseId;
        }

        public void setCourseId(String courseId) {
            this.courseId = courseId;
        }

        public SessionKind getKind() {
            return kind;
        }

        public void setKind(SessionKind kind) {
            this.kind = kind;
        }

        public int getDuration() {
            return duration;
        }

        public void setDuration(int duration) {
            this.duration = duration;
        }

        public int getMeetingsPerWeek() {
            return meetingsPerWeek;
        }

        public void setMeetingsPerWeek(int meetingsPerWeek) {
            this.meetingsPerWeek = meetingsPerWeek;
        }

        public List<String> getRequiredTags() {
            return requiredTags;
        }

        public void setRequiredTags(List<String> requiredTags) {
            this.requiredTags = requiredTags;
        }

        public int getEnrolledCount() {
            return enrolledCount;
        }

        public void setEnrolledCount(int enrolledCount) {
            this.enrolledCount = enrolledCount;
        }

        public List<String> getQualifiedFacultyIds() {
            return qualifiedFacultyIds;
        }

        public void setQualifiedFacultyIds(List<String> qualifiedFacultyIds) {
            this.qualifiedFacultyIds = qualifiedFacultyIds;
        }

        public String getExclusionGroup() {
            return exclusionGroup;
        }

        public void setExclusionGroup(String exclusionGroup) {
            this.exclusionGroup = exclusionGroup;
        }
    }

    public static class EnrollmentSpec {
        private String studentId;
        private String sectionId;

        public EnrollmentSpec() {
        }

        public EnrollmentSpec(String studentId, String sectionId) {
            this.studentId = studentId;
            this.sectionId = sectionId;
        }

        public String getStudentId() {
            return studentId;
        }

        public void setStudentId(String studentId) {
            this.studentId = studentId;
        }

        public String getSectionId() {
            return sectionId;
        }

        public void setSectionId(String sectionId) {
            this.sectionId = sectionId;
        }
    }

    public static class ExamRound {
        private Grid grid;
        private List<String> examOnlyDays = new ArrayList<>();
        private List<ExamSpec> exams = new ArrayList<>();

        public Grid getGrid() {
            return grid;
        }

        public void setGrid(Grid grid) {
            this.grid = grid;
        }

        public List<String> getExamOnlyDays() {
            return examOnlyDays;
        }

        public void setExamOnlyDays(List<String> examOnlyDays) {
            this.examOnlyDays = examOnlyDays;
        }

        public List<ExamSpec> getExams() {
            return exams;
        }

        public void setExams(List<ExamSpec> exams) {
            this.exams = exams;
        }
    }

    public static class ExamSpec {
        private String id;
        private String courseId;
        private int duration = 1;
        /** Empty means every student enrolled in a section of the course. */
        private List<String> studentIds = new ArrayList<>();
        private SeatingDensity density = SeatingDensity.FULL;
        private List<String> requiredTags = new ArrayList<>();

        public ExamSpec() {
        }

        public ExamSpec(String id, String courseId, int duration) {
            this.id = id;
            this.courseId = courseId;
            this.duration = duration;
        }

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getCourseId() {
            return courseId;
        }

        public void setCourseId(String courseId) {
            this.courseId = courseId;
        }

        public int getDuration() {
            return duration;
        }

        public void setDuration(int duration) {
            this.duration = duration;
        }

        public List<String> getStudentIds() {
            return studentIds;
        }

        public void setStudentIds(List<String> studentIds) {
            this.studentIds = studentIds;
        }

        public SeatingDensity getDensity() {
            return density;
        }

        public void setDensity(SeatingDensity density) {
            this.density = density;
        }

        public List<String> getRequiredTags() {
            return requiredTags;
        }

        public void setRequiredTags(List<String> requiredTags) {
            this.requiredTags = requiredTags;
        }
    }

    /** Per-request overrides of the configured solver defaults; null keeps the default. */
    public static class Settings {
        private Long seed;
        private Integer timeBudgetSeconds;
        private Integer moveBudget;
        private Map<String, Double> weights = new LinkedHashMap<>();
        private SeatingRule seatingRule;
        private InvigilationPolicy invigilationPolicy;
        private Boolean allowInstructorInvigilation;
        private Integer minInvigilatorsPerRoom;
        private Integer studentsPerInvigilator;
        private Integer maxExamsPerStudentPerDay;

        public Long getSeed() {
            return seed;
        }

        public void setSeed(Long seed) {
            this.seed = seed;
        }

        public Integer getTimeBudgetSeconds() {
            return timeBudgetSeconds;
        }

        public void setTimeBudgetSeconds(Integer timeBudgetSeconds) {
            this.timeBudgetSeconds = timeBudgetSeconds;
        }

        public Integer getMoveBudget() {
            return moveBudget;
        }

        public void setMoveBudget(Integer moveBudget) {
            this.moveBudget = moveBudget;
        }

        public Map<String, Double> getWeights() {
            return weights;
        }

        public void setWeights(Map<String, Double> weights) {
            this.weights = weights;
        }

        public SeatingRule getSeatingRule() {
            return seatingRule;
        }

        public void setSeatingRule(SeatingRule seatingRule) {
            this.seatingRule = seatingRule;
        }

        public InvigilationPolicy getInvigilationPolicy() {
            return invigilationPolicy;
        }

        public void setInvigilationPolicy(InvigilationPolicy invigilationPolicy) {
            this.invigilationPolicy = invigilationPolicy;
        }

        public Boolean getAllowInstructorInvigilation() {
            return allowInstructorInvigilation;
        }

        public void setAllowInstructorInvigilation(Boolean allowInstructorInvigilation) {
            this.allowInstructorInvigilation = allowInstructorInvigilation;
        }

        public Integer getMinInvigilatorsPerRoom() {
            return minInvigilatorsPerRoom;
        }

        public void setMinInvigilatorsPerRoom(Integer minInvigilatorsPerRoom) {
            this.minInvigilatorsPerRoom = minInvigilatorsPerRoom;
        }

        public Integer getStudentsPerInvigilator() {
            return studentsPerInvigilator;
        }

        public void setStudentsPerInvigilator(Integer studentsPerInvigilator) {
            this.studentsPerInvigilator = studentsPerInvigilator;
        }

        public Integer getMaxExamsPerStudentPerDay() {
            return maxExamsPerStudentPerDay;
        }

        public void setMaxExamsPerStudentPerDay(Integer maxExamsPerStudentPerDay) {
            this.maxExamsPerStudentPerDay = maxExamsPerStudentPerDay;
        }
    }
}
