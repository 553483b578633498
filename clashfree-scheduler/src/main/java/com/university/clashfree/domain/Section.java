package com.university.clashfree.domain;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * One teachable instance of a course. Each of its {@code meetingsPerWeek}
 * meetings needs {@code duration} contiguous periods in one room with one
 * faculty member.
 */
public final class Section {

    private final String id;
    private final String courseId;
    private final SessionKind kind;
    private final int duration;
    private final int meetingsPerWeek;
    private final Set<String> requiredTags;
    private final int enrolledCount;
    private final Set<String> qualifiedFacultyIds;
    private final String exclusionGroup;

    private Section(Builder builder) {
        this.id = builder.id;
        this.courseId = builder.courseId;
        this.kind = builder.kind;
        this.duration = builder.duration;
        this.meetingsPerWeek = builder.meetingsPerWeek;
        this.requiredTags = Collections.unmodifiableSet(new TreeSet<>(builder.requiredTags));
        this.enrolledCount = builder.enrolledCount;
        this.qualifiedFacultyIds = Collections.unmodifiableSet(new TreeSet<>(builder.qualifiedFacultyIds));
        this.exclusionGroup = builder.exclusionGroup == null || builder.exclusionGroup.isBlank()
                ? null : builder.exclusionGroup;
    }

    public static Builder builder(String id, String courseId) {
        return new Builder(id, courseId);
    }

    public String getId() {
        return id;
    }

    public String getCourseId() {
        return courseId;
    }

    public SessionKind getKind() {
        return kind;
    }

    public int getDuration() {
        return duration;
    }

    public int getMeetingsPerWeek() {
        return meetingsPerWeek;
    }

    public Set<String> getRequiredTags() {
        return requiredTags;
    }

    public int getEnrolledCount() {
        return enrolledCount;
    }

    public Set<String> getQualifiedFacultyIds() {
        return qualifiedFacultyIds;
    }

    /** Elective basket this section belongs to, or null for a core section. */
    public String getExclusionGroup() {
        return exclusionGroup;
    }

    public List<Session> sessions() {
        List<Session> sessions = new ArrayList<>(meetingsPerWeek);
        for (int i = 1; i <= meetingsPerWeek; i++) {
            sessions.add(new Session(this, i));
        }
        return sessions;
    }

    @Override
    public String toString() {
        return id;
    }

    public static final class Builder {
        private final String id;
        private final String courseId;
        private SessionKind kind = SessionKind.LECTURE;
        private int duration = 1;
        private int meetingsPerWeek = 1;
        private final Set<String> requiredTags = new TreeSet<>();
        private int enrolledCount;
        private final Set<String> qualifiedFacultyIds = new TreeSet<>();
        private String exclusionGroup;

        private Builder(String id, String courseId) {
            this.id = id;
            this.courseId = courseId;
        }

        public Builder kind(SessionKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder duration(int duration) {
            this.duration = duration;
            return this;
        }

        public Builder meetingsPerWeek(int meetingsPerWeek) {
            this.meetingsPerWeek = meetingsPerWeek;
            return this;
        }

        public Builder requiredTags(String... tags) {
            return requiredTags(Arrays.asList(tags));
        }

        public Builder requiredTags(Collection<String> tags) {
            if (tags != null) {
                this.requiredTags.addAll(tags);
            }
            return this;
        }

        public Builder enrolled(int count) {
            this.enrolledCount = count;
            return this;
        }

        public Builder qualified(String... facultyIds) {
            return qualified(Arrays.asList(facultyIds));
        }

        public Builder qualified(Collection<String> facultyIds) {
            if (facultyIds != null) {
                this.qualifiedFacultyIds.addAll(facultyIds);
            }
            return this;
        }

        public Builder exclusionGroup(String group) {
            this.exclusionGroup = group;
            return this;
        }

        public Section build() {
            if (id == null || id.isBlank()) {
                throw new ModelException("Section id is required");
            }
            if (courseId == null || courseId.isBlank()) {
                throw new ModelException("Section " + id + " has no course id");
            }
            if (kind == null) {
                throw new ModelException("Section " + id + " has no session kind");
            }
            if (duration < 1) {
                throw new ModelException("Section " + id + " needs a duration of at least one period");
            }
            if (meetingsPerWeek < 1) {
                throw new ModelException("Section " + id + " needs at least one meeting per week");
            }
            if (enrolledCount < 0) {
                throw new ModelException("Section " + id + " has a negative enrolled count");
            }
            return new Section(this);
        }
    }
}
