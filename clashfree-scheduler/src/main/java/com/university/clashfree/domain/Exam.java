package com.university.clashfree.domain;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * One exam sitting of a course. Students are kept in id order.
 */
public final class Exam {

    private final String id;
    private final String courseId;
    private final int duration;
    private final Set<String> studentIds;
    private final SeatingDensity density;
    private final Set<String> requiredTags;

    private Exam(Builder builder) {
        this.id = builder.id;
        this.courseId = builder.courseId;
        this.duration = builder.duration;
        this.studentIds = Collections.unmodifiableSet(new TreeSet<>(builder.studentIds));
        this.density = builder.density;
        this.requiredTags = Collections.unmodifiableSet(new TreeSet<>(builder.requiredTags));
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

    public int getDuration() {
        return duration;
    }

    public Set<String> getStudentIds() {
        return studentIds;
    }

    public int getEnrolledCount() {
        return studentIds.size();
    }

    public SeatingDensity getDensity() {
        return density;
    }

    public Set<String> getRequiredTags() {
        return requiredTags;
    }

    @Override
    public String toString() {
        return id + "(" + courseId + ", " + studentIds.size() + " students)";
    }

    public static final class Builder {
        private final String id;
        private final String courseId;
        private int duration = 1;
        private final Set<String> studentIds = new TreeSet<>();
        private SeatingDensity density = SeatingDensity.FULL;
        private final Set<String> requiredTags = new TreeSet<>();

        private Builder(String id, String courseId) {
            this.id = id;
            this.courseId = courseId;
        }

        public Builder duration(int duration) {
            this.duration = duration;
            return this;
        }

        public Builder students(String... ids) {
            return students(Arrays.asList(ids));
        }

        public Builder students(Collection<String> ids) {
            if (ids != null) {
                this.studentIds.addAll(ids);
            }
            return this;
        }

        public Builder density(SeatingDensity density) {
            this.density = density;
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

        public Exam build() {
            if (id == null || id.isBlank()) {
                throw new ModelException("Exam id is required");
            }
            if (courseId == null || courseId.isBlank()) {
                throw new ModelException("Exam " + id + " has no course id");
            }
            if (duration < 1) {
                throw new ModelException("Exam " + id + " needs a duration of at least one period");
            }
            if (density == null) {
                throw new ModelException("Exam " + id + " has no seating density");
            }
            return new Exam(this);
        }
    }
}
