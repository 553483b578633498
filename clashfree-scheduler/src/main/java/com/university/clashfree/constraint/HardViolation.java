package com.university.clashfree.constraint;

import com.university.clashfree.domain.TimeSlot;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * One broken hard constraint: which rule, the assignments involved (sorted),
 * the resource they compete for and the first slot where it happens.
 */
public final class HardViolation implements Comparable<HardViolation> {

    private static final Comparator<HardViolation> ORDER = Comparator
            .comparing(HardViolation::getKind)
            .thenComparing(v -> String.join(",", v.getAssignmentIds()))
            .thenComparing(HardViolation::getResourceId, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(HardViolation::getSlot, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final ConstraintKind kind;
    private final List<String> assignmentIds;
    private final String resourceId;
    private final TimeSlot slot;
    private final String message;

    public HardViolation(ConstraintKind kind, Collection<String> assignmentIds, String resourceId,
            TimeSlot slot, String message) {
        this.kind = Objects.requireNonNull(kind, "kind");
        List<String> ids = new ArrayList<>(assignmentIds);
        Collections.sort(ids);
        this.assignmentIds = Collections.unmodifiableList(ids);
        this.resourceId = resourceId;
        this.slot = slot;
        this.message = message;
    }

    public ConstraintKind getKind() {
        return kind;
    }

    public List<String> getAssignmentIds() {
        return assignmentIds;
    }

    public String getResourceId() {
        return resourceId;
    }

    /** First offending slot, or null for constraints not tied to one (e.g. overload). */
    public TimeSlot getSlot() {
        return slot;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public int compareTo(HardViolation other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HardViolation)) {
            return false;
        }
        HardViolation that = (HardViolation) o;
        return kind == that.kind && assignmentIds.equals(that.assignmentIds)
                && Objects.equals(resourceId, that.resourceId) && Objects.equals(slot, that.slot);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, assignmentIds, resourceId, slot);
    }

    @Override
    public String toString() {
        return kind.name() + assignmentIds + (resourceId == null ? "" : " on " + resourceId)
                + (slot == null ? "" : " at " + slot) + ": " + message;
    }
}
