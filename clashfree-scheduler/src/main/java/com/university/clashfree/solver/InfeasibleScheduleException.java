package com.university.clashfree.solver;

import com.university.clashfree.constraint.ConstraintKind;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * No schedule satisfying every hard constraint was found. Carries a reason
 * code, the constraint most responsible (when known) and the ids of the
 * sessions, exams or posts involved.
 */
public class InfeasibleScheduleException extends Exception {

    public static final String INFEASIBLE = "infeasible";

    private final String reason;
    private final ConstraintKind kind;
    private final List<String> conflictingIds;

    public InfeasibleScheduleException(String message, ConstraintKind kind, Collection<String> conflictingIds) {
        this(INFEASIBLE, message, kind, conflictingIds);
    }

    protected InfeasibleScheduleException(String reason, String message, ConstraintKind kind,
            Collection<String> conflictingIds) {
        super(message);
        this.reason = reason;
        this.kind = kind;
        List<String> ids = new ArrayList<>(conflictingIds);
        Collections.sort(ids);
        this.conflictingIds = Collections.unmodifiableList(ids);
    }

    public String getReason() {
        return reason;
    }

    /** Constraint that ruled out the last remaining candidates; null when unknown. */
    public ConstraintKind getKind() {
        return kind;
    }

    public List<String> getConflictingIds() {
        return conflictingIds;
    }
}
