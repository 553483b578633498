package com.university.clashfree.solver;

import java.util.Collections;

/**
 * The search ran out of steps or time before it could decide. Retrying with a
 * larger budget may succeed.
 */
public class BudgetExceededException extends InfeasibleScheduleException {

    public static final String BUDGET_EXCEEDED = "budget_exceeded";

    public enum Budget {
        BACKTRACK, TIME
    }

    private final Budget budget;

    public BudgetExceededException(Budget budget, String message) {
        super(BUDGET_EXCEEDED, message, null, Collections.emptyList());
        this.budget = budget;
    }

    public Budget getBudget() {
        return budget;
    }
}
