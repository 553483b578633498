package com.university.clashfree.config;

import java.time.Duration;
import java.util.Map;

/**
 * Every knob of one solver run, passed explicitly to the solvers. Immutable;
 * {@link #toBuilder()} derives variants, e.g. a request overriding the seed.
 */
public final class SolverConfig {

    private final SoftWeights weights;
    private final long backtrackBudget;
    private final int retryBudget;
    private final int moveBudget;
    private final int movesPerStep;
    private final double worseAcceptanceProbability;
    private final Duration timeBudget;
    private final long seed;
    private final boolean parallelRefinement;
    private final SeatingRule seatingRule;
    private final int minInvigilatorsPerRoom;
    private final int studentsPerInvigilator;
    private final InvigilationPolicy invigilationPolicy;
    private final boolean allowInstructorInvigilation;
    private final int maxExamsPerStudentPerDay;
    private final int maxRoomsPerExam;
    private final int roomCombinationLimit;

    private SolverConfig(Builder b) {
        this.weights = b.weights;
        this.backtrackBudget = b.backtrackBudget;
        this.retryBudget = b.retryBudget;
        this.moveBudget = b.moveBudget;
        this.movesPerStep = b.movesPerStep;
        this.worseAcceptanceProbability = b.worseAcceptanceProbability;
        this.timeBudget = b.timeBudget;
        this.seed = b.seed;
        this.parallelRefinement = b.parallelRefinement;
        this.seatingRule = b.seatingRule;
        this.minInvigilatorsPerRoom = b.minInvigilatorsPerRoom;
        this.studentsPerInvigilator = b.studentsPerInvigilator;
        this.invigilationPolicy = b.invigilationPolicy;
        this.allowInstructorInvigilation = b.allowInstructorInvigilation;
        this.maxExamsPerStudentPerDay = b.maxExamsPerStudentPerDay;
        this.maxRoomsPerExam = b.maxRoomsPerExam;
        this.roomCombinationLimit = b.roomCombinationLimit;
    }

    public static SolverConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .weights(weights)
                .backtrackBudget(backtrackBudget)
                .retryBudget(retryBudget)
                .moveBudget(moveBudget)
                .movesPerStep(movesPerStep)
                .worseAcceptanceProbability(worseAcceptanceProbability)
                .timeBudget(timeBudget)
                .seed(seed)
                .parallelRefinement(parallelRefinement)
                .seatingRule(seatingRule)
                .minInvigilatorsPerRoom(minInvigilatorsPerRoom)
                .studentsPerInvigilator(studentsPerInvigilator)
                .invigilationPolicy(invigilationPolicy)
                .allowInstructorInvigilation(allowInstructorInvigilation)
                .maxExamsPerStudentPerDay(maxExamsPerStudentPerDay)
                .maxRoomsPerExam(maxRoomsPerExam)
                .roomCombinationLimit(roomCombinationLimit);
    }

    public SoftWeights getWeights() {
        return weights;
    }

    /** Maximum number of search steps of one backtracking run. */
    public long getBacktrackBudget() {
        return backtrackBudget;
    }

    /** Backjumps allowed before the search falls back to chronological backtracking. */
    public int getRetryBudget() {
        return retryBudget;
    }

    /** Refinement steps; zero skips refinement. */
    public int getMoveBudget() {
        return moveBudget;
    }

    public int getMovesPerStep() {
        return movesPerStep;
    }

    public double getWorseAcceptanceProbability() {
        return worseAcceptanceProbability;
    }

    public Duration getTimeBudget() {
        return timeBudget;
    }

    public long getSeed() {
        return seed;
    }

    public boolean isParallelRefinement() {
        return parallelRefinement;
    }

    public SeatingRule getSeatingRule() {
        return seatingRule;
    }

    public int getMinInvigilatorsPerRoom() {
        return minInvigilatorsPerRoom;
    }

    /** Students one invigilator can watch; zero means no per-student requirement. */
    public int getStudentsPerInvigilator() {
        return studentsPerInvigilator;
    }

    public InvigilationPolicy getInvigilationPolicy() {
        return invigilationPolicy;
    }

    public boolean isAllowInstructorInvigilation() {
        return allowInstructorInvigilation;
    }

    /** Zero means unlimited. */
    public int getMaxExamsPerStudentPerDay() {
        return maxExamsPerStudentPerDay;
    }

    public int getMaxRoomsPerExam() {
        return maxRoomsPerExam;
    }

    /** Room combinations kept per exam, smallest surplus first. */
    public int getRoomCombinationLimit() {
        return roomCombinationLimit;
    }

    /** True when the instructor-exclusion rule is hard for this run. */
    public boolean isInstructorExclusionHard() {
        return !allowInstructorInvigilation && invigilationPolicy == InvigilationPolicy.EXCLUSION_FIRST;
    }

    @Override
    public String toString() {
        return "SolverConfig{seed=" + seed + ", backtrackBudget=" + backtrackBudget
                + ", retryBudget=" + retryBudget + ", moveBudget=" + moveBudget
                + ", timeBudget=" + timeBudget + ", weights=" + weights + "}";
    }

    public static final class Builder {
        private SoftWeights weights = SoftWeights.defaults();
        private long backtrackBudget = 200_000;
        private int retryBudget = 5_000;
        private int moveBudget = 2_000;
        private int movesPerStep = 16;
        private double worseAcceptanceProbability = 0.05;
        private Duration timeBudget = Duration.ofSeconds(30);
        private long seed = 42L;
        private boolean parallelRefinement;
        private SeatingRule seatingRule = SeatingRule.NONE;
        private int minInvigilatorsPerRoom = 1;
        private int studentsPerInvigilator;
        private InvigilationPolicy invigilationPolicy = InvigilationPolicy.EXCLUSION_FIRST;
        private boolean allowInstructorInvigilation;
        private int maxExamsPerStudentPerDay;
        private int maxRoomsPerExam = 3;
        private int roomCombinationLimit = 24;

        private Builder() {
        }

        public Builder weights(SoftWeights weights) {
            this.weights = weights;
            return this;
        }

        public Builder weights(Map<String, Double> overrides) {
            this.weights = SoftWeights.fromMap(overrides);
            return this;
        }

        public Builder backtrackBudget(long backtrackBudget) {
            this.backtrackBudget = backtrackBudget;
            return this;
        }

        public Builder retryBudget(int retryBudget) {
            this.retryBudget = retryBudget;
            return this;
        }

        public Builder moveBudget(int moveBudget) {
            this.moveBudget = moveBudget;
            return this;
        }

        public Builder movesPerStep(int movesPerStep) {
            this.movesPerStep = movesPerStep;
            return this;
        }

        public Builder worseAcceptanceProbability(double probability) {
            this.worseAcceptanceProbability = probability;
            return this;
        }

        public Builder timeBudget(Duration timeBudget) {
            this.timeBudget = timeBudget;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public Builder parallelRefinement(boolean parallelRefinement) {
            this.parallelRefinement = parallelRefinement;
            return this;
        }

        public Builder seatingRule(SeatingRule seatingRule) {
            this.seatingRule = seatingRule;
            return this;
        }

        public Builder minInvigilatorsPerRoom(int minInvigilatorsPerRoom) {
            this.minInvigilatorsPerRoom = minInvigilatorsPerRoom;
            return this;
        }

        public Builder studentsPerInvigilator(int studentsPerInvigilator) {
            this.studentsPerInvigilator = studentsPerInvigilator;
            return this;
        }

        public Builder invigilationPolicy(InvigilationPolicy invigilationPolicy) {
            this.invigilationPolicy = invigilationPolicy;
            return this;
        }

        public Builder allowInstructorInvigilation(boolean allow) {
            this.allowInstructorInvigilation = allow;
            return this;
        }

        public Builder maxExamsPerStudentPerDay(int max) {
            this.maxExamsPerStudentPerDay = max;
            return this;
        }

        public Builder maxRoomsPerExam(int maxRoomsPerExam) {
            this.maxRoomsPerExam = maxRoomsPerExam;
            return this;
        }

        public Builder roomCombinationLimit(int roomCombinationLimit) {
            this.roomCombinationLimit = roomCombinationLimit;
            return this;
        }

        public SolverConfig build() {
            if (weights == null) {
                throw new IllegalArgumentException("Soft weights are required");
            }
            if (backtrackBudget < 1) {
                throw new IllegalArgumentException("Backtrack budget must be positive");
            }
            if (retryBudget < 0 || moveBudget < 0) {
                throw new IllegalArgumentException("Retry and move budgets must not be negative");
            }
            if (movesPerStep < 1) {
                throw new IllegalArgumentException("At least one move per refinement step is required");
            }
            if (worseAcceptanceProbability < 0 || worseAcceptanceProbability > 1) {
                throw new IllegalArgumentException("Worse-move acceptance must lie in [0, 1]");
            }
            if (timeBudget == null || timeBudget.isNegative() || timeBudget.isZero()) {
                throw new IllegalArgumentException("Time budget must be positive");
            }
            if (seatingRule == null || invigilationPolicy == null) {
                throw new IllegalArgumentException("Seating rule and invigilation policy are required");
            }
            if (minInvigilatorsPerRoom < 1) {
                throw new IllegalArgumentException("At least one invigilator per room is required");
            }
            if (studentsPerInvigilator < 0 || maxExamsPerStudentPerDay < 0) {
                throw new IllegalArgumentException("Invigilation ratio and daily exam limit must not be negative");
            }
            if (maxRoomsPerExam < 1 || maxRoomsPerExam > 3) {
                throw new IllegalArgumentException("An exam may use between one and three rooms");
            }
            if (roomCombinationLimit < 1) {
                throw new IllegalArgumentException("Room combination limit must be positive");
            }
            return new SolverConfig(this);
        }
    }
}
