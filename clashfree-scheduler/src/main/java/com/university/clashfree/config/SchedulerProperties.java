package com.university.clashfree.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Solver defaults bound from the {@code scheduler.*} properties.
 */
@ConfigurationProperties(prefix = "scheduler")
public class SchedulerProperties {

    private long seed = 42;
    private Duration timeBudget = Duration.ofSeconds(30);
    private long backtrackBudget = 200_000;
    private int retryBudget = 5_000;
    private int moveBudget = 2_000;
    private int movesPerStep = 16;
    private double worseAcceptanceProbability = 0.05;
    private boolean parallelRefinement;
    private Map<String, Double> weights = new LinkedHashMap<>();
    private SeatingRule seatingRule = SeatingRule.NONE;
    private int minInvigilatorsPerRoom = 1;
    private int studentsPerInvigilator;
    private InvigilationPolicy invigilationPolicy = InvigilationPolicy.EXCLUSION_FIRST;
    private boolean allowInstructorInvigilation;
    private int maxExamsPerStudentPerDay;
    private int maxRoomsPerExam = 3;
    private int executorThreads = 2;

    public SolverConfig toSolverConfig() {
        return SolverConfig.builder()
                .seed(seed)
                .timeBudget(timeBudget)
                .backtrackBudget(backtrackBudget)
                .retryBudget(retryBudget)
                .moveBudget(moveBudget)
                .movesPerStep(movesPerStep)
                .worseAcceptanceProbability(worseAcceptanceProbability)
                .parallelRefinement(parallelRefinement)
                .weights(weights)
                .seatingRule(seatingRule)
                .minInvigilatorsPerRoom(minInvigilatorsPerRoom)
                .studentsPerInvigilator(studentsPerInvigilator)
                .invigilationPolicy(invigilationPolicy)
                .allowInstructorInvigilation(allowInstructorInvigilation)
                .maxExamsPerStudentPerDay(maxExamsPerStudentPerDay)
                .maxRoomsPerExam(maxRoomsPerExam)
                .build();
    }

    public long getSeed() {
        return seed;
    }

    public void setSeed(long seed) {
        this.seed = seed;
    }

    public Duration getTimeBudget() {
        return timeBudget;
    }

    public void setTimeBudget(Duration timeBudget) {
        this.timeBudget = timeBudget;
    }

    public long getBacktrackBudget() {
        return backtrackBudget;
    }

    public void setBacktrackBudget(long backtrackBudget) {
        this.backtrackBudget = backtrackBudget;
    }

    public int getRetryBudget() {
        return retryBudget;
    }

    public void setRetryBudget(int retryBudget) {
        this.retryBudget = retryBudget;
    }

    public int getMoveBudget() {
        return moveBudget;
    }

    public void setMoveBudget(int moveBudget) {
        this.moveBudget = moveBudget;
    }

    public int getMovesPerStep() {
        return movesPerStep;
    }

    public void setMovesPerStep(int movesPerStep) {
        this.movesPerStep = movesPerStep;
    }

    public double getWorseAcceptanceProbability() {
        return worseAcceptanceProbability;
    }

    public void setWorseAcceptanceProbability(double worseAcceptanceProbability) {
        this.worseAcceptanceProbability = worseAcceptanceProbability;
    }

    public boolean isParallelRefinement() {
        return parallelRefinement;
    }

    public void setParallelRefinement(boolean parallelRefinement) {
        this.parallelRefinement = parallelRefinement;
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

    public int getMinInvigilatorsPerRoom() {
        return minInvigilatorsPerRoom;
    }

    public void setMinInvigilatorsPerRoom(int minInvigilatorsPerRoom) {
        this.minInvigilatorsPerRoom = minInvigilatorsPerRoom;
    }

    public int getStudentsPerInvigilator() {
        return studentsPerInvigilator;
    }

    public void setStudentsPerInvigilator(int studentsPerInvigilator) {
        this.studentsPerInvigilator = studentsPerInvigilator;
    }

    public InvigilationPolicy getInvigilationPolicy() {
        return invigilationPolicy;
    }

    public void setInvigilationPolicy(InvigilationPolicy invigilationPolicy) {
        this.invigilationPolicy = invigilationPolicy;
    }

    public boolean isAllowInstructorInvigilation() {
        return allowInstructorInvigilation;
    }

    public void setAllowInstructorInvigilation(boolean allowInstructorInvigilation) {
        this.allowInstructorInvigilation = allowInstructorInvigilation;
    }

    public int getMaxExamsPerStudentPerDay() {
        return maxExamsPerStudentPerDay;
    }

    public void setMaxExamsPerStudentPerDay(int maxExamsPerStudentPerDay) {
        this.maxExamsPerStudentPerDay = maxExamsPerStudentPerDay;
    }

    public int getMaxRoomsPerExam() {
        return maxRoomsPerExam;
    }

    public void setMaxRoomsPerExam(int maxRoomsPerExam) {
        this.maxRoomsPerExam = maxRoomsPerExam;
    }

    public int getExecutorThreads() {
        return executorThreads;
    }

    public void setExecutorThreads(int executorThreads) {
        this.executorThreads = executorThreads;
    }
}
