package com.university.clashfree.solver;

import com.university.clashfree.constraint.ConstraintEvaluator;
import com.university.clashfree.domain.Assignment;
import com.university.clashfree.domain.Schedule;
import com.university.clashfree.domain.Session;
import com.university.clashfree.domain.TimetableProblem;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Relocations and swaps over the complete schedule left in a
 * {@link TimetableSearchSpace} by the constructive phase. Feasibility is
 * checked against the space's occupancy with the moved sessions lifted out.
 */
public class TimetableMoveSpace implements MoveSpace<TimetableMove, Schedule> {

    private static final int ATTEMPTS_PER_MOVE = 4;

    private final TimetableSearchSpace state;
    private final ConstraintEvaluator<Schedule, TimetableProblem> evaluator;
    private final TimetableProblem problem;
    private double cost;

    public TimetableMoveSpace(TimetableSearchSpace state, ConstraintEvaluator<Schedule, TimetableProblem> evaluator) {
        this.state = state;
        this.evaluator = evaluator;
        this.problem = state.getProblem();
        this.cost = evaluator.softCost(state.getSchedule(), problem);
    }

    @Override
    public double currentCost() {
        return cost;
    }

    @Override
    public List<TimetableMove> propose(Random random, int count) {
        List<Assignment> assignments = new ArrayList<>(state.getSchedule().getAssignments());
        List<TimetableMove> moves = new ArrayList<>();
        if (assignments.isEmpty()) {
            return moves;
        }
        for (int attempt = 0; attempt < count * ATTEMPTS_PER_MOVE && moves.size() < count; attempt++) {
            Assignment a = assignments.get(random.nextInt(assignments.size()));
            TimetableMove move = random.nextBoolean() || assignments.size() < 2
                    ? relocation(a, random)
                    : swap(a, assignments.get(random.nextInt(assignments.size())));
            if (move != null) {
                moves.add(move);
            }
        }
        return moves;
    }

    private TimetableMove relocation(Assignment from, Random random) {
        List<TimetableCandidate> domain = state.staticDomain(from.getId());
        TimetableCandidate c = domain.get(random.nextInt(domain.size()));
        Assignment to = c.toAssignment(from.getSession());
        if (to.equals(from)) {
            return null;
        }
        TimetableMove move = TimetableMove.relocate(from, to);
        return feasible(move) ? move : null;
    }

    private TimetableMove swap(Assignment a, Assignment b) {
        if (a.getId().equals(b.getId()) || a.getSession().getDuration() != b.getSession().getDuration()
                || a.getRange().equals(b.getRange())) {
            return null;
        }
        TimetableMove move = TimetableMove.swap(a, b);
        for (Assignment added : move.getAdded()) {
            if (!state.staticallyAllowed(added)) {
                return null;
            }
        }
        return feasible(move) ? move : null;
    }

    /** Lifts the removed assignments out, tries the added ones, and restores the state. */
    private boolean feasible(TimetableMove move) {
        move.getRemoved().forEach(state::release);
        List<Assignment> placed = new ArrayList<>();
        boolean ok = true;
        for (Assignment added : move.getAdded()) {
            Session session = added.getSession();
            if (!state.fits(session, added.getRange(), added.getRoom(), added.getFaculty())) {
                ok = false;
                break;
            }
            state.occupy(added);
            placed.add(added);
        }
        placed.forEach(state::release);
        move.getRemoved().forEach(state::occupy);
        return ok;
    }

    @Override
    public double evaluate(TimetableMove move) {
        Schedule trial = state.getSchedule().copy();
        move.getRemoved().forEach(a -> trial.remove(a.getId()));
        move.getAdded().forEach(trial::put);
        return evaluator.softCost(trial, problem);
    }

    @Override
    public boolean commit(TimetableMove move) {
        Schedule schedule = state.getSchedule();
        for (Assignment removed : move.getRemoved()) {
            if (!removed.equals(schedule.get(removed.getId()))) {
                return false;
            }
        }
        if (!feasible(move)) {
            return false;
        }
        move.getRemoved().forEach(state::release);
        move.getAdded().forEach(state::occupy);
        cost = evaluator.softCost(schedule, problem);
        return true;
    }

    @Override
    public Schedule snapshot() {
        return state.getSchedule().copy();
    }
}
