package com.university.clashfree.exam;

import com.university.clashfree.constraint.ConstraintEvaluator;
import com.university.clashfree.domain.ExamPlacement;
import com.university.clashfree.domain.ExamProblem;
import com.university.clashfree.domain.ExamSchedule;
import com.university.clashfree.solver.MoveSpace;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Relocations of placed exams, scored with the placement rules only. Seating
 * and invigilation follow once the placements are final.
 */
public class ExamMoveSpace implements MoveSpace<ExamMove, ExamSchedule> {

    private static final int ATTEMPTS_PER_MOVE = 4;

    private final ExamSearchSpace state;
    private final ConstraintEvaluator<ExamSchedule, ExamProblem> evaluator;
    private final ExamProblem problem;
    private double cost;

    public ExamMoveSpace(ExamSearchSpace state, ConstraintEvaluator<ExamSchedule, ExamProblem> evaluator) {
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
    public List<ExamMove> propose(Random random, int count) {
        List<ExamPlacement> placements = new ArrayList<>(state.getSchedule().getPlacements());
        List<ExamMove> moves = new ArrayList<>();
        if (placements.isEmpty()) {
            return moves;
        }
        for (int attempt = 0; attempt < count * ATTEMPTS_PER_MOVE && moves.size() < count; attempt++) {
            ExamPlacement from = placements.get(random.nextInt(placements.size()));
            List<ExamCandidate> domain = state.staticDomain(from.getId());
            ExamPlacement to = domain.get(random.nextInt(domain.size())).toPlacement(from.getExam());
            if (to.equals(from)) {
                continue;
            }
            ExamMove move = new ExamMove(from, to);
            if (feasible(move)) {
                moves.add(move);
            }
        }
        return moves;
    }

    private boolean feasible(ExamMove move) {
        state.release(move.getFrom());
        ExamPlacement to = move.getTo();
        boolean ok = state.fits(to.getExam(), to.getRange(), to.getRooms());
        state.occupy(move.getFrom());
        return ok;
    }

    @Override
    public double evaluate(ExamMove move) {
        ExamSchedule trial = state.getSchedule().copy();
        trial.put(move.getTo());
        return evaluator.softCost(trial, problem);
    }

    @Override
    public boolean commit(ExamMove move) {
        ExamSchedule schedule = state.getSchedule();
        if (!move.getFrom().equals(schedule.get(move.getFrom().getId())) || !feasible(move)) {
            return false;
        }
        state.release(move.getFrom());
        state.occupy(move.getTo());
        cost = evaluator.softCost(schedule, problem);
        return true;
    }

    @Override
    public ExamSchedule snapshot() {
        return state.getSchedule().copy();
    }
}
