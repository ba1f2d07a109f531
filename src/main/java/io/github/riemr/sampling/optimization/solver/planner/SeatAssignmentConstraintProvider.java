package io.github.riemr.sampling.optimization.solver.planner;

import org.optaplanner.core.api.score.buildin.hardsoftbigdecimal.HardSoftBigDecimalScore;
import org.optaplanner.core.api.score.stream.Constraint;
import org.optaplanner.core.api.score.stream.ConstraintFactory;
import org.optaplanner.core.api.score.stream.ConstraintProvider;
import org.optaplanner.core.api.score.stream.Joiners;

public class SeatAssignmentConstraintProvider implements ConstraintProvider {

    @Override
    public Constraint[] defineConstraints(ConstraintFactory factory) {
        return new Constraint[] {
                // ハード制約
                workerSeatedTwiceOnTask(factory),
                workerInMultipleAreas(factory),
                // ソフト制約
                suitability(factory)
        };
    }

    // 同じ業務枠に同じ作業者を 2 席
    private Constraint workerSeatedTwiceOnTask(ConstraintFactory f) {
        return f.forEach(SeatAssignment.class)
                .filter(SeatAssignment::isSeated)
                .join(SeatAssignment.class,
                        Joiners.equal(SeatAssignment::getTaskIndex),
                        Joiners.equal(SeatAssignment::getWorker),
                        Joiners.lessThan(SeatAssignment::getId))
                .penalize(HardSoftBigDecimalScore.ONE_HARD)
                .asConstraint("Worker seated twice on one task");
    }

    // 1 日 1 地区
    private Constraint workerInMultipleAreas(ConstraintFactory f) {
        return f.forEach(SeatAssignment.class)
                .filter(SeatAssignment::isSeated)
                .join(SeatAssignment.class,
                        Joiners.equal(SeatAssignment::getWorker),
                        Joiners.lessThan(SeatAssignment::getId))
                .filter((a, b) -> a.getAreaIndex() != b.getAreaIndex())
                .penalize(HardSoftBigDecimalScore.ONE_HARD)
                .asConstraint("Worker in multiple areas");
    }

    // 候補は正のスコアのみなので報酬だけ
    private Constraint suitability(ConstraintFactory f) {
        return f.forEach(SeatAssignment.class)
                .filter(SeatAssignment::isSeated)
                .rewardBigDecimal(HardSoftBigDecimalScore.ONE_SOFT, SeatAssignment::seatedScore)
                .asConstraint("Suitability");
    }
}
