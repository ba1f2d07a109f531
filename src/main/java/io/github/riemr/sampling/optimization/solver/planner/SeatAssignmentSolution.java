package io.github.riemr.sampling.optimization.solver.planner;

import io.github.riemr.sampling.domain.model.ResolvedTask;
import io.github.riemr.sampling.optimization.model.AssignmentModel;
import io.github.riemr.sampling.optimization.model.BinaryProgram;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.optaplanner.core.api.domain.solution.PlanningEntityCollectionProperty;
import org.optaplanner.core.api.domain.solution.PlanningScore;
import org.optaplanner.core.api.domain.solution.PlanningSolution;
import org.optaplanner.core.api.domain.solution.ProblemFactCollectionProperty;
import org.optaplanner.core.api.score.buildin.hardsoftbigdecimal.HardSoftBigDecimalScore;

import java.util.ArrayList;
import java.util.List;

/**
 * 1 日分の割当モデルを席と作業者の問題として表したもの。
 * ハード = 同一業務での重複着席・複数地区への着席、ソフト = 着席した作業者のスコア合計。
 */
@PlanningSolution
@Getter
@Setter
@NoArgsConstructor
public class SeatAssignmentSolution {

    private String name;

    @ProblemFactCollectionProperty
    private List<CandidateWorker> workerList = new ArrayList<>();

    @PlanningEntityCollectionProperty
    private List<SeatAssignment> seatList = new ArrayList<>();

    @PlanningScore
    private HardSoftBigDecimalScore score;

    /**
     * スコアはモデルの目的係数 x[w,t] をそのまま使う。
     * 席数は必要人数と候補者数の小さいほう。候補のいない業務には席を作らない。
     */
    public static SeatAssignmentSolution of(AssignmentModel model) {
        BinaryProgram program = model.getProgram();
        SeatAssignmentSolution solution = new SeatAssignmentSolution();
        solution.setName(program.getName());
        for (int w = 0; w < model.getWorkers().size(); w++) {
            solution.workerList.add(new CandidateWorker(w, model.getWorkers().get(w).getName()));
        }

        int seatId = 0;
        for (int t = 0; t < model.getTasks().size(); t++) {
            ResolvedTask task = model.getTasks().get(t);
            int area = model.getAreas().indexOf(task.getArea());
            double[] scores = new double[solution.workerList.size()];
            List<CandidateWorker> candidates = new ArrayList<>();
            for (CandidateWorker c : solution.workerList) {
                scores[c.index()] = program.objectiveCoefficient(model.assignmentVariable(c.index(), t));
                if (scores[c.index()] > 0) {
                    candidates.add(c);
                }
            }
            int seats = Math.min(task.getRequiredWorkers(), candidates.size());
            for (int k = 0; k < seats; k++) {
                solution.seatList.add(new SeatAssignment(seatId++, t, task.getDisplayName(), k, area,
                        List.copyOf(candidates), scores));
            }
        }
        return solution;
    }

    /** 席の割当を x[w,t] / y[w,a] の 0-1 値に戻す */
    public boolean[] toValues(AssignmentModel model) {
        boolean[] values = new boolean[model.getProgram().variableCount()];
        for (SeatAssignment seat : seatList) {
            if (!seat.isSeated()) continue;
            int w = seat.getWorker().index();
            values[model.assignmentVariable(w, seat.getTaskIndex())] = true;
            values[model.areaVariable(w, seat.getAreaIndex())] = true;
        }
        return values;
    }
}
