package io.github.riemr.sampling.optimization.solver.planner;

import lombok.extern.slf4j.Slf4j;
import org.optaplanner.core.api.score.director.ScoreDirector;
import org.optaplanner.core.impl.phase.custom.CustomPhaseCommand;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 初期解。スコアの高い (席, 作業者) の組から順に、制約を破らない範囲で着席させる。
 * 同点は席 ID・作業者添字の順で決めるため、同じ入力なら常に同じ初期解になる。
 */
@Slf4j
public class GreedySeatInitializer implements CustomPhaseCommand<SeatAssignmentSolution> {

    private record Option(SeatAssignment seat, CandidateWorker worker, double score) {
    }

    @Override
    public void changeWorkingSolution(ScoreDirector<SeatAssignmentSolution> scoreDirector) {
        SeatAssignmentSolution solution = scoreDirector.getWorkingSolution();
        if (solution == null || solution.getSeatList().isEmpty()) {
            return;
        }

        Map<Integer, Integer> areaByWorker = new HashMap<>();
        Set<String> seatedOnTask = new HashSet<>();
        List<Option> options = new ArrayList<>();
        for (SeatAssignment seat : solution.getSeatList()) {
            if (seat.isSeated()) {
                areaByWorker.put(seat.getWorker().index(), seat.getAreaIndex());
                seatedOnTask.add(seat.getTaskIndex() + ":" + seat.getWorker().index());
                continue;
            }
            for (CandidateWorker c : seat.getSeatCandidates()) {
                options.add(new Option(seat, c, seat.scoreOf(c)));
            }
        }
        options.sort(Comparator.comparingDouble(Option::score).reversed()
                .thenComparing(o -> o.seat().getId())
                .thenComparingInt(o -> o.worker().index()));

        int seated = 0;
        for (Option o : options) {
            SeatAssignment seat = o.seat();
            if (seat.isSeated()) continue;
            Integer area = areaByWorker.get(o.worker().index());
            if (area != null && area != seat.getAreaIndex()) continue;
            if (!seatedOnTask.add(seat.getTaskIndex() + ":" + o.worker().index())) continue;

            scoreDirector.beforeVariableChanged(seat, "worker");
            seat.setWorker(o.worker());
            scoreDirector.afterVariableChanged(seat, "worker");
            areaByWorker.put(o.worker().index(), seat.getAreaIndex());
            seated++;
        }
        scoreDirector.triggerVariableListeners();
        log.debug("{}: greedy initializer seated {}/{} seat(s)", solution.getName(), seated, solution.getSeatList().size());
    }
}
