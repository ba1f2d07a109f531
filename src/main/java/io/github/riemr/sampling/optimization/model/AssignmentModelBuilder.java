package io.github.riemr.sampling.optimization.model;

import io.github.riemr.sampling.domain.model.ResolvedTask;
import io.github.riemr.sampling.domain.model.Worker;
import io.github.riemr.sampling.optimization.scoring.SuitabilityScorer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 1 日分の作業者・業務から 0-1 整数計画を組み立てる。
 * <ul>
 *   <li>目的: Σ (score(w,t) + 補正(w)) · x[w,t] の最大化</li>
 *   <li>各作業者は 1 日 1 地区のみ: Σ_a y[w,a] ≤ 1</li>
 *   <li>担当地区の業務のみ従事: x[w,t] ≤ y[w,area(t)]</li>
 *   <li>配置人数の上限: Σ_w x[w,t] ≤ requiredWorkers(t)（不足は許容）</li>
 * </ul>
 * 全変数 0 は常に実行可能。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AssignmentModelBuilder {

    private final SuitabilityScorer scorer;

    public AssignmentModel build(LocalDate date, List<Worker> workers, List<ResolvedTask> tasks) {
        // 地区ごとに業務枠をまとめる（初出順）
        Map<String, List<Integer>> areaTasks = new LinkedHashMap<>();
        for (int t = 0; t < tasks.size(); t++) {
            areaTasks.computeIfAbsent(tasks.get(t).getArea(), k -> new ArrayList<>()).add(t);
        }
        List<String> areas = new ArrayList<>(areaTasks.keySet());

        BinaryProgram program = new BinaryProgram("Sampling_Assignment_" + date);
        int[][] x = new int[workers.size()][tasks.size()];
        int[][] y = new int[workers.size()][areas.size()];

        for (int w = 0; w < workers.size(); w++) {
            Worker worker = workers.get(w);
            double adjustment = scorer.priorityAdjustment(worker);
            for (int t = 0; t < tasks.size(); t++) {
                x[w][t] = program.addVariable("x[" + w + "," + t + "]");
                double score = scorer.score(worker, tasks.get(t).getDefinition()) + adjustment;
                program.setObjectiveCoefficient(x[w][t], score);
            }
            for (int a = 0; a < areas.size(); a++) {
                y[w][a] = program.addVariable("y[" + w + "," + a + "]");
            }
        }

        for (int w = 0; w < workers.size(); w++) {
            List<LinearTerm> oneArea = new ArrayList<>();
            for (int a = 0; a < areas.size(); a++) {
                oneArea.add(new LinearTerm(y[w][a], 1));
            }
            program.addConstraint("one_area[" + w + "]", oneArea, ConstraintSense.LESS_OR_EQUAL, 1);
        }

        for (int w = 0; w < workers.size(); w++) {
            for (int a = 0; a < areas.size(); a++) {
                for (int t : areaTasks.get(areas.get(a))) {
                    program.addConstraint("link[" + w + "," + t + "]",
                            List.of(new LinearTerm(x[w][t], 1), new LinearTerm(y[w][a], -1)),
                            ConstraintSense.LESS_OR_EQUAL, 0);
                }
            }
        }

        for (int t = 0; t < tasks.size(); t++) {
            List<LinearTerm> staffed = new ArrayList<>();
            for (int w = 0; w < workers.size(); w++) {
                staffed.add(new LinearTerm(x[w][t], 1));
            }
            program.addConstraint("capacity[" + t + "]", staffed, ConstraintSense.LESS_OR_EQUAL,
                    tasks.get(t).getRequiredWorkers());
        }

        log.debug("Built model for {}: workers={}, tasks={}, areas={}, {}",
                date, workers.size(), tasks.size(), areas.size(), program);
        return new AssignmentModel(program, workers, tasks, areas, x, y);
    }
}
