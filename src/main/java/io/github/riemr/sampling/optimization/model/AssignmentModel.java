package io.github.riemr.sampling.optimization.model;

import io.github.riemr.sampling.domain.model.ResolvedTask;
import io.github.riemr.sampling.domain.model.TaskAssignment;
import io.github.riemr.sampling.domain.model.Worker;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * 1 日分の割当モデル。x[w][t]（作業者 w が枠 t に従事）と y[w][a]（作業者 w が地区 a を担当）の
 * 変数添字を保持し、ソルバーの解を枠ごとの担当者リストに戻す。
 */
@Getter
public class AssignmentModel {

    private final BinaryProgram program;
    private final List<Worker> workers;
    private final List<ResolvedTask> tasks;
    private final List<String> areas;
    private final int[][] x;
    private final int[][] y;

    AssignmentModel(BinaryProgram program, List<Worker> workers, List<ResolvedTask> tasks, List<String> areas,
                    int[][] x, int[][] y) {
        this.program = program;
        this.workers = List.copyOf(workers);
        this.tasks = List.copyOf(tasks);
        this.areas = List.copyOf(areas);
        this.x = x;
        this.y = y;
    }

    public int assignmentVariable(int worker, int task) {
        return x[worker][task];
    }

    public int areaVariable(int worker, int area) {
        return y[worker][area];
    }

    /** 担当者は作業者マスタ順（スコア順ではない） */
    public List<TaskAssignment> extract(boolean[] values) {
        List<TaskAssignment> result = new ArrayList<>(tasks.size());
        for (int t = 0; t < tasks.size(); t++) {
            ResolvedTask task = tasks.get(t);
            List<String> assigned = new ArrayList<>();
            for (int w = 0; w < workers.size(); w++) {
                if (values[x[w][t]]) {
                    assigned.add(workers.get(w).getName());
                }
            }
            result.add(new TaskAssignment(task.getSlot(), task.getDisplayName(), task.getArea(),
                    task.isUnregistered(), assigned));
        }
        return result;
    }
}
