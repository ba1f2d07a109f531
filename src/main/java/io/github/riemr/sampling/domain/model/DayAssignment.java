package io.github.riemr.sampling.domain.model;

import lombok.Value;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 1 日分の割当結果。tasks はスケジュール記載順で、同名業務も別枠として保持する。
 */
@Value
public class DayAssignment {
    LocalDate date;
    DayStatus status;
    double objectiveValue;
    List<TaskAssignment> tasks;

    public DayAssignment(LocalDate date, DayStatus status, double objectiveValue, List<TaskAssignment> tasks) {
        this.date = date;
        this.status = status;
        this.objectiveValue = objectiveValue;
        this.tasks = List.copyOf(tasks);
    }

    /**
     * 業務名 → 担当者リスト。同名業務が複数枠ある場合は枠順に連結する。
     * 割当のない業務も空リストでキーに含まれる。
     */
    public Map<String, List<String>> byTaskName() {
        Map<String, List<String>> result = new LinkedHashMap<>();
        for (TaskAssignment t : tasks) {
            result.computeIfAbsent(t.taskName(), k -> new ArrayList<>()).addAll(t.workers());
        }
        return result;
    }

    public int assignedCount() {
        return tasks.stream().mapToInt(t -> t.workers().size()).sum();
    }
}
