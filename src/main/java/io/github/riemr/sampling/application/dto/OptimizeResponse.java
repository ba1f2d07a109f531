package io.github.riemr.sampling.application.dto;

import io.github.riemr.sampling.domain.model.DayAssignment;
import io.github.riemr.sampling.domain.model.DayFailure;
import io.github.riemr.sampling.domain.model.ScheduleResult;
import io.github.riemr.sampling.domain.model.TaskAssignment;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * スケジュール全体の最適化結果。results は 日付 → 業務名 → 担当者、
 * slots は同じ内容を枠単位で（マスタ未登録フラグ付き）持つ。
 */
public record OptimizeResponse(boolean success,
                               Map<LocalDate, Map<String, List<String>>> results,
                               Map<LocalDate, List<TaskAssignment>> slots,
                               Map<LocalDate, String> statuses,
                               Map<LocalDate, FailureDto> failures,
                               List<LocalDate> dates) {

    public static OptimizeResponse from(ScheduleResult result) {
        Map<LocalDate, Map<String, List<String>>> results = new LinkedHashMap<>();
        Map<LocalDate, List<TaskAssignment>> slots = new LinkedHashMap<>();
        Map<LocalDate, String> statuses = new LinkedHashMap<>();
        for (DayAssignment day : result.getAssignments().values()) {
            results.put(day.getDate(), day.byTaskName());
            slots.put(day.getDate(), day.getTasks());
            statuses.put(day.getDate(), day.getStatus().name());
        }
        Map<LocalDate, FailureDto> failures = new LinkedHashMap<>();
        for (DayFailure f : result.getFailures().values()) {
            failures.put(f.date(), FailureDto.from(f));
            statuses.put(f.date(), f.kind().name());
        }
        return new OptimizeResponse(result.isComplete(), results, slots, statuses, failures, List.copyOf(result.dates()));
    }
}
