package io.github.riemr.sampling.application.dto;

import io.github.riemr.sampling.domain.model.TaskAssignment;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * assignments / slots は直近の一括最適化結果。
 * status は日の状態（OPTIMAL 等）、失敗日は FAILED で failure に理由、未実行は NOT_OPTIMIZED。
 */
public record ScheduleViewResponse(boolean success,
                                   LocalDate date,
                                   List<String> tasks,
                                   String status,
                                   Map<String, List<String>> assignments,
                                   List<TaskAssignment> slots,
                                   FailureDto failure) {

    public static final String FAILED = "FAILED";
    public static final String NOT_OPTIMIZED = "NOT_OPTIMIZED";
}
