package io.github.riemr.sampling.domain.model;

import java.time.LocalDate;
import java.util.List;

/**
 * 最適化できなかった日。割当が空だった日（{@link DayAssignment}）とは区別する。
 */
public record DayFailure(LocalDate date, DayFailureKind kind, String message, List<String> taskNames) {

    public DayFailure {
        taskNames = taskNames == null ? List.of() : List.copyOf(taskNames);
    }
}
