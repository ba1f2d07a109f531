package io.github.riemr.sampling.domain.model;

import java.time.LocalDate;

/**
 * スケジュール 1 行（日付 + 業務表示名）。業務名はマスタと完全一致しなくてよい。
 */
public record ScheduleEntry(LocalDate date, String taskName) {
}
