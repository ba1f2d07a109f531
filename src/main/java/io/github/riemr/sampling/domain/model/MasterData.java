package io.github.riemr.sampling.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 1 回の実行で共有する読み取り専用の入力一式（作業者・業務マスタ・スケジュール）。
 * 一度ロードして使い回し、明示的な再ロード以外では差し替えない。
 */
@Value
@Builder
public class MasterData {
    @Singular
    List<Worker> workers;
    @Singular
    List<TaskDefinition> tasks;
    @Singular("entry")
    List<ScheduleEntry> schedule;
    Instant loadedAt;
    String source;

    /** 日付昇順、同一日内はスケジュール記載順 */
    public Map<LocalDate, List<String>> scheduleByDate() {
        Map<LocalDate, List<String>> byDate = new TreeMap<>();
        for (ScheduleEntry e : schedule) {
            byDate.computeIfAbsent(e.date(), d -> new ArrayList<>()).add(e.taskName());
        }
        return byDate;
    }

    public List<String> tasksOn(LocalDate date) {
        return scheduleByDate().getOrDefault(date, List.of());
    }

    public boolean hasDate(LocalDate date) {
        return schedule.stream().anyMatch(e -> date.equals(e.date()));
    }
}
