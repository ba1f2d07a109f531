package io.github.riemr.sampling.domain.model;

import lombok.Value;

import java.time.LocalDate;
import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * スケジュール全体の結果。assignments と failures のキーの和集合が入力スケジュールの日付集合に一致する。
 */
@Value
public class ScheduleResult {
    SortedMap<LocalDate, DayAssignment> assignments;
    SortedMap<LocalDate, DayFailure> failures;

    public ScheduleResult(Map<LocalDate, DayAssignment> assignments, Map<LocalDate, DayFailure> failures) {
        this.assignments = Collections.unmodifiableSortedMap(new TreeMap<>(assignments));
        this.failures = Collections.unmodifiableSortedMap(new TreeMap<>(failures));
    }

    public static ScheduleResult empty() {
        return new ScheduleResult(Map.of(), Map.of());
    }

    public SortedSet<LocalDate> dates() {
        SortedSet<LocalDate> dates = new TreeSet<>(assignments.keySet());
        dates.addAll(failures.keySet());
        return dates;
    }

    public boolean isComplete() {
        return failures.isEmpty();
    }
}
