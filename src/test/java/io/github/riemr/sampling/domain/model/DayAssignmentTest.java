package io.github.riemr.sampling.domain.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DayAssignmentTest {

    private static final LocalDate DAY = LocalDate.of(2025, 4, 1);

    @Test
    void byTaskName_concatenatesRepeatedNamesInSlotOrder() {
        DayAssignment day = new DayAssignment(DAY, DayStatus.OPTIMAL, 0.0, List.of(
                new TaskAssignment(0, "T", "A", false, List.of("a")),
                new TaskAssignment(1, "U", "A", false, List.of()),
                new TaskAssignment(2, "T", "A", false, List.of("b", "c"))));

        Map<String, List<String>> byName = day.byTaskName();

        assertThat(byName.keySet()).containsExactly("T", "U");
        assertThat(byName.get("T")).containsExactly("a", "b", "c");
        assertThat(byName.get("U")).isEmpty();
        assertThat(day.assignedCount()).isEqualTo(3);
    }

    @Test
    void scheduleResult_datesIsUnionOfAssignmentsAndFailures() {
        LocalDate next = DAY.plusDays(1);
        ScheduleResult result = new ScheduleResult(
                Map.of(next, new DayAssignment(next, DayStatus.OPTIMAL, 0.0, List.of())),
                Map.of(DAY, new DayFailure(DAY, DayFailureKind.CANCELLED, "x", null)));

        assertThat(result.dates()).containsExactly(DAY, next);
        assertThat(result.getFailures().get(DAY).taskNames()).isEmpty();
        assertThat(ScheduleResult.empty().isComplete()).isTrue();
    }

    @Test
    void masterData_groupsScheduleByDateKeepingEntryOrder() {
        MasterData data = MasterData.builder()
                .entry(new ScheduleEntry(DAY.plusDays(1), "x"))
                .entry(new ScheduleEntry(DAY, "y"))
                .entry(new ScheduleEntry(DAY.plusDays(1), "x"))
                .build();

        assertThat(data.scheduleByDate().keySet()).containsExactly(DAY, DAY.plusDays(1));
        assertThat(data.tasksOn(DAY.plusDays(1))).containsExactly("x", "x");
        assertThat(data.hasDate(DAY.plusDays(2))).isFalse();
        assertThat(data.tasksOn(DAY.plusDays(2))).isEmpty();
    }

    @Test
    void weekdayRestriction_requiresAtLeastOneDay() {
        assertThatThrownBy(() -> new WeekdayRestriction(java.util.Set.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
