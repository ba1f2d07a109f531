package io.github.riemr.sampling.optimization.service;

import io.github.riemr.sampling.domain.exception.DayOptimizationException;
import io.github.riemr.sampling.domain.exception.InvalidInputException;
import io.github.riemr.sampling.domain.model.DayAssignment;
import io.github.riemr.sampling.domain.model.DayFailure;
import io.github.riemr.sampling.domain.model.DayFailureKind;
import io.github.riemr.sampling.domain.model.DayStatus;
import io.github.riemr.sampling.domain.model.MasterData;
import io.github.riemr.sampling.domain.model.ScheduleEntry;
import io.github.riemr.sampling.domain.model.ScheduleResult;
import io.github.riemr.sampling.optimization.config.SolverSettings;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static io.github.riemr.sampling.support.Fixtures.task;
import static io.github.riemr.sampling.support.Fixtures.worker;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ScheduleOptimizerTest {

    private static final LocalDate D1 = LocalDate.of(2025, 4, 1);
    private static final LocalDate D2 = LocalDate.of(2025, 4, 2);
    private static final LocalDate D3 = LocalDate.of(2025, 4, 3);

    private final DayOptimizer dayOptimizer = mock(DayOptimizer.class);

    private ScheduleOptimizer optimizer(Duration timeLimit, int parallelism) {
        return new ScheduleOptimizer(dayOptimizer, new MasterDataValidator(),
                new SolverSettings(timeLimit, parallelism, Duration.ofMillis(200)));
    }

    @Test
    void optimize_recordsFailedDayAndKeepsOthers() {
        MasterData data = data(D1, D2, D3);
        when(dayOptimizer.optimize(eq(D1), anyList(), any())).thenReturn(day(D1));
        when(dayOptimizer.optimize(eq(D2), anyList(), any())).thenThrow(new DayOptimizationException(
                new DayFailure(D2, DayFailureKind.SOLVER_INFEASIBLE, "infeasible", List.of("T"))));
        when(dayOptimizer.optimize(eq(D3), anyList(), any())).thenReturn(day(D3));

        ScheduleResult result = optimizer(Duration.ofSeconds(5), 2).optimize(data);

        assertThat(result.getAssignments()).containsOnlyKeys(D1, D3);
        assertThat(result.getFailures()).containsOnlyKeys(D2);
        assertThat(result.getFailures().get(D2).kind()).isEqualTo(DayFailureKind.SOLVER_INFEASIBLE);
        assertThat(result.dates()).containsExactly(D1, D2, D3);
        assertThat(result.isComplete()).isFalse();
    }

    @Test
    void optimize_passesTasksOfEachDateInScheduleOrder() {
        MasterData data = MasterData.builder()
                .worker(worker("a", 3, 3).build())
                .task(task(1, "T", "A", 1).build())
                .entry(new ScheduleEntry(D2, "x"))
                .entry(new ScheduleEntry(D1, "y"))
                .entry(new ScheduleEntry(D2, "z"))
                .build();
        when(dayOptimizer.optimize(any(), anyList(), any())).thenAnswer(inv -> day(inv.getArgument(0)));

        ScheduleResult result = optimizer(Duration.ofSeconds(5), 1).optimize(data);

        assertThat(result.getAssignments().keySet()).containsExactly(D1, D2);
        verify(dayOptimizer).optimize(eq(D2), eq(List.of("x", "z")), eq(data));
        verify(dayOptimizer).optimize(eq(D1), eq(List.of("y")), eq(data));
    }

    @Test
    void optimize_recordsUnexpectedExceptionAsSolverError() {
        MasterData data = data(D1);
        when(dayOptimizer.optimize(eq(D1), anyList(), any())).thenThrow(new IllegalStateException("native crash"));

        ScheduleResult result = optimizer(Duration.ofSeconds(5), 1).optimize(data);

        DayFailure failure = result.getFailures().get(D1);
        assertThat(failure.kind()).isEqualTo(DayFailureKind.SOLVER_ERROR);
        assertThat(failure.message()).contains("native crash");
        assertThat(failure.taskNames()).containsExactly("T");
    }

    @Test
    void optimize_recordsTimeout_whenDayExceedsGuard() {
        MasterData data = data(D1, D2);
        when(dayOptimizer.optimize(eq(D1), anyList(), any())).thenReturn(day(D1));
        doAnswer(inv -> {
            Thread.sleep(10_000);
            return day(D2);
        }).when(dayOptimizer).optimize(eq(D2), anyList(), any());

        ScheduleResult result = optimizer(Duration.ofMillis(300), 2).optimize(data);

        assertThat(result.getAssignments()).containsOnlyKeys(D1);
        assertThat(result.getFailures().get(D2).kind()).isEqualTo(DayFailureKind.TIMEOUT);
    }

    @Test
    void cancel_marksOutstandingDaysCancelled_andKeepsCompletedOnes() throws Exception {
        MasterData data = data(D1, D2, D3);
        CountDownLatch blocking = new CountDownLatch(1);
        when(dayOptimizer.optimize(eq(D1), anyList(), any())).thenReturn(day(D1));
        doAnswer(inv -> {
            blocking.countDown();
            Thread.sleep(30_000);
            return day(D2);
        }).when(dayOptimizer).optimize(eq(D2), anyList(), any());
        when(dayOptimizer.optimize(eq(D3), anyList(), any())).thenReturn(day(D3));

        ScheduleRun run = optimizer(Duration.ofSeconds(30), 1).start(data);
        assertThat(blocking.await(5, TimeUnit.SECONDS)).isTrue();
        run.cancel();
        ScheduleResult result = run.awaitResult();

        assertThat(run.isCancelled()).isTrue();
        assertThat(result.getAssignments()).containsOnlyKeys(D1);
        assertThat(result.getFailures()).containsOnlyKeys(D2, D3);
        assertThat(result.getFailures().values()).extracting(DayFailure::kind)
                .containsOnly(DayFailureKind.CANCELLED);
        assertThat(result.dates()).containsExactly(D1, D2, D3);
    }

    @Test
    void start_rejectsInvalidInput_beforeSolvingAnyDay() {
        MasterData invalid = MasterData.builder()
                .task(task(1, "T", "A", 1).build())
                .entry(new ScheduleEntry(D1, "T"))
                .build();

        assertThatThrownBy(() -> optimizer(Duration.ofSeconds(5), 1).start(invalid))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("worker registry is empty");
        verify(dayOptimizer, never()).optimize(any(), anyList(), any());
    }

    @Test
    void optimize_returnsEmptyResult_whenScheduleEmpty() {
        MasterData data = MasterData.builder()
                .worker(worker("a", 3, 3).build())
                .task(task(1, "T", "A", 1).build())
                .build();

        ScheduleResult result = optimizer(Duration.ofSeconds(5), 2).optimize(data);

        assertThat(result.dates()).isEmpty();
        assertThat(result.isComplete()).isTrue();
    }

    private static MasterData data(LocalDate... dates) {
        MasterData.MasterDataBuilder b = MasterData.builder()
                .worker(worker("a", 3, 3).build())
                .task(task(1, "T", "A", 1).build());
        for (LocalDate d : dates) {
            b.entry(new ScheduleEntry(d, "T"));
        }
        return b.build();
    }

    private static DayAssignment day(LocalDate date) {
        return new DayAssignment(date, DayStatus.OPTIMAL, 0.0, List.of());
    }
}
