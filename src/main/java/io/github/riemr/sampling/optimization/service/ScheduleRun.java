package io.github.riemr.sampling.optimization.service;

import io.github.riemr.sampling.domain.exception.DayOptimizationException;
import io.github.riemr.sampling.domain.model.DayAssignment;
import io.github.riemr.sampling.domain.model.DayFailure;
import io.github.riemr.sampling.domain.model.DayFailureKind;
import io.github.riemr.sampling.domain.model.ScheduleResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 実行中のスケジュール最適化。{@link #cancel()} で未完了の日を中断できる（完了済みの日の結果は残る）。
 */
@Slf4j
public class ScheduleRun {

    private final Map<LocalDate, Future<DayAssignment>> futures;
    private final Map<LocalDate, List<String>> tasksByDate;
    private final ExecutorService pool;
    private final Duration guardTimeout;

    private volatile boolean cancelled;
    private ScheduleResult result;

    ScheduleRun(Map<LocalDate, Future<DayAssignment>> futures, Map<LocalDate, List<String>> tasksByDate,
                ExecutorService pool, Duration guardTimeout) {
        this.futures = new LinkedHashMap<>(futures);
        this.tasksByDate = tasksByDate;
        this.pool = pool;
        this.guardTimeout = guardTimeout;
    }

    public void cancel() {
        cancelled = true;
        futures.values().forEach(f -> f.cancel(true));
        pool.shutdownNow();
        log.info("Schedule run cancelled");
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public boolean isDone() {
        return futures.values().stream().allMatch(Future::isDone);
    }

    /**
     * 全日の完了を待って結果をまとめる。各日の待機は timeLimit + 猶予まで。
     * 2 回目以降の呼び出しは最初の結果を返す。
     */
    public synchronized ScheduleResult awaitResult() {
        if (result != null) {
            return result;
        }
        Map<LocalDate, DayAssignment> assignments = new TreeMap<>();
        Map<LocalDate, DayFailure> failures = new TreeMap<>();
        boolean interrupted = false;

        for (Map.Entry<LocalDate, Future<DayAssignment>> e : futures.entrySet()) {
            LocalDate date = e.getKey();
            Future<DayAssignment> future = e.getValue();
            List<String> taskNames = tasksByDate.getOrDefault(date, List.of());
            try {
                if (interrupted && !future.isDone()) {
                    future.cancel(true);
                    failures.put(date, new DayFailure(date, DayFailureKind.CANCELLED, "Run interrupted", taskNames));
                    continue;
                }
                assignments.put(date, future.get(guardTimeout.toMillis(), TimeUnit.MILLISECONDS));
            } catch (ExecutionException ex) {
                DayFailure failure = toFailure(date, taskNames, ex.getCause());
                log.warn("{}: day failed ({}): {}", date, failure.kind(), failure.message());
                failures.put(date, failure);
            } catch (TimeoutException ex) {
                future.cancel(true);
                log.warn("{}: no result within {}", date, guardTimeout);
                failures.put(date, new DayFailure(date, DayFailureKind.TIMEOUT,
                        "No result within " + guardTimeout, taskNames));
            } catch (CancellationException ex) {
                failures.put(date, new DayFailure(date, DayFailureKind.CANCELLED, "Cancelled", taskNames));
            } catch (InterruptedException ex) {
                interrupted = true;
                future.cancel(true);
                failures.put(date, new DayFailure(date, DayFailureKind.CANCELLED, "Run interrupted", taskNames));
            }
        }
        pool.shutdownNow();
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        result = new ScheduleResult(assignments, failures);
        log.info("Schedule run finished: {} day(s) optimized, {} failed", assignments.size(), failures.size());
        return result;
    }

    private DayFailure toFailure(LocalDate date, List<String> taskNames, Throwable cause) {
        if (cause instanceof DayOptimizationException doe) {
            return doe.getFailure();
        }
        if (cancelled) {
            return new DayFailure(date, DayFailureKind.CANCELLED, "Cancelled", taskNames);
        }
        String message = cause == null ? "unknown error" : cause.getClass().getSimpleName() + ": " + cause.getMessage();
        return new DayFailure(date, DayFailureKind.SOLVER_ERROR, message, taskNames);
    }
}
