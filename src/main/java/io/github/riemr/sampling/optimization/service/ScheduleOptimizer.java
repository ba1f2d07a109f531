package io.github.riemr.sampling.optimization.service;

import io.github.riemr.sampling.domain.model.DayAssignment;
import io.github.riemr.sampling.domain.model.MasterData;
import io.github.riemr.sampling.domain.model.ScheduleResult;
import io.github.riemr.sampling.optimization.config.SolverSettings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * スケジュール全体を日付ごとに独立して最適化する。ある日の失敗は他の日に影響しない。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScheduleOptimizer {

    private final DayOptimizer dayOptimizer;
    private final MasterDataValidator validator;
    private final SolverSettings settings;

    /** 全日の完了まで待つ */
    public ScheduleResult optimize(MasterData data) {
        return start(data).awaitResult();
    }

    /**
     * 入力を検証し、日ごとのジョブを投入して即座に返す。
     * 入力不備はここで {@link io.github.riemr.sampling.domain.exception.InvalidInputException} になり、どの日も解かれない。
     */
    public ScheduleRun start(MasterData data) {
        validator.validate(data);
        Map<LocalDate, List<String>> byDate = data.scheduleByDate();
        int parallelism = Math.max(1, Math.min(settings.parallelism(), byDate.size()));
        log.info("Optimizing {} day(s), {} worker(s), parallelism={}",
                byDate.size(), data.getWorkers().size(), parallelism);

        ExecutorService pool = Executors.newFixedThreadPool(parallelism);
        Map<LocalDate, Future<DayAssignment>> futures = new LinkedHashMap<>();
        for (Map.Entry<LocalDate, List<String>> e : byDate.entrySet()) {
            final LocalDate day = e.getKey();
            final List<String> taskNames = e.getValue();
            futures.put(day, pool.submit(() -> dayOptimizer.optimize(day, taskNames, data)));
        }
        pool.shutdown();
        return new ScheduleRun(futures, byDate, pool, settings.guardTimeout());
    }
}
