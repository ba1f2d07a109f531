package io.github.riemr.sampling.application.service;

import io.github.riemr.sampling.application.dto.DataOverviewResponse;
import io.github.riemr.sampling.application.dto.DaySchedule;
import io.github.riemr.sampling.application.dto.FailureDto;
import io.github.riemr.sampling.application.dto.ScheduleViewResponse;
import io.github.riemr.sampling.application.dto.WorkerSummary;
import io.github.riemr.sampling.domain.exception.ScheduleDateNotFoundException;
import io.github.riemr.sampling.domain.model.DayAssignment;
import io.github.riemr.sampling.domain.model.DayFailure;
import io.github.riemr.sampling.domain.model.MasterData;
import io.github.riemr.sampling.domain.model.ScheduleResult;
import io.github.riemr.sampling.domain.model.Worker;
import io.github.riemr.sampling.optimization.service.DayOptimizer;
import io.github.riemr.sampling.optimization.service.MasterDataValidator;
import io.github.riemr.sampling.optimization.service.ScheduleOptimizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 画面・API 向けの窓口。直近の一括最適化結果を保持し、CSV 出力や日別表示に使う。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SamplingAssignmentService {

    private final MasterDataHolder masterDataHolder;
    private final ScheduleOptimizer scheduleOptimizer;
    private final DayOptimizer dayOptimizer;
    private final MasterDataValidator validator;

    private final AtomicReference<ScheduleResult> latestResult = new AtomicReference<>();

    public DataOverviewResponse overview() {
        MasterData data = masterDataHolder.get();
        Map<LocalDate, List<String>> byDate = data.scheduleByDate();
        List<DaySchedule> schedule = new ArrayList<>();
        byDate.forEach((date, tasks) -> schedule.add(new DaySchedule(date, tasks.size(), tasks)));
        List<WorkerSummary> persons = data.getWorkers().stream()
                .map(w -> new WorkerSummary(w.getName(), w.getSkill(), w.getNotes()))
                .toList();
        return new DataOverviewResponse(new ArrayList<>(byDate.keySet()), persons, schedule);
    }

    public ScheduleResult optimizeAll() {
        ScheduleResult result = scheduleOptimizer.optimize(masterDataHolder.get());
        latestResult.set(result);
        return result;
    }

    /** 単日の最適化。直近の一括結果は更新しない */
    public DayAssignment optimizeDay(LocalDate date) {
        MasterData data = masterDataHolder.get();
        if (!data.hasDate(date)) {
            throw new ScheduleDateNotFoundException(date);
        }
        validator.validate(data);
        return dayOptimizer.optimize(date, data.tasksOn(date), data);
    }

    public ScheduleViewResponse scheduleFor(LocalDate date) {
        MasterData data = masterDataHolder.get();
        if (!data.hasDate(date)) {
            throw new ScheduleDateNotFoundException(date);
        }
        ScheduleResult result = latestResult.get();
        DayAssignment day = result == null ? null : result.getAssignments().get(date);
        if (day != null) {
            return new ScheduleViewResponse(true, date, data.tasksOn(date), day.getStatus().name(),
                    day.byTaskName(), day.getTasks(), null);
        }
        DayFailure failure = result == null ? null : result.getFailures().get(date);
        if (failure != null) {
            return new ScheduleViewResponse(true, date, data.tasksOn(date), ScheduleViewResponse.FAILED,
                    Map.of(), List.of(), FailureDto.from(failure));
        }
        return new ScheduleViewResponse(true, date, data.tasksOn(date), ScheduleViewResponse.NOT_OPTIMIZED,
                Map.of(), List.of(), null);
    }

    public List<Worker> persons() {
        return masterDataHolder.get().getWorkers();
    }

    public Optional<ScheduleResult> latestResult() {
        return Optional.ofNullable(latestResult.get());
    }

    /** マスタを読み直す。旧マスタに対する結果は破棄する */
    public MasterData reload() {
        MasterData data = masterDataHolder.reload();
        latestResult.set(null);
        log.info("Master data reloaded from {}", data.getSource());
        return data;
    }
}
