package io.github.riemr.sampling.optimization.service;

import io.github.riemr.sampling.domain.exception.DayOptimizationException;
import io.github.riemr.sampling.domain.model.DayAssignment;
import io.github.riemr.sampling.domain.model.DayFailure;
import io.github.riemr.sampling.domain.model.DayFailureKind;
import io.github.riemr.sampling.domain.model.DayStatus;
import io.github.riemr.sampling.domain.model.MasterData;
import io.github.riemr.sampling.domain.model.ResolvedTask;
import io.github.riemr.sampling.domain.model.TaskAssignment;
import io.github.riemr.sampling.domain.model.Worker;
import io.github.riemr.sampling.optimization.availability.AvailabilityFilter;
import io.github.riemr.sampling.optimization.config.SolverSettings;
import io.github.riemr.sampling.optimization.model.AssignmentModel;
import io.github.riemr.sampling.optimization.model.AssignmentModelBuilder;
import io.github.riemr.sampling.optimization.resolve.TaskResolver;
import io.github.riemr.sampling.optimization.solver.SolverAdapter;
import io.github.riemr.sampling.optimization.solver.SolverOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * 1 日分の割当を解く。業務名の照合 → 出勤可否での絞り込み → 整数計画の構築 → 求解 → 結果の復元。
 * ソルバーが解を返せなかった日は空の割当ではなく {@link DayOptimizationException} で通知する。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DayOptimizer {

    private final TaskResolver taskResolver;
    private final AvailabilityFilter availabilityFilter;
    private final AssignmentModelBuilder modelBuilder;
    private final SolverAdapter solverAdapter;
    private final SolverSettings settings;

    public DayAssignment optimize(LocalDate date, List<String> taskNames, MasterData data) {
        List<ResolvedTask> tasks = new ArrayList<>(taskNames.size());
        for (int slot = 0; slot < taskNames.size(); slot++) {
            tasks.add(taskResolver.resolve(taskNames.get(slot), date, slot, data.getTasks()));
        }

        List<Worker> eligible = availabilityFilter.eligibleOn(data.getWorkers(), date);
        if (eligible.isEmpty()) {
            log.info("{}: no eligible workers, {} task(s) left unassigned", date, tasks.size());
            return new DayAssignment(date, DayStatus.NO_ELIGIBLE_WORKERS, 0.0,
                    tasks.stream().map(TaskAssignment::unassigned).toList());
        }
        if (tasks.isEmpty()) {
            return new DayAssignment(date, DayStatus.OPTIMAL, 0.0, List.of());
        }
        if (Thread.currentThread().isInterrupted()) {
            throw failure(date, DayFailureKind.CANCELLED, "Cancelled before solving", taskNames);
        }

        AssignmentModel model = modelBuilder.build(date, eligible, tasks);
        SolverOutcome outcome = solverAdapter.solve(model, settings.timeLimit());

        if (!outcome.hasSolution()) {
            if (Thread.currentThread().isInterrupted()) {
                throw failure(date, DayFailureKind.CANCELLED, "Cancelled while solving", taskNames);
            }
            DayFailureKind kind = switch (outcome.getStatus()) {
                case INFEASIBLE -> DayFailureKind.SOLVER_INFEASIBLE;
                case TIMEOUT -> DayFailureKind.TIMEOUT;
                default -> DayFailureKind.SOLVER_ERROR;
            };
            String message = outcome.getMessage() != null ? outcome.getMessage()
                    : solverAdapter.name() + " returned " + outcome.getStatus();
            throw failure(date, kind, message, taskNames);
        }

        DayStatus status = switch (outcome.getStatus()) {
            case OPTIMAL -> DayStatus.OPTIMAL;
            default -> DayStatus.FEASIBLE;
        };
        DayAssignment result = new DayAssignment(date, status, outcome.getObjectiveValue(),
                model.extract(outcome.getValues()));
        log.info("{}: {} objective={} assigned={} eligible={} ({}ms, {})",
                date, status, outcome.getObjectiveValue(), result.assignedCount(), eligible.size(),
                outcome.getWallTimeMillis(), solverAdapter.name());
        return result;
    }

    private static DayOptimizationException failure(LocalDate date, DayFailureKind kind, String message,
                                                    List<String> taskNames) {
        return new DayOptimizationException(new DayFailure(date, kind, message, taskNames));
    }
}
