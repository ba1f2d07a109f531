package io.github.riemr.sampling.optimization.solver.planner;

import io.github.riemr.sampling.optimization.model.AssignmentModel;
import io.github.riemr.sampling.optimization.model.BinaryProgram;
import io.github.riemr.sampling.optimization.solver.SolverAdapter;
import io.github.riemr.sampling.optimization.solver.SolverOutcome;
import io.github.riemr.sampling.optimization.solver.SolverStatus;
import lombok.extern.slf4j.Slf4j;
import org.optaplanner.core.api.solver.SolverJob;
import org.optaplanner.core.api.solver.SolverManager;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * OptaPlanner の局所探索による近似解法。最適性は証明できないため解は FEASIBLE 扱い。
 * 探索は未改善ステップ数で打ち切るので、上限時間内に収まれば同じ入力に同じ解を返す。
 */
@Slf4j
public class OptaPlannerSolverAdapter implements SolverAdapter {

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final SolverManager<SeatAssignmentSolution, ProblemKey> solverManager;

    public OptaPlannerSolverAdapter(SolverManager<SeatAssignmentSolution, ProblemKey> solverManager) {
        this.solverManager = solverManager;
    }

    @Override
    public SolverOutcome solve(AssignmentModel model, Duration timeLimit) {
        long started = System.currentTimeMillis();
        BinaryProgram program = model.getProgram();
        SeatAssignmentSolution problem = SeatAssignmentSolution.of(model);
        if (problem.getSeatList().isEmpty()) {
            // 正のスコアを持つ組がない: 全員未割当が最適
            return SolverOutcome.solved(SolverStatus.OPTIMAL, new boolean[program.variableCount()], 0.0,
                    System.currentTimeMillis() - started);
        }

        ProblemKey key = new ProblemKey(program.getName(), SEQUENCE.incrementAndGet());
        SolverJob<SeatAssignmentSolution, ProblemKey> job = solverManager.solve(key, problem);
        // 上限時間で早期終了させるタイマー
        ScheduledExecutorService killer = Executors.newSingleThreadScheduledExecutor();
        if (timeLimit != null && !timeLimit.isZero() && !timeLimit.isNegative()) {
            killer.schedule(() -> solverManager.terminateEarly(key), timeLimit.toMillis(), TimeUnit.MILLISECONDS);
        }
        try {
            SeatAssignmentSolution best = job.getFinalBestSolution();
            long elapsed = System.currentTimeMillis() - started;
            boolean[] values = best.toValues(model);
            if (!program.isSatisfiedBy(values)) {
                log.warn("{}: best solution still violates constraints (score={})", key, best.getScore());
                return SolverOutcome.failed(SolverStatus.INFEASIBLE,
                        "Best solution violates constraints, score=" + best.getScore(), elapsed);
            }
            log.debug("{} solved: score={}, seats={}, wall={}ms", key, best.getScore(), best.getSeatList().size(), elapsed);
            return SolverOutcome.solved(SolverStatus.FEASIBLE, values, program.objectiveValue(values), elapsed);
        } catch (InterruptedException e) {
            solverManager.terminateEarly(key);
            Thread.currentThread().interrupt();
            return SolverOutcome.failed(SolverStatus.ERROR, "Interrupted while solving",
                    System.currentTimeMillis() - started);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("{} failed: {}", key, cause.getMessage(), cause);
            return SolverOutcome.failed(SolverStatus.ERROR, cause.getMessage(),
                    System.currentTimeMillis() - started);
        } finally {
            killer.shutdownNow();
        }
    }

    @Override
    public String name() {
        return "optaplanner";
    }
}
