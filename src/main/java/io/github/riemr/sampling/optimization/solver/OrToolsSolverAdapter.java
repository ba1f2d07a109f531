package io.github.riemr.sampling.optimization.solver;

import com.google.ortools.Loader;
import com.google.ortools.linearsolver.MPConstraint;
import com.google.ortools.linearsolver.MPObjective;
import com.google.ortools.linearsolver.MPSolver;
import com.google.ortools.linearsolver.MPVariable;
import io.github.riemr.sampling.optimization.model.AssignmentModel;
import io.github.riemr.sampling.optimization.model.BinaryProgram;
import io.github.riemr.sampling.optimization.model.LinearConstraint;
import io.github.riemr.sampling.optimization.model.LinearTerm;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * OR-Tools の MPSolver（既定は SCIP）による厳密解法。
 */
@Slf4j
public class OrToolsSolverAdapter implements SolverAdapter {

    private static boolean nativeLoaded = false;

    private final String backend;

    public OrToolsSolverAdapter(String backend) {
        this.backend = backend;
    }

    private static synchronized void ensureNativeLoaded() {
        if (!nativeLoaded) {
            Loader.loadNativeLibraries();
            nativeLoaded = true;
        }
    }

    @Override
    public SolverOutcome solve(AssignmentModel model, Duration timeLimit) {
        return solve(model.getProgram(), timeLimit);
    }

    public SolverOutcome solve(BinaryProgram program, Duration timeLimit) {
        long started = System.currentTimeMillis();
        try {
            ensureNativeLoaded();
        } catch (RuntimeException | LinkageError e) {
            log.error("Failed to load OR-Tools native libraries", e);
            return SolverOutcome.failed(SolverStatus.ERROR, "OR-Tools native libraries unavailable: " + e.getMessage(),
                    System.currentTimeMillis() - started);
        }

        MPSolver solver = MPSolver.createSolver(backend);
        if (solver == null) {
            return SolverOutcome.failed(SolverStatus.ERROR, "Could not create solver " + backend,
                    System.currentTimeMillis() - started);
        }
        try {
            int n = program.variableCount();
            MPVariable[] vars = new MPVariable[n];
            for (int i = 0; i < n; i++) {
                vars[i] = solver.makeBoolVar(program.variableName(i));
            }

            double infinity = MPSolver.infinity();
            for (LinearConstraint c : program.getConstraints()) {
                MPConstraint row = switch (c.sense()) {
                    case LESS_OR_EQUAL -> solver.makeConstraint(-infinity, c.rhs(), c.name());
                    case GREATER_OR_EQUAL -> solver.makeConstraint(c.rhs(), infinity, c.name());
                    case EQUAL -> solver.makeConstraint(c.rhs(), c.rhs(), c.name());
                };
                for (LinearTerm t : c.terms()) {
                    row.setCoefficient(vars[t.variable()], t.coefficient());
                }
            }

            MPObjective objective = solver.objective();
            for (int i = 0; i < n; i++) {
                objective.setCoefficient(vars[i], program.objectiveCoefficient(i));
            }
            objective.setMaximization();

            if (timeLimit != null && !timeLimit.isZero() && !timeLimit.isNegative()) {
                solver.setTimeLimit(timeLimit.toMillis());
            }
            if (Thread.currentThread().isInterrupted()) {
                return SolverOutcome.failed(SolverStatus.ERROR, "Interrupted before solve",
                        System.currentTimeMillis() - started);
            }

            MPSolver.ResultStatus resultStatus = solver.solve();
            long elapsed = System.currentTimeMillis() - started;
            log.debug("{} solved by {}: status={}, wall={}ms", program.getName(), backend, resultStatus, elapsed);

            if (resultStatus == MPSolver.ResultStatus.OPTIMAL || resultStatus == MPSolver.ResultStatus.FEASIBLE) {
                boolean[] values = new boolean[n];
                for (int i = 0; i < n; i++) {
                    // 浮動小数の誤差を考慮して 0.5 で判定
                    values[i] = vars[i].solutionValue() > 0.5;
                }
                SolverStatus status = resultStatus == MPSolver.ResultStatus.OPTIMAL
                        ? SolverStatus.OPTIMAL : SolverStatus.FEASIBLE;
                return SolverOutcome.solved(status, values, objective.value(), elapsed);
            }
            if (resultStatus == MPSolver.ResultStatus.INFEASIBLE) {
                return SolverOutcome.failed(SolverStatus.INFEASIBLE, "Solver reported infeasible", elapsed);
            }
            if (resultStatus == MPSolver.ResultStatus.NOT_SOLVED) {
                return SolverOutcome.failed(SolverStatus.TIMEOUT, "No solution within " + timeLimit, elapsed);
            }
            return SolverOutcome.failed(SolverStatus.ERROR, "Solver status " + resultStatus, elapsed);
        } finally {
            solver.delete();
        }
    }

    @Override
    public String name() {
        return "ortools-" + backend;
    }
}
