package io.github.riemr.sampling.optimization.solver;

public enum SolverStatus {
    OPTIMAL,
    FEASIBLE,
    INFEASIBLE,
    ERROR,
    TIMEOUT;

    public boolean hasSolution() {
        return this == OPTIMAL || this == FEASIBLE;
    }
}
