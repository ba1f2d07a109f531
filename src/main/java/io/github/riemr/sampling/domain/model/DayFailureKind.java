package io.github.riemr.sampling.domain.model;

public enum DayFailureKind {
    SOLVER_INFEASIBLE,
    SOLVER_ERROR,
    TIMEOUT,
    CANCELLED
}
