package io.github.riemr.sampling.optimization.solver;

import lombok.Value;

/**
 * ソルバーの結果。values は status が OPTIMAL / FEASIBLE のときのみ意味を持つ。
 */
@Value
public class SolverOutcome {
    SolverStatus status;
    boolean[] values;
    double objectiveValue;
    long wallTimeMillis;
    String message;

    public static SolverOutcome solved(SolverStatus status, boolean[] values, double objectiveValue, long wallTimeMillis) {
        return new SolverOutcome(status, values, objectiveValue, wallTimeMillis, null);
    }

    public static SolverOutcome failed(SolverStatus status, String message, long wallTimeMillis) {
        return new SolverOutcome(status, new boolean[0], 0.0, wallTimeMillis, message);
    }

    public boolean hasSolution() {
        return status.hasSolution();
    }
}
