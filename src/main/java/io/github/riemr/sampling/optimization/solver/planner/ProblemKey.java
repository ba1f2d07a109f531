package io.github.riemr.sampling.optimization.solver.planner;

import java.util.Objects;

/**
 * SolverManager の問題識別子。同じ日付の問題が並行して投入されても衝突しないよう連番を持つ。
 */
public final class ProblemKey {
    private final String programName;
    private final long sequence;

    public ProblemKey(String programName, long sequence) {
        this.programName = programName;
        this.sequence = sequence;
    }

    public String getProgramName() { return programName; }
    public long getSequence() { return sequence; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProblemKey that = (ProblemKey) o;
        return sequence == that.sequence && Objects.equals(programName, that.programName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(programName, sequence);
    }

    @Override
    public String toString() {
        return programName + "#" + sequence;
    }
}
