package io.github.riemr.sampling.optimization.model;

import java.util.List;

/**
 * Σ coefficient·x (≤ | ≥ | =) rhs。係数・右辺は整数のみ扱う。
 */
public record LinearConstraint(int index, String name, List<LinearTerm> terms, ConstraintSense sense, int rhs) {

    public LinearConstraint {
        terms = List.copyOf(terms);
    }

    public int leftHandSide(boolean[] values) {
        int lhs = 0;
        for (LinearTerm t : terms) {
            if (values[t.variable()]) {
                lhs += t.coefficient();
            }
        }
        return lhs;
    }

    /** 右辺からのはみ出し量。満たしていれば 0 */
    public int violation(int lhs) {
        return switch (sense) {
            case LESS_OR_EQUAL -> Math.max(0, lhs - rhs);
            case GREATER_OR_EQUAL -> Math.max(0, rhs - lhs);
            case EQUAL -> Math.abs(lhs - rhs);
        };
    }

    public boolean isSatisfiedBy(boolean[] values) {
        return violation(leftHandSide(values)) == 0;
    }
}
