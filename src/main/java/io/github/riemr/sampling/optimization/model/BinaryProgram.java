package io.github.riemr.sampling.optimization.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 0-1 変数・線形制約・線形目的関数（最大化）からなる整数計画。
 * ソルバーアダプタへの受け渡し単位で、ソルバー固有の型は持たない。
 */
public class BinaryProgram {

    private final String name;
    private final List<String> variableNames = new ArrayList<>();
    private final List<Double> objective = new ArrayList<>();
    private final List<LinearConstraint> constraints = new ArrayList<>();

    public BinaryProgram(String name) {
        this.name = name;
    }

    /** @return 追加した変数の添字 */
    public int addVariable(String variableName) {
        variableNames.add(variableName);
        objective.add(0.0);
        return variableNames.size() - 1;
    }

    public void setObjectiveCoefficient(int variable, double coefficient) {
        objective.set(variable, coefficient);
    }

    public LinearConstraint addConstraint(String constraintName, List<LinearTerm> terms, ConstraintSense sense, int rhs) {
        for (LinearTerm t : terms) {
            if (t.variable() < 0 || t.variable() >= variableNames.size()) {
                throw new IllegalArgumentException("Unknown variable " + t.variable() + " in " + constraintName);
            }
        }
        LinearConstraint c = new LinearConstraint(constraints.size(), constraintName, terms, sense, rhs);
        constraints.add(c);
        return c;
    }

    public String getName() {
        return name;
    }

    public int variableCount() {
        return variableNames.size();
    }

    public String variableName(int variable) {
        return variableNames.get(variable);
    }

    public double objectiveCoefficient(int variable) {
        return objective.get(variable);
    }

    public List<LinearConstraint> getConstraints() {
        return Collections.unmodifiableList(constraints);
    }

    public double objectiveValue(boolean[] values) {
        double total = 0.0;
        for (int i = 0; i < values.length; i++) {
            if (values[i]) total += objective.get(i);
        }
        return total;
    }

    public boolean isSatisfiedBy(boolean[] values) {
        if (values.length != variableNames.size()) return false;
        for (LinearConstraint c : constraints) {
            if (!c.isSatisfiedBy(values)) return false;
        }
        return true;
    }

    @Override
    public String toString() {
        return name + "[vars=" + variableNames.size() + ", constraints=" + constraints.size() + "]";
    }
}
