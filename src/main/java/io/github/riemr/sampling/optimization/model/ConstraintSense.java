package io.github.riemr.sampling.optimization.model;

public enum ConstraintSense {
    LESS_OR_EQUAL,
    GREATER_OR_EQUAL,
    EQUAL
}
