package io.github.riemr.sampling.optimization.model;

/**
 * 制約行の 1 項（係数 × 0-1 変数）。
 */
public record LinearTerm(int variable, int coefficient) {
}
