package io.github.riemr.sampling.domain.exception;

import io.github.riemr.sampling.domain.model.DayFailure;

/**
 * 1 日分の最適化がソルバー側の理由で失敗した。他の日の処理は継続する。
 */
public class DayOptimizationException extends RuntimeException {

    private final transient DayFailure failure;

    public DayOptimizationException(DayFailure failure) {
        super(failure.date() + ": " + failure.kind() + " - " + failure.message());
        this.failure = failure;
    }

    public DayFailure getFailure() {
        return failure;
    }
}
