package io.github.riemr.sampling.domain.model;

public enum DayStatus {
    /** ソルバーが最適性を証明した */
    OPTIMAL,
    /** 実行可能解（最適性は未証明） */
    FEASIBLE,
    /** 当日作業可能な作業者がいない。全枠未割当で正常終了 */
    NO_ELIGIBLE_WORKERS
}
