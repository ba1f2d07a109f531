package io.github.riemr.sampling.optimization.config;

import java.time.Duration;

/**
 * 日次最適化の実行設定。
 *
 * @param timeLimit   1 日あたりのソルバー時間上限
 * @param parallelism 同時に解く日数
 * @param grace       日次ジョブ待機時に timeLimit へ上乗せする猶予
 */
public record SolverSettings(Duration timeLimit, int parallelism, Duration grace) {

    public SolverSettings {
        if (timeLimit == null || timeLimit.isNegative() || timeLimit.isZero()) {
            throw new IllegalArgumentException("timeLimit must be positive: " + timeLimit);
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1: " + parallelism);
        }
        grace = grace == null ? Duration.ZERO : grace;
    }

    public Duration guardTimeout() {
        return timeLimit.plus(grace);
    }
}
