package io.github.riemr.sampling.optimization.solver;

import io.github.riemr.sampling.optimization.model.AssignmentModel;

import java.time.Duration;

/**
 * 1 日分の割当モデルを解くソルバーへの窓口。
 * 実装は呼び出しごとに独立したソルバーインスタンスを使い、並行呼び出しに耐えること。
 * 返す values は {@link AssignmentModel#getProgram()} の変数の並び。
 */
public interface SolverAdapter {

    /**
     * @param model     最大化問題
     * @param timeLimit 1 回の求解の上限時間。超過時は途中解があれば FEASIBLE、なければ TIMEOUT
     */
    SolverOutcome solve(AssignmentModel model, Duration timeLimit);

    String name();
}
