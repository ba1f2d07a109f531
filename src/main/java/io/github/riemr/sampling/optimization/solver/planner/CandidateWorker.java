package io.github.riemr.sampling.optimization.solver.planner;

/**
 * 席に座らせる候補の作業者（問題事実）。index は割当モデル上の作業者添字。
 */
public record CandidateWorker(int index, String name) {

    @Override
    public String toString() {
        return name;
    }
}
