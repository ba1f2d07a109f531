package io.github.riemr.sampling.optimization.scoring;

import io.github.riemr.sampling.domain.model.TaskDefinition;
import io.github.riemr.sampling.domain.model.Worker;
import org.springframework.stereotype.Component;

/**
 * 作業者と業務の適性スコア。高いほど適任。副作用なし・同一入力に対して常に同じ値。
 */
@Component
public class SuitabilityScorer {

    private final ScoringWeights weights;

    public SuitabilityScorer(ScoringWeights weights) {
        this.weights = weights;
    }

    public double score(Worker worker, TaskDefinition task) {
        double score = 0.0;

        // 技量（最重要）
        score += graded(worker.getSkill() - task.getRequiredSkill(),
                weights.skillBase(), weights.skillSurplus(), weights.skillDeficit());

        // 体力
        score += graded(worker.getStrength() - task.getRequiredStrength(),
                weights.strengthBase(), weights.strengthSurplus(), weights.strengthDeficit());

        // 船上作業
        if (task.vesselWorkRequired()) {
            score += graded(worker.getVesselAbility() - task.getRequiresVesselWork(),
                    weights.vesselBase(), weights.vesselSurplus(), weights.vesselDeficit());
        }

        // 操船
        if (task.navigationRequired()) {
            if (worker.isCanNavigate()) {
                score += weights.navigationBase() + weights.navigationPerLevel() * worker.getNavigationAbility();
            } else {
                score += weights.navigationMissing();
            }
        }
        return score;
    }

    /** 作業者単位の補正。業務に依らず全スコアに加算する */
    public double priorityAdjustment(Worker worker) {
        return worker.isAnalysisPriority() ? weights.analysisPriorityPenalty() : 0.0;
    }

    public ScoringWeights getWeights() {
        return weights;
    }

    private static double graded(int diff, double base, double surplus, double deficit) {
        if (diff >= 0) {
            return base + diff * surplus;
        }
        return -Math.abs(diff) * deficit;
    }
}
