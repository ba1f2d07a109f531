package io.github.riemr.sampling.optimization.scoring;

/**
 * 適性スコアの重み。不足側のペナルティを余裕側のボーナスより急にして、最低要件を満たす配置へ寄せる。
 *
 * @param skillBase             技量が要件以上のときの基本点
 * @param skillSurplus          技量の余裕 1 あたりの加点
 * @param skillDeficit          技量の不足 1 あたりの減点
 * @param strengthBase          体力が要件以上のときの基本点
 * @param strengthSurplus       体力の余裕 1 あたりの加点
 * @param strengthDeficit       体力の不足 1 あたりの減点
 * @param vesselBase            船上作業能力が要件以上のときの基本点
 * @param vesselSurplus         船上作業能力の余裕 1 あたりの加点
 * @param vesselDeficit         船上作業能力の不足 1 あたりの減点
 * @param navigationBase        操船可能な作業者の基本点
 * @param navigationPerLevel    操船能力 1 あたりの加点
 * @param navigationMissing     操船できない作業者への減点（除外ではない）
 * @param analysisPriorityPenalty 分析優先の作業者に全業務で加える補正
 */
public record ScoringWeights(double skillBase,
                             double skillSurplus,
                             double skillDeficit,
                             double strengthBase,
                             double strengthSurplus,
                             double strengthDeficit,
                             double vesselBase,
                             double vesselSurplus,
                             double vesselDeficit,
                             double navigationBase,
                             double navigationPerLevel,
                             double navigationMissing,
                             double analysisPriorityPenalty) {

    public static ScoringWeights defaults() {
        return new ScoringWeights(
                30, 5, 20,
                20, 3, 15,
                15, 2, 10,
                10, 2, -30,
                -20);
    }
}
