package io.github.riemr.sampling.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * 作業者マスタ 1 行分。ロード後は読み取り専用。
 * <p>
 * trouble は値が小さいほど良い記述用の評価で、スコア計算には使わない。
 * 船上・操船は 0 が不可、1 以上が能力の段階（○/× で書かれたマスタは 1/0）。
 */
@Value
@Builder(toBuilder = true)
public class Worker {
    String name;
    int priority;
    int skill;
    int strength;
    int temperament;
    int troubleTolerance;
    int vesselAbility;
    boolean canDrive;
    int navigationAbility;
    /** 分析業務を優先する作業者（サンプリングへの割当を控えめにする） */
    boolean analysisPriority;
    @Singular
    List<AvailabilityRule> availabilityRules;
    /** 取り込み元の備考欄（表示用） */
    String notes;

    public boolean isCanWorkOnVessel() {
        return vesselAbility > 0;
    }

    public boolean isCanNavigate() {
        return navigationAbility > 0;
    }

    public boolean isAvailableOn(LocalDate date) {
        for (AvailabilityRule rule : availabilityRules) {
            if (!rule.permits(date)) {
                return false;
            }
        }
        return true;
    }

    public static class WorkerBuilder {
        public WorkerBuilder canWorkOnVessel(boolean able) {
            return vesselAbility(able ? 1 : 0);
        }

        public WorkerBuilder canNavigate(boolean able) {
            return navigationAbility(able ? 1 : 0);
        }
    }
}
