package io.github.riemr.sampling.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * 業務マスタ 1 行分。スケジュール上の業務名はこのマスタと照合される。
 */
@Value
@Builder(toBuilder = true)
public class TaskDefinition {

    /** 船上作業・操船要件がこの値以上のとき要件として扱う */
    public static final int REQUIREMENT_THRESHOLD = 3;

    int id;
    String name;
    /** 同一日に 1 人が従事できるのは 1 地区のみ */
    String area;
    /** 配置人数の上限（満たせなくてもよい） */
    int requiredWorkers;
    int requiredSkill;
    int requiredStrength;
    int urgency;
    int requiresVesselWork;
    int requiresNavigation;
    /** 所要時間（時間） */
    double duration;

    public boolean vesselWorkRequired() {
        return requiresVesselWork >= REQUIREMENT_THRESHOLD;
    }

    public boolean navigationRequired() {
        return requiresNavigation >= REQUIREMENT_THRESHOLD;
    }
}
