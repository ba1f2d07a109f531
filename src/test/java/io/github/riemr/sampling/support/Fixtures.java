package io.github.riemr.sampling.support;

import io.github.riemr.sampling.domain.model.TaskDefinition;
import io.github.riemr.sampling.domain.model.Worker;

/**
 * テスト用のマスタ生成ヘルパー。要件・能力は中程度、船上/操船要件なしが既定。
 */
public final class Fixtures {
    private Fixtures() {}

    public static Worker.WorkerBuilder worker(String name, int skill, int strength) {
        return Worker.builder()
                .name(name)
                .priority(1)
                .skill(skill)
                .strength(strength)
                .temperament(3)
                .troubleTolerance(1)
                .notes("");
    }

    public static TaskDefinition.TaskDefinitionBuilder task(int id, String name, String area, int requiredWorkers) {
        return TaskDefinition.builder()
                .id(id)
                .name(name)
                .area(area)
                .requiredWorkers(requiredWorkers)
                .requiredSkill(3)
                .requiredStrength(3)
                .urgency(3)
                .requiresVesselWork(1)
                .requiresNavigation(1)
                .duration(1.0);
    }
}
