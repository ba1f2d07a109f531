package io.github.riemr.sampling.optimization.resolve;

import io.github.riemr.sampling.domain.model.ResolvedTask;
import io.github.riemr.sampling.domain.model.TaskDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;

/**
 * スケジュールの業務名を業務マスタと照合する。
 * <ol>
 *   <li>前後の空白を除去して完全一致</li>
 *   <li>マスタ順に走査し、どちらかがもう一方を含む最初の業務（最良一致ではない）</li>
 *   <li>該当なしはマスタ未登録として既定値（1 名配置）で補う</li>
 * </ol>
 */
@Component
@Slf4j
public class TaskResolver {

    public static final String UNKNOWN_AREA = "不明";

    public ResolvedTask resolve(String displayName, LocalDate date, int slot, List<TaskDefinition> registry) {
        String cleaned = displayName == null ? "" : displayName.strip();

        for (TaskDefinition def : registry) {
            if (cleaned.equals(def.getName())) {
                return new ResolvedTask(def, date, displayName, slot, false);
            }
        }

        if (!cleaned.isEmpty()) {
            for (TaskDefinition def : registry) {
                String registered = def.getName() == null ? "" : def.getName().strip();
                if (registered.isEmpty()) continue;
                if (cleaned.contains(registered) || registered.contains(cleaned)) {
                    return new ResolvedTask(def, date, displayName, slot, false);
                }
            }
        }

        log.debug("Unregistered task on {}: '{}' -> default requirements", date, cleaned);
        return new ResolvedTask(unregisteredDefault(cleaned), date, displayName, slot, true);
    }

    static TaskDefinition unregisteredDefault(String name) {
        return TaskDefinition.builder()
                .id(0)
                .name(name)
                .area(UNKNOWN_AREA)
                .requiredWorkers(1)
                .requiredSkill(3)
                .requiredStrength(3)
                .urgency(3)
                .requiresVesselWork(1)
                .requiresNavigation(1)
                .duration(1.0)
                .build();
    }
}
