package io.github.riemr.sampling.optimization.service;

import io.github.riemr.sampling.domain.exception.InvalidInputException;
import io.github.riemr.sampling.domain.model.MasterData;
import io.github.riemr.sampling.domain.model.ScheduleEntry;
import io.github.riemr.sampling.domain.model.TaskDefinition;
import io.github.riemr.sampling.domain.model.Worker;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 最適化開始前の入力チェック。問題はまとめて 1 つの {@link InvalidInputException} で報告する。
 */
@Component
public class MasterDataValidator {

    public void validate(MasterData data) {
        List<String> errors = new ArrayList<>();
        if (data == null) {
            throw new InvalidInputException("Master data is not loaded");
        }
        if (data.getWorkers().isEmpty()) {
            errors.add("worker registry is empty");
        }
        if (data.getTasks().isEmpty()) {
            errors.add("task registry is empty");
        }

        Set<String> names = new HashSet<>();
        for (int i = 0; i < data.getWorkers().size(); i++) {
            Worker w = data.getWorkers().get(i);
            if (w.getName() == null || w.getName().isBlank()) {
                errors.add("worker #" + (i + 1) + ": blank name");
                continue;
            }
            if (!names.add(w.getName())) {
                errors.add("worker '" + w.getName() + "': duplicate name");
            }
            if (w.getSkill() < 0 || w.getStrength() < 0 || w.getTemperament() < 0 || w.getTroubleTolerance() < 0) {
                errors.add("worker '" + w.getName() + "': negative rating");
            }
        }

        for (int i = 0; i < data.getTasks().size(); i++) {
            TaskDefinition t = data.getTasks().get(i);
            String label = t.getName() == null || t.getName().isBlank() ? "#" + (i + 1) : "'" + t.getName() + "'";
            if (t.getName() == null || t.getName().isBlank()) {
                errors.add("task " + label + ": blank name");
            }
            if (t.getRequiredWorkers() <= 0) {
                errors.add("task " + label + ": requiredWorkers must be positive");
            }
            if (t.getRequiredSkill() < 0 || t.getRequiredStrength() < 0 || t.getUrgency() < 0
                    || t.getRequiresVesselWork() < 0 || t.getRequiresNavigation() < 0) {
                errors.add("task " + label + ": negative rating");
            }
        }

        for (int i = 0; i < data.getSchedule().size(); i++) {
            ScheduleEntry e = data.getSchedule().get(i);
            if (e.date() == null) {
                errors.add("schedule entry #" + (i + 1) + ": missing date");
            }
            if (e.taskName() == null || e.taskName().isBlank()) {
                errors.add("schedule entry #" + (i + 1) + ": missing task name");
            }
        }

        if (!errors.isEmpty()) {
            throw new InvalidInputException("Invalid input: " + String.join("; ", errors));
        }
    }
}
