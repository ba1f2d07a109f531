package io.github.riemr.sampling.application.dto;

import io.github.riemr.sampling.domain.model.AvailabilityRule;
import io.github.riemr.sampling.domain.model.Worker;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class WorkerView {
    String name;
    int priority;
    int skill;
    int trouble;
    int personality;
    int strength;
    int ship;
    boolean driving;
    int navigation;
    boolean analysisPriority;
    List<String> availability;
    String notes;

    public static WorkerView from(Worker w) {
        return WorkerView.builder()
                .name(w.getName())
                .priority(w.getPriority())
                .skill(w.getSkill())
                .trouble(w.getTroubleTolerance())
                .personality(w.getTemperament())
                .strength(w.getStrength())
                .ship(w.getVesselAbility())
                .driving(w.isCanDrive())
                .navigation(w.getNavigationAbility())
                .analysisPriority(w.isAnalysisPriority())
                .availability(w.getAvailabilityRules().stream().map(AvailabilityRule::describe).toList())
                .notes(w.getNotes())
                .build();
    }
}
