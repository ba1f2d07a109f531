package io.github.riemr.sampling.application.dto;

import io.github.riemr.sampling.domain.model.DayAssignment;
import io.github.riemr.sampling.domain.model.TaskAssignment;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

public record DayOptimizeResponse(boolean success,
                                  LocalDate date,
                                  String status,
                                  double objectiveValue,
                                  Map<String, List<String>> results,
                                  List<TaskAssignment> slots) {

    public static DayOptimizeResponse from(DayAssignment day) {
        return new DayOptimizeResponse(true, day.getDate(), day.getStatus().name(), day.getObjectiveValue(),
                day.byTaskName(), day.getTasks());
    }
}
