package io.github.riemr.sampling.application.dto;

import java.time.LocalDate;
import java.util.List;

public record DataOverviewResponse(List<LocalDate> dates, List<WorkerSummary> persons, List<DaySchedule> schedule) {
}
