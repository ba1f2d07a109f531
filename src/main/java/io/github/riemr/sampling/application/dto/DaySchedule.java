package io.github.riemr.sampling.application.dto;

import java.time.LocalDate;
import java.util.List;

public record DaySchedule(LocalDate date, int taskCount, List<String> tasks) {
}
