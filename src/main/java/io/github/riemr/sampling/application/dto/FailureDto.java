package io.github.riemr.sampling.application.dto;

import io.github.riemr.sampling.domain.model.DayFailure;

import java.time.LocalDate;
import java.util.List;

public record FailureDto(LocalDate date, String kind, String message, List<String> tasks) {

    public static FailureDto from(DayFailure f) {
        return new FailureDto(f.date(), f.kind().name(), f.message(), f.taskNames());
    }
}
