package io.github.riemr.sampling.application.dto;

public record WorkerSummary(String name, int skill, String notes) {
}
