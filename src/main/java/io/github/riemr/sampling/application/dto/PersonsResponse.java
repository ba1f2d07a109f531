package io.github.riemr.sampling.application.dto;

import java.util.List;

public record PersonsResponse(boolean success, List<WorkerView> persons) {
}
