package io.github.riemr.sampling.application.dto;

import java.time.Instant;

public record ReloadResponse(boolean success, int workers, int tasks, int scheduleEntries, Instant loadedAt) {
}
