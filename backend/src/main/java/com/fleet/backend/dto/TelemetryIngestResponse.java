package com.fleet.backend.dto;

import java.time.Instant;

public record TelemetryIngestResponse(Long id, Instant recordedAt) {
}
