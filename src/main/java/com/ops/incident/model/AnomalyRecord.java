package com.ops.incident.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "An anomaly found in a batch of logs")
public class AnomalyRecord {

    @Schema(description = "Kind of anomaly", example = "SPIKE_ERROR_RATE")
    private AnomalyType type;

    @Schema(description = "Anomaly severity", example = "high")
    private AnomalySeverity severity;

    @Schema(description = "Start of the one-minute window (time-window anomalies only)",
            example = "2026-10-19T10:42:00Z")
    private Instant timestamp;

    @Schema(description = "Service name (per-service anomalies only)", example = "checkout")
    private String service;

    @Schema(description = "Human-readable description",
            example = "Error rate spike detected: 20/25 logs are errors (80.0%)")
    private String description;

    @Schema(description = "Numeric evidence: rates, counts, expected ranges")
    private Map<String, Object> details;
}
