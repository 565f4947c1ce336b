package com.ops.incident.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "An incident opened for a detected anomaly")
public class Incident {

    @Schema(description = "Incident identifier", example = "17")
    private long id;

    @Schema(description = "Creation time (UTC)", example = "2026-10-19T10:45:00Z")
    private Instant createdAt;

    @Schema(description = "Lifecycle status", example = "open", allowableValues = {"open", "resolved"})
    private IncidentStatus status;

    @Schema(description = "Severity copied from the anomaly", example = "high", allowableValues = {"high", "medium"})
    private AnomalySeverity severity;

    @Schema(description = "Anomaly description",
            example = "High error rate in checkout: 4/10 logs are errors (40.0%)")
    private String description;

    @Schema(description = "LLM-generated summary, null until requested")
    private String summary;

    @Schema(description = "LLM-generated root cause, null until requested")
    private String rootCause;

    @Schema(description = "Resolution time (UTC), null while open")
    private Instant resolvedAt;

    public boolean hasSummary() {
        return summary != null && rootCause != null;
    }
}
