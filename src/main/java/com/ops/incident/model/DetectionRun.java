package com.ops.incident.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Result of a detection run over recently stored logs")
public class DetectionRun {

    @Schema(description = "Number of anomalies found", example = "2")
    private int anomaliesDetected;

    @Schema(description = "Identifiers of incidents opened by this run")
    private List<Long> incidentsCreated;

    @Schema(description = "Anomalies found, in assembly order")
    private List<AnomalyRecord> anomalies;

    @Schema(description = "Explanation when nothing was created", example = "No anomalies detected")
    private String message;
}
