package com.ops.incident.model;

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
@Schema(description = "Outcome of running the detection engine over one batch")
public class DetectionReport {

    @Schema(description = "Anomalies in assembly order: spikes, service error rates, volume outliers")
    private List<AnomalyRecord> anomalies;

    @Schema(description = "Records received in the batch", example = "1000")
    private int recordsReceived;

    @Schema(description = "Records dropped because their timestamp could not be resolved", example = "3")
    private int recordsDropped;

    @Schema(description = "Distinct one-minute windows in the batch", example = "60")
    private int timeBuckets;

    @Schema(description = "Distinct services in the batch", example = "4")
    private int services;
}
