package com.ops.incident.controller;

import com.ops.incident.model.DetectionReport;
import com.ops.incident.model.DetectionRun;
import com.ops.incident.service.AnomalyDetectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/detections")
@Tag(name = "Detection", description = "Run the anomaly detection engine")
public class DetectionController {

    private final AnomalyDetectionService detectionService;

    public DetectionController(AnomalyDetectionService detectionService) {
        this.detectionService = detectionService;
    }

    @Operation(summary = "Detect anomalies in recent logs",
            description = "Runs the engine over logs from the last hour (up to 1000). Each anomaly " +
                    "opens an incident and sends an alert. Fewer than 10 logs skips the run.")
    @PostMapping("/run")
    public ResponseEntity<DetectionRun> runDetection() {
        return ResponseEntity.ok(detectionService.runDetection());
    }

    @Operation(summary = "Analyze a caller-supplied batch",
            description = "Runs the engine over the posted records without storing anything or " +
                    "sending alerts. Records with a missing or unparsable timestamp are dropped and counted.")
    @PostMapping("/analyze")
    public ResponseEntity<DetectionReport> analyze(@RequestBody List<Map<String, Object>> batch) {
        return ResponseEntity.ok(detectionService.analyze(batch));
    }
}
