package com.ops.incident.controller;

import com.ops.incident.model.IngestLogsRequest;
import com.ops.incident.model.LogEntry;
import com.ops.incident.service.LogIngestionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/logs")
@Tag(name = "Logs", description = "Ingest structured log lines and browse what was stored")
public class LogController {

    private final LogIngestionService ingestionService;

    public LogController(LogIngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    @Operation(summary = "Ingest a batch of logs",
            description = "Stores log lines for later anomaly detection. Lines without a timestamp " +
                    "are stamped with the ingestion time.")
    @PostMapping
    public ResponseEntity<Map<String, Object>> ingestLogs(@RequestBody IngestLogsRequest request) {
        if (request == null || request.getLogs() == null || request.getLogs().isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "no logs provided"));
        }

        List<LogEntry> stored = ingestionService.ingest(request.getLogs());
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of("status", "accepted", "count", stored.size()));
    }

    @Operation(summary = "List recent logs",
            description = "Returns the most recently timestamped logs, newest first.")
    @GetMapping
    public ResponseEntity<List<LogEntry>> getRecentLogs(
            @Parameter(description = "Max number of logs to return", example = "100")
            @RequestParam(defaultValue = "100") int limit) {
        if (limit < 0) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(ingestionService.getRecentLogs(limit));
    }
}
