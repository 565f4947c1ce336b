package com.ops.incident.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A stored log line")
public class LogEntry {

    @Schema(description = "Log identifier", example = "1042")
    private long id;

    @Schema(description = "Event time (UTC). Defaults to ingestion time if not provided.",
            example = "2026-10-19T10:42:17Z")
    private Instant timestamp;

    @Schema(description = "Emitting service", example = "checkout")
    private String service;

    @Schema(description = "Log level, free text", example = "error")
    private String level;

    @Schema(description = "Log message", example = "payment gateway timeout")
    private String message;

    @Schema(description = "Arbitrary structured attributes")
    private Map<String, Object> metadata;

    /**
     * Raw-record view consumed by the detection engine.
     */
    public Map<String, Object> toRawRecord() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("timestamp", timestamp);
        raw.put("service", service);
        raw.put("level", level);
        raw.put("message", message);
        raw.put("metadata", metadata);
        return raw;
    }
}
