package com.ops.incident.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A batch of log lines to store")
public class IngestLogsRequest {

    @Schema(description = "Log lines")
    private List<Line> logs;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @Schema(name = "IngestLogLine", description = "One log line. Missing timestamp means now.")
    public static class Line {

        @Schema(example = "2026-10-19T10:42:17Z")
        private Instant timestamp;

        @Schema(example = "checkout")
        private String service;

        @Schema(example = "error")
        private String level;

        @Schema(example = "payment gateway timeout")
        private String message;

        private Map<String, Object> metadata;
    }
}
