package com.ops.incident.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * A raw log record after normalization: UTC timestamp, lower-cased level,
 * service defaulted to "unknown". Never mutated once built.
 */
@Value
@Builder
public class LogRecord {

    public static final String UNKNOWN_SERVICE = "unknown";

    Instant timestamp;
    String level;
    String service;
    String message;

    Map<String, Object> metadata;

    public SeverityClass getSeverityClass() {
        return SeverityClass.fromLevel(level);
    }
}
