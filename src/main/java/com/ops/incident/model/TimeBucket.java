package com.ops.incident.model;

import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Log counts for one minute of the batch. The key is the minute-truncated UTC timestamp.
 */
@Getter
@ToString
public class TimeBucket {

    private final Instant key;
    private long total;
    private long errorCount;
    private long warningCount;

    public TimeBucket(Instant key) {
        this.key = key;
    }

    public void record(SeverityClass severity) {
        total++;
        if (severity == SeverityClass.ERROR) {
            errorCount++;
        } else if (severity == SeverityClass.WARNING) {
            warningCount++;
        }
    }

    public double getErrorRate() {
        return (double) errorCount / Math.max(total, 1);
    }
}
