package com.ops.incident.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "detection")
public class DetectionConfig {

    // Below this many one-minute buckets there is no baseline and nothing is reported.
    private int minTimeBuckets = 3;

    // Spike thresholds are mean + k * std for both error rate and volume.
    private double spikeStdMultiplier = 2.0;

    // Spikes whose error rate exceeds this are HIGH, otherwise MEDIUM.
    private double highSeverityErrorRate = 0.5;

    // Services with fewer logs than this are never judged.
    private long serviceMinLogs = 5;
    private double serviceErrorRateThreshold = 0.3;

    // Outlier scoring over per-minute volume.
    private Outlier outlier = new Outlier();

    // Log source window for stored-log detection runs.
    private Duration lookback = Duration.ofHours(1);
    private int fetchLimit = 1000;

    // Stored-log runs with fewer logs than this are skipped.
    private int minLogs = 10;

    private Schedule schedule = new Schedule();

    @Data
    public static class Outlier {
        private int minTimeBuckets = 10;
        private double contamination = 0.10;
        private int numTrees = 100;
        private int sampleSize = 256;
        private long seed = 42L;
    }

    @Data
    public static class Schedule {
        private boolean enabled = false;
        private int intervalMinutes = 5;
    }
}
