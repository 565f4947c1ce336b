package com.ops.incident.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger openIncidentCount;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.openIncidentCount = registry.gauge("incidents.open", new AtomicInteger(0));
    }

    public void recordLogsIngested(int count) {
        Counter.builder("logs.ingested.count")
                .register(registry)
                .increment(count);
    }

    public void recordDetectionRun(String outcome, int batchSize) {
        Counter.builder("detection.run.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();

        DistributionSummary.builder("detection.batch_size")
                .tag("outcome", outcome)
                .register(registry)
                .record(batchSize);
    }

    public void recordRecordsDropped(int count) {
        if (count <= 0) return;
        Counter.builder("detection.records.dropped")
                .register(registry)
                .increment(count);
    }

    public void recordAnomaly(String anomalyType, String severity) {
        Counter.builder("anomaly.detected.count")
                .tag("type", anomalyType)
                .tag("severity", severity)
                .register(registry)
                .increment();
    }

    public void recordIncidentCreated(String severity) {
        Counter.builder("incident.created.count")
                .tag("severity", severity)
                .register(registry)
                .increment();
    }

    public void recordNotification(String channel, String status) {
        Counter.builder("notification.sent.count")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordSummary(String status) {
        Counter.builder("incident.summary.count")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void updateOpenIncidentCount(int count) {
        openIncidentCount.set(count);
    }
}
