package com.ops.incident.engine.detectors;

import com.ops.incident.config.DetectionConfig;
import com.ops.incident.engine.AnomalyDetector;
import com.ops.incident.engine.BaselineStatistics;
import com.ops.incident.engine.DetectionContext;
import com.ops.incident.model.AnomalyRecord;
import com.ops.incident.model.AnomalySeverity;
import com.ops.incident.model.AnomalyType;
import com.ops.incident.model.TimeBucket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Flags one-minute windows whose error rate spikes above the batch baseline.
 *
 * Logic: a window is flagged only when BOTH its error rate exceeds
 * meanErrorRate + k * stdErrorRate AND its volume exceeds meanVolume + k * stdVolume
 * (k = 2 by default). The volume condition keeps quiet minutes, where a couple of
 * errors swing the rate wildly, from being reported.
 *
 * Example: 14 minutes at 20 logs / 2 errors and one minute at 25 logs / 20 errors.
 * Error threshold is ~0.50, volume threshold ~22.8; the 80% minute is flagged HIGH.
 */
@Component
public class ErrorRateSpikeDetector implements AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(ErrorRateSpikeDetector.class);

    private final DetectionConfig config;

    public ErrorRateSpikeDetector(DetectionConfig config) {
        this.config = config;
    }

    @Override
    public AnomalyType getSupportedType() {
        return AnomalyType.SPIKE_ERROR_RATE;
    }

    @Override
    public List<AnomalyRecord> detect(DetectionContext context) {
        BaselineStatistics baseline = context.getBaseline();
        List<TimeBucket> buckets = context.getTimeBuckets();
        double k = config.getSpikeStdMultiplier();

        double errorThreshold = baseline.getMeanErrorRate() + k * baseline.getStdErrorRate();
        double volumeThreshold = baseline.getMeanVolume() + k * baseline.getStdVolume();

        List<AnomalyRecord> anomalies = new ArrayList<>();
        for (int i = 0; i < buckets.size(); i++) {
            TimeBucket bucket = buckets.get(i);
            double errorRate = baseline.getErrorRates()[i];

            if (errorRate <= errorThreshold || bucket.getTotal() <= volumeThreshold) {
                continue;
            }

            AnomalySeverity severity = errorRate > config.getHighSeverityErrorRate()
                    ? AnomalySeverity.HIGH
                    : AnomalySeverity.MEDIUM;

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("error_rate", errorRate);
            details.put("total_logs", bucket.getTotal());
            details.put("error_count", bucket.getErrorCount());

            anomalies.add(AnomalyRecord.builder()
                    .type(AnomalyType.SPIKE_ERROR_RATE)
                    .severity(severity)
                    .timestamp(bucket.getKey())
                    .description(String.format(Locale.ROOT,
                            "Error rate spike detected: %d/%d logs are errors (%.1f%%)",
                            bucket.getErrorCount(), bucket.getTotal(), errorRate * 100))
                    .details(details)
                    .build());

            log.debug("Error rate spike at {}: rate={} (threshold={}), volume={} (threshold={})",
                    bucket.getKey(), errorRate, errorThreshold, bucket.getTotal(), volumeThreshold);
        }
        return anomalies;
    }
}
