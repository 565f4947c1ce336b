package com.ops.incident.engine.detectors;

import com.ops.incident.config.DetectionConfig;
import com.ops.incident.engine.AnomalyDetector;
import com.ops.incident.engine.DetectionContext;
import com.ops.incident.model.AnomalyRecord;
import com.ops.incident.model.AnomalySeverity;
import com.ops.incident.model.AnomalyType;
import com.ops.incident.model.ServiceBucket;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Flags services whose share of error-level logs is too high.
 *
 * Services with fewer than serviceMinLogs (5) records are skipped: a rate over
 * two or three lines says nothing. Remaining services are flagged MEDIUM when
 * errors / total exceeds serviceErrorRateThreshold (0.3). Emitted in first-seen order.
 */
@Component
public class ServiceErrorRateDetector implements AnomalyDetector {

    private final DetectionConfig config;

    public ServiceErrorRateDetector(DetectionConfig config) {
        this.config = config;
    }

    @Override
    public AnomalyType getSupportedType() {
        return AnomalyType.SERVICE_ERROR_RATE;
    }

    @Override
    public List<AnomalyRecord> detect(DetectionContext context) {
        List<AnomalyRecord> anomalies = new ArrayList<>();

        for (ServiceBucket bucket : context.getServiceBuckets()) {
            if (bucket.getTotal() < config.getServiceMinLogs()) {
                continue;
            }

            double errorRate = bucket.getErrorRate();
            if (errorRate <= config.getServiceErrorRateThreshold()) {
                continue;
            }

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("service", bucket.getService());
            details.put("error_rate", errorRate);
            details.put("total_logs", bucket.getTotal());
            details.put("error_count", bucket.getErrorCount());

            anomalies.add(AnomalyRecord.builder()
                    .type(AnomalyType.SERVICE_ERROR_RATE)
                    .severity(AnomalySeverity.MEDIUM)
                    .service(bucket.getService())
                    .description(String.format(Locale.ROOT,
                            "High error rate in %s: %d/%d logs are errors (%.1f%%)",
                            bucket.getService(), bucket.getErrorCount(), bucket.getTotal(), errorRate * 100))
                    .details(details)
                    .build());
        }
        return anomalies;
    }
}
