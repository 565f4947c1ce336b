package com.ops.incident.engine;

import com.ops.incident.config.DetectionConfig;
import com.ops.incident.model.AnomalyRecord;
import com.ops.incident.model.AnomalyType;
import com.ops.incident.model.DetectionReport;
import com.ops.incident.model.LogRecord;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Core engine that runs every registered detector over one batch of raw log records.
 * Uses the Strategy pattern: each AnomalyType is reported by a registered AnomalyDetector.
 *
 * The engine keeps no state between calls. Each call normalizes, aggregates and
 * computes its own baseline, so concurrent callers with independent batches need
 * no coordination.
 */
@Component
public class AnomalyEngine {

    private static final Logger log = LoggerFactory.getLogger(AnomalyEngine.class);

    private final LogNormalizer normalizer;
    private final BucketAggregator aggregator;
    private final Map<AnomalyType, AnomalyDetector> detectorMap;
    private final DetectionConfig config;
    private final Tracer tracer;

    public AnomalyEngine(LogNormalizer normalizer, BucketAggregator aggregator,
                         List<AnomalyDetector> detectors, DetectionConfig config, Tracer tracer) {
        this.normalizer = normalizer;
        this.aggregator = aggregator;
        this.detectorMap = new EnumMap<>(AnomalyType.class);
        this.config = config;
        this.tracer = tracer;

        // EnumMap iteration follows AnomalyType order, which is the assembly order
        for (AnomalyDetector detector : detectors) {
            detectorMap.put(detector.getSupportedType(), detector);
            log.info("Registered anomaly detector: {} -> {}",
                    detector.getSupportedType(), detector.getClass().getSimpleName());
        }
    }

    /**
     * Detect anomalies in a batch of raw log records.
     *
     * @param batch raw records; any field may be missing
     * @return anomalies ordered spikes, service error rates, volume outliers; empty when none
     */
    public List<AnomalyRecord> detect(List<? extends Map<String, ?>> batch) {
        return analyze(batch).getAnomalies();
    }

    /**
     * Same as {@link #detect(List)} but also reports how the batch was bucketed and how many
     * records were dropped for an unresolvable timestamp.
     */
    @Observed(name = "detection.analyze", contextualName = "analyze-log-batch")
    public DetectionReport analyze(List<? extends Map<String, ?>> batch) {
        List<? extends Map<String, ?>> records = batch != null ? batch : Collections.emptyList();

        List<LogRecord> normalized = new ArrayList<>(records.size());
        int dropped = 0;
        for (Map<String, ?> raw : records) {
            Optional<LogRecord> record = normalizer.normalize(raw);
            if (record.isPresent()) {
                normalized.add(record.get());
            } else {
                dropped++;
            }
        }
        if (dropped > 0) {
            log.debug("Dropped {} of {} log records with unresolvable timestamps", dropped, records.size());
        }

        BucketAggregation aggregation = aggregator.aggregate(normalized);
        List<AnomalyRecord> anomalies = new ArrayList<>();

        DetectionReport.DetectionReportBuilder report = DetectionReport.builder()
                .anomalies(anomalies)
                .recordsReceived(records.size())
                .recordsDropped(dropped)
                .timeBuckets(aggregation.getTimeBuckets().size())
                .services(aggregation.getServiceBuckets().size());

        if (aggregation.getTimeBuckets().size() < config.getMinTimeBuckets()) {
            log.debug("Insufficient data for a baseline: {} minute buckets, need {}",
                    aggregation.getTimeBuckets().size(), config.getMinTimeBuckets());
            return report.build();
        }

        DetectionContext context = DetectionContext.builder()
                .timeBuckets(aggregation.getTimeBuckets())
                .serviceBuckets(aggregation.getServiceBuckets())
                .baseline(BaselineStatistics.of(aggregation.getTimeBuckets()))
                .build();

        for (AnomalyDetector detector : detectorMap.values()) {
            Span span = tracer.nextSpan()
                    .name("detector." + detector.getSupportedType())
                    .tag("anomaly.type", detector.getSupportedType().name())
                    .start();

            try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
                List<AnomalyRecord> found = detector.detect(context);
                anomalies.addAll(found);
                span.tag("anomaly.count", String.valueOf(found.size()));
            } catch (Exception e) {
                span.error(e);
                log.error("Detector {} failed on a batch of {} records: {}",
                        detector.getSupportedType(), records.size(), e.getMessage(), e);
                // One failing detector must not hide what the others found
            } finally {
                span.end();
            }
        }

        return report.build();
    }
}
