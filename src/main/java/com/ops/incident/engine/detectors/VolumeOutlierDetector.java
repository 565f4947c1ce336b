package com.ops.incident.engine.detectors;

import com.ops.incident.config.DetectionConfig;
import com.ops.incident.engine.AnomalyDetector;
import com.ops.incident.engine.BaselineStatistics;
import com.ops.incident.engine.DetectionContext;
import com.ops.incident.engine.isolationforest.OutlierScorer;
import com.ops.incident.model.AnomalyRecord;
import com.ops.incident.model.AnomalySeverity;
import com.ops.incident.model.AnomalyType;
import com.ops.incident.model.TimeBucket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Flags one-minute windows with unusual log volume using an {@link OutlierScorer}.
 *
 * The per-minute totals, in time order, are scored as one-dimensional samples.
 * Catches volume bursts and drops that the rule detectors do not look for.
 * Needs at least outlier.minTimeBuckets (10) minutes; below that the scorer
 * has too little to isolate against and nothing is reported.
 */
@Component
public class VolumeOutlierDetector implements AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(VolumeOutlierDetector.class);

    private final OutlierScorer outlierScorer;
    private final DetectionConfig config;

    public VolumeOutlierDetector(OutlierScorer outlierScorer, DetectionConfig config) {
        this.outlierScorer = outlierScorer;
        this.config = config;
    }

    @Override
    public AnomalyType getSupportedType() {
        return AnomalyType.VOLUME_OUTLIER;
    }

    @Override
    public List<AnomalyRecord> detect(DetectionContext context) {
        List<TimeBucket> buckets = context.getTimeBuckets();
        DetectionConfig.Outlier outlierConfig = config.getOutlier();

        if (buckets.size() < outlierConfig.getMinTimeBuckets()) {
            log.debug("Skipping volume outlier scoring: {} minutes, need {}",
                    buckets.size(), outlierConfig.getMinTimeBuckets());
            return List.of();
        }

        double[][] samples = new double[buckets.size()][];
        for (int i = 0; i < buckets.size(); i++) {
            samples[i] = new double[] {buckets.get(i).getTotal()};
        }

        boolean[] outliers = outlierScorer.labelOutliers(samples, outlierConfig.getContamination());

        BaselineStatistics baseline = context.getBaseline();
        String expectedRange = formatWhole(baseline.getMeanVolume() - baseline.getStdVolume())
                + " - " + formatWhole(baseline.getMeanVolume() + baseline.getStdVolume());

        List<AnomalyRecord> anomalies = new ArrayList<>();
        for (int i = 0; i < buckets.size(); i++) {
            if (!outliers[i]) continue;

            TimeBucket bucket = buckets.get(i);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("log_count", bucket.getTotal());
            details.put("expected_range", expectedRange);

            anomalies.add(AnomalyRecord.builder()
                    .type(AnomalyType.VOLUME_OUTLIER)
                    .severity(AnomalySeverity.MEDIUM)
                    .timestamp(bucket.getKey())
                    .description(String.format(Locale.ROOT,
                            "Unusual log volume detected: %d logs in this time window", bucket.getTotal()))
                    .details(details)
                    .build());
        }
        return anomalies;
    }

    // Exact binary value rounded half-even, so 12.5 -> "12" and 13.5 -> "14"
    static String formatWhole(double value) {
        return new BigDecimal(value).setScale(0, RoundingMode.HALF_EVEN).toPlainString();
    }
}
