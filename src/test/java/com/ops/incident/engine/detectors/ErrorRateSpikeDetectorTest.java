package com.ops.incident.engine.detectors;

import com.ops.incident.config.DetectionConfig;
import com.ops.incident.model.AnomalyRecord;
import com.ops.incident.model.AnomalySeverity;
import com.ops.incident.model.AnomalyType;
import com.ops.incident.model.TimeBucket;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.ops.incident.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ErrorRateSpikeDetectorTest {

    private ErrorRateSpikeDetector detector;

    @BeforeEach
    void setUp() {
        detector = new ErrorRateSpikeDetector(new DetectionConfig());
    }

    private static List<TimeBucket> steadyMinutes(int count, long total, long errors) {
        List<TimeBucket> buckets = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            buckets.add(timeBucket(BASE_TIME.plusSeconds(60L * i), total, errors, 0));
        }
        return buckets;
    }

    @Test
    void getSupportedType_isSpike() {
        assertThat(detector.getSupportedType()).isEqualTo(AnomalyType.SPIKE_ERROR_RATE);
    }

    @Test
    void detect_highErrorRateAndVolume_flaggedHigh() {
        List<TimeBucket> buckets = steadyMinutes(14, 20, 2);
        buckets.add(timeBucket(BASE_TIME.plusSeconds(60L * 14), 25, 20, 0));

        List<AnomalyRecord> anomalies = detector.detect(contextFor(buckets, List.of()));

        assertThat(anomalies).hasSize(1);
        AnomalyRecord anomaly = anomalies.get(0);
        assertThat(anomaly.getType()).isEqualTo(AnomalyType.SPIKE_ERROR_RATE);
        assertThat(anomaly.getSeverity()).isEqualTo(AnomalySeverity.HIGH);
        assertThat(anomaly.getTimestamp()).isEqualTo(BASE_TIME.plusSeconds(60L * 14));
        assertThat(anomaly.getService()).isNull();
        assertThat(anomaly.getDescription()).isEqualTo("Error rate spike detected: 20/25 logs are errors (80.0%)");
        assertThat((Double) anomaly.getDetails().get("error_rate")).isCloseTo(0.8, within(1e-9));
        assertThat(anomaly.getDetails()).containsEntry("total_logs", 25L).containsEntry("error_count", 20L);
    }

    @Test
    void detect_spikeBelowHalf_flaggedMedium() {
        List<TimeBucket> buckets = steadyMinutes(14, 20, 0);
        // rate 0.3 against an error threshold of ~0.17, volume 30 against ~25.6
        buckets.add(timeBucket(BASE_TIME.plusSeconds(60L * 14), 30, 9, 0));

        List<AnomalyRecord> anomalies = detector.detect(contextFor(buckets, List.of()));

        assertThat(anomalies).hasSize(1);
        assertThat(anomalies.get(0).getSeverity()).isEqualTo(AnomalySeverity.MEDIUM);
        assertThat(anomalies.get(0).getDescription()).endsWith("9/30 logs are errors (30.0%)");
    }

    @Test
    void detect_highErrorRateWithoutVolumeIncrease_notFlagged() {
        List<TimeBucket> buckets = steadyMinutes(14, 20, 0);
        buckets.add(timeBucket(BASE_TIME.plusSeconds(60L * 14), 20, 16, 0));

        assertThat(detector.detect(contextFor(buckets, List.of()))).isEmpty();
    }

    @Test
    void detect_highVolumeWithoutErrors_notFlagged() {
        List<TimeBucket> buckets = steadyMinutes(14, 20, 2);
        buckets.add(timeBucket(BASE_TIME.plusSeconds(60L * 14), 200, 0, 0));

        assertThat(detector.detect(contextFor(buckets, List.of()))).isEmpty();
    }

    @Test
    void detect_uniformBatch_nothingFlagged() {
        assertThat(detector.detect(contextFor(steadyMinutes(10, 20, 10), List.of()))).isEmpty();
    }

    @Test
    void detect_warningsDoNotCountAsErrors() {
        List<TimeBucket> buckets = steadyMinutes(14, 20, 0);
        buckets.add(timeBucket(BASE_TIME.plusSeconds(60L * 14), 40, 0, 40));

        assertThat(detector.detect(contextFor(buckets, List.of()))).isEmpty();
    }

    @Test
    void detect_customMultiplier_respected() {
        DetectionConfig config = new DetectionConfig();
        config.setSpikeStdMultiplier(10.0);
        ErrorRateSpikeDetector strict = new ErrorRateSpikeDetector(config);

        List<TimeBucket> buckets = steadyMinutes(14, 20, 2);
        buckets.add(timeBucket(BASE_TIME.plusSeconds(60L * 14), 25, 20, 0));

        assertThat(strict.detect(contextFor(buckets, List.of()))).isEmpty();
    }
}
