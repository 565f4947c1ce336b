package com.ops.incident.engine;

import com.ops.incident.model.AnomalyRecord;
import com.ops.incident.model.AnomalyType;

import java.util.List;

/**
 * Interface for all anomaly detectors.
 * Each implementation reports a single AnomalyType.
 */
public interface AnomalyDetector {

    /**
     * The anomaly type this detector reports.
     */
    AnomalyType getSupportedType();

    /**
     * Inspect the aggregated batch.
     *
     * @param context buckets and baseline for the current batch
     * @return anomalies found, possibly empty, never null
     */
    List<AnomalyRecord> detect(DetectionContext context);
}
