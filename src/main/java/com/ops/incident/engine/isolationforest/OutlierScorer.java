package com.ops.incident.engine.isolationforest;

/**
 * Unsupervised novelty detection over a set of samples.
 *
 * Implementations must be deterministic: the same samples and contamination
 * always produce the same labels.
 */
public interface OutlierScorer {

    /**
     * Label roughly {@code contamination * samples.length} of the most anomalous samples as outliers.
     *
     * @param samples       one feature vector per sample, all the same length
     * @param contamination expected fraction of outliers, in (0, 0.5]
     * @return one flag per sample, true for outliers
     */
    boolean[] labelOutliers(double[][] samples, double contamination);
}
