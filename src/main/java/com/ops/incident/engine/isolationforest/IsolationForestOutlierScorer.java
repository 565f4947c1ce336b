package com.ops.incident.engine.isolationforest;

import com.ops.incident.config.DetectionConfig;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * {@link OutlierScorer} backed by a freshly fitted {@link IsolationForest}.
 *
 * The cutoff is the (1 - contamination) percentile of the batch's own anomaly
 * scores, linearly interpolated; samples scoring strictly above it are outliers.
 * Ties at the cutoff stay inliers, so a batch of identical samples has no outliers.
 */
@Component
public class IsolationForestOutlierScorer implements OutlierScorer {

    private final DetectionConfig config;

    public IsolationForestOutlierScorer(DetectionConfig config) {
        this.config = config;
    }

    @Override
    public boolean[] labelOutliers(double[][] samples, double contamination) {
        boolean[] labels = new boolean[samples.length];
        if (samples.length == 0 || contamination <= 0) {
            return labels;
        }

        DetectionConfig.Outlier params = config.getOutlier();
        IsolationForest forest = IsolationForest.fit(
                samples, params.getNumTrees(), params.getSampleSize(), params.getSeed());

        double[] scores = forest.anomalyScores(samples);
        double cutoff = percentile(scores, 1.0 - contamination);

        for (int i = 0; i < samples.length; i++) {
            labels[i] = scores[i] > cutoff;
        }
        return labels;
    }

    static double percentile(double[] values, double fraction) {
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        double position = Math.max(0.0, Math.min(1.0, fraction)) * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (position - lower);
    }
}
