package com.ops.incident.engine;

import com.ops.incident.model.TimeBucket;
import lombok.Getter;

import java.util.List;

/**
 * Mean and population standard deviation of per-minute error rate and volume,
 * computed from the current batch only.
 */
@Getter
public class BaselineStatistics {

    private final double[] errorRates;
    private final double[] volumes;
    private final double meanErrorRate;
    private final double stdErrorRate;
    private final double meanVolume;
    private final double stdVolume;

    private BaselineStatistics(double[] errorRates, double[] volumes) {
        this.errorRates = errorRates;
        this.volumes = volumes;
        this.meanErrorRate = mean(errorRates);
        this.stdErrorRate = stdDev(errorRates, meanErrorRate);
        this.meanVolume = mean(volumes);
        this.stdVolume = stdDev(volumes, meanVolume);
    }

    public static BaselineStatistics of(List<TimeBucket> buckets) {
        double[] errorRates = new double[buckets.size()];
        double[] volumes = new double[buckets.size()];
        for (int i = 0; i < buckets.size(); i++) {
            TimeBucket bucket = buckets.get(i);
            errorRates[i] = bucket.getErrorRate();
            volumes[i] = bucket.getTotal();
        }
        return new BaselineStatistics(errorRates, volumes);
    }

    public int size() {
        return errorRates.length;
    }

    static double mean(double[] values) {
        if (values.length == 0) return 0.0;
        double sum = 0.0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    // Population form (divide by n); zero below two samples.
    static double stdDev(double[] values, double mean) {
        if (values.length < 2) return 0.0;
        double sumSq = 0.0;
        for (double v : values) {
            double d = v - mean;
            sumSq += d * d;
        }
        return Math.sqrt(sumSq / values.length);
    }
}
