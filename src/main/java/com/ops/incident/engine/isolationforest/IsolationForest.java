package com.ops.incident.engine.isolationforest;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Ensemble of randomized isolation trees (Liu, Ting and Zhou, 2008).
 *
 * Points that are isolated after few random splits sit far from the bulk of the
 * data and get a high anomaly score. A forest is fitted to one batch and thrown away.
 */
public class IsolationForest {

    private final List<IsolationNode> trees;
    private final int sampleSize;

    private IsolationForest(List<IsolationNode> trees, int sampleSize) {
        this.trees = trees;
        this.sampleSize = sampleSize;
    }

    /**
     * Fit a forest to the given data.
     *
     * @param data       samples, each row is a feature vector
     * @param numTrees   number of trees in the forest (typically 100)
     * @param sampleSize sub-sampling size per tree (typically 256), capped at data.length
     * @param seed       random seed; equal inputs and seeds give equal forests
     */
    public static IsolationForest fit(double[][] data, int numTrees, int sampleSize, long seed) {
        if (data.length == 0) {
            return new IsolationForest(Collections.emptyList(), 0);
        }
        int effectiveSampleSize = Math.min(sampleSize, data.length);
        int maxDepth = (int) Math.ceil(Math.log(effectiveSampleSize) / Math.log(2));

        Random random = new Random(seed);
        List<IsolationNode> trees = new ArrayList<>(numTrees);
        for (int i = 0; i < numTrees; i++) {
            double[][] sample = subsample(data, effectiveSampleSize, random);
            trees.add(IsolationNode.growTree(sample, maxDepth, random));
        }
        return new IsolationForest(trees, effectiveSampleSize);
    }

    /**
     * Anomaly score s(x, n) = 2^(-E(h(x)) / c(n)).
     *
     * @return score between 0.0 (normal) and 1.0 (anomalous); around 0.5 means no clear separation
     */
    public double anomalyScore(double[] point) {
        if (trees.isEmpty()) return 0.0;

        double avgPathLength = 0.0;
        for (IsolationNode tree : trees) {
            avgPathLength += tree.pathLength(point);
        }
        avgPathLength /= trees.size();

        double c = IsolationNode.averagePathLength(sampleSize);
        if (c <= 0) return 0.0;

        return Math.pow(2.0, -avgPathLength / c);
    }

    public double[] anomalyScores(double[][] points) {
        double[] scores = new double[points.length];
        for (int i = 0; i < points.length; i++) {
            scores[i] = anomalyScore(points[i]);
        }
        return scores;
    }

    private static double[][] subsample(double[][] data, int size, Random random) {
        if (data.length <= size) {
            return Arrays.copyOf(data, data.length);
        }
        double[][] sample = new double[size][];
        // Partial Fisher-Yates shuffle on indices
        int[] indices = new int[data.length];
        for (int i = 0; i < data.length; i++) indices[i] = i;
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(data.length - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
            sample[i] = data[indices[i]];
        }
        return sample;
    }

    public int getTreeCount() { return trees.size(); }
    public int getSampleSize() { return sampleSize; }
}
