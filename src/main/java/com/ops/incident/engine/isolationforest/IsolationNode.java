package com.ops.incident.engine.isolationforest;

import java.util.Random;

/**
 * A node of an isolation tree: either a split on one feature or a leaf holding
 * the number of samples that could not be separated further. A tree is its root node.
 */
public final class IsolationNode {

    private static final double EULER_GAMMA = 0.5772156649;

    private final int splitFeature;
    private final double splitValue;
    private final IsolationNode below;
    private final IsolationNode atOrAbove;
    private final int size;

    private IsolationNode(int splitFeature, double splitValue, IsolationNode below,
                          IsolationNode atOrAbove, int size) {
        this.splitFeature = splitFeature;
        this.splitValue = splitValue;
        this.below = below;
        this.atOrAbove = atOrAbove;
        this.size = size;
    }

    private static IsolationNode leaf(int size) {
        return new IsolationNode(-1, 0.0, null, null, size);
    }

    /**
     * Grow a tree over {@code rows}. The array is reordered in place, the rows themselves are not touched.
     */
    static IsolationNode growTree(double[][] rows, int maxDepth, Random random) {
        return grow(rows, 0, rows.length, 0, maxDepth, random);
    }

    // Rows in [from, to) belong to this node
    private static IsolationNode grow(double[][] rows, int from, int to, int depth, int maxDepth, Random random) {
        int count = to - from;
        if (count <= 1 || depth >= maxDepth) {
            return leaf(count);
        }

        int feature = random.nextInt(rows[from].length);
        double lo = rows[from][feature];
        double hi = lo;
        for (int i = from + 1; i < to; i++) {
            lo = Math.min(lo, rows[i][feature]);
            hi = Math.max(hi, rows[i][feature]);
        }
        if (lo == hi) {
            return leaf(count);
        }

        double cut = lo + random.nextDouble() * (hi - lo);
        int boundary = partition(rows, from, to, feature, cut);

        IsolationNode below = grow(rows, from, boundary, depth + 1, maxDepth, random);
        IsolationNode atOrAbove = grow(rows, boundary, to, depth + 1, maxDepth, random);
        return new IsolationNode(feature, cut, below, atOrAbove, count);
    }

    // Moves rows with value < cut to the front of the range; returns the first index of the rest
    private static int partition(double[][] rows, int from, int to, int feature, double cut) {
        int boundary = from;
        for (int i = from; i < to; i++) {
            if (rows[i][feature] < cut) {
                double[] swap = rows[boundary];
                rows[boundary] = rows[i];
                rows[i] = swap;
                boundary++;
            }
        }
        return boundary;
    }

    /**
     * Depth at which {@code point} reaches a leaf, plus the expected extra depth for
     * the samples that leaf could not separate.
     */
    double pathLength(double[] point) {
        IsolationNode node = this;
        int depth = 0;
        while (!node.isLeaf()) {
            node = point[node.splitFeature] < node.splitValue ? node.below : node.atOrAbove;
            depth++;
        }
        return depth + averagePathLength(node.size);
    }

    /**
     * Average path length of an unsuccessful BST search over n points:
     * c(n) = 2H(n-1) - 2(n-1)/n, with H(i) approximated by ln(i) + Euler's constant.
     */
    static double averagePathLength(int n) {
        if (n <= 1) return 0;
        if (n == 2) return 1;
        double harmonicNumber = Math.log(n - 1.0) + EULER_GAMMA;
        return 2.0 * harmonicNumber - (2.0 * (n - 1.0) / n);
    }

    boolean isLeaf() { return below == null; }
    int getSize() { return size; }
}
