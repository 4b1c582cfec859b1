package com.residencyinsight.core.analysis;

import java.util.Objects;
import java.util.Random;

/**
 * Isolation forest over a single numeric feature.
 *
 * <p>
 * Each tree is grown on a sub-sample drawn without replacement by splitting
 * at a uniformly random value between the node's minimum and maximum, until a
 * node holds one distinct value or the height limit
 * {@code ceil(log2(sampleSize))} is reached. Points that are isolated after
 * few splits receive high anomaly scores.
 * </p>
 *
 * <p>
 * The score of {@code x} is {@code 2^(-E[h(x)] / c(ψ))}, where {@code h} is
 * the path length in one tree (plus {@code c(leaf size)} at an unexpanded
 * leaf) and {@code c(n)} is the average path length of an unsuccessful search
 * in a binary search tree of {@code n} nodes. Scores lie in {@code (0, 1]}.
 * </p>
 *
 * <p>
 * Instances are immutable once fitted and safe to share.
 * </p>
 *
 * @since 1.0.0
 */
public final class IsolationForest {

    private static final double EULER_GAMMA = 0.5772156649015329;

    private final Node[] trees;
    private final int sampleSize;

    private IsolationForest(Node[] trees, int sampleSize) {
        this.trees = trees;
        this.sampleSize = sampleSize;
    }

    /**
     * Fit a forest.
     *
     * @param values        training values; at least two
     * @param treeCount     number of trees; at least one
     * @param maxSampleSize upper bound on each tree's sub-sample
     * @param seed          seed for sampling and split selection
     * @return fitted forest
     * @throws IllegalArgumentException if any argument is out of range
     */
    public static IsolationForest fit(double[] values, int treeCount, int maxSampleSize, long seed) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.length < 2) {
            throw new IllegalArgumentException("Need at least 2 values to fit, got: " + values.length);
        }
        if (treeCount < 1) {
            throw new IllegalArgumentException("treeCount must be >= 1, got: " + treeCount);
        }
        if (maxSampleSize < 2) {
            throw new IllegalArgumentException("maxSampleSize must be >= 2, got: " + maxSampleSize);
        }

        int sampleSize = Math.min(maxSampleSize, values.length);
        int heightLimit = (int) Math.ceil(Math.log(sampleSize) / Math.log(2));
        Random random = new Random(seed);

        int[] indices = new int[values.length];
        Node[] trees = new Node[treeCount];
        for (int t = 0; t < treeCount; t++) {
            for (int i = 0; i < indices.length; i++) {
                indices[i] = i;
            }
            // Partial Fisher-Yates: the first sampleSize slots become the sub-sample
            double[] sample = new double[sampleSize];
            for (int i = 0; i < sampleSize; i++) {
                int j = i + random.nextInt(indices.length - i);
                int tmp = indices[i];
                indices[i] = indices[j];
                indices[j] = tmp;
                sample[i] = values[indices[i]];
            }
            trees[t] = grow(sample, 0, heightLimit, random);
        }
        return new IsolationForest(trees, sampleSize);
    }

    /**
     * @param value point to score
     * @return anomaly score in {@code (0, 1]}; higher is more anomalous
     */
    public double score(double value) {
        double total = 0;
        for (Node tree : trees) {
            total += pathLength(tree, value);
        }
        double meanPath = total / trees.length;
        return Math.pow(2, -meanPath / averagePathLength(sampleSize));
    }

    public int getTreeCount() {
        return trees.length;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    /**
     * Average path length of an unsuccessful search in a binary search tree
     * built from {@code n} points.
     */
    static double averagePathLength(long n) {
        if (n <= 1) {
            return 0.0;
        }
        if (n == 2) {
            return 1.0;
        }
        return 2.0 * (Math.log(n - 1.0) + EULER_GAMMA) - 2.0 * (n - 1.0) / n;
    }

    // ---------------------------------------------------------------
    // Tree construction and traversal
    // ---------------------------------------------------------------

    private static Node grow(double[] data, int depth, int heightLimit, Random random) {
        if (depth >= heightLimit || data.length <= 1) {
            return Node.leaf(data.length);
        }
        double min = data[0];
        double max = data[0];
        for (double v : data) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        if (min == max) {
            return Node.leaf(data.length);
        }

        double split = min + random.nextDouble() * (max - min);
        if (split >= max) {
            split = min;
        }

        int leftCount = 0;
        for (double v : data) {
            if (v <= split) {
                leftCount++;
            }
        }
        double[] left = new double[leftCount];
        double[] right = new double[data.length - leftCount];
        int l = 0;
        int r = 0;
        for (double v : data) {
            if (v <= split) {
                left[l++] = v;
            } else {
                right[r++] = v;
            }
        }
        return Node.internal(split,
                grow(left, depth + 1, heightLimit, random),
                grow(right, depth + 1, heightLimit, random));
    }

    private static double pathLength(Node root, double value) {
        Node node = root;
        int depth = 0;
        while (!node.isLeaf()) {
            node = value <= node.split ? node.left : node.right;
            depth++;
        }
        return depth + averagePathLength(node.size);
    }

    private static final class Node {
        private final double split;
        private final Node left;
        private final Node right;
        private final int size;

        private Node(double split, Node left, Node right, int size) {
            this.split = split;
            this.left = left;
            this.right = right;
            this.size = size;
        }

        static Node leaf(int size) {
            return new Node(Double.NaN, null, null, size);
        }

        static Node internal(double split, Node left, Node right) {
            return new Node(split, left, right, left.size + right.size);
        }

        boolean isLeaf() {
            return left == null;
        }
    }
}
