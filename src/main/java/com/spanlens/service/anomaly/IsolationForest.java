package com.spanlens.service.anomaly;

import java.util.Arrays;
import java.util.Random;

/**
 * Isolation forest over a single numeric feature.
 * Each tree is grown on a random sub-sample by cutting at a uniform point between the
 * current minimum and maximum until a point is alone, the values are equal, or the
 * height limit is hit. Points that are isolated after few cuts score close to 1.
 * Fitting and scoring always use the same batch; nothing is kept between calls.
 */
public class IsolationForest {

    private static final double EULER_GAMMA = 0.5772156649015329;

    private final int numTrees;
    private final int maxSamples;
    private final long seed;

    public IsolationForest(int numTrees, int maxSamples, long seed) {
        if (numTrees < 1) {
            throw new IllegalArgumentException("numTrees must be >= 1: " + numTrees);
        }
        if (maxSamples < 2) {
            throw new IllegalArgumentException("maxSamples must be >= 2: " + maxSamples);
        }
        this.numTrees = numTrees;
        this.maxSamples = maxSamples;
        this.seed = seed;
    }

    /**
     * Fit on {@code values} and return one anomaly score in (0, 1] per value, in input order.
     */
    public double[] fitScore(double[] values) {
        int n = values.length;
        if (n == 0) {
            return new double[0];
        }

        int sampleSize = Math.min(maxSamples, n);
        int heightLimit = (int) Math.ceil(log2(Math.max(sampleSize, 2)));
        Random random = new Random(seed);

        Node[] trees = new Node[numTrees];
        int[] indices = new int[n];
        for (int t = 0; t < numTrees; t++) {
            double[] sample = drawSample(values, indices, sampleSize, random);
            trees[t] = grow(sample, 0, sample.length, 0, heightLimit, random);
        }

        double normalizer = averagePathLength(sampleSize);
        double[] scores = new double[n];
        for (int i = 0; i < n; i++) {
            double total = 0;
            for (Node tree : trees) {
                total += pathLength(tree, values[i]);
            }
            double meanDepth = total / numTrees;
            scores[i] = normalizer > 0 ? Math.pow(2, -meanDepth / normalizer) : 0.5;
        }
        return scores;
    }

    /**
     * Flags values whose score lies strictly above the {@code 1 - contamination} quantile
     * of all scores.
     */
    public boolean[] fitPredict(double[] values, double contamination) {
        double[] scores = fitScore(values);
        double threshold = percentile(scores, 100.0 * (1.0 - contamination));
        boolean[] outliers = new boolean[scores.length];
        for (int i = 0; i < scores.length; i++) {
            outliers[i] = scores[i] > threshold;
        }
        return outliers;
    }

    // Partial Fisher-Yates, sampling without replacement
    private double[] drawSample(double[] values, int[] indices, int sampleSize, Random random) {
        for (int i = 0; i < indices.length; i++) {
            indices[i] = i;
        }
        double[] sample = new double[sampleSize];
        for (int i = 0; i < sampleSize; i++) {
            int j = i + random.nextInt(indices.length - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
            sample[i] = values[indices[i]];
        }
        return sample;
    }

    // Grows a tree over data[from, to), reordering that range in place
    private Node grow(double[] data, int from, int to, int depth, int heightLimit, Random random) {
        int size = to - from;
        if (depth >= heightLimit || size <= 1) {
            return Node.leaf(size);
        }

        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (int i = from; i < to; i++) {
            min = Math.min(min, data[i]);
            max = Math.max(max, data[i]);
        }
        if (min == max) {
            return Node.leaf(size);
        }

        double split = min + random.nextDouble() * (max - min);
        int mid = partition(data, from, to, split);
        if (mid == from || mid == to) {
            return Node.leaf(size);
        }

        Node left = grow(data, from, mid, depth + 1, heightLimit, random);
        Node right = grow(data, mid, to, depth + 1, heightLimit, random);
        return Node.branch(split, left, right);
    }

    // Moves values < split to the front, returns the first index of the right side
    private int partition(double[] data, int from, int to, double split) {
        int store = from;
        for (int i = from; i < to; i++) {
            if (data[i] < split) {
                double tmp = data[store];
                data[store] = data[i];
                data[i] = tmp;
                store++;
            }
        }
        return store;
    }

    private double pathLength(Node node, double value) {
        int depth = 0;
        while (!node.isLeaf()) {
            node = value < node.split ? node.left : node.right;
            depth++;
        }
        return depth + averagePathLength(node.size);
    }

    /**
     * Average path length of an unsuccessful search in a binary search tree of {@code n} nodes.
     */
    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0.0;
        }
        if (n == 2) {
            return 1.0;
        }
        return 2.0 * (Math.log(n - 1.0) + EULER_GAMMA) - 2.0 * (n - 1.0) / n;
    }

    /**
     * Percentile with linear interpolation between closest ranks.
     */
    static double percentile(double[] values, double percent) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        if (sorted.length == 1) {
            return sorted[0];
        }
        double rank = percent / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        return sorted[lower] + (rank - lower) * (sorted[upper] - sorted[lower]);
    }

    private static double log2(double value) {
        return Math.log(value) / Math.log(2);
    }

    private static final class Node {
        final double split;
        final Node left;
        final Node right;
        final int size;

        private Node(double split, Node left, Node right, int size) {
            this.split = split;
            this.left = left;
            this.right = right;
            this.size = size;
        }

        static Node leaf(int size) {
            return new Node(Double.NaN, null, null, size);
        }

        static Node branch(double split, Node left, Node right) {
            return new Node(split, left, right, 0);
        }

        boolean isLeaf() {
            return left == null;
        }
    }
}
