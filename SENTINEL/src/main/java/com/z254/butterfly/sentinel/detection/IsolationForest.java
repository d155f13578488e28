package com.z254.butterfly.sentinel.detection;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Isolation forest outlier model.
 * <p>
 * Each tree isolates points by recursive random axis-aligned splits over a random subsample.
 * Anomalies are isolated in fewer splits, so the score
 * {@code s(x) = 2^(-E[h(x)] / c(ψ))} approaches 1 for outliers and stays near 0.5 or below
 * for ordinary points.
 */
public final class IsolationForest {

    private static final double EULER_MASCHERONI = 0.5772156649;

    private final List<Node> trees;
    private final int subsampleSize;
    private final double threshold;

    private IsolationForest(List<Node> trees, int subsampleSize, double threshold) {
        this.trees = trees;
        this.subsampleSize = subsampleSize;
        this.threshold = threshold;
    }

    /**
     * Train a forest.
     *
     * @param data          training vectors, all of the same length
     * @param treeCount     number of isolation trees
     * @param sampleSize    subsample drawn per tree (capped at the data size)
     * @param contamination expected outlier share; sets the voting threshold
     * @param seed          random seed
     */
    public static IsolationForest fit(double[][] data, int treeCount, int sampleSize,
                                      double contamination, long seed) {
        if (data.length < 2) {
            throw new IllegalArgumentException("At least two training vectors are required");
        }
        Random random = new Random(seed);
        int psi = Math.min(sampleSize, data.length);
        int heightLimit = (int) Math.ceil(Math.log(psi) / Math.log(2));

        List<Node> trees = new ArrayList<>(treeCount);
        for (int t = 0; t < treeCount; t++) {
            double[][] sample = subsample(data, psi, random);
            trees.add(build(sample, 0, heightLimit, random));
        }

        IsolationForest unthresholded = new IsolationForest(trees, psi, Double.NaN);
        double[] trainingScores = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            trainingScores[i] = unthresholded.score(data[i]);
        }
        Arrays.sort(trainingScores);
        int cut = (int) Math.floor((1.0 - contamination) * (trainingScores.length - 1));
        double threshold = trainingScores[Math.max(0, Math.min(cut, trainingScores.length - 1))];

        return new IsolationForest(trees, psi, threshold);
    }

    public double score(double[] point) {
        double totalPath = 0.0;
        for (Node tree : trees) {
            totalPath += pathLength(point, tree, 0);
        }
        double meanPath = totalPath / trees.size();
        double normalizer = averagePathLength(subsampleSize);
        if (normalizer <= 0) {
            return 0.5;
        }
        return Math.pow(2, -meanPath / normalizer);
    }

    /**
     * Whether the point scores above the contamination threshold of the training data.
     */
    public boolean isOutlier(double[] point) {
        return score(point) > threshold;
    }

    public double getThreshold() {
        return threshold;
    }

    public int getTreeCount() {
        return trees.size();
    }

    // ========== Private Methods ==========

    private static double[][] subsample(double[][] data, int size, Random random) {
        int[] indices = new int[data.length];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = i;
        }
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(indices.length - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
        }
        double[][] sample = new double[size][];
        for (int i = 0; i < size; i++) {
            sample[i] = data[indices[i]];
        }
        return sample;
    }

    private static Node build(double[][] data, int depth, int heightLimit, Random random) {
        if (depth >= heightLimit || data.length <= 1) {
            return Node.leaf(data.length);
        }

        int dimensions = data[0].length;
        List<Integer> splittable = new ArrayList<>();
        double[] mins = new double[dimensions];
        double[] maxs = new double[dimensions];
        for (int d = 0; d < dimensions; d++) {
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (double[] row : data) {
                min = Math.min(min, row[d]);
                max = Math.max(max, row[d]);
            }
            mins[d] = min;
            maxs[d] = max;
            if (max > min) {
                splittable.add(d);
            }
        }
        if (splittable.isEmpty()) {
            return Node.leaf(data.length);
        }

        int feature = splittable.get(random.nextInt(splittable.size()));
        double split = mins[feature] + random.nextDouble() * (maxs[feature] - mins[feature]);

        List<double[]> left = new ArrayList<>();
        List<double[]> right = new ArrayList<>();
        for (double[] row : data) {
            if (row[feature] < split) {
                left.add(row);
            } else {
                right.add(row);
            }
        }
        return Node.split(feature, split,
                build(left.toArray(new double[0][]), depth + 1, heightLimit, random),
                build(right.toArray(new double[0][]), depth + 1, heightLimit, random));
    }

    private static double pathLength(double[] point, Node node, int depth) {
        if (node.isLeaf()) {
            return depth + averagePathLength(node.size);
        }
        Node next = point[node.feature] < node.splitValue ? node.left : node.right;
        return pathLength(point, next, depth + 1);
    }

    /**
     * Average path length of an unsuccessful binary-search-tree lookup over {@code n} points.
     */
    static double averagePathLength(int n) {
        if (n > 2) {
            return 2.0 * (Math.log(n - 1.0) + EULER_MASCHERONI) - 2.0 * (n - 1.0) / n;
        }
        return n == 2 ? 1.0 : 0.0;
    }

    private static final class Node {
        private final int feature;
        private final double splitValue;
        private final Node left;
        private final Node right;
        private final int size;

        private Node(int feature, double splitValue, Node left, Node right, int size) {
            this.feature = feature;
            this.splitValue = splitValue;
            this.left = left;
            this.right = right;
            this.size = size;
        }

        static Node leaf(int size) {
            return new Node(-1, 0.0, null, null, size);
        }

        static Node split(int feature, double value, Node left, Node right) {
            return new Node(feature, value, left, right, 0);
        }

        boolean isLeaf() {
            return left == null;
        }
    }
}
