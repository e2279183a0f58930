package com.kpisentinel.analyzer.detection;

import java.util.ArrayList;
import java.util.List;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * One-dimensional isolation forest. Each tree isolates points of a random sub-sample by
 * splitting at uniformly drawn values between the node's minimum and maximum; points that are
 * isolated after few splits are anomalous.
 *
 * <p>Scores follow the usual convention: {@code -2^(-E[h(x)] / c(psi))}, so they lie in
 * {@code [-1, 0)} and lower means more anomalous. Instances are immutable once fitted.
 */
final class IsolationForest {

    static final int DEFAULT_TREES = 100;
    static final int MAX_SAMPLES = 256;

    private static final double EULER_GAMMA = 0.5772156649015329d;

    private final List<Node> trees;
    private final int sampleSize;

    private IsolationForest(List<Node> trees, int sampleSize) {
        this.trees = trees;
        this.sampleSize = sampleSize;
    }

    static IsolationForest fit(double[] values, int treeCount, long seed) {
        if (values.length == 0) {
            throw new IllegalArgumentException("cannot fit an isolation forest on an empty sequence");
        }
        RandomGenerator random = new MersenneTwister(seed);
        int sampleSize = Math.min(MAX_SAMPLES, values.length);
        int heightLimit = (int) Math.ceil(Math.log(Math.max(sampleSize, 2)) / Math.log(2));
        List<Node> trees = new ArrayList<>(treeCount);
        for (int t = 0; t < treeCount; t++) {
            double[] sample = sampleWithoutReplacement(values, sampleSize, random);
            trees.add(grow(sample, 0, heightLimit, random));
        }
        return new IsolationForest(List.copyOf(trees), sampleSize);
    }

    double[] scoreSamples(double[] values) {
        double normaliser = averagePathLength(sampleSize);
        double[] scores = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            double totalDepth = 0;
            for (Node tree : trees) {
                totalDepth += pathLength(tree, values[i]);
            }
            double meanDepth = totalDepth / trees.size();
            scores[i] = normaliser == 0 ? -0.5d : -Math.pow(2, -meanDepth / normaliser);
        }
        return scores;
    }

    /** Average path length of an unsuccessful binary-search-tree lookup among {@code n} points. */
    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0d;
        }
        if (n == 2) {
            return 1d;
        }
        double harmonic = Math.log(n - 1d) + EULER_GAMMA;
        return 2d * harmonic - 2d * (n - 1d) / n;
    }

    private static double pathLength(Node node, double value) {
        int depth = 0;
        Node current = node;
        while (!current.isLeaf()) {
            current = value < current.split ? current.left : current.right;
            depth++;
        }
        return depth + averagePathLength(current.size);
    }

    private static Node grow(double[] sample, int depth, int heightLimit, RandomGenerator random) {
        if (depth >= heightLimit || sample.length <= 1) {
            return Node.leaf(sample.length);
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double value : sample) {
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        if (min == max) {
            return Node.leaf(sample.length);
        }
        double split = min + random.nextDouble() * (max - min);
        int leftCount = 0;
        for (double value : sample) {
            if (value < split) {
                leftCount++;
            }
        }
        double[] left = new double[leftCount];
        double[] right = new double[sample.length - leftCount];
        int l = 0;
        int r = 0;
        for (double value : sample) {
            if (value < split) {
                left[l++] = value;
            } else {
                right[r++] = value;
            }
        }
        return Node.split(split,
                grow(left, depth + 1, heightLimit, random),
                grow(right, depth + 1, heightLimit, random));
    }

    private static double[] sampleWithoutReplacement(double[] values, int size, RandomGenerator random) {
        int[] indices = new int[values.length];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = i;
        }
        double[] sample = new double[size];
        for (int i = 0; i < size; i++) {
            int pick = i + random.nextInt(indices.length - i);
            int chosen = indices[pick];
            indices[pick] = indices[i];
            indices[i] = chosen;
            sample[i] = values[chosen];
        }
        return sample;
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

        static Node split(double split, Node left, Node right) {
            return new Node(split, left, right, 0);
        }

        boolean isLeaf() {
            return left == null;
        }
    }
}
