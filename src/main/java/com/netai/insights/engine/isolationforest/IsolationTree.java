package com.netai.insights.engine.isolationforest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Random;

@JsonIgnoreProperties(ignoreUnknown = true)
public class IsolationTree {

    @JsonProperty("root")
    private IsolationNode root;

    public IsolationTree() {}

    IsolationTree(IsolationNode root) {
        this.root = root;
    }

    static IsolationTree grow(double[][] sample, int heightLimit, Random random) {
        int[] rows = new int[sample.length];
        for (int i = 0; i < rows.length; i++) rows[i] = i;
        return new IsolationTree(new Grower(sample, rows, heightLimit, random).grow(0, rows.length, 0));
    }

    boolean consistentWith(int featureCount) {
        return root != null && root.consistentWith(featureCount);
    }

    double pathLength(double[] point) {
        return root.pathLength(point, 0);
    }

    public IsolationNode getRoot() { return root; }

    /**
     * Grows one tree over a row index array, partitioning {@code rows[from, to)} in place at every split.
     */
    private static final class Grower {

        private final double[][] sample;
        private final int[] rows;
        private final int heightLimit;
        private final Random random;

        Grower(double[][] sample, int[] rows, int heightLimit, Random random) {
            this.sample = sample;
            this.rows = rows;
            this.heightLimit = heightLimit;
            this.random = random;
        }

        IsolationNode grow(int from, int to, int depth) {
            int size = to - from;
            if (depth >= heightLimit || size <= 1) {
                return IsolationNode.leaf(size);
            }

            int feature = random.nextInt(sample[rows[from]].length);
            double[] range = range(from, to, feature);
            if (range[0] >= range[1]) {
                return IsolationNode.leaf(size);
            }
            double threshold = range[0] + random.nextDouble() * (range[1] - range[0]);

            int boundary = partition(from, to, feature, threshold);
            return IsolationNode.split(feature, threshold,
                    grow(from, boundary, depth + 1),
                    grow(boundary, to, depth + 1));
        }

        private double[] range(int from, int to, int feature) {
            double[] range = {Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY};
            for (int i = from; i < to; i++) {
                double value = sample[rows[i]][feature];
                range[0] = Math.min(range[0], value);
                range[1] = Math.max(range[1], value);
            }
            return range;
        }

        // rows below the threshold end up in [from, boundary), the rest in [boundary, to)
        private int partition(int from, int to, int feature, double threshold) {
            int boundary = from;
            for (int i = from; i < to; i++) {
                if (sample[rows[i]][feature] < threshold) {
                    int swap = rows[boundary];
                    rows[boundary] = rows[i];
                    rows[i] = swap;
                    boundary++;
                }
            }
            return boundary;
        }
    }
}
