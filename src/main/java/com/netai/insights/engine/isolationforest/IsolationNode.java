package com.netai.insights.engine.isolationforest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Node of an isolation tree. Leaves remember how many training points reached them so
 * the unbuilt part of the subtree can be estimated with {@link #averagePathLength}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class IsolationNode {

    private static final double EULER_GAMMA = 0.5772156649;

    @JsonProperty("f")
    private int feature;

    @JsonProperty("t")
    private double threshold;

    @JsonProperty("lo")
    private IsolationNode below;

    @JsonProperty("hi")
    private IsolationNode aboveOrEqual;

    @JsonProperty("n")
    private int leafSize;

    @JsonProperty("leaf")
    private boolean leaf;

    public IsolationNode() {}

    static IsolationNode split(int feature, double threshold, IsolationNode below, IsolationNode aboveOrEqual) {
        IsolationNode node = new IsolationNode();
        node.feature = feature;
        node.threshold = threshold;
        node.below = below;
        node.aboveOrEqual = aboveOrEqual;
        return node;
    }

    static IsolationNode leaf(int size) {
        IsolationNode node = new IsolationNode();
        node.leafSize = size;
        node.leaf = true;
        return node;
    }

    double pathLength(double[] point, int depth) {
        IsolationNode node = this;
        while (!node.leaf) {
            node = point[node.feature] < node.threshold ? node.below : node.aboveOrEqual;
            depth++;
        }
        return depth + averagePathLength(node.leafSize);
    }

    boolean consistentWith(int featureCount) {
        if (leaf) {
            return leafSize >= 0;
        }
        return feature >= 0 && feature < featureCount && !Double.isNaN(threshold)
                && below != null && aboveOrEqual != null
                && below.consistentWith(featureCount) && aboveOrEqual.consistentWith(featureCount);
    }

    /**
     * c(n): expected path length of an unsuccessful BST search over n points,
     * 2H(n-1) - 2(n-1)/n with H(i) approximated by ln(i) + Euler's constant.
     */
    public static double averagePathLength(int n) {
        if (n <= 1) return 0.0;
        if (n == 2) return 1.0;
        double harmonic = Math.log(n - 1.0) + EULER_GAMMA;
        return 2.0 * harmonic - (2.0 * (n - 1.0) / n);
    }

    public boolean isLeaf() { return leaf; }
    public int getLeafSize() { return leafSize; }
}
