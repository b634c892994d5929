package com.netai.insights.engine.dbscan;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.netai.insights.engine.AnomalyModel;
import com.netai.insights.engine.ModelOutput;
import com.netai.insights.model.ModelType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/**
 * Density-based clustering with Euclidean distance. Points reachable from no core point are
 * noise, and noise is what this detector reports as anomalous. A point is a core point when at
 * least {@code minSamples} points, itself included, lie within {@code eps}.
 *
 * There is no continuous score, only the label. The fitted state keeps the core samples, so new
 * points are labelled noise unless they fall within {@code eps} of one of them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Dbscan implements AnomalyModel {

    public static final int NOISE = -1;

    private static final int UNVISITED = -2;

    @JsonProperty("eps")
    private double eps;

    @JsonProperty("minSamples")
    private int minSamples;

    @JsonProperty("coreSamples")
    private double[][] coreSamples;

    @JsonProperty("clusterCount")
    private int clusterCount;

    public Dbscan() {}

    public Dbscan(double eps, int minSamples) {
        if (eps <= 0.0) {
            throw new IllegalArgumentException("eps must be positive, got " + eps);
        }
        if (minSamples < 1) {
            throw new IllegalArgumentException("minSamples must be at least 1, got " + minSamples);
        }
        this.eps = eps;
        this.minSamples = minSamples;
    }

    @Override
    public ModelType modelType() {
        return ModelType.DBSCAN;
    }

    @Override
    public ModelOutput fitAndScore(double[][] data) {
        int[] labels = cluster(data);
        boolean[] anomalies = new boolean[labels.length];
        for (int i = 0; i < labels.length; i++) {
            anomalies[i] = labels[i] == NOISE;
        }
        return ModelOutput.labelsOnly(anomalies);
    }

    @Override
    public ModelOutput score(double[][] data) {
        if (!fitted()) {
            throw new IllegalStateException("DBSCAN has not been fit");
        }
        double epsSquared = eps * eps;
        boolean[] anomalies = new boolean[data.length];
        for (int i = 0; i < data.length; i++) {
            anomalies[i] = true;
            for (double[] core : coreSamples) {
                if (squaredDistance(data[i], core) <= epsSquared) {
                    anomalies[i] = false;
                    break;
                }
            }
        }
        return ModelOutput.labelsOnly(anomalies);
    }

    @Override
    public boolean fitted() {
        return coreSamples != null;
    }

    @Override
    public boolean consistentWith(int featureCount) {
        if (!fitted() || !(eps > 0.0)) {
            return false;
        }
        for (double[] core : coreSamples) {
            if (core == null || core.length != featureCount) {
                return false;
            }
        }
        return true;
    }

    /**
     * Cluster labels per row: 0..k-1 for cluster members, {@link #NOISE} for outliers.
     */
    public int[] cluster(double[][] data) {
        int n = data.length;
        List<int[]> neighbourhoods = new ArrayList<>(n);
        boolean[] core = new boolean[n];
        for (int i = 0; i < n; i++) {
            int[] neighbours = regionQuery(data, i);
            neighbourhoods.add(neighbours);
            core[i] = neighbours.length >= minSamples;
        }

        int[] labels = new int[n];
        Arrays.fill(labels, UNVISITED);
        int cluster = 0;
        for (int i = 0; i < n; i++) {
            if (labels[i] != UNVISITED || !core[i]) {
                continue;
            }
            labels[i] = cluster;
            Deque<Integer> frontier = new ArrayDeque<>();
            frontier.push(i);
            while (!frontier.isEmpty()) {
                int p = frontier.pop();
                for (int q : neighbourhoods.get(p)) {
                    if (labels[q] != UNVISITED) {
                        continue;
                    }
                    labels[q] = cluster;
                    // border points join the cluster but do not extend it
                    if (core[q]) {
                        frontier.push(q);
                    }
                }
            }
            cluster++;
        }
        for (int i = 0; i < n; i++) {
            if (labels[i] == UNVISITED) {
                labels[i] = NOISE;
            }
        }

        List<double[]> cores = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            if (core[i]) cores.add(data[i]);
        }
        coreSamples = cores.toArray(new double[0][]);
        clusterCount = cluster;
        return labels;
    }

    private int[] regionQuery(double[][] data, int index) {
        double epsSquared = eps * eps;
        List<Integer> found = new ArrayList<>();
        for (int j = 0; j < data.length; j++) {
            if (squaredDistance(data[index], data[j]) <= epsSquared) {
                found.add(j);
            }
        }
        return found.stream().mapToInt(Integer::intValue).toArray();
    }

    private static double squaredDistance(double[] a, double[] b) {
        double sum = 0.0;
        for (int k = 0; k < a.length; k++) {
            double d = a[k] - b[k];
            sum += d * d;
        }
        return sum;
    }

    public double getEps() { return eps; }
    public int getMinSamples() { return minSamples; }
    public int getClusterCount() { return clusterCount; }
    public double[][] getCoreSamples() { return coreSamples; }
}
