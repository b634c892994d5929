package com.netai.insights.engine.isolationforest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.netai.insights.engine.AnomalyModel;
import com.netai.insights.engine.ModelOutput;
import com.netai.insights.engine.ScoreRange;
import com.netai.insights.model.ModelType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Isolation Forest: points that random axis-aligned splits separate in few steps are anomalous.
 *
 * Raw output is a decision score, {@code -s(x) - offset}, where {@code s(x) = 2^(-E[h(x)] / c(n))}
 * is the classic isolation score in (0, 1] and {@code offset} is the contamination percentile of
 * {@code -s} over the training batch. Lower is more anomalous; a negative decision is an anomaly,
 * so roughly {@code contamination} of the training batch is flagged.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class IsolationForest implements AnomalyModel {

    @JsonProperty("numTrees")
    private int numTrees;

    @JsonProperty("maxSamples")
    private int maxSamples;

    @JsonProperty("contamination")
    private double contamination;

    @JsonProperty("seed")
    private long seed;

    @JsonProperty("sampleSize")
    private int sampleSize;

    @JsonProperty("offset")
    private double offset;

    @JsonProperty("trainingRange")
    private ScoreRange trainingRange;

    @JsonProperty("trees")
    private List<IsolationTree> trees = new ArrayList<>();

    public IsolationForest() {}

    /**
     * @param numTrees      number of trees in the forest (typically 100)
     * @param maxSamples    sub-sampling size per tree (typically 256), capped at the batch size
     * @param contamination expected share of anomalies, in (0, 0.5]
     * @param seed          random seed for reproducibility
     */
    public IsolationForest(int numTrees, int maxSamples, double contamination, long seed) {
        if (contamination <= 0.0 || contamination > 0.5) {
            throw new IllegalArgumentException("contamination must be in (0, 0.5], got " + contamination);
        }
        this.numTrees = numTrees;
        this.maxSamples = maxSamples;
        this.contamination = contamination;
        this.seed = seed;
    }

    @Override
    public ModelType modelType() {
        return ModelType.ISOLATION_FOREST;
    }

    @Override
    public ModelOutput fitAndScore(double[][] data) {
        train(data);

        double[] negated = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            negated[i] = -isolationScore(data[i]);
        }
        offset = percentile(negated, contamination * 100.0);

        double[] decisions = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            decisions[i] = negated[i] - offset;
        }
        trainingRange = ScoreRange.of(decisions);
        return new ModelOutput(flag(decisions), decisions, null);
    }

    @Override
    public ModelOutput score(double[][] data) {
        if (!fitted()) {
            throw new IllegalStateException("Isolation forest has not been fit");
        }
        double[] decisions = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            decisions[i] = decisionFunction(data[i]);
        }
        return new ModelOutput(flag(decisions), decisions, trainingRange);
    }

    @Override
    public boolean fitted() {
        return !trees.isEmpty();
    }

    @Override
    public boolean consistentWith(int featureCount) {
        if (!fitted() || sampleSize < 1 || trainingRange == null) {
            return false;
        }
        for (IsolationTree tree : trees) {
            if (tree == null || !tree.consistentWith(featureCount)) {
                return false;
            }
        }
        return true;
    }

    void train(double[][] data) {
        sampleSize = Math.min(maxSamples, data.length);
        int heightLimit = (int) Math.ceil(Math.log(Math.max(sampleSize, 2)) / Math.log(2));
        Random random = new Random(seed);

        trees = new ArrayList<>(numTrees);
        for (int i = 0; i < numTrees; i++) {
            trees.add(IsolationTree.grow(subsample(data, sampleSize, random), heightLimit, random));
        }
    }

    /**
     * s(x) in (0, 1]: close to 1 is anomalous, well below 0.5 is normal.
     */
    public double isolationScore(double[] point) {
        double meanPath = 0.0;
        for (IsolationTree tree : trees) {
            meanPath += tree.pathLength(point);
        }
        meanPath /= trees.size();

        double c = IsolationNode.averagePathLength(sampleSize);
        if (c <= 0.0) {
            return 0.5;
        }
        return Math.pow(2.0, -meanPath / c);
    }

    public double decisionFunction(double[] point) {
        return -isolationScore(point) - offset;
    }

    private static boolean[] flag(double[] decisions) {
        boolean[] anomalies = new boolean[decisions.length];
        for (int i = 0; i < decisions.length; i++) {
            anomalies[i] = decisions[i] < 0.0;
        }
        return anomalies;
    }

    private static double[][] subsample(double[][] data, int size, Random random) {
        if (data.length <= size) {
            return Arrays.copyOf(data, data.length);
        }
        // partial Fisher-Yates over row indices
        int[] indices = new int[data.length];
        for (int i = 0; i < indices.length; i++) indices[i] = i;
        double[][] sample = new double[size][];
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(data.length - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
            sample[i] = data[indices[i]];
        }
        return sample;
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
        int upper = Math.min(lower + 1, sorted.length - 1);
        double fraction = rank - lower;
        return sorted[lower] + fraction * (sorted[upper] - sorted[lower]);
    }

    public int getNumTrees() { return numTrees; }
    public int getSampleSize() { return sampleSize; }
    public double getOffset() { return offset; }
    public ScoreRange getTrainingRange() { return trainingRange; }
    public List<IsolationTree> getTrees() { return trees; }
}
