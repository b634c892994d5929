package com.netai.insights.engine.pipeline;

import java.util.List;

/**
 * Imputed, standardized model input: one row per record, one column per feature name.
 */
public record FeatureMatrix(List<String> featureNames, double[][] values) {

    public int rows() {
        return values.length;
    }

    public int columns() {
        return featureNames.size();
    }

    public double[] column(int index) {
        double[] column = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            column[i] = values[i][index];
        }
        return column;
    }
}
