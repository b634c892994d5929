package com.netai.insights.engine.pipeline;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;

/**
 * Median imputation followed by standardization (zero mean, unit variance per column).
 * Statistics come from the batch passed to {@link #fitTransform}; missing values are NaN.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class FeatureScaler {

    @JsonProperty("medians")
    private double[] medians;

    @JsonProperty("means")
    private double[] means;

    @JsonProperty("scales")
    private double[] scales;

    public FeatureScaler() {}

    public double[][] fitTransform(double[][] raw) {
        int columns = raw[0].length;
        medians = new double[columns];
        means = new double[columns];
        scales = new double[columns];

        for (int c = 0; c < columns; c++) {
            medians[c] = median(raw, c);
        }
        double[][] imputed = impute(raw);

        int n = imputed.length;
        for (int c = 0; c < columns; c++) {
            double sum = 0.0;
            for (double[] row : imputed) sum += row[c];
            double mean = sum / n;

            double squares = 0.0;
            for (double[] row : imputed) {
                double d = row[c] - mean;
                squares += d * d;
            }
            double std = Math.sqrt(squares / n);

            means[c] = mean;
            // constant column: leave values centred but unscaled
            scales[c] = std > 0.0 ? std : 1.0;
        }
        return standardize(imputed);
    }

    public double[][] transform(double[][] raw) {
        if (!isFitted()) {
            throw new IllegalStateException("Scaler has not been fit");
        }
        if (raw.length > 0 && raw[0].length != means.length) {
            throw new IllegalArgumentException(String.format(
                    "Expected %d feature columns, got %d", means.length, raw[0].length));
        }
        return standardize(impute(raw));
    }

    @JsonIgnore
    public boolean isFitted() {
        return means != null;
    }

    /**
     * Whether medians, means and scales all cover exactly {@code featureCount} columns.
     */
    public boolean coversColumns(int featureCount) {
        return isFitted() && medians != null && scales != null
                && medians.length == featureCount && means.length == featureCount && scales.length == featureCount;
    }

    private double[][] impute(double[][] raw) {
        double[][] out = new double[raw.length][];
        for (int i = 0; i < raw.length; i++) {
            out[i] = Arrays.copyOf(raw[i], raw[i].length);
            for (int c = 0; c < out[i].length; c++) {
                if (Double.isNaN(out[i][c])) {
                    out[i][c] = medians[c];
                }
            }
        }
        return out;
    }

    private double[][] standardize(double[][] imputed) {
        double[][] out = new double[imputed.length][];
        for (int i = 0; i < imputed.length; i++) {
            out[i] = new double[imputed[i].length];
            for (int c = 0; c < imputed[i].length; c++) {
                out[i][c] = (imputed[i][c] - means[c]) / scales[c];
            }
        }
        return out;
    }

    /**
     * Median of the non-missing values of a column; 0.0 when the column has no values at all.
     */
    static double median(double[][] raw, int column) {
        double[] present = Arrays.stream(raw)
                .mapToDouble(row -> row[column])
                .filter(v -> !Double.isNaN(v))
                .sorted()
                .toArray();
        if (present.length == 0) {
            return 0.0;
        }
        int mid = present.length / 2;
        return present.length % 2 == 1
                ? present[mid]
                : (present[mid - 1] + present[mid]) / 2.0;
    }

    public double[] getMedians() { return medians; }
    public double[] getMeans() { return means; }
    public double[] getScales() { return scales; }
}
