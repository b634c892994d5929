package com.netai.insights.engine.svm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.netai.insights.engine.AnomalyModel;
import com.netai.insights.engine.ModelOutput;
import com.netai.insights.model.ModelType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One-class SVM with an RBF kernel (Schölkopf formulation).
 *
 * Solves {@code min ½ αᵀQα} subject to {@code 0 ≤ αᵢ ≤ 1} and {@code Σαᵢ = ν·l} with SMO,
 * picking the maximal violating pair each step. The decision value
 * {@code f(x) = Σ αᵢ K(xᵢ, x) − ρ} is a signed distance to the learned boundary:
 * negative means outside, i.e. anomalous. Only support vectors (αᵢ > 0) are kept after fitting.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class OneClassSvm implements AnomalyModel {

    private static final Logger log = LoggerFactory.getLogger(OneClassSvm.class);

    private static final double TAU = 1e-12;

    @JsonProperty("nu")
    private double nu;

    @JsonProperty("gamma")
    private double gamma;

    @JsonProperty("tolerance")
    private double tolerance;

    @JsonProperty("maxIterations")
    private int maxIterations;

    @JsonProperty("cacheRows")
    private int cacheRows;

    @JsonProperty("supportVectors")
    private double[][] supportVectors;

    @JsonProperty("coefficients")
    private double[] coefficients;

    @JsonProperty("rho")
    private double rho;

    public OneClassSvm() {}

    /**
     * @param nu            upper bound on the share of training errors, in (0, 1]
     * @param gamma         RBF width; 0 or negative means "auto" (1 / number of features)
     * @param tolerance     KKT violation tolerance used as stopping criterion
     * @param maxIterations hard cap on SMO iterations
     * @param cacheRows     kernel rows kept in the LRU cache during fitting
     */
    public OneClassSvm(double nu, double gamma, double tolerance, int maxIterations, int cacheRows) {
        if (nu <= 0.0 || nu > 1.0) {
            throw new IllegalArgumentException("nu must be in (0, 1], got " + nu);
        }
        this.nu = nu;
        this.gamma = gamma;
        this.tolerance = tolerance;
        this.maxIterations = maxIterations;
        this.cacheRows = cacheRows;
    }

    @Override
    public ModelType modelType() {
        return ModelType.ONE_CLASS_SVM;
    }

    @Override
    public ModelOutput fitAndScore(double[][] data) {
        fit(data);
        return score(data);
    }

    @Override
    public ModelOutput score(double[][] data) {
        if (!fitted()) {
            throw new IllegalStateException("One-class SVM has not been fit");
        }
        double[] distances = new double[data.length];
        boolean[] anomalies = new boolean[data.length];
        for (int i = 0; i < data.length; i++) {
            distances[i] = decisionFunction(data[i]);
            anomalies[i] = distances[i] < 0.0;
        }
        return new ModelOutput(anomalies, distances, null);
    }

    @Override
    public boolean fitted() {
        return supportVectors != null;
    }

    @Override
    public boolean consistentWith(int featureCount) {
        if (!fitted() || coefficients == null || coefficients.length != supportVectors.length
                || !(gamma > 0.0) || !Double.isFinite(rho)) {
            return false;
        }
        for (double[] vector : supportVectors) {
            if (vector == null || vector.length != featureCount) {
                return false;
            }
        }
        return true;
    }

    public double decisionFunction(double[] point) {
        double sum = 0.0;
        for (int i = 0; i < supportVectors.length; i++) {
            sum += coefficients[i] * kernel(supportVectors[i], point);
        }
        return sum - rho;
    }

    void fit(double[][] data) {
        int l = data.length;
        if (gamma <= 0.0) {
            gamma = 1.0 / data[0].length;
        }
        KernelRows rows = new KernelRows(data, cacheRows);

        // feasible start: the first floor(nu*l) alphas at the bound, remainder on the next one
        double[] alpha = new double[l];
        double total = nu * l;
        int full = (int) Math.floor(total);
        for (int i = 0; i < Math.min(full, l); i++) {
            alpha[i] = 1.0;
        }
        if (full < l) {
            alpha[full] = total - full;
        }

        double[] gradient = new double[l];
        for (int i = 0; i < l; i++) {
            if (alpha[i] > 0.0) {
                double[] q = rows.row(i);
                for (int t = 0; t < l; t++) {
                    gradient[t] += alpha[i] * q[t];
                }
            }
        }

        int iteration = 0;
        while (iteration < maxIterations) {
            int up = -1;
            int down = -1;
            double minGradient = Double.POSITIVE_INFINITY;
            double maxGradient = Double.NEGATIVE_INFINITY;
            for (int t = 0; t < l; t++) {
                if (alpha[t] < 1.0 && gradient[t] < minGradient) {
                    minGradient = gradient[t];
                    up = t;
                }
                if (alpha[t] > 0.0 && gradient[t] > maxGradient) {
                    maxGradient = gradient[t];
                    down = t;
                }
            }
            if (up < 0 || down < 0 || maxGradient - minGradient < tolerance) {
                break;
            }

            double[] qUp = rows.row(up);
            double[] qDown = rows.row(down);
            double curvature = qUp[up] + qDown[down] - 2.0 * qUp[down];
            if (curvature <= 0.0) {
                curvature = TAU;
            }
            double step = (maxGradient - minGradient) / curvature;
            step = Math.min(step, 1.0 - alpha[up]);
            step = Math.min(step, alpha[down]);

            alpha[up] += step;
            alpha[down] -= step;
            for (int t = 0; t < l; t++) {
                gradient[t] += step * (qUp[t] - qDown[t]);
            }
            iteration++;
        }
        if (iteration >= maxIterations) {
            log.warn("One-class SVM stopped after {} iterations without reaching tolerance {}",
                    maxIterations, tolerance);
        }

        rho = computeRho(alpha, gradient);

        List<double[]> vectors = new ArrayList<>();
        List<Double> weights = new ArrayList<>();
        for (int i = 0; i < l; i++) {
            if (alpha[i] > 0.0) {
                vectors.add(data[i]);
                weights.add(alpha[i]);
            }
        }
        supportVectors = vectors.toArray(new double[0][]);
        coefficients = weights.stream().mapToDouble(Double::doubleValue).toArray();

        log.debug("One-class SVM fit: {} samples, {} support vectors, {} iterations, rho={}",
                l, supportVectors.length, iteration, rho);
    }

    /**
     * ρ is the gradient value shared by free support vectors; without free ones it is
     * taken midway between the bounded sets.
     */
    private static double computeRho(double[] alpha, double[] gradient) {
        double freeSum = 0.0;
        int freeCount = 0;
        double upperBound = Double.POSITIVE_INFINITY;
        double lowerBound = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < alpha.length; i++) {
            if (alpha[i] >= 1.0) {
                lowerBound = Math.max(lowerBound, gradient[i]);
            } else if (alpha[i] <= 0.0) {
                upperBound = Math.min(upperBound, gradient[i]);
            } else {
                freeSum += gradient[i];
                freeCount++;
            }
        }
        if (freeCount > 0) {
            return freeSum / freeCount;
        }
        if (Double.isInfinite(upperBound)) return lowerBound;
        if (Double.isInfinite(lowerBound)) return upperBound;
        return (upperBound + lowerBound) / 2.0;
    }

    private double kernel(double[] a, double[] b) {
        double squared = 0.0;
        for (int k = 0; k < a.length; k++) {
            double d = a[k] - b[k];
            squared += d * d;
        }
        return Math.exp(-gamma * squared);
    }

    public double getNu() { return nu; }
    public double getGamma() { return gamma; }
    public double getRho() { return rho; }
    public double[][] getSupportVectors() { return supportVectors; }
    public double[] getCoefficients() { return coefficients; }

    /**
     * Kernel matrix rows computed on demand and kept in a bounded LRU cache.
     */
    private final class KernelRows {

        private final double[][] data;
        private final Map<Integer, double[]> cache;

        KernelRows(double[][] data, int capacity) {
            this.data = data;
            int bounded = Math.max(2, capacity);
            this.cache = new LinkedHashMap<>(16, 0.75f, true) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<Integer, double[]> eldest) {
                    return size() > bounded;
                }
            };
        }

        double[] row(int i) {
            double[] cached = cache.get(i);
            if (cached != null) {
                return cached;
            }
            double[] row = new double[data.length];
            for (int t = 0; t < data.length; t++) {
                row[t] = kernel(data[i], data[t]);
            }
            cache.put(i, row);
            return row;
        }
    }
}
