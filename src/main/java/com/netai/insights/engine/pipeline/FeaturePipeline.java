package com.netai.insights.engine.pipeline;

import com.netai.insights.exception.InsufficientDataException;
import com.netai.insights.model.TelemetryFeature;
import com.netai.insights.model.TelemetryRecord;

import java.util.List;

/**
 * Turns a batch of telemetry records into the standardized matrix the detectors consume.
 *
 * A pipeline owns the scaler it fits, so each detection run needs its own instance.
 * {@link #fromScaler} rebuilds a transform-only pipeline around a persisted scaler.
 */
public class FeaturePipeline {

    private final List<TelemetryFeature> features;
    private final int minBatchSize;
    private FeatureScaler scaler;

    public FeaturePipeline(List<TelemetryFeature> features, int minBatchSize) {
        this.features = List.copyOf(features);
        this.minBatchSize = minBatchSize;
    }

    public static FeaturePipeline fromScaler(List<TelemetryFeature> features, FeatureScaler scaler) {
        FeaturePipeline pipeline = new FeaturePipeline(features, 0);
        pipeline.scaler = scaler;
        return pipeline;
    }

    /**
     * Impute with batch medians and standardize with batch statistics.
     *
     * @throws InsufficientDataException when the batch is smaller than the minimum batch size
     */
    public FeatureMatrix prepare(List<TelemetryRecord> batch) {
        if (batch.size() < minBatchSize || batch.isEmpty()) {
            throw new InsufficientDataException(batch.size(), Math.max(1, minBatchSize));
        }
        FeatureScaler fresh = new FeatureScaler();
        double[][] values = fresh.fitTransform(extract(batch));
        this.scaler = fresh;
        return new FeatureMatrix(featureNames(), values);
    }

    /**
     * Apply the already fitted scaler; no size requirement.
     */
    public FeatureMatrix transform(List<TelemetryRecord> records) {
        if (scaler == null) {
            throw new IllegalStateException("Pipeline has no fitted scaler");
        }
        return new FeatureMatrix(featureNames(), scaler.transform(extract(records)));
    }

    double[][] extract(List<TelemetryRecord> records) {
        double[][] raw = new double[records.size()][features.size()];
        for (int i = 0; i < records.size(); i++) {
            TelemetryRecord record = records.get(i);
            for (int f = 0; f < features.size(); f++) {
                Double value = features.get(f).valueOf(record);
                raw[i][f] = value != null ? value : Double.NaN;
            }
        }
        return raw;
    }

    public List<String> featureNames() {
        return features.stream().map(TelemetryFeature::getWireName).toList();
    }

    public FeatureScaler getScaler() {
        return scaler;
    }
}
