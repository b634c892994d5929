package com.netai.insights.engine;

import com.netai.insights.config.DetectionConfig;
import com.netai.insights.config.MetricsConfig;
import com.netai.insights.engine.pipeline.FeatureMatrix;
import com.netai.insights.engine.pipeline.FeaturePipeline;
import com.netai.insights.model.ModelBundle;
import com.netai.insights.model.ModelType;
import com.netai.insights.model.ScoredRecord;
import com.netai.insights.model.TelemetryFeature;
import com.netai.insights.model.TelemetryRecord;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the detection pipeline: feature preparation, fit-and-score with the selected detector,
 * and score normalization. Every call builds its own pipeline and model, so the engine itself
 * holds no per-run state.
 */
@Component
public class AnomalyDetectionEngine {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionEngine.class);

    private final AnomalyModelRegistry registry;
    private final DetectionConfig config;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    public AnomalyDetectionEngine(AnomalyModelRegistry registry, DetectionConfig config,
                                  Tracer tracer, MetricsConfig metricsConfig) {
        this.registry = registry;
        this.config = config;
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Fit the detector on the batch and classify every record of it.
     *
     * @param batch     telemetry records, returned wrapped in input order
     * @param modelType detector to fit
     * @return scored records plus the fitted bundle
     * @throws com.netai.insights.exception.InsufficientDataException when the batch is below the minimum size
     */
    public DetectionRun detect(List<TelemetryRecord> batch, ModelType modelType) {
        Span span = tracer.nextSpan()
                .name("detection.run")
                .tag("model.type", modelType.getSelector())
                .tag("batch.size", String.valueOf(batch.size()))
                .start();

        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            FeaturePipeline pipeline = new FeaturePipeline(TelemetryFeature.MODEL_FEATURES, config.getMinBatchSize());
            FeatureMatrix matrix = pipeline.prepare(batch);

            AnomalyModel model = registry.newModel(modelType);
            ModelOutput output = model.fitAndScore(matrix.values());
            double[] scores = registry.normalizerFor(modelType).normalize(output);
            List<ScoredRecord> scored = wrap(batch, output.anomalies(), scores);

            ModelBundle bundle = ModelBundle.builder()
                    .modelType(modelType)
                    .model(model)
                    .scaler(pipeline.getScaler())
                    .featureNames(matrix.featureNames())
                    .fittedAt(Instant.now())
                    .trainingSamples(matrix.rows())
                    .build();

            DetectionRun run = new DetectionRun(scored, bundle);
            int anomalies = (int) run.anomalyCount();
            span.tag("detection.anomalies", String.valueOf(anomalies));
            metricsConfig.recordDetectionRun(modelType.getSelector(), batch.size(), anomalies);

            log.info("Detection run with {}: {} records, {} anomalies",
                    modelType.getSelector(), batch.size(), anomalies);
            return run;
        } catch (RuntimeException e) {
            span.error(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Classify records with an already fitted bundle; nothing is re-fit.
     */
    public List<ScoredRecord> score(ModelBundle bundle, List<TelemetryRecord> records) {
        List<TelemetryFeature> features = bundle.getFeatureNames().stream()
                .map(TelemetryFeature::fromWireName)
                .toList();
        FeatureMatrix matrix = FeaturePipeline.fromScaler(features, bundle.getScaler()).transform(records);

        ModelOutput output = bundle.getModel().score(matrix.values());
        double[] scores = registry.normalizerFor(bundle.getModelType()).normalize(output);
        return wrap(records, output.anomalies(), scores);
    }

    private static List<ScoredRecord> wrap(List<TelemetryRecord> records, boolean[] anomalies, double[] scores) {
        List<ScoredRecord> scored = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            scored.add(ScoredRecord.builder()
                    .record(records.get(i))
                    .anomaly(anomalies[i])
                    .anomalyScore(scores[i])
                    .build());
        }
        return scored;
    }
}
