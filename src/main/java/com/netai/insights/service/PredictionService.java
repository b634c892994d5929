package com.netai.insights.service;

import com.netai.insights.config.DetectionConfig;
import com.netai.insights.config.MetricsConfig;
import com.netai.insights.engine.AnomalyDetectionEngine;
import com.netai.insights.engine.ExplanationGenerator;
import com.netai.insights.exception.InsufficientDataException;
import com.netai.insights.exception.ModelLoadException;
import com.netai.insights.model.ModelBundle;
import com.netai.insights.model.ModelType;
import com.netai.insights.model.Prediction;
import com.netai.insights.model.ScoredRecord;
import com.netai.insights.model.TelemetryFeature;
import com.netai.insights.model.TelemetryRecord;
import com.netai.insights.repository.ModelBundleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Real-time classification of a single feature vector.
 *
 * The persisted bundle was fit on some earlier batch, so its scaling and score range say nothing
 * about how representative the query is. Every prediction therefore carries {@code calibrated=false}
 * and the fit time of the model that produced it.
 */
@Service
public class PredictionService {

    private static final Logger log = LoggerFactory.getLogger(PredictionService.class);

    private final ModelBundleRepository bundleRepository;
    private final AnomalyDetectionEngine engine;
    private final ExplanationGenerator explanationGenerator;
    private final DetectionConfig config;
    private final MetricsConfig metricsConfig;

    public PredictionService(ModelBundleRepository bundleRepository,
                             AnomalyDetectionEngine engine,
                             ExplanationGenerator explanationGenerator,
                             DetectionConfig config,
                             MetricsConfig metricsConfig) {
        this.bundleRepository = bundleRepository;
        this.engine = engine;
        this.explanationGenerator = explanationGenerator;
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    /**
     * @param featureValues feature values keyed by wire name (e.g. {@code latency_ms}); absent keys are missing values
     */
    public Prediction predictOne(Map<String, Double> featureValues) {
        TelemetryRecord record = TelemetryFeature.toRecord(featureValues);

        ModelBundle bundle;
        try {
            bundle = bundleRepository.load(config.getBundleKey());
        } catch (ModelLoadException e) {
            log.warn("No usable model bundle under '{}', fitting ad hoc: {}", config.getBundleKey(), e.getMessage());
            metricsConfig.recordModelLoadFallback("bundle_unavailable");
            return adHocPrediction(record);
        }

        ScoredRecord scored = engine.score(bundle, List.of(record)).get(0);
        String caveat = String.format(
                "Scored with a %s model fit on %d records at %s; the score is relative to that batch and not calibrated to this query",
                bundle.getModelType().getSelector(), bundle.getTrainingSamples(), bundle.getFittedAt());
        return build(scored, bundle.getModelType(), Prediction.ModelSource.PERSISTED_BUNDLE,
                bundle.getFittedAt(), caveat, bundle.getFeatureNames());
    }

    private Prediction adHocPrediction(TelemetryRecord record) {
        ModelType modelType = ModelType.fromSelector(config.getDefaultModelType());
        List<String> features = TelemetryFeature.MODEL_FEATURES.stream().map(TelemetryFeature::getWireName).toList();
        try {
            ScoredRecord scored = engine.detect(List.of(record), modelType).scoredRecords().get(0);
            return build(scored, modelType, Prediction.ModelSource.AD_HOC_FIT, Instant.now(),
                    "Fit ad hoc on the query alone; the score carries no information about other traffic", features);
        } catch (InsufficientDataException e) {
            log.warn("Ad hoc fit impossible for a single record ({}); returning default classification", e.getMessage());
            ScoredRecord scored = ScoredRecord.builder()
                    .record(record)
                    .anomaly(false)
                    .anomalyScore(0.0)
                    .build();
            String caveat = String.format(
                    "No persisted model available and one record is below the minimum batch size of %d; default classification returned",
                    e.getMinimumRequired());
            return build(scored, modelType, Prediction.ModelSource.AD_HOC_FIT, null, caveat, features);
        }
    }

    private Prediction build(ScoredRecord scored, ModelType modelType, Prediction.ModelSource source,
                             Instant fittedAt, String caveat, List<String> features) {
        return Prediction.builder()
                .result(scored.toDetectionResult())
                .explanation(explanationGenerator.explain(scored))
                .modelType(modelType)
                .modelSource(source)
                .modelFittedAt(fittedAt)
                .calibrated(false)
                .caveat(caveat)
                .metricsAnalyzed(features)
                .build();
    }
}
