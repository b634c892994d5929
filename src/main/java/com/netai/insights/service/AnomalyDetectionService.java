package com.netai.insights.service;

import com.netai.insights.config.DetectionConfig;
import com.netai.insights.engine.AnomalyDetectionEngine;
import com.netai.insights.engine.DetectionRun;
import com.netai.insights.engine.ExplanationGenerator;
import com.netai.insights.exception.DetectionException;
import com.netai.insights.exception.InsufficientDataException;
import com.netai.insights.model.DetectionReport;
import com.netai.insights.model.DetectionStatistics;
import com.netai.insights.model.Explanation;
import com.netai.insights.model.ModelBundle;
import com.netai.insights.model.ModelType;
import com.netai.insights.model.ScoredRecord;
import com.netai.insights.model.TelemetryFeature;
import com.netai.insights.model.TelemetryRecord;
import com.netai.insights.repository.ModelBundleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

@Service
public class AnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

    private final AnomalyDetectionEngine engine;
    private final ExplanationGenerator explanationGenerator;
    private final ModelBundleRepository bundleRepository;
    private final DetectionConfig config;

    public AnomalyDetectionService(AnomalyDetectionEngine engine,
                                   ExplanationGenerator explanationGenerator,
                                   ModelBundleRepository bundleRepository,
                                   DetectionConfig config) {
        this.engine = engine;
        this.explanationGenerator = explanationGenerator;
        this.bundleRepository = bundleRepository;
        this.config = config;
    }

    /**
     * Fit the selected detector on the batch, classify every record and summarize the run.
     * The fitted bundle is then persisted for real-time prediction; a failed save is reported in
     * the statistics and does not fail the detection.
     */
    public DetectionReport detect(List<TelemetryRecord> batch, ModelType modelType) {
        DetectionRun run;
        try {
            run = engine.detect(batch, modelType);
        } catch (InsufficientDataException e) {
            log.warn("Rejected {} batch of {} records: {}", modelType.getSelector(), batch.size(), e.getMessage());
            throw e;
        }

        boolean persisted = config.isPersistAfterDetect() && persist(run.bundle());
        return DetectionReport.builder()
                .scoredRecords(run.scoredRecords())
                .statistics(statistics(run.scoredRecords(), modelType, persisted))
                .build();
    }

    public Explanation explain(ScoredRecord scored) {
        return explanationGenerator.explain(scored);
    }

    public ModelType defaultModelType() {
        return ModelType.fromSelector(config.getDefaultModelType());
    }

    DetectionStatistics statistics(List<ScoredRecord> scored, ModelType modelType, boolean persisted) {
        List<ScoredRecord> anomalies = scored.stream().filter(ScoredRecord::isAnomaly).toList();
        int total = scored.size();

        Map<String, Long> byDeviceType = anomalies.stream()
                .map(s -> s.getRecord().getDeviceType())
                .filter(Objects::nonNull)
                .collect(Collectors.groupingBy(t -> t, TreeMap::new, Collectors.counting()));

        Map<String, DetectionStatistics.FeatureAnomalyStats> featureStats = new LinkedHashMap<>();
        if (!anomalies.isEmpty()) {
            for (TelemetryFeature feature : TelemetryFeature.MODEL_FEATURES) {
                List<Double> values = anomalies.stream()
                        .map(s -> feature.valueOf(s.getRecord()))
                        .filter(Objects::nonNull)
                        .toList();
                if (values.isEmpty()) continue;
                featureStats.put(feature.getWireName(), DetectionStatistics.FeatureAnomalyStats.builder()
                        .mean(values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0))
                        .max(values.stream().mapToDouble(Double::doubleValue).max().orElse(0.0))
                        .build());
            }
        }

        return DetectionStatistics.builder()
                .totalRecords(total)
                .totalAnomalies(anomalies.size())
                .anomalyPercentage(total > 0 ? anomalies.size() * 100.0 / total : 0.0)
                .modelType(modelType)
                .detectionTime(Instant.now())
                .anomaliesByDeviceType(byDeviceType)
                .featureStats(featureStats)
                .topAnomalousDevices(topDevices(anomalies))
                .topAnomalyExplanations(topExplanations(anomalies))
                .modelPersisted(persisted)
                .build();
    }

    private List<DetectionStatistics.DeviceAnomalyScore> topDevices(List<ScoredRecord> anomalies) {
        Map<String, Double> meanByDevice = anomalies.stream()
                .filter(s -> s.getRecord().getDeviceId() != null)
                .collect(Collectors.groupingBy(s -> s.getRecord().getDeviceId(), TreeMap::new,
                        Collectors.averagingDouble(ScoredRecord::getAnomalyScore)));

        return meanByDevice.entrySet().stream()
                .sorted(Map.Entry.<String, Double>comparingByValue().reversed())
                .limit(config.getTopAnomalousDevices())
                .map(e -> DetectionStatistics.DeviceAnomalyScore.builder()
                        .deviceId(e.getKey())
                        .meanScore(e.getValue())
                        .build())
                .toList();
    }

    private List<Explanation> topExplanations(List<ScoredRecord> anomalies) {
        return anomalies.stream()
                .sorted(Comparator.comparingDouble(ScoredRecord::getAnomalyScore).reversed())
                .limit(config.getTopExplanations())
                .map(explanationGenerator::explain)
                .toList();
    }

    private boolean persist(ModelBundle bundle) {
        try {
            bundleRepository.save(config.getBundleKey(), bundle);
            return true;
        } catch (DetectionException e) {
            log.error("Failed to persist {} bundle under '{}'",
                    bundle.getModelType().getSelector(), config.getBundleKey(), e);
            return false;
        }
    }
}
