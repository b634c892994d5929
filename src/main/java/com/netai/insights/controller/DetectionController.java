package com.netai.insights.controller;

import com.netai.insights.config.DetectionConfig;
import com.netai.insights.exception.DegenerateScaleException;
import com.netai.insights.exception.InsufficientDataException;
import com.netai.insights.exception.UnsupportedModelException;
import com.netai.insights.model.DetectionReport;
import com.netai.insights.model.ModelType;
import com.netai.insights.model.ScoredRecord;
import com.netai.insights.model.TelemetryFeature;
import com.netai.insights.model.TelemetryRecord;
import com.netai.insights.service.AnomalyDetectionService;
import com.netai.insights.service.PredictionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/ml")
@Tag(name = "Machine Learning", description = "Batch anomaly detection, real-time prediction and explanations")
public class DetectionController {

    private final AnomalyDetectionService detectionService;
    private final PredictionService predictionService;
    private final DetectionConfig detectionConfig;

    public DetectionController(AnomalyDetectionService detectionService,
                               PredictionService predictionService,
                               DetectionConfig detectionConfig) {
        this.detectionService = detectionService;
        this.predictionService = predictionService;
        this.detectionConfig = detectionConfig;
    }

    @Operation(summary = "Detect anomalies in a telemetry batch",
            description = "Fits the selected unsupervised model on the submitted batch and classifies every record. " +
                    "Missing feature values are imputed with the batch median. Returns one scored record per input " +
                    "record plus run statistics, and persists the fitted model for real-time prediction.")
    @PostMapping("/detect")
    public ResponseEntity<?> detect(
            @RequestBody(required = false) List<TelemetryRecord> records,
            @Parameter(description = "isolation_forest, one_class_svm or dbscan", example = "isolation_forest")
            @RequestParam(required = false) String modelType) {

        if (records == null || records.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Request body must contain at least one record"));
        }
        if (records.size() > detectionConfig.getMaxBatchSize()) {
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "Batch of " + records.size() + " records exceeds the limit of " + detectionConfig.getMaxBatchSize()));
        }

        ModelType type;
        try {
            type = modelType == null ? detectionService.defaultModelType() : ModelType.fromSelector(modelType);
        } catch (UnsupportedModelException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }

        try {
            DetectionReport report = detectionService.detect(records, type);
            return ResponseEntity.ok(report);
        } catch (InsufficientDataException e) {
            return ResponseEntity.unprocessableEntity().body(Map.of(
                    "error", e.getMessage(),
                    "minimumRequired", e.getMinimumRequired()));
        } catch (DegenerateScaleException e) {
            return ResponseEntity.unprocessableEntity().body(Map.of("error", e.getMessage()));
        }
    }

    @Operation(summary = "Predict whether one measurement is anomalous",
            description = "Scores a single set of feature values with the most recently persisted model. " +
                    "Omitted features are imputed with the model's training medians. The result is never " +
                    "calibrated to the query and names the fit time of the model used.")
    @GetMapping("/predict")
    public ResponseEntity<?> predict(
            @Parameter(description = "Latency in ms", example = "250.0") @RequestParam(required = false) Double latency,
            @Parameter(description = "Jitter in ms", example = "12.5") @RequestParam(required = false) Double jitter,
            @Parameter(description = "Packet loss fraction", example = "0.01") @RequestParam(required = false) Double packetLoss,
            @Parameter(description = "CPU usage %", example = "45.0") @RequestParam(required = false) Double cpuUtil,
            @Parameter(description = "Memory usage %", example = "60.0") @RequestParam(required = false) Double memoryUtil,
            @Parameter(description = "TCP retransmissions", example = "2") @RequestParam(required = false) Double tcpRetrans,
            @Parameter(description = "Connected clients", example = "20") @RequestParam(required = false) Double clientCount,
            @Parameter(description = "Throughput in Mbps", example = "350.0") @RequestParam(required = false) Double throughput) {

        Map<String, Double> values = new HashMap<>();
        putIfPresent(values, TelemetryFeature.LATENCY_MS, latency);
        putIfPresent(values, TelemetryFeature.JITTER_MS, jitter);
        putIfPresent(values, TelemetryFeature.PACKET_LOSS, packetLoss);
        putIfPresent(values, TelemetryFeature.CPU_UTILIZATION, cpuUtil);
        putIfPresent(values, TelemetryFeature.MEMORY_UTILIZATION, memoryUtil);
        putIfPresent(values, TelemetryFeature.TCP_RETRANSMISSIONS, tcpRetrans);
        putIfPresent(values, TelemetryFeature.CLIENT_COUNT, clientCount);
        putIfPresent(values, TelemetryFeature.THROUGHPUT_MBPS, throughput);

        if (values.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "At least one feature value is required"));
        }
        return ResponseEntity.ok(predictionService.predictOne(values));
    }

    @Operation(summary = "Explain a scored record",
            description = "Lists the features of an anomalous record that exceed their fixed thresholds, " +
                    "with remediation hints. Normal records get a single 'no anomaly detected' reason.")
    @PostMapping("/explain")
    public ResponseEntity<?> explain(@RequestBody ScoredRecord scored) {
        if (scored.getRecord() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "Scored record must include the source record"));
        }
        return ResponseEntity.ok(detectionService.explain(scored));
    }

    @Operation(summary = "List the model features",
            description = "Returns the default model type and the ordered feature vector fed to every model.")
    @GetMapping("/features")
    public ResponseEntity<Map<String, Object>> features() {
        Map<String, String> features = new LinkedHashMap<>();
        for (TelemetryFeature feature : TelemetryFeature.MODEL_FEATURES) {
            features.put(feature.getWireName(), feature.getDescription());
        }
        return ResponseEntity.ok(Map.of(
                "modelType", detectionConfig.getDefaultModelType(),
                "features", features));
    }

    private static void putIfPresent(Map<String, Double> values, TelemetryFeature feature, Double value) {
        if (value != null) {
            values.put(feature.getWireName(), value);
        }
    }
}
