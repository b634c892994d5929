package com.netai.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Summary of one detection run")
public class DetectionStatistics {

    @Schema(description = "Records in the analyzed batch", example = "1000")
    private int totalRecords;

    @Schema(description = "Records flagged as anomalous", example = "100")
    private int totalAnomalies;

    @Schema(description = "Anomalous share of the batch in percent", example = "10.0")
    private double anomalyPercentage;

    @Schema(description = "Detector that produced the classification", example = "isolation_forest")
    private ModelType modelType;

    @Schema(description = "When the run finished")
    private Instant detectionTime;

    @Schema(description = "Anomaly count per device type", example = "{\"router\": 12, \"switch\": 4}")
    private Map<String, Long> anomaliesByDeviceType;

    @Schema(description = "Mean and maximum of each model feature over the anomalous records")
    private Map<String, FeatureAnomalyStats> featureStats;

    @Schema(description = "Devices with the highest mean anomaly score, most anomalous first")
    private List<DeviceAnomalyScore> topAnomalousDevices;

    @Schema(description = "Explanations of the highest scoring anomalies")
    private List<Explanation> topAnomalyExplanations;

    @Schema(description = "Whether the fitted model bundle was persisted for real-time prediction", example = "true")
    private boolean modelPersisted;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FeatureAnomalyStats {
        private Double mean;
        private Double max;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DeviceAnomalyScore {
        private String deviceId;
        private double meanScore;
    }
}
