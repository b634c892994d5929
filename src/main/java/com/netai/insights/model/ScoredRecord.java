package com.netai.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A telemetry record paired with the classification derived for it")
public class ScoredRecord {

    @Schema(description = "The source record, unchanged")
    private TelemetryRecord record;

    @Schema(description = "Whether the model flagged the record as anomalous", example = "true")
    private boolean anomaly;

    @Schema(description = "Anomaly score; higher is more anomalous. [0,1] except for one_class_svm", example = "0.87")
    private double anomalyScore;

    public DetectionResult toDetectionResult() {
        return new DetectionResult(record != null ? record.getId() : null, anomaly, anomalyScore);
    }
}
