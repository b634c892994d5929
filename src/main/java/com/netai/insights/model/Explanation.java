package com.netai.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Human-readable account of why a record was (or was not) classified as anomalous")
public class Explanation {

    @Schema(description = "Device that produced the record", example = "SW-CORE-01")
    private String deviceId;

    @Schema(description = "Record timestamp")
    private Instant timestamp;

    @Schema(description = "Whether the record is anomalous", example = "true")
    private boolean anomalous;

    @Schema(description = "Anomaly score rounded to three decimals", example = "0.912")
    private double anomalyScore;

    @Builder.Default
    private List<Reason> reasons = new ArrayList<>();

    @Builder.Default
    @Schema(description = "Remediation hints", example = "[\"Check network congestion or routing issues\"]")
    private List<String> recommendations = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @Schema(description = "One reason; feature, value and threshold are absent for model-level reasons")
    public static class Reason {
        @Schema(example = "latency_ms")
        private String feature;
        @Schema(example = "412.7")
        private Double observedValue;
        @Schema(example = "100")
        private Double threshold;
        @Schema(example = "High latency_ms: 412.70 (threshold: 100)")
        private String message;
    }
}
