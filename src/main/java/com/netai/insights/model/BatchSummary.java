package com.netai.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Headline statistics of a telemetry batch")
public class BatchSummary {

    @Schema(example = "5000")
    private int totalRecords;

    @Schema(description = "Successful records in percent, two decimals", example = "96.42")
    private double successRate;

    @Schema(example = "{\"router\": 1200, \"switch\": 1800}")
    private Map<String, Long> recordsByDeviceType;

    private Map<String, LatencyStats> latencyByDeviceType;

    @Schema(description = "Records whose source anomaly score exceeds the summary threshold", example = "250")
    private long highAnomalyCount;

    @Schema(example = "5.0")
    private double highAnomalyPercentage;

    private ReportProvenance provenance;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LatencyStats {
        private double avg;
        private double max;
        private double min;
    }
}
