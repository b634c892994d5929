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
@Schema(description = "Security-relevant events grouped by event type and device type")
public class SecurityEventSummary {

    @Schema(example = "auth_failure")
    private String eventType;

    @Schema(example = "firewall")
    private String deviceType;

    @Schema(example = "14")
    private long count;

    @Schema(description = "Mean source-provided anomaly score", example = "0.61")
    private Double avgAnomalyScore;
}
