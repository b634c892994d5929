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
@Schema(description = "Per-device performance over the batch, grouped by device id, type and location")
public class DevicePerformance {

    @Schema(example = "RTR-EDGE-03")
    private String deviceId;

    @Schema(example = "router")
    private String deviceType;

    @Schema(example = "datacenter-1")
    private String location;

    @Schema(example = "240")
    private long eventCount;

    @Schema(description = "Mean latency in ms; null when no record reported it", example = "42.7")
    private Double avgLatency;

    private Double maxLatency;

    private Double avgCpu;

    private Double avgMemory;

    private Double avgThroughput;

    @Schema(description = "Sum of TCP retransmissions", example = "118")
    private Double totalRetransmissions;

    private Double avgPacketLoss;

    @Schema(example = "228")
    private long successCount;

    @Schema(description = "successCount / eventCount * 100", example = "95.0")
    private double successRate;
}
