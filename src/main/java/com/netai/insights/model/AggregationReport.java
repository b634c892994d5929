package com.netai.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "All aggregate views of one telemetry batch")
public class AggregationReport {

    private BatchSummary summary;

    @Schema(description = "Sorted by mean latency, highest first")
    private List<DevicePerformance> devicePerformance;

    @Schema(description = "Sorted by hour of day")
    private List<HourlyTraffic> hourlyTraffic;

    private PerformanceIssues performanceIssues;

    @Schema(description = "Devices with the most threshold violations, most first")
    private List<ProblematicDevice> problematicDevices;

    @Schema(description = "Sorted by count, highest first; empty when the batch has no security events")
    private List<SecurityEventSummary> securitySummary;

    private ReportProvenance provenance;
}
