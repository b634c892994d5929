package com.netai.insights.controller;

import com.netai.insights.config.DetectionConfig;
import com.netai.insights.model.AggregationReport;
import com.netai.insights.model.BatchSummary;
import com.netai.insights.model.TelemetryRecord;
import com.netai.insights.service.TelemetryAggregationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/analytics")
@Tag(name = "Analytics", description = "Group-by aggregations over telemetry batches")
public class AnalyticsController {

    private final TelemetryAggregationService aggregationService;
    private final DetectionConfig detectionConfig;

    public AnalyticsController(TelemetryAggregationService aggregationService,
                               DetectionConfig detectionConfig) {
        this.aggregationService = aggregationService;
        this.detectionConfig = detectionConfig;
    }

    @Operation(summary = "Aggregate a telemetry batch",
            description = "Computes device performance, hourly traffic, performance issue counts, the most " +
                    "problematic devices and the security event summary for the submitted batch.")
    @PostMapping("/aggregate")
    public ResponseEntity<?> aggregate(@RequestBody(required = false) List<TelemetryRecord> records) {
        ResponseEntity<?> rejected = validate(records);
        if (rejected != null) {
            return rejected;
        }
        AggregationReport report = aggregationService.aggregate(records);
        return ResponseEntity.ok(report);
    }

    @Operation(summary = "Summarize a telemetry batch",
            description = "Success rate, record counts and latency ranges per device type, and the share of " +
                    "records whose source anomaly score is above the summary threshold.")
    @PostMapping("/summary")
    public ResponseEntity<?> summary(@RequestBody(required = false) List<TelemetryRecord> records) {
        ResponseEntity<?> rejected = validate(records);
        if (rejected != null) {
            return rejected;
        }
        BatchSummary summary = aggregationService.summarize(records);
        return ResponseEntity.ok(summary);
    }

    private ResponseEntity<?> validate(List<TelemetryRecord> records) {
        if (records == null || records.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Request body must contain at least one record"));
        }
        if (records.size() > detectionConfig.getMaxBatchSize()) {
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "Batch of " + records.size() + " records exceeds the limit of " + detectionConfig.getMaxBatchSize()));
        }
        return null;
    }
}
