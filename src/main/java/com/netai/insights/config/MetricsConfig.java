package com.netai.insights.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDetectionRun(String modelType, int records, int anomalies) {
        Counter.builder("detection.run.count")
                .tag("model_type", modelType)
                .register(registry)
                .increment();

        Counter.builder("detection.anomaly.count")
                .tag("model_type", modelType)
                .register(registry)
                .increment(anomalies);

        DistributionSummary.builder("detection.anomaly_ratio")
                .tag("model_type", modelType)
                .register(registry)
                .record(records == 0 ? 0.0 : (double) anomalies / records);
    }

    public void recordModelLoadFallback(String reason) {
        Counter.builder("model.load.fallback.count")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordAggregationRun(String report) {
        Counter.builder("aggregation.run.count")
                .tag("report", report)
                .register(registry)
                .increment();
    }
}
