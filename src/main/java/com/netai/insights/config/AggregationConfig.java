package com.netai.insights.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "netai.aggregation")
public class AggregationConfig {

    private double highLatencyMs = 100.0;

    private double highCpuPct = 80.0;

    // fraction, 0.05 = 5%
    private double highPacketLoss = 0.05;

    private double highRetransmissions = 10.0;

    private int topProblematicDevices = 10;

    // Zone used to derive hour-of-day for the hourly traffic view.
    private String zoneId = "UTC";

    // Source anomaly score above which the batch summary counts a record as anomalous.
    private double summaryAnomalyThreshold = 0.7;
}
