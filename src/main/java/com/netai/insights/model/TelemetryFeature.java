package com.netai.insights.model;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Numeric telemetry dimensions the detection models consume, in model input order.
 * The wire name is the one used by model bundles and the prediction API.
 */
public enum TelemetryFeature {

    LATENCY_MS("latency_ms", "Network latency in milliseconds", TelemetryRecord::getLatencyMs),
    JITTER_MS("jitter_ms", "Packet delay variation in milliseconds", TelemetryRecord::getJitterMs),
    PACKET_LOSS("packet_loss", "Fraction of packets lost", TelemetryRecord::getPacketLoss),
    CPU_UTILIZATION("cpu_utilization", "Device CPU usage percentage", TelemetryRecord::getCpuUtilization),
    MEMORY_UTILIZATION("memory_utilization", "Device memory usage percentage", TelemetryRecord::getMemoryUtilization),
    TCP_RETRANSMISSIONS("tcp_retransmissions", "Number of TCP retransmissions", TelemetryRecord::getTcpRetransmissions),
    CLIENT_COUNT("client_count", "Number of connected clients", TelemetryRecord::getClientCount),
    THROUGHPUT_MBPS("throughput_mbps", "Network throughput in Mbps", TelemetryRecord::getThroughputMbps);

    public static final List<TelemetryFeature> MODEL_FEATURES = List.of(values());

    private final String wireName;
    private final String description;
    private final Function<TelemetryRecord, Double> accessor;

    TelemetryFeature(String wireName, String description, Function<TelemetryRecord, Double> accessor) {
        this.wireName = wireName;
        this.description = description;
        this.accessor = accessor;
    }

    public String getWireName() {
        return wireName;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Value of this feature on the record, or null when the device did not report it.
     */
    public Double valueOf(TelemetryRecord record) {
        return accessor.apply(record);
    }

    public static TelemetryFeature fromWireName(String wireName) {
        for (TelemetryFeature feature : values()) {
            if (feature.wireName.equals(wireName)) {
                return feature;
            }
        }
        throw new IllegalArgumentException("Unknown telemetry feature: " + wireName);
    }

    /**
     * Builds a feature-only record from wire-named values, e.g. for single-record prediction.
     */
    public static TelemetryRecord toRecord(Map<String, Double> values) {
        return TelemetryRecord.builder()
                .latencyMs(values.get(LATENCY_MS.wireName))
                .jitterMs(values.get(JITTER_MS.wireName))
                .packetLoss(values.get(PACKET_LOSS.wireName))
                .cpuUtilization(values.get(CPU_UTILIZATION.wireName))
                .memoryUtilization(values.get(MEMORY_UTILIZATION.wireName))
                .tcpRetransmissions(values.get(TCP_RETRANSMISSIONS.wireName))
                .clientCount(values.get(CLIENT_COUNT.wireName))
                .throughputMbps(values.get(THROUGHPUT_MBPS.wireName))
                .build();
    }
}
