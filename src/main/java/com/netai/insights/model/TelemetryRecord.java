package com.netai.insights.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@Schema(description = "One telemetry observation emitted by a network device")
public class TelemetryRecord {

    @Schema(description = "Source record identifier", example = "1042")
    private Long id;

    @Schema(description = "Observation timestamp (ISO-8601)", example = "2024-05-01T13:45:00Z")
    private Instant timestamp;

    @Schema(description = "Device identifier", example = "SW-CORE-01")
    private String deviceId;

    @Schema(description = "Device type", example = "switch")
    private String deviceType;

    @Schema(description = "Device hardware model", example = "C9300-48P")
    private String deviceModel;

    @Schema(description = "Site or rack location", example = "DC1-Row3")
    private String location;

    @Schema(description = "Event category", example = "performance")
    private String eventCategory;

    @Schema(description = "Event type", example = "auth_fail")
    private String eventType;

    @Schema(description = "Network protocol", example = "TCP")
    private String protocol;

    @Schema(description = "Source IP address", example = "10.0.3.17")
    private String sourceIp;

    @Schema(description = "Destination IP address", example = "10.0.8.2")
    private String destinationIp;

    @Schema(description = "Bytes sent during the session", example = "48211")
    private Long bytesSent;

    @Schema(description = "Bytes received during the session", example = "91234")
    private Long bytesReceived;

    @Schema(description = "Packets sent during the session", example = "412")
    private Long packetsSent;

    @Schema(description = "Packets received during the session", example = "530")
    private Long packetsReceived;

    @Schema(description = "Session duration in seconds", example = "34")
    private Long sessionDurationSeconds;

    @Schema(description = "Round-trip latency in milliseconds", example = "23.4")
    private Double latencyMs;

    @Schema(description = "Packet delay variation in milliseconds", example = "2.1")
    private Double jitterMs;

    @Schema(description = "Fraction of packets lost (0.05 = 5%)", example = "0.01")
    private Double packetLoss;

    @Schema(description = "Throughput in Mbps", example = "412.5")
    private Double throughputMbps;

    @Schema(description = "CPU utilization percentage", example = "41.0")
    private Double cpuUtilization;

    @Schema(description = "Memory utilization percentage", example = "63.2")
    private Double memoryUtilization;

    @Schema(description = "TCP retransmission count", example = "2")
    private Double tcpRetransmissions;

    @Schema(description = "Wireless signal strength in dBm", example = "-61")
    private Double wirelessSignalStrength;

    @Schema(description = "Number of connected clients", example = "18")
    private Double clientCount;

    @Schema(description = "Whether the event completed successfully", example = "true")
    private Boolean success;

    @Schema(description = "Error code reported by the device, if any", example = "E401")
    private String errorCode;

    @Schema(description = "Anomaly score assigned by the upstream log producer", example = "0.12")
    private Double anomalyScore;
}
