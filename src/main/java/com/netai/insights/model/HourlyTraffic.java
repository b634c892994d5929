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
@Schema(description = "Traffic per hour of day and device type")
public class HourlyTraffic {

    @Schema(description = "Hour of day, 0-23", example = "14")
    private int hour;

    @Schema(example = "switch")
    private String deviceType;

    @Schema(example = "87")
    private long eventCount;

    private Double avgLatency;

    private Double avgThroughput;

    @Schema(example = "1048576")
    private long totalBytesSent;

    @Schema(example = "2097152")
    private long totalBytesReceived;
}
