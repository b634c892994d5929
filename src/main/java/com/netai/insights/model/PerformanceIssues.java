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
@Schema(description = "Threshold violation counts; a record can count towards several")
public class PerformanceIssues {

    @Schema(example = "52")
    private long highLatencyCount;

    @Schema(example = "17")
    private long highCpuCount;

    @Schema(example = "9")
    private long highPacketLossCount;

    @Schema(example = "23")
    private long highRetransmissionCount;

    @Schema(description = "Sum of the four counts", example = "101")
    private long totalIssues;
}
