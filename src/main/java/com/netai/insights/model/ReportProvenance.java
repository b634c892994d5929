package com.netai.insights.model;

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
@Schema(description = "What a report was computed from")
public class ReportProvenance {

    @Schema(example = "5000")
    private int recordsAnalyzed;

    @Schema(example = "25")
    private long distinctDevices;

    @Schema(description = "Earliest record timestamp; null when no record has one")
    private Instant earliestTimestamp;

    private Instant latestTimestamp;

    private Instant generatedAt;
}
