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
@Schema(description = "Scored batch and run statistics returned by batch detection")
public class DetectionReport {

    @Schema(description = "One entry per input record, in input order")
    private List<ScoredRecord> scoredRecords;

    private DetectionStatistics statistics;
}
