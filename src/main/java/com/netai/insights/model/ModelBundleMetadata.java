package com.netai.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Descriptive metadata of a persisted model bundle")
public class ModelBundleMetadata {

    @Schema(example = "anomaly_detector")
    private String key;

    @Schema(example = "isolation_forest")
    private ModelType modelType;

    private List<String> featureNames;

    private Instant fittedAt;

    @Schema(example = "1000")
    private int trainingSamples;
}
