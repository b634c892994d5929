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
@Schema(description = "Real-time classification of a single set of feature values")
public class Prediction {

    public enum ModelSource {
        PERSISTED_BUNDLE,
        AD_HOC_FIT
    }

    private DetectionResult result;

    private Explanation explanation;

    @Schema(description = "Detector used", example = "isolation_forest")
    private ModelType modelType;

    @Schema(description = "Where the model came from", example = "PERSISTED_BUNDLE")
    private ModelSource modelSource;

    @Schema(description = "When the scoring model was fit; null when no model could be fit")
    private Instant modelFittedAt;

    @Schema(description = "Always false: the model was fit on a different batch than the query", example = "false")
    private boolean calibrated;

    @Schema(description = "Accuracy caveat for this prediction")
    private String caveat;

    @Schema(description = "Features fed to the model", example = "[\"latency_ms\", \"jitter_ms\"]")
    private List<String> metricsAnalyzed;
}
