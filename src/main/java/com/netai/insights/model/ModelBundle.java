package com.netai.insights.model;

import com.netai.insights.engine.AnomalyModel;
import com.netai.insights.engine.pipeline.FeatureScaler;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * A fitted detector together with the scaler and feature order it was fit with.
 * Serialized as a single JSON document by the model bundle repositories.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelBundle {

    private ModelType modelType;

    private AnomalyModel model;

    private FeatureScaler scaler;

    private List<String> featureNames;

    private Instant fittedAt;

    private int trainingSamples;

    public ModelBundleMetadata toMetadata(String key) {
        return ModelBundleMetadata.builder()
                .key(key)
                .modelType(modelType)
                .featureNames(featureNames)
                .fittedAt(fittedAt)
                .trainingSamples(trainingSamples)
                .build();
    }
}
