package com.netai.insights.engine;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.netai.insights.engine.dbscan.Dbscan;
import com.netai.insights.engine.isolationforest.IsolationForest;
import com.netai.insights.engine.svm.OneClassSvm;
import com.netai.insights.model.ModelType;

/**
 * Contract shared by all unsupervised detectors.
 * Implementations are stateful: create one instance per detection run.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "algorithm")
@JsonSubTypes({
        @JsonSubTypes.Type(value = IsolationForest.class, name = "isolation_forest"),
        @JsonSubTypes.Type(value = OneClassSvm.class, name = "one_class_svm"),
        @JsonSubTypes.Type(value = Dbscan.class, name = "dbscan")
})
public interface AnomalyModel {

    ModelType modelType();

    /**
     * Fit on the whole standardized batch and classify every row of it.
     */
    ModelOutput fitAndScore(double[][] data);

    /**
     * Classify rows with the already fitted state.
     *
     * @throws IllegalStateException if the model has not been fit
     */
    ModelOutput score(double[][] data);

    boolean fitted();

    /**
     * Whether the fitted state is usable on rows of {@code featureCount} columns.
     * Checked when a persisted model is loaded, before it scores anything.
     */
    boolean consistentWith(int featureCount);
}
