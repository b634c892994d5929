package com.netai.insights.engine.normalizers;

import com.netai.insights.config.DetectionConfig;
import com.netai.insights.engine.ModelOutput;
import com.netai.insights.model.ModelType;
import org.springframework.stereotype.Component;

/**
 * DBSCAN only labels points, so the score is two-level: noise gets the anomaly score (0.8 by
 * default), clustered points the normal score (0.2). It says nothing about degree.
 */
@Component
public class ClusterLabelNormalizer implements ScoreNormalizer {

    private final DetectionConfig config;

    public ClusterLabelNormalizer(DetectionConfig config) {
        this.config = config;
    }

    @Override
    public ModelType getSupportedModelType() {
        return ModelType.DBSCAN;
    }

    @Override
    public double[] normalize(ModelOutput output) {
        boolean[] anomalies = output.anomalies();
        double[] scores = new double[anomalies.length];
        for (int i = 0; i < anomalies.length; i++) {
            scores[i] = anomalies[i] ? config.getDbscan().getAnomalyScore() : config.getDbscan().getNormalScore();
        }
        return scores;
    }
}
