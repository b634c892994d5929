package com.netai.insights.engine.normalizers;

import com.netai.insights.engine.ModelOutput;
import com.netai.insights.model.ModelType;

/**
 * Maps a detector's native output onto the anomaly-score scale, where a higher score is
 * always more anomalous. The three detectors have incompatible notions of "anomalous", so each
 * normalizer documents the range and meaning of what it returns.
 */
public interface ScoreNormalizer {

    ModelType getSupportedModelType();

    double[] normalize(ModelOutput output);
}
