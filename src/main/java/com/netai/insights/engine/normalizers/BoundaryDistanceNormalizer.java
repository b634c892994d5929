package com.netai.insights.engine.normalizers;

import com.netai.insights.engine.ModelOutput;
import com.netai.insights.model.ModelType;
import org.springframework.stereotype.Component;

/**
 * One-class SVM distances are reported as they are, only negated so that points outside the
 * boundary score positive. There is no rescaling: the score is unbounded and its magnitude is the
 * kernel-space distance, so it is not comparable with the [0, 1] scores of the other detectors.
 */
@Component
public class BoundaryDistanceNormalizer implements ScoreNormalizer {

    @Override
    public ModelType getSupportedModelType() {
        return ModelType.ONE_CLASS_SVM;
    }

    @Override
    public double[] normalize(ModelOutput output) {
        double[] raw = output.rawScores();
        if (raw == null) {
            throw new IllegalArgumentException("One-class SVM output has no raw scores");
        }
        double[] scores = new double[raw.length];
        for (int i = 0; i < raw.length; i++) {
            scores[i] = -raw[i];
        }
        return scores;
    }
}
