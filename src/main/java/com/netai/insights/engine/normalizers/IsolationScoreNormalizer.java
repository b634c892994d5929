package com.netai.insights.engine.normalizers;

import com.netai.insights.config.DetectionConfig;
import com.netai.insights.engine.ModelOutput;
import com.netai.insights.engine.ScoreRange;
import com.netai.insights.exception.DegenerateScaleException;
import com.netai.insights.model.ModelType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * Isolation forest decision scores, min-max normalized and inverted: {@code 1 - (d - min) / (max - min)}.
 * Results lie in [0, 1]. The range is the batch's own unless the output carries the training
 * range of a persisted model, in which case out-of-range scores are clamped.
 */
@Component
public class IsolationScoreNormalizer implements ScoreNormalizer {

    private static final Logger log = LoggerFactory.getLogger(IsolationScoreNormalizer.class);

    private final DetectionConfig config;

    public IsolationScoreNormalizer(DetectionConfig config) {
        this.config = config;
    }

    @Override
    public ModelType getSupportedModelType() {
        return ModelType.ISOLATION_FOREST;
    }

    @Override
    public double[] normalize(ModelOutput output) {
        double[] raw = output.rawScores();
        if (raw == null) {
            throw new IllegalArgumentException("Isolation forest output has no raw scores");
        }
        if (raw.length == 0) {
            return new double[0];
        }
        ScoreRange range = output.referenceRange() != null ? output.referenceRange() : ScoreRange.of(raw);

        if (range.width() <= 0.0) {
            if (config.getDegenerateScalePolicy() == DetectionConfig.DegenerateScalePolicy.FAIL) {
                throw new DegenerateScaleException(range.min(), raw.length);
            }
            log.warn("All {} decision scores equal {}; assigning constant anomaly score {}",
                    raw.length, range.min(), config.getDegenerateScore());
            double[] constant = new double[raw.length];
            Arrays.fill(constant, config.getDegenerateScore());
            return constant;
        }

        double[] scores = new double[raw.length];
        for (int i = 0; i < raw.length; i++) {
            double normalized = (raw[i] - range.min()) / range.width();
            scores[i] = clamp(1.0 - normalized);
        }
        return scores;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
