package com.netai.insights.engine;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record ScoreRange(double min, double max) {

    public static ScoreRange of(double[] values) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            if (v < min) min = v;
            if (v > max) max = v;
        }
        return new ScoreRange(min, max);
    }

    @JsonIgnore
    public double width() {
        return max - min;
    }
}
