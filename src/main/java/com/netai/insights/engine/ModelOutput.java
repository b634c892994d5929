package com.netai.insights.engine;

/**
 * Native output of a detector over a batch.
 *
 * @param anomalies      per-row anomaly flag
 * @param rawScores      per-row native score, or null when the detector only produces labels
 * @param referenceRange raw score range to normalize against, or null to use the batch's own range
 */
public record ModelOutput(boolean[] anomalies, double[] rawScores, ScoreRange referenceRange) {

    public static ModelOutput labelsOnly(boolean[] anomalies) {
        return new ModelOutput(anomalies, null, null);
    }

    public boolean hasRawScores() {
        return rawScores != null;
    }
}
