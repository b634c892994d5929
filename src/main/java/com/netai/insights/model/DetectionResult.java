package com.netai.insights.model;

/**
 * Classification of one record. The score grows with anomalousness for every model type.
 */
public record DetectionResult(Long recordId, boolean anomaly, double score) {}
