package com.netai.insights.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "netai.detection")
public class DetectionConfig {

    // Batches below this size are rejected: imputing and scaling on fewer points is unreliable.
    private int minBatchSize = 10;

    // Upper bound on records accepted by a single detection or aggregation request.
    private int maxBatchSize = 10000;

    private String defaultModelType = "isolation_forest";

    // What min-max normalization does when every raw score in the batch is equal.
    private DegenerateScalePolicy degenerateScalePolicy = DegenerateScalePolicy.CONSTANT;

    private double degenerateScore = 0.5;

    // Persist the fitted bundle after each batch detection so real-time prediction can reuse it.
    private boolean persistAfterDetect = true;

    private String bundleKey = "anomaly_detector";

    private int topAnomalousDevices = 5;

    private int topExplanations = 5;

    private IsolationForestSettings isolationForest = new IsolationForestSettings();

    private OneClassSvmSettings oneClassSvm = new OneClassSvmSettings();

    private DbscanSettings dbscan = new DbscanSettings();

    public enum DegenerateScalePolicy {
        CONSTANT,
        FAIL
    }

    @Data
    public static class IsolationForestSettings {
        private int numTrees = 100;
        private int sampleSize = 256;
        private double contamination = 0.1;
        private long seed = 42;
    }

    @Data
    public static class OneClassSvmSettings {
        private double nu = 0.1;
        // <= 0 selects 1 / number of features
        private double gamma = 0.0;
        private double tolerance = 1e-3;
        private int maxIterations = 100000;
        private int cacheRows = 1024;
    }

    @Data
    public static class DbscanSettings {
        private double eps = 0.5;
        private int minSamples = 10;
        private double anomalyScore = 0.8;
        private double normalScore = 0.2;
    }
}
