package com.netai.insights.engine;

import com.netai.insights.model.Explanation;
import com.netai.insights.model.ScoredRecord;
import com.netai.insights.model.TelemetryFeature;
import com.netai.insights.model.TelemetryRecord;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Explains a classification in terms of fixed per-feature thresholds. Stateless.
 *
 * The thresholds are independent of the model: an anomaly the model found only through a
 * combination of features gets a single model-level reason.
 */
@Component
public class ExplanationGenerator {

    public static final String NO_ANOMALY = "no anomaly detected";
    public static final String MODEL_LEVEL_REASON = "anomaly detected by model based on feature combinations";

    private static final Map<TelemetryFeature, Double> THRESHOLDS = new LinkedHashMap<>();
    private static final Map<TelemetryFeature, String> RECOMMENDATIONS = new LinkedHashMap<>();

    static {
        THRESHOLDS.put(TelemetryFeature.LATENCY_MS, 100.0);
        THRESHOLDS.put(TelemetryFeature.JITTER_MS, 20.0);
        THRESHOLDS.put(TelemetryFeature.PACKET_LOSS, 0.05);
        THRESHOLDS.put(TelemetryFeature.CPU_UTILIZATION, 80.0);
        THRESHOLDS.put(TelemetryFeature.MEMORY_UTILIZATION, 80.0);
        THRESHOLDS.put(TelemetryFeature.TCP_RETRANSMISSIONS, 10.0);
        THRESHOLDS.put(TelemetryFeature.CLIENT_COUNT, 50.0);

        RECOMMENDATIONS.put(TelemetryFeature.LATENCY_MS, "Check network congestion or routing issues");
        RECOMMENDATIONS.put(TelemetryFeature.CPU_UTILIZATION, "Consider load balancing or device upgrade");
        RECOMMENDATIONS.put(TelemetryFeature.TCP_RETRANSMISSIONS, "Investigate network stability or packet loss");
    }

    public Explanation explain(ScoredRecord scored) {
        TelemetryRecord record = scored.getRecord() != null ? scored.getRecord() : new TelemetryRecord();
        Explanation explanation = Explanation.builder()
                .deviceId(record.getDeviceId())
                .timestamp(record.getTimestamp())
                .anomalous(scored.isAnomaly())
                .anomalyScore(Math.round(scored.getAnomalyScore() * 1000.0) / 1000.0)
                .build();

        if (!scored.isAnomaly()) {
            explanation.getReasons().add(messageOnly(NO_ANOMALY));
            return explanation;
        }

        List<Explanation.Reason> reasons = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();
        for (Map.Entry<TelemetryFeature, Double> entry : THRESHOLDS.entrySet()) {
            TelemetryFeature feature = entry.getKey();
            Double value = feature.valueOf(record);
            double threshold = entry.getValue();
            if (value == null || value <= threshold) {
                continue;
            }
            reasons.add(Explanation.Reason.builder()
                    .feature(feature.getWireName())
                    .observedValue(value)
                    .threshold(threshold)
                    .message(String.format(Locale.ROOT, "High %s: %.2f (threshold: %s)",
                            feature.getWireName(), value, formatThreshold(threshold)))
                    .build());
            String recommendation = RECOMMENDATIONS.get(feature);
            if (recommendation != null) {
                recommendations.add(recommendation);
            }
        }

        if (reasons.isEmpty()) {
            reasons.add(messageOnly(MODEL_LEVEL_REASON));
        }
        explanation.setReasons(reasons);
        explanation.setRecommendations(recommendations);
        return explanation;
    }

    private static Explanation.Reason messageOnly(String message) {
        return Explanation.Reason.builder().message(message).build();
    }

    // 100.0 -> "100", 0.05 -> "0.05"
    private static String formatThreshold(double threshold) {
        return BigDecimal.valueOf(threshold).stripTrailingZeros().toPlainString();
    }
}
