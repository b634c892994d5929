package com.netai.insights.engine;

import com.netai.insights.config.DetectionConfig;
import com.netai.insights.exception.InsufficientDataException;
import com.netai.insights.model.ModelBundle;
import com.netai.insights.model.ModelType;
import com.netai.insights.model.ScoredRecord;
import com.netai.insights.model.TelemetryRecord;
import com.netai.insights.testutil.TestDataFactory;
import com.netai.insights.testutil.TestEngines;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AnomalyDetectionEngineTest {

    private SimpleMeterRegistry meterRegistry;
    private AnomalyDetectionEngine engine;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        engine = TestEngines.engine(new DetectionConfig(), meterRegistry);
    }

    @Test
    void detect_latencyScenario_flagsTheFiveOutliers() {
        List<TelemetryRecord> batch = TestDataFactory.createLatencyScenario();

        DetectionRun run = engine.detect(batch, ModelType.ISOLATION_FOREST);
        List<ScoredRecord> scored = run.scoredRecords();

        assertThat(scored).hasSize(100);
        for (int i : TestDataFactory.LATENCY_OUTLIERS) {
            assertThat(scored.get(i).isAnomaly()).as("record %d", i).isTrue();
        }
        assertThat(run.anomalyCount()).isLessThanOrEqualTo(10);

        double outlierMean = TestDataFactory.LATENCY_OUTLIERS.stream()
                .mapToDouble(i -> scored.get(i).getAnomalyScore()).average().orElseThrow();
        double normalMean = 0.0;
        for (int i = 0; i < scored.size(); i++) {
            if (!TestDataFactory.LATENCY_OUTLIERS.contains(i)) normalMean += scored.get(i).getAnomalyScore();
        }
        normalMean /= 95;

        assertThat(outlierMean).isGreaterThan(0.6);
        assertThat(normalMean).isLessThan(0.4);
        for (int i : TestDataFactory.LATENCY_OUTLIERS) {
            assertThat(scored.get(i).getAnomalyScore()).isGreaterThan(normalMean);
        }
    }

    @Test
    void detect_isolationForest_scoresSpanUnitInterval() {
        List<ScoredRecord> scored = engine.detect(TestDataFactory.createNormalBatch(60, 4L), ModelType.ISOLATION_FOREST)
                .scoredRecords();

        assertThat(scored).allSatisfy(s -> assertThat(s.getAnomalyScore()).isBetween(0.0, 1.0));
        assertThat(scored).anySatisfy(s -> assertThat(s.getAnomalyScore()).isEqualTo(1.0));
        assertThat(scored).anySatisfy(s -> assertThat(s.getAnomalyScore()).isEqualTo(0.0));
    }

    @Test
    void detect_wrapsRecordsInInputOrderWithoutTouchingThem() {
        List<TelemetryRecord> batch = TestDataFactory.createNormalBatch(30, 2L);
        batch.get(3).setLatencyMs(null);

        List<ScoredRecord> scored = engine.detect(batch, ModelType.DBSCAN).scoredRecords();

        for (int i = 0; i < batch.size(); i++) {
            assertThat(scored.get(i).getRecord()).isSameAs(batch.get(i));
        }
        assertThat(batch.get(3).getLatencyMs()).isNull();
    }

    @Test
    void detect_dbscan_scoresAreTwoLevel() {
        List<ScoredRecord> scored = engine.detect(TestDataFactory.createNormalBatch(40, 6L), ModelType.DBSCAN)
                .scoredRecords();

        assertThat(scored).allSatisfy(s ->
                assertThat(s.getAnomalyScore()).isEqualTo(s.isAnomaly() ? 0.8 : 0.2));
    }

    @Test
    void detect_oneClassSvm_positiveScoreMeansAnomaly() {
        List<ScoredRecord> scored = engine.detect(TestDataFactory.createNormalBatch(50, 8L), ModelType.ONE_CLASS_SVM)
                .scoredRecords();

        assertThat(scored).allSatisfy(s -> assertThat(s.isAnomaly()).isEqualTo(s.getAnomalyScore() > 0.0));
    }

    @Test
    void detect_belowMinimumBatch_throws() {
        assertThatThrownBy(() -> engine.detect(TestDataFactory.createNormalBatch(9, 1L), ModelType.ISOLATION_FOREST))
                .isInstanceOf(InsufficientDataException.class);
    }

    @Test
    void detect_buildsBundleAndRecordsMetrics() {
        DetectionRun run = engine.detect(TestDataFactory.createNormalBatch(25, 3L), ModelType.ISOLATION_FOREST);
        ModelBundle bundle = run.bundle();

        assertThat(bundle.getModelType()).isEqualTo(ModelType.ISOLATION_FOREST);
        assertThat(bundle.getTrainingSamples()).isEqualTo(25);
        assertThat(bundle.getFeatureNames()).hasSize(8).startsWith("latency_ms");
        assertThat(bundle.getModel().fitted()).isTrue();
        assertThat(bundle.getScaler().isFitted()).isTrue();
        assertThat(bundle.getFittedAt()).isNotNull();

        assertThat(meterRegistry.counter("detection.run.count", "model_type", "isolation_forest").count())
                .isEqualTo(1.0);
        assertThat(meterRegistry.counter("detection.anomaly.count", "model_type", "isolation_forest").count())
                .isEqualTo((double) run.anomalyCount());
    }

    @Test
    void score_reusesFittedBundleForNewRecords() {
        List<TelemetryRecord> batch = TestDataFactory.createNormalBatch(40, 5L);
        DetectionRun run = engine.detect(batch, ModelType.ISOLATION_FOREST);

        List<TelemetryRecord> query = new ArrayList<>(batch.subList(0, 3));
        List<ScoredRecord> rescored = engine.score(run.bundle(), query);

        assertThat(rescored).hasSize(3);
        for (int i = 0; i < 3; i++) {
            assertThat(rescored.get(i).isAnomaly()).isEqualTo(run.scoredRecords().get(i).isAnomaly());
            assertThat(rescored.get(i).getAnomalyScore())
                    .isCloseTo(run.scoredRecords().get(i).getAnomalyScore(), within(1e-9));
        }
    }
}
