package com.netai.insights.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.netai.insights.config.DetectionConfig;
import com.netai.insights.config.ModelStoreConfig;
import com.netai.insights.engine.AnomalyDetectionEngine;
import com.netai.insights.exception.DetectionException;
import com.netai.insights.exception.ModelLoadException;
import com.netai.insights.model.ModelBundle;
import com.netai.insights.model.ModelBundleMetadata;
import com.netai.insights.model.ModelType;
import com.netai.insights.model.TelemetryRecord;
import com.netai.insights.testutil.TestDataFactory;
import com.netai.insights.testutil.TestEngines;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AerospikeModelBundleRepositoryTest {

    @Mock
    private AerospikeClient client;

    private AerospikeModelBundleRepository repository;
    private AnomalyDetectionEngine engine;

    @BeforeEach
    void setUp() {
        DetectionConfig config = new DetectionConfig();
        config.getIsolationForest().setNumTrees(20);
        engine = TestEngines.engine(config, new SimpleMeterRegistry());
        repository = new AerospikeModelBundleRepository(client, new ModelStoreConfig(), new WritePolicy(), new Policy());
    }

    @Test
    void saveThenLoad_roundTripsThroughBins() {
        Map<String, Object> stored = captureWrites();
        List<TelemetryRecord> batch = TestDataFactory.createNormalBatch(50, 9L);
        ModelBundle bundle = engine.detect(batch, ModelType.ISOLATION_FOREST).bundle();

        repository.save("anomaly_detector", bundle);

        assertThat(stored).containsEntry(AerospikeModelBundleRepository.BIN_KEY, "anomaly_detector");
        assertThat(stored).containsEntry(AerospikeModelBundleRepository.BIN_MODEL_TYPE, "isolation_forest");
        assertThat(stored.get(AerospikeModelBundleRepository.BIN_FEATURES).toString()).startsWith("latency_ms,jitter_ms");

        when(client.get(any(Policy.class), any(Key.class))).thenReturn(new Record(stored, 1, 0));
        ModelBundle loaded = repository.load("anomaly_detector");

        assertThat(loaded.getModelType()).isEqualTo(ModelType.ISOLATION_FOREST);
        assertThat(engine.score(loaded, batch))
                .extracting("anomalyScore")
                .isEqualTo(engine.score(bundle, batch).stream().map(s -> (Object) s.getAnomalyScore()).toList());
    }

    @Test
    void findMetadata_readsDescriptiveBins() {
        Map<String, Object> bins = new HashMap<>();
        bins.put(AerospikeModelBundleRepository.BIN_MODEL_TYPE, "dbscan");
        bins.put(AerospikeModelBundleRepository.BIN_FEATURES, "latency_ms,jitter_ms");
        bins.put(AerospikeModelBundleRepository.BIN_FITTED_AT, 1709251200000L);
        bins.put(AerospikeModelBundleRepository.BIN_SAMPLES, 250L);
        when(client.get(any(Policy.class), any(Key.class))).thenReturn(new Record(bins, 1, 0));

        Optional<ModelBundleMetadata> metadata = repository.findMetadata("anomaly_detector");

        assertThat(metadata).isPresent();
        assertThat(metadata.get().getModelType()).isEqualTo(ModelType.DBSCAN);
        assertThat(metadata.get().getFeatureNames()).containsExactly("latency_ms", "jitter_ms");
        assertThat(metadata.get().getFittedAt()).isEqualTo(TestDataFactory.BASE_TIME);
        assertThat(metadata.get().getTrainingSamples()).isEqualTo(250);
    }

    @Test
    void load_missingRecord_throwsModelLoadException() {
        when(client.get(any(Policy.class), any(Key.class))).thenReturn(null);

        assertThatThrownBy(() -> repository.load("anomaly_detector")).isInstanceOf(ModelLoadException.class);
        assertThat(repository.findMetadata("anomaly_detector")).isEmpty();
    }

    @Test
    void load_storeUnavailable_throwsModelLoadException() {
        when(client.get(any(Policy.class), any(Key.class))).thenThrow(new AerospikeException("connection refused"));

        assertThatThrownBy(() -> repository.load("anomaly_detector"))
                .isInstanceOf(ModelLoadException.class)
                .hasMessageContaining("unavailable");
        assertThat(repository.findMetadata("anomaly_detector")).isEmpty();
    }

    @Test
    void save_storeFailure_throwsDetectionException() {
        doThrow(new AerospikeException("write failed"))
                .when(client).put(any(WritePolicy.class), any(Key.class), any(Bin[].class));
        ModelBundle bundle = engine.detect(TestDataFactory.createNormalBatch(20, 2L), ModelType.DBSCAN).bundle();

        assertThatThrownBy(() -> repository.save("anomaly_detector", bundle))
                .isInstanceOf(DetectionException.class)
                .isNotInstanceOf(ModelLoadException.class);
    }

    // Record.getLong casts to Long, so integral bins are stored the way the server returns them
    private Map<String, Object> captureWrites() {
        Map<String, Object> stored = new HashMap<>();
        doAnswer(invocation -> {
            Object[] args = invocation.getArguments();
            for (int i = 2; i < args.length; i++) {
                if (args[i] instanceof Bin bin) {
                    store(stored, bin);
                } else if (args[i] instanceof Bin[] bins) {
                    for (Bin bin : bins) store(stored, bin);
                }
            }
            return null;
        }).when(client).put(any(WritePolicy.class), any(Key.class), any(Bin[].class));
        return stored;
    }

    private static void store(Map<String, Object> stored, Bin bin) {
        Object value = bin.value.getObject();
        stored.put(bin.name, value instanceof Number n && !(value instanceof Double) ? (Object) n.longValue() : value);
    }
}
