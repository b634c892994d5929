package com.netai.insights.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.netai.insights.config.DetectionConfig;
import com.netai.insights.engine.AnomalyDetectionEngine;
import com.netai.insights.exception.ModelLoadException;
import com.netai.insights.model.ModelBundle;
import com.netai.insights.model.ModelBundleMetadata;
import com.netai.insights.model.ModelType;
import com.netai.insights.model.ScoredRecord;
import com.netai.insights.model.TelemetryRecord;
import com.netai.insights.testutil.TestDataFactory;
import com.netai.insights.testutil.TestEngines;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileModelBundleRepositoryTest {

    @TempDir
    Path directory;

    private FileModelBundleRepository repository;
    private AnomalyDetectionEngine engine;

    @BeforeEach
    void setUp() {
        DetectionConfig config = new DetectionConfig();
        config.getIsolationForest().setNumTrees(25);
        engine = TestEngines.engine(config, new SimpleMeterRegistry());
        repository = new FileModelBundleRepository(directory.resolve("models"));
    }

    @ParameterizedTest
    @EnumSource(ModelType.class)
    void saveThenLoad_scoresIdentically(ModelType modelType) {
        List<TelemetryRecord> batch = TestDataFactory.createLatencyScenario();
        ModelBundle bundle = engine.detect(batch, modelType).bundle();

        repository.save("anomaly_detector", bundle);
        ModelBundle loaded = repository.load("anomaly_detector");

        assertThat(loaded.getModelType()).isEqualTo(modelType);
        assertThat(loaded.getFeatureNames()).isEqualTo(bundle.getFeatureNames());
        assertThat(loaded.getFittedAt()).isEqualTo(bundle.getFittedAt());
        assertThat(loaded.getTrainingSamples()).isEqualTo(100);

        List<ScoredRecord> before = engine.score(bundle, batch);
        List<ScoredRecord> after = engine.score(loaded, batch);
        for (int i = 0; i < batch.size(); i++) {
            assertThat(after.get(i).isAnomaly()).isEqualTo(before.get(i).isAnomaly());
            assertThat(after.get(i).getAnomalyScore()).isEqualTo(before.get(i).getAnomalyScore());
        }
    }

    @Test
    void save_replacesExistingBundleWithoutLeavingTempFiles() throws IOException {
        List<TelemetryRecord> batch = TestDataFactory.createNormalBatch(30, 3L);
        repository.save("anomaly_detector", engine.detect(batch, ModelType.ISOLATION_FOREST).bundle());
        repository.save("anomaly_detector", engine.detect(batch, ModelType.DBSCAN).bundle());

        assertThat(repository.load("anomaly_detector").getModelType()).isEqualTo(ModelType.DBSCAN);
        try (Stream<Path> files = Files.list(directory.resolve("models"))) {
            assertThat(files.map(p -> p.getFileName().toString())).containsExactly("anomaly_detector.json");
        }
    }

    @Test
    void load_missingKey_throwsModelLoadException() {
        assertThatThrownBy(() -> repository.load("never_saved"))
                .isInstanceOf(ModelLoadException.class)
                .hasMessageContaining("never_saved");
    }

    @Test
    void load_corruptFile_throwsModelLoadException() throws IOException {
        Files.createDirectories(directory.resolve("models"));
        Files.writeString(directory.resolve("models/broken.json"), "{\"modelType\": \"isolation_forest\", \"model\": ");

        assertThatThrownBy(() -> repository.load("broken"))
                .isInstanceOf(ModelLoadException.class)
                .hasMessageContaining("cannot be decoded");
    }

    @Test
    void load_incompleteBundle_throwsModelLoadException() throws IOException {
        Files.createDirectories(directory.resolve("models"));
        Files.writeString(directory.resolve("models/empty.json"), "{}");

        assertThatThrownBy(() -> repository.load("empty"))
                .isInstanceOf(ModelLoadException.class)
                .hasMessageContaining("incomplete");
    }

    @Test
    void load_unknownFeatureName_throwsModelLoadException() throws IOException {
        saveAndTamper("anomaly_detector", ModelType.ISOLATION_FOREST, bundle -> {
            ArrayNode names = (ArrayNode) bundle.get("featureNames");
            names.set(0, TextNode.valueOf("latency"));
        });

        assertThatThrownBy(() -> repository.load("anomaly_detector"))
                .isInstanceOf(ModelLoadException.class)
                .hasMessageContaining("unknown feature: latency");
        assertThat(repository.findMetadata("anomaly_detector")).isEmpty();
    }

    @Test
    void load_featureListShorterThanScaler_throwsModelLoadException() throws IOException {
        saveAndTamper("anomaly_detector", ModelType.ISOLATION_FOREST,
                bundle -> ((ArrayNode) bundle.get("featureNames")).remove(7));

        assertThatThrownBy(() -> repository.load("anomaly_detector"))
                .isInstanceOf(ModelLoadException.class)
                .hasMessageContaining("scaler");
    }

    @Test
    void load_missingModelType_throwsModelLoadException() throws IOException {
        saveAndTamper("anomaly_detector", ModelType.DBSCAN, bundle -> bundle.putNull("modelType"));

        assertThatThrownBy(() -> repository.load("anomaly_detector"))
                .isInstanceOf(ModelLoadException.class)
                .hasMessageContaining("incomplete");
    }

    @Test
    void load_modelTypeDisagreesWithModel_throwsModelLoadException() throws IOException {
        saveAndTamper("anomaly_detector", ModelType.DBSCAN, bundle -> bundle.put("modelType", "isolation_forest"));

        assertThatThrownBy(() -> repository.load("anomaly_detector"))
                .isInstanceOf(ModelLoadException.class)
                .hasMessageContaining("declares isolation_forest but holds a dbscan model");
    }

    @Test
    void load_svmWithoutCoefficients_throwsModelLoadException() throws IOException {
        saveAndTamper("anomaly_detector", ModelType.ONE_CLASS_SVM,
                bundle -> ((ObjectNode) bundle.get("model")).putNull("coefficients"));

        assertThatThrownBy(() -> repository.load("anomaly_detector"))
                .isInstanceOf(ModelLoadException.class)
                .hasMessageContaining("fitted state");
    }

    @Test
    void load_treeSplitOnMissingColumn_throwsModelLoadException() throws IOException {
        saveAndTamper("anomaly_detector", ModelType.ISOLATION_FOREST, bundle -> {
            ObjectNode root = (ObjectNode) bundle.get("model").get("trees").get(0).get("root");
            root.put("leaf", false);
            root.put("f", 42);
        });

        assertThatThrownBy(() -> repository.load("anomaly_detector"))
                .isInstanceOf(ModelLoadException.class)
                .hasMessageContaining("fitted state");
    }

    @Test
    void invalidKey_rejected() {
        assertThatThrownBy(() -> repository.load("../outside"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(repository.findMetadata("../outside")).isEmpty();
    }

    @Test
    void findMetadata_describesStoredBundle() {
        ModelBundle bundle = engine.detect(TestDataFactory.createNormalBatch(40, 5L), ModelType.ONE_CLASS_SVM).bundle();
        repository.save("svm", bundle);

        Optional<ModelBundleMetadata> metadata = repository.findMetadata("svm");

        assertThat(metadata).isPresent();
        assertThat(metadata.get().getKey()).isEqualTo("svm");
        assertThat(metadata.get().getModelType()).isEqualTo(ModelType.ONE_CLASS_SVM);
        assertThat(metadata.get().getTrainingSamples()).isEqualTo(40);
        assertThat(metadata.get().getFeatureNames()).hasSize(8).startsWith("latency_ms");
        assertThat(repository.findMetadata("absent")).isEmpty();
    }

    private void saveAndTamper(String key, ModelType modelType, Consumer<ObjectNode> change) throws IOException {
        repository.save(key, engine.detect(TestDataFactory.createLatencyScenario(), modelType).bundle());
        Path file = directory.resolve("models").resolve(key + ".json");
        ObjectMapper mapper = BundleJson.newMapper();
        ObjectNode bundle = (ObjectNode) mapper.readTree(file.toFile());
        change.accept(bundle);
        mapper.writeValue(file.toFile(), bundle);
    }
}
