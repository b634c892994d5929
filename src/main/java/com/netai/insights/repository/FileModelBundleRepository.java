package com.netai.insights.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.netai.insights.config.ModelStoreConfig;
import com.netai.insights.exception.DetectionException;
import com.netai.insights.exception.ModelLoadException;
import com.netai.insights.model.ModelBundle;
import com.netai.insights.model.ModelBundleMetadata;
import com.netai.insights.model.TelemetryFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Stores each bundle as {@code <directory>/<key>.json}. Writes go to a temporary file in the same
 * directory which then replaces the target, so readers never see a half-written bundle.
 */
@Repository
@ConditionalOnProperty(name = "netai.model-store.type", havingValue = "file", matchIfMissing = true)
public class FileModelBundleRepository implements ModelBundleRepository {

    private static final Logger log = LoggerFactory.getLogger(FileModelBundleRepository.class);

    private static final Pattern VALID_KEY = Pattern.compile("[A-Za-z0-9_.-]+");

    private final Path directory;
    private final ObjectMapper objectMapper;

    public FileModelBundleRepository(ModelStoreConfig config) {
        this(Paths.get(config.getDirectory()));
    }

    FileModelBundleRepository(Path directory) {
        this.directory = directory;
        this.objectMapper = BundleJson.newMapper();
    }

    @Override
    public void save(String key, ModelBundle bundle) {
        Path target = pathFor(key);
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, key, ".tmp");
            objectMapper.writeValue(temp.toFile(), bundle);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException atomicUnsupported) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.info("Saved {} bundle '{}' to {} ({} training samples)",
                    bundle.getModelType().getSelector(), key, target, bundle.getTrainingSamples());
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new DetectionException("Failed to save model bundle '" + key + "'", e);
        }
    }

    @Override
    public ModelBundle load(String key) {
        Path path = pathFor(key);
        if (!Files.exists(path)) {
            throw new ModelLoadException("No model bundle stored under '" + key + "'");
        }
        try {
            ModelBundle bundle = objectMapper.readValue(path.toFile(), ModelBundle.class);
            validate(key, bundle);
            return bundle;
        } catch (IOException e) {
            throw new ModelLoadException("Model bundle '" + key + "' cannot be decoded", e);
        }
    }

    @Override
    public Optional<ModelBundleMetadata> findMetadata(String key) {
        try {
            return Optional.of(load(key).toMetadata(key));
        } catch (ModelLoadException | IllegalArgumentException e) {
            log.debug("No readable bundle for '{}': {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Rejects bundles that decode but cannot score: missing parts, a model type that disagrees with
     * the stored model, unknown feature names, or fitted state sized for a different feature list.
     *
     * @throws ModelLoadException describing the first problem found
     */
    static void validate(String key, ModelBundle bundle) {
        if (bundle == null || bundle.getModel() == null || bundle.getScaler() == null
                || bundle.getFeatureNames() == null || bundle.getModelType() == null
                || !bundle.getModel().fitted() || !bundle.getScaler().isFitted()) {
            throw new ModelLoadException("Model bundle '" + key + "' is incomplete");
        }
        if (bundle.getModelType() != bundle.getModel().modelType()) {
            throw new ModelLoadException(String.format("Model bundle '%s' declares %s but holds a %s model",
                    key, bundle.getModelType().getSelector(), bundle.getModel().modelType().getSelector()));
        }
        for (String name : bundle.getFeatureNames()) {
            try {
                TelemetryFeature.fromWireName(name);
            } catch (IllegalArgumentException e) {
                throw new ModelLoadException("Model bundle '" + key + "' uses an unknown feature: " + name, e);
            }
        }
        int featureCount = bundle.getFeatureNames().size();
        if (!bundle.getScaler().coversColumns(featureCount)) {
            throw new ModelLoadException(String.format(
                    "Model bundle '%s' has a scaler that does not match its %d features", key, featureCount));
        }
        if (!bundle.getModel().consistentWith(featureCount)) {
            throw new ModelLoadException(String.format(
                    "Model bundle '%s' has fitted state that does not match its %d features", key, featureCount));
        }
    }

    private Path pathFor(String key) {
        if (key == null || !VALID_KEY.matcher(key).matches()) {
            throw new IllegalArgumentException("Invalid bundle key: " + key);
        }
        return directory.resolve(key + ".json");
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) return;
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temporary bundle file {}", temp, e);
        }
    }
}
