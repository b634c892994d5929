package com.netai.insights.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.netai.insights.config.ModelStoreConfig;
import com.netai.insights.exception.DetectionException;
import com.netai.insights.exception.ModelLoadException;
import com.netai.insights.model.ModelBundle;
import com.netai.insights.model.ModelBundleMetadata;
import com.netai.insights.model.ModelType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

@Repository
@ConditionalOnProperty(name = "netai.model-store.type", havingValue = "aerospike")
public class AerospikeModelBundleRepository implements ModelBundleRepository {

    private static final Logger log = LoggerFactory.getLogger(AerospikeModelBundleRepository.class);

    static final String BIN_KEY = "key";
    static final String BIN_MODEL_TYPE = "modelType";
    static final String BIN_BUNDLE = "bundleJson";
    static final String BIN_FEATURES = "features";
    static final String BIN_FITTED_AT = "fittedAt";
    static final String BIN_SAMPLES = "trainSamples";

    private final AerospikeClient client;
    private final String namespace;
    private final String set;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public AerospikeModelBundleRepository(AerospikeClient client, ModelStoreConfig config,
                                          @Qualifier("bundleWritePolicy") WritePolicy writePolicy,
                                          @Qualifier("bundleReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = config.getAerospike().getNamespace();
        this.set = config.getAerospike().getSet();
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = BundleJson.newMapper();
    }

    @Override
    public void save(String key, ModelBundle bundle) {
        try {
            String bundleJson = objectMapper.writeValueAsString(bundle);
            client.put(writePolicy, new Key(namespace, set, key),
                    new Bin(BIN_KEY, key),
                    new Bin(BIN_MODEL_TYPE, bundle.getModelType().getSelector()),
                    new Bin(BIN_BUNDLE, bundleJson),
                    new Bin(BIN_FEATURES, String.join(",", bundle.getFeatureNames())),
                    new Bin(BIN_FITTED_AT, bundle.getFittedAt().toEpochMilli()),
                    new Bin(BIN_SAMPLES, bundle.getTrainingSamples()));

            log.info("Saved {} bundle '{}' ({} training samples)",
                    bundle.getModelType().getSelector(), key, bundle.getTrainingSamples());
        } catch (JsonProcessingException | AerospikeException e) {
            throw new DetectionException("Failed to save model bundle '" + key + "'", e);
        }
    }

    @Override
    public ModelBundle load(String key) {
        Record record = fetch(key);
        if (record == null) {
            throw new ModelLoadException("No model bundle stored under '" + key + "'");
        }
        String bundleJson = record.getString(BIN_BUNDLE);
        if (bundleJson == null) {
            throw new ModelLoadException("Model bundle '" + key + "' has no payload");
        }
        try {
            ModelBundle bundle = objectMapper.readValue(bundleJson, ModelBundle.class);
            FileModelBundleRepository.validate(key, bundle);
            return bundle;
        } catch (JsonProcessingException e) {
            throw new ModelLoadException("Model bundle '" + key + "' cannot be decoded", e);
        }
    }

    /**
     * Reads the descriptive bins only; the bundle payload is not decoded.
     */
    @Override
    public Optional<ModelBundleMetadata> findMetadata(String key) {
        Record record;
        try {
            record = fetch(key);
        } catch (ModelLoadException e) {
            log.warn("Metadata lookup for '{}' failed: {}", key, e.getMessage());
            return Optional.empty();
        }
        if (record == null) {
            return Optional.empty();
        }

        String features = record.getString(BIN_FEATURES);
        List<String> featureNames = features == null || features.isEmpty()
                ? List.of()
                : Arrays.asList(features.split(","));
        return Optional.of(ModelBundleMetadata.builder()
                .key(key)
                .modelType(ModelType.fromSelector(record.getString(BIN_MODEL_TYPE)))
                .featureNames(featureNames)
                .fittedAt(Instant.ofEpochMilli(record.getLong(BIN_FITTED_AT)))
                .trainingSamples(record.getInt(BIN_SAMPLES))
                .build());
    }

    private Record fetch(String key) {
        try {
            return client.get(readPolicy, new Key(namespace, set, key));
        } catch (AerospikeException e) {
            throw new ModelLoadException("Model store unavailable while reading '" + key + "'", e);
        }
    }
}
