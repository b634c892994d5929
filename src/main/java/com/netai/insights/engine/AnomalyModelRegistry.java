package com.netai.insights.engine;

import com.netai.insights.engine.normalizers.ScoreNormalizer;
import com.netai.insights.exception.UnsupportedModelException;
import com.netai.insights.model.ModelType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Looks up the factory and score normalizer registered for each {@link ModelType}.
 */
@Component
public class AnomalyModelRegistry {

    private static final Logger log = LoggerFactory.getLogger(AnomalyModelRegistry.class);

    private final Map<ModelType, AnomalyModelFactory> factories = new EnumMap<>(ModelType.class);
    private final Map<ModelType, ScoreNormalizer> normalizers = new EnumMap<>(ModelType.class);

    public AnomalyModelRegistry(List<AnomalyModelFactory> modelFactories, List<ScoreNormalizer> scoreNormalizers) {
        for (AnomalyModelFactory factory : modelFactories) {
            factories.put(factory.getSupportedModelType(), factory);
            log.info("Registered anomaly model: {} -> {}",
                    factory.getSupportedModelType(), factory.getClass().getSimpleName());
        }
        for (ScoreNormalizer normalizer : scoreNormalizers) {
            normalizers.put(normalizer.getSupportedModelType(), normalizer);
            log.info("Registered score normalizer: {} -> {}",
                    normalizer.getSupportedModelType(), normalizer.getClass().getSimpleName());
        }
    }

    public AnomalyModel newModel(ModelType modelType) {
        AnomalyModelFactory factory = factories.get(modelType);
        if (factory == null) {
            throw new UnsupportedModelException(modelType.getSelector());
        }
        return factory.create();
    }

    public ScoreNormalizer normalizerFor(ModelType modelType) {
        ScoreNormalizer normalizer = normalizers.get(modelType);
        if (normalizer == null) {
            throw new UnsupportedModelException(modelType.getSelector());
        }
        return normalizer;
    }
}
