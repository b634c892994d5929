package com.netai.insights.engine.isolationforest;

import com.netai.insights.config.DetectionConfig;
import com.netai.insights.engine.AnomalyModel;
import com.netai.insights.engine.AnomalyModelFactory;
import com.netai.insights.model.ModelType;
import org.springframework.stereotype.Component;

@Component
public class IsolationForestFactory implements AnomalyModelFactory {

    private final DetectionConfig config;

    public IsolationForestFactory(DetectionConfig config) {
        this.config = config;
    }

    @Override
    public ModelType getSupportedModelType() {
        return ModelType.ISOLATION_FOREST;
    }

    @Override
    public AnomalyModel create() {
        DetectionConfig.IsolationForestSettings settings = config.getIsolationForest();
        return new IsolationForest(settings.getNumTrees(), settings.getSampleSize(),
                settings.getContamination(), settings.getSeed());
    }
}
