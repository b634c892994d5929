package com.netai.insights.engine.dbscan;

import com.netai.insights.config.DetectionConfig;
import com.netai.insights.engine.AnomalyModel;
import com.netai.insights.engine.AnomalyModelFactory;
import com.netai.insights.model.ModelType;
import org.springframework.stereotype.Component;

@Component
public class DbscanFactory implements AnomalyModelFactory {

    private final DetectionConfig config;

    public DbscanFactory(DetectionConfig config) {
        this.config = config;
    }

    @Override
    public ModelType getSupportedModelType() {
        return ModelType.DBSCAN;
    }

    @Override
    public AnomalyModel create() {
        return new Dbscan(config.getDbscan().getEps(), config.getDbscan().getMinSamples());
    }
}
