package com.netai.insights.engine.svm;

import com.netai.insights.config.DetectionConfig;
import com.netai.insights.engine.AnomalyModel;
import com.netai.insights.engine.AnomalyModelFactory;
import com.netai.insights.model.ModelType;
import org.springframework.stereotype.Component;

@Component
public class OneClassSvmFactory implements AnomalyModelFactory {

    private final DetectionConfig config;

    public OneClassSvmFactory(DetectionConfig config) {
        this.config = config;
    }

    @Override
    public ModelType getSupportedModelType() {
        return ModelType.ONE_CLASS_SVM;
    }

    @Override
    public AnomalyModel create() {
        DetectionConfig.OneClassSvmSettings settings = config.getOneClassSvm();
        return new OneClassSvm(settings.getNu(), settings.getGamma(), settings.getTolerance(),
                settings.getMaxIterations(), settings.getCacheRows());
    }
}
