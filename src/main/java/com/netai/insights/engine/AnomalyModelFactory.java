package com.netai.insights.engine;

import com.netai.insights.model.ModelType;

/**
 * Creates fresh, unfitted detector instances for one model type.
 */
public interface AnomalyModelFactory {

    ModelType getSupportedModelType();

    AnomalyModel create();
}
