package com.netai.insights.repository;

import com.netai.insights.model.ModelBundle;
import com.netai.insights.model.ModelBundleMetadata;

import java.util.Optional;

/**
 * Key-addressed store of fitted model bundles. A save replaces whatever was stored under the key.
 */
public interface ModelBundleRepository {

    /**
     * @throws com.netai.insights.exception.DetectionException if the bundle cannot be written
     */
    void save(String key, ModelBundle bundle);

    /**
     * @throws com.netai.insights.exception.ModelLoadException if nothing is stored under the key
     *                                                         or the stored bundle cannot be decoded
     */
    ModelBundle load(String key);

    Optional<ModelBundleMetadata> findMetadata(String key);
}
