package com.netai.insights.controller;

import com.netai.insights.model.ModelBundleMetadata;
import com.netai.insights.repository.ModelBundleRepository;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/models")
@Tag(name = "Models", description = "Metadata of persisted model bundles")
public class ModelController {

    private final ModelBundleRepository bundleRepository;

    public ModelController(ModelBundleRepository bundleRepository) {
        this.bundleRepository = bundleRepository;
    }

    @Operation(summary = "Get model bundle metadata",
            description = "Returns the model type, feature list, fit time and training sample count of the bundle stored under the key.")
    @GetMapping("/{key}")
    public ResponseEntity<ModelBundleMetadata> getModelMetadata(
            @Parameter(description = "Bundle key", example = "anomaly_detector")
            @PathVariable String key) {
        return bundleRepository.findMetadata(key)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
