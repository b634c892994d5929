package com.netai.insights.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "netai.model-store")
public class ModelStoreConfig {

    // "file" or "aerospike"
    private String type = "file";

    // Root directory of the file store; bundles live at <directory>/<key>.json
    private String directory = "models";

    private Aerospike aerospike = new Aerospike();

    @Data
    public static class Aerospike {
        private String host = "127.0.0.1";
        private int port = 3000;
        private String namespace = "netai";
        private String set = "model_bundles";
    }
}
