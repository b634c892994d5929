package com.netai.insights.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI netAiInsightsOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("NetAI Insights API")
                        .version("1.0.0")
                        .description(
                                "Anomaly detection and batch analytics over network device telemetry.\n\n" +
                                "**Detection Pipeline:**\n" +
                                "1. Submit a telemetry batch via `POST /api/v1/ml/detect`\n" +
                                "2. Impute missing features with batch medians and standardize\n" +
                                "3. Fit the selected unsupervised model on the batch and classify every record\n" +
                                "4. Normalize scores so that higher always means more anomalous\n" +
                                "5. Persist the fitted bundle for `GET /api/v1/ml/predict`\n\n" +
                                "**Model Types:**\n" +
                                "- `isolation_forest`: random partitioning, scores in [0, 1]\n" +
                                "- `one_class_svm`: RBF boundary, unbounded negated distance\n" +
                                "- `dbscan`: density clustering, noise scores 0.8 and members 0.2\n\n" +
                                "Predictions reuse a model fit on an earlier batch and are never calibrated to the query.")
                        .contact(new Contact().name("NetAI Insights Team")));
    }
}
