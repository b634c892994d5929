package com.netai.insights.config;

import io.micrometer.tracing.Tracer;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

/**
 * No-op tracer for @SpringBootTest contexts, so detection spans need no reporter.
 * Controller tests mock at the service layer and do not need it.
 */
@TestConfiguration
public class TestTracingConfig {

    @Bean
    public Tracer testTracer() {
        return Tracer.NOOP;
    }
}
