package com.quantlab.orchestrator.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

/**
 * Core beans: clock and the HTTP client used to reach the compute service.
 */
@Configuration
@EnableConfigurationProperties(OrchestratorProperties.class)
public class OrchestratorConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Every gateway call is bounded by these timeouts; a timeout surfaces as a transient failure.
     */
    @Bean(name = "computeRestTemplate")
    public RestTemplate computeRestTemplate(RestTemplateBuilder builder, OrchestratorProperties properties) {
        OrchestratorProperties.Gateway gateway = properties.getGateway();
        return builder
                .rootUri(gateway.getBaseUrl())
                .setConnectTimeout(gateway.getConnectTimeout())
                .setReadTimeout(gateway.getReadTimeout())
                .build();
    }
}
