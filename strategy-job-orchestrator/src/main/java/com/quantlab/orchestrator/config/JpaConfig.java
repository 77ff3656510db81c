package com.quantlab.orchestrator.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * JPA configuration for the job and strategy tables.
 * Timestamps are written by the job store from the injected clock, so auditing stays off.
 */
@Configuration
@EnableJpaRepositories(basePackages = "com.quantlab.orchestrator.repository")
@EnableTransactionManagement
public class JpaConfig {
}
