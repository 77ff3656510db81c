package com.quantlab.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Strategy Job Orchestrator service.
 * Submits strategy jobs to the compute service and tracks them with internal polling workers.
 */
@SpringBootApplication
public class StrategyJobOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(StrategyJobOrchestratorApplication.class, args);
    }
}
