package com.quantlab.orchestrator.exception;

public class StrategyNotFoundException extends RuntimeException {

    public StrategyNotFoundException(Long strategyId) {
        super("Strategy not found: " + strategyId);
    }
}
