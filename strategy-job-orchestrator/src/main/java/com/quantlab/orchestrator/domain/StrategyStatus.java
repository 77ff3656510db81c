package com.quantlab.orchestrator.domain;

public enum StrategyStatus {
    DRAFT,
    ACTIVE,
    PAUSED,
    STOPPED,
    ERROR
}
