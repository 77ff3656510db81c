package com.quantlab.orchestrator.domain;

/**
 * Kind of work executed on the external compute service.
 */
public enum JobKind {
    TRAIN,
    BACKTEST,
    LABEL
}
