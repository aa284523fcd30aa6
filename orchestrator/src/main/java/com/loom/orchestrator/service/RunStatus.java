package com.loom.orchestrator.service;

public enum RunStatus {
    COMPLETED,
    /** Every stage ran, at least one through a fallback. */
    COMPLETED_WITH_DEGRADATION,
    HALTED,
    CANCELLED
}
