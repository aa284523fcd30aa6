package com.loom.orchestrator.service;

/**
 * Per-stage lifecycle within one run.
 *
 * <pre>
 *   PENDING -> CACHE_HIT -> SUCCEEDED
 *   PENDING -> INVOKING  -> SUCCEEDED | FAILED_RECOVERED | FAILED_HALTED
 * </pre>
 */
public enum StageState {
    PENDING,
    CACHE_HIT,
    INVOKING,
    SUCCEEDED,
    /** Failed, and the configured fallback let the run continue. */
    FAILED_RECOVERED,
    /** Failed and stopped the run. */
    FAILED_HALTED;

    public boolean isFinal() {
        return this == SUCCEEDED || this == FAILED_RECOVERED || this == FAILED_HALTED;
    }
}
