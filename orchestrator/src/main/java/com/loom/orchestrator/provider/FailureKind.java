package com.loom.orchestrator.provider;

/**
 * Classification of a failed stage or provider call.
 *
 * Only {@link #PROVIDER_TRANSIENT} is eligible for retry; every other kind is
 * terminal the moment it occurs.
 */
public enum FailureKind {
    PROVIDER_UNAVAILABLE,   // credential missing/invalid, backend unknown or unreachable
    PROVIDER_TRANSIENT,     // timeout, rate limit, transient network failure
    STAGE_OUTPUT_INVALID,   // stage rejected the shape of the provider output
    STAGE_ERROR;            // unexpected exception inside a stage

    public boolean isRetryable() {
        return this == PROVIDER_TRANSIENT;
    }
}
