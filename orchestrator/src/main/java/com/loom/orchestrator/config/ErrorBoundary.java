package com.loom.orchestrator.config;

/**
 * Per-stage error-boundary policy.
 *
 * @param required     whether a failure of the stage may stop the run
 * @param fallbackMode configured fallback
 * @param defaultValue placeholder written by {@link FallbackMode#USE_DEFAULT_VALUE}
 */
public record ErrorBoundary(boolean required, FallbackMode fallbackMode, String defaultValue) {

    /** Only a required stage configured with halt-pipeline stops the run. */
    public boolean haltsPipeline() {
        return required && fallbackMode == FallbackMode.HALT_PIPELINE;
    }

    /**
     * The fallback actually applied on a non-halting failure. An optional stage
     * cannot halt the run, so halt-pipeline degrades to skip there.
     */
    public FallbackMode effectiveFallback() {
        return fallbackMode == FallbackMode.HALT_PIPELINE ? FallbackMode.SKIP : fallbackMode;
    }
}
