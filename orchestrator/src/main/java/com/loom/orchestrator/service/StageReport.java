package com.loom.orchestrator.service;

import com.loom.orchestrator.config.FallbackMode;
import com.loom.orchestrator.provider.FailureKind;

import java.util.List;

/**
 * Outcome of one stage in a run.
 *
 * @param attempts        provider attempts made (0 on a cache hit)
 * @param failureKind     null unless the stage failed
 * @param failureReason   null unless the stage failed
 * @param appliedFallback fallback that was actually applied; null unless FAILED_RECOVERED
 * @param writtenKeys     context keys written for this stage, including fallback writes
 */
public record StageReport(String stageName,
                          StageState state,
                          boolean cacheHit,
                          int attempts,
                          long elapsedMillis,
                          FailureKind failureKind,
                          String failureReason,
                          FallbackMode appliedFallback,
                          List<String> writtenKeys) {

    public StageReport {
        writtenKeys = writtenKeys == null ? List.of() : List.copyOf(writtenKeys);
    }

    public boolean degraded() {
        return state == StageState.FAILED_RECOVERED;
    }
}
