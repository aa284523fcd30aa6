package com.loom.orchestrator.service;

import com.loom.orchestrator.config.FallbackMode;
import com.loom.orchestrator.provider.FailureKind;

/**
 * One stage transition, as seen by a {@link ProgressListener}.
 *
 * @param elapsedMillis time since the stage left PENDING
 * @param failureKind   set for failed states only
 * @param fallback      set for FAILED_RECOVERED only
 */
public record StageEvent(String runId,
                         String stageName,
                         StageState state,
                         long elapsedMillis,
                         FailureKind failureKind,
                         FallbackMode fallback) {

    static StageEvent of(String runId, String stageName, StageState state, long elapsedMillis) {
        return new StageEvent(runId, stageName, state, elapsedMillis, null, null);
    }
}
