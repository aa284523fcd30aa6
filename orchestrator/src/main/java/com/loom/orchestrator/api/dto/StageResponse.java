package com.loom.orchestrator.api.dto;

import com.loom.orchestrator.service.StageReport;

import java.util.List;

public record StageResponse(
        String       stage,
        String       state,
        boolean      cacheHit,
        int          attempts,
        long         elapsedMillis,
        String       failureKind,
        String       failureReason,
        String       fallback,
        List<String> writtenKeys
) {
    public static StageResponse from(StageReport r) {
        return new StageResponse(
                r.stageName(),
                r.state().name(),
                r.cacheHit(),
                r.attempts(),
                r.elapsedMillis(),
                r.failureKind() == null ? null : r.failureKind().name(),
                r.failureReason(),
                r.appliedFallback() == null ? null : r.appliedFallback().configName(),
                r.writtenKeys()
        );
    }
}
