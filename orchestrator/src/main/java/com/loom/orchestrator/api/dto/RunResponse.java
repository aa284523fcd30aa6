package com.loom.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.loom.orchestrator.context.ContextEntry;
import com.loom.orchestrator.service.PipelineHaltedException;
import com.loom.orchestrator.service.RunReport;
import com.loom.orchestrator.service.StageReport;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Response body for POST /runs.
 *
 * haltedStage / haltKind are only present when a required stage stopped the
 * run; context and stages then cover what ran before the halt.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunResponse(
        String              runId,
        String              status,
        Instant             startedAt,
        long                elapsedMillis,
        String              haltedStage,
        String              haltKind,
        Map<String, String> context,
        List<ContextEntry>  history,
        List<StageResponse> stages,
        List<String>        degradedStages
) {
    public static RunResponse from(RunReport report) {
        return of(report, null, null);
    }

    public static RunResponse halted(PipelineHaltedException e) {
        return of(e.getPartialReport(), e.getStageName(), e.getKind().name());
    }

    private static RunResponse of(RunReport report, String haltedStage, String haltKind) {
        return new RunResponse(
                report.runId(),
                report.status().name(),
                report.startedAt(),
                report.elapsedMillis(),
                haltedStage,
                haltKind,
                report.context(),
                report.history(),
                report.stages().stream().map(StageResponse::from).toList(),
                report.degradedStages().stream().map(StageReport::stageName).toList()
        );
    }
}
