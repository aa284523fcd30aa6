package com.loom.orchestrator.service;

import com.loom.orchestrator.context.ContextEntry;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of a pipeline run: final context, its write history and one report
 * per stage that was reached.
 */
public record RunReport(String runId,
                        RunStatus status,
                        Instant startedAt,
                        long elapsedMillis,
                        Map<String, String> context,
                        List<ContextEntry> history,
                        List<StageReport> stages) {

    public RunReport {
        context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
        history = List.copyOf(history);
        stages  = List.copyOf(stages);
    }

    public List<StageReport> degradedStages() {
        return stages.stream().filter(StageReport::degraded).toList();
    }

    public StageReport stage(String stageName) {
        return stages.stream()
                .filter(s -> s.stageName().equals(stageName))
                .findFirst()
                .orElse(null);
    }
}
