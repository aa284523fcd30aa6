package com.loom.orchestrator.service;

import com.loom.orchestrator.provider.FailureKind;

/**
 * A required stage with the halt-pipeline policy failed. Carries the report
 * of everything that ran up to and including the halting stage.
 */
public class PipelineHaltedException extends RuntimeException {

    private final String      stageName;
    private final FailureKind kind;
    private final RunReport   partialReport;

    public PipelineHaltedException(String stageName, FailureKind kind, String reason, RunReport partialReport) {
        super("Pipeline halted at stage '" + stageName + "' [" + kind + "]: " + reason);
        this.stageName     = stageName;
        this.kind          = kind;
        this.partialReport = partialReport;
    }

    public String getStageName() { return stageName; }
    public FailureKind getKind() { return kind; }
    public RunReport getPartialReport() { return partialReport; }
}
