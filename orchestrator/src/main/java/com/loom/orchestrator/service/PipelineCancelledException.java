package com.loom.orchestrator.service;

/**
 * The thread running a pipeline was interrupted. The partial report holds
 * only the writes of stages that completed before the interrupt.
 */
public class PipelineCancelledException extends RuntimeException {

    private final String    stageName;
    private final RunReport partialReport;

    public PipelineCancelledException(String stageName, RunReport partialReport, Throwable cause) {
        super("Pipeline " + partialReport.runId() + " cancelled"
                + (stageName == null ? "" : " during stage '" + stageName + "'"), cause);
        this.stageName     = stageName;
        this.partialReport = partialReport;
    }

    /** Stage that was running when the run was cancelled; null if between stages. */
    public String getStageName() { return stageName; }
    public RunReport getPartialReport() { return partialReport; }
}
