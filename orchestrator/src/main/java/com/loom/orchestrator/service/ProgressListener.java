package com.loom.orchestrator.service;

/**
 * Receives stage transitions while a run is in progress. Called on the
 * thread running the pipeline.
 */
@FunctionalInterface
public interface ProgressListener {

    void onStageEvent(StageEvent event);
}
