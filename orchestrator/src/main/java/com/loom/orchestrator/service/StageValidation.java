package com.loom.orchestrator.service;

import com.loom.orchestrator.config.ConfigLayer;

import java.util.List;
import java.util.Map;

/**
 * Validate-only outcome for one stage.
 *
 * @param providerId null when the configuration could not be resolved
 * @param sources    layer of each resolved setting; empty when unresolved
 */
public record StageValidation(String stageName,
                              boolean valid,
                              String providerId,
                              String model,
                              List<String> problems,
                              Map<String, ConfigLayer> sources) {

    public StageValidation {
        problems = List.copyOf(problems);
        sources  = Map.copyOf(sources);
    }
}
