package com.loom.orchestrator.stage;

import java.util.List;

/**
 * Static description of a stage.
 *
 * @param name            unique stage name, used in configuration and reports
 * @param outputKeys      context keys this stage owns; the first receives its output
 * @param interestingKeys context keys the stage reads; they feed the cache key
 *                        but are not enforced dependencies
 */
public record StageDescriptor(String name, List<String> outputKeys, List<String> interestingKeys) {

    public StageDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Stage name must not be blank");
        }
        if (outputKeys == null || outputKeys.isEmpty()) {
            throw new IllegalArgumentException("Stage '" + name + "' must declare at least one output key");
        }
        outputKeys      = List.copyOf(outputKeys);
        interestingKeys = interestingKeys == null ? List.of() : List.copyOf(interestingKeys);
    }

    public String primaryOutputKey() {
        return outputKeys.get(0);
    }
}
