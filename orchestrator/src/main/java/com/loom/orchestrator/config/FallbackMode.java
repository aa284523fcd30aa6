package com.loom.orchestrator.config;

import java.util.Arrays;
import java.util.Optional;

/**
 * What the orchestrator does after a stage fails terminally.
 */
public enum FallbackMode {
    USE_CACHE("use-cache"),                 // reuse the stage's latest cached output, else skip
    USE_DEFAULT_VALUE("use-default-value"), // write the configured placeholder
    SKIP("skip"),                           // write nothing
    HALT_PIPELINE("halt-pipeline");         // stop the run (required stages only)

    private final String configName;

    FallbackMode(String configName) {
        this.configName = configName;
    }

    public String configName() { return configName; }

    public static Optional<FallbackMode> fromConfig(String value) {
        return Arrays.stream(values())
                .filter(m -> m.configName.equals(value))
                .findFirst();
    }

    @Override
    public String toString() { return configName; }
}
