package com.loom.orchestrator.config;

/**
 * Where a resolved setting came from, highest precedence first.
 */
public enum ConfigLayer {
    STAGE,      // stages.<name>.<setting>
    DEFAULTS,   // defaults.<setting>
    BUILT_IN    // compiled-in constant
}
