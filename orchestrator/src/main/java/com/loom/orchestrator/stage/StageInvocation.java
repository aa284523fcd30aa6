package com.loom.orchestrator.stage;

import com.loom.orchestrator.config.EffectiveStageConfig;
import com.loom.orchestrator.context.ContextSnapshot;
import com.loom.orchestrator.provider.ExecutionResult;
import com.loom.orchestrator.provider.ProviderGateway;

/**
 * Everything a stage gets for one execution.
 *
 * @param runId   id of the enclosing run (for logging)
 * @param context point-in-time view of the shared context
 * @param config  the stage's effective settings
 * @param gateway provider access
 */
public record StageInvocation(String runId,
                              ContextSnapshot context,
                              EffectiveStageConfig config,
                              ProviderGateway gateway) {

    /** Send {@code request} to the stage's configured provider with its retry and timeout settings. */
    public ExecutionResult callProvider(String request) {
        return gateway.execute(config.providerId(), request, config.params(),
                config.timeout(), config.retryCount());
    }
}
