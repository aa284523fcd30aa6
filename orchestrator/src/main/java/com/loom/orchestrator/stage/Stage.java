package com.loom.orchestrator.stage;

import com.loom.orchestrator.cache.CacheKeys;
import com.loom.orchestrator.config.EffectiveStageConfig;
import com.loom.orchestrator.context.ContextSnapshot;
import com.loom.orchestrator.provider.ExecutionResult;

import java.util.Map;

/**
 * One unit of analysis in the pipeline.
 *
 * A stage reads the context snapshot it is given, calls a provider through
 * the invocation and returns the outcome. It never writes the context
 * itself: the orchestrator writes {@link #toContextWrites(String)} on success.
 *
 * Implementations are Spring {@code @Component}s; their {@code @Order}
 * defines the registration order.
 */
public interface Stage {

    StageDescriptor descriptor();

    default String name() {
        return descriptor().name();
    }

    /**
     * Run the stage once. Failures are returned, not thrown; any exception
     * that escapes is treated as a stage error.
     */
    ExecutionResult execute(StageInvocation invocation);

    /** Cache key for running with {@code config} against {@code snapshot}. */
    default String cacheKey(EffectiveStageConfig config, ContextSnapshot snapshot) {
        return CacheKeys.of(name(), config, descriptor().interestingKeys(), snapshot);
    }

    /** Context writes for a successful output. Keys must be among the declared output keys. */
    default Map<String, String> toContextWrites(String output) {
        return Map.of(descriptor().primaryOutputKey(), output);
    }
}
