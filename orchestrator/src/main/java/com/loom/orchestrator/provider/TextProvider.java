package com.loom.orchestrator.provider;

import java.time.Duration;

/**
 * A text-generation backend.
 *
 * Every backend is registered as a Spring {@code @Component} and looked up by
 * {@link #id()} through {@link ProviderRegistry}. Implementations report
 * failures by throwing {@link ProviderException} with a {@link FailureKind};
 * retry, timeout enforcement and metrics live in {@link ProviderGateway}.
 */
public interface TextProvider {

    /** Identifier used in pipeline configuration, e.g. "claude". */
    String id();

    /** Model used when configuration does not name one. */
    String defaultModel();

    /**
     * Generate text for {@code request}.
     *
     * @param timeout upper bound for this single call
     * @throws ProviderException on any failure, classified by kind
     */
    String generate(String request, GenerationParams params, Duration timeout) throws ProviderException;

    /** Check credentials (and optionally reachability) without generating anything. */
    ProviderStatus validate();
}
