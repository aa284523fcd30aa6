package com.loom.orchestrator.cache;

import java.time.Instant;

/**
 * A memoized stage output.
 *
 * @param stageName stage that produced {@code output}
 * @param output    raw provider text, before it is written to the context
 * @param createdAt when the entry was stored
 */
public record CacheEntry(String stageName, String output, Instant createdAt) {}
