package com.loom.orchestrator.cache;

import java.util.Optional;

/**
 * Key/value store for stage outputs. Keys are computed by the stage; the
 * cache never looks inside them.
 */
public interface StageCache {

    Optional<CacheEntry> lookup(String cacheKey);

    void store(String cacheKey, CacheEntry entry);

    /** Most recently stored entry for {@code stageName}, whatever its key. */
    Optional<CacheEntry> latestFor(String stageName);

    void clear();

    int size();
}
