package com.loom.orchestrator.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide stage cache. Entries live until {@link #clear()} or shutdown.
 */
@Component
public class InMemoryStageCache implements StageCache {

    private static final Logger log = LoggerFactory.getLogger(InMemoryStageCache.class);

    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Map<String, CacheEntry> latest  = new ConcurrentHashMap<>();

    @Override
    public Optional<CacheEntry> lookup(String cacheKey) {
        return Optional.ofNullable(entries.get(cacheKey));
    }

    @Override
    public void store(String cacheKey, CacheEntry entry) {
        entries.put(cacheKey, entry);
        latest.merge(entry.stageName(), entry,
                (old, neu) -> neu.createdAt().isBefore(old.createdAt()) ? old : neu);
        log.debug("Cached output of stage '{}' under {}", entry.stageName(), cacheKey);
    }

    @Override
    public Optional<CacheEntry> latestFor(String stageName) {
        return Optional.ofNullable(latest.get(stageName));
    }

    @Override
    public void clear() {
        int dropped = entries.size();
        entries.clear();
        latest.clear();
        log.info("Stage cache cleared ({} entries dropped)", dropped);
    }

    @Override
    public int size() {
        return entries.size();
    }
}
