package com.loom.orchestrator.config;

import com.loom.orchestrator.provider.GenerationParams;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fully resolved settings of one stage for one run. Immutable.
 *
 * @param sources layer each setting was taken from, keyed by setting name
 */
public record EffectiveStageConfig(
        String                   stageName,
        String                   providerId,
        GenerationParams         params,
        int                      retryCount,
        Duration                 timeout,
        ErrorBoundary            errorBoundary,
        Map<String, ConfigLayer> sources) {

    public EffectiveStageConfig {
        sources = Map.copyOf(sources);
    }

    public ConfigLayer sourceOf(String settingName) {
        return sources.get(settingName);
    }

    /** Setting values only (no provenance), in a fixed order. */
    public Map<String, Object> fingerprint() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("stage",          stageName);
        values.put("provider",       providerId);
        values.put("model",          params.model());
        values.put("temperature",    params.temperature());
        values.put("maxTokens",      params.maxTokens());
        values.put("topP",           params.topP());
        values.put("topK",           params.topK());
        values.put("retryCount",     retryCount);
        values.put("timeoutMillis",  timeout.toMillis());
        values.put("required",       errorBoundary.required());
        values.put("fallbackMode",   errorBoundary.fallbackMode().configName());
        values.put("defaultValue",   errorBoundary.defaultValue());
        return values;
    }
}
