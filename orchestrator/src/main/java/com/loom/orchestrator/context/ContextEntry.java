package com.loom.orchestrator.context;

/**
 * One write recorded in a run's context history.
 *
 * @param key            context key that was written
 * @param value          value written
 * @param producingStage stage that performed the write ({@link ContextStore#INPUT_STAGE} for the run input)
 * @param sequence       store-wide sequence number, strictly increasing in write order
 */
public record ContextEntry(String key, String value, String producingStage, long sequence) {}
