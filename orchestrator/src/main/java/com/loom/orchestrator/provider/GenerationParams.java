package com.loom.orchestrator.provider;

/**
 * Generation parameters passed through to a provider unchanged.
 *
 * @param model       backend model identifier
 * @param temperature sampling temperature
 * @param maxTokens   output size ceiling
 * @param topP        nucleus sampling mass
 * @param topK        top-k sampling cutoff (ignored by backends that lack it)
 */
public record GenerationParams(String model, double temperature, int maxTokens, double topP, int topK) {}
