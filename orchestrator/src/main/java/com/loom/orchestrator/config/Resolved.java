package com.loom.orchestrator.config;

/**
 * A resolved setting value together with the layer that supplied it.
 */
public record Resolved<T>(T value, ConfigLayer layer) {}
