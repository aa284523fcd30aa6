package com.loom.orchestrator.service;

/**
 * @param input           text stored under the {@code input} context key before the first stage
 * @param invalidateCache drop every cached stage output before running
 */
public record RunRequest(String input, boolean invalidateCache) {

    public static RunRequest of(String input) {
        return new RunRequest(input, false);
    }
}
