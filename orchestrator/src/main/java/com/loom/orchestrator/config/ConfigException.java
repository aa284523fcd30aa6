package com.loom.orchestrator.config;

import java.util.List;

/**
 * The pipeline configuration cannot be used: malformed document, bad setting
 * value, or a reference to an unknown provider or stage.
 *
 * Always raised before any provider call is made.
 */
public class ConfigException extends RuntimeException {

    private final List<String> problems;

    public ConfigException(String problem) {
        this(List.of(problem), null);
    }

    public ConfigException(String problem, Throwable cause) {
        this(List.of(problem), cause);
    }

    public ConfigException(List<String> problems) {
        this(problems, null);
    }

    private ConfigException(List<String> problems, Throwable cause) {
        super(problems.size() == 1
                ? "Invalid pipeline configuration: " + problems.get(0)
                : "Invalid pipeline configuration (" + problems.size() + " problems): "
                        + String.join("; ", problems), cause);
        this.problems = List.copyOf(problems);
    }

    public List<String> problems() { return problems; }
}
