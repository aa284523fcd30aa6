package com.loom.orchestrator.config;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * One configurable stage setting: its name in the document, how a JSON value
 * is read and checked, and its built-in value.
 *
 * A missing field and an explicit JSON {@code null} both mean "unset" and
 * fall through to the next layer. Zero, {@code false} and the empty string
 * are ordinary values.
 */
public final class Setting<T> {

    @FunctionalInterface
    interface Reader<T> {
        /** @throws ConfigException if {@code node} has the wrong type or an out-of-range value */
        T read(JsonNode node, String location);
    }

    private final String    name;
    private final Reader<T> reader;
    private final T         builtIn;

    Setting(String name, Reader<T> reader, T builtIn) {
        this.name    = name;
        this.reader  = reader;
        this.builtIn = builtIn;
    }

    public String name() { return name; }

    /**
     * Built-in value, or null when the built-in depends on other settings
     * (see {@link ConfigResolver}).
     */
    public T builtIn() { return builtIn; }

    /**
     * Read this setting from a layer block.
     *
     * @param block    the {@code defaults} object or a {@code stages.<name>} object; may be missing
     * @param location dotted path of {@code block}, used in error messages
     */
    public Optional<T> readFrom(JsonNode block, String location) {
        JsonNode node = block.path(name);
        if (node.isMissingNode() || node.isNull()) {
            return Optional.empty();
        }
        return Optional.of(reader.read(node, location + "." + name));
    }

    @Override
    public String toString() { return name; }
}
