package com.loom.orchestrator.config;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Catalogue of settings accepted in {@code defaults} and {@code stages.<name>} blocks.
 */
public final class StageSettings {

    public static final Setting<String> PROVIDER =
            new Setting<>("provider", StageSettings::nonBlankText, BuiltInDefaults.PROVIDER);

    /** Built-in is the provider's own default model. */
    public static final Setting<String> MODEL =
            new Setting<>("model", StageSettings::nonBlankText, null);

    public static final Setting<Double> TEMPERATURE =
            new Setting<>("temperature", decimal(0.0, 2.0), BuiltInDefaults.TEMPERATURE);

    public static final Setting<Integer> MAX_TOKENS =
            new Setting<>("maxTokens", integer(1, 1_000_000), BuiltInDefaults.MAX_TOKENS);

    public static final Setting<Double> TOP_P =
            new Setting<>("topP", decimal(0.0, 1.0), BuiltInDefaults.TOP_P);

    public static final Setting<Integer> TOP_K =
            new Setting<>("topK", integer(1, 1000), BuiltInDefaults.TOP_K);

    public static final Setting<Integer> RETRY_COUNT =
            new Setting<>("retryCount", integer(0, 10), BuiltInDefaults.RETRY_COUNT);

    public static final Setting<Double> TIMEOUT_SECONDS =
            new Setting<>("timeoutSeconds", seconds(3600.0), BuiltInDefaults.TIMEOUT_SECONDS);

    public static final Setting<Boolean> REQUIRED =
            new Setting<>("required", StageSettings::bool, BuiltInDefaults.REQUIRED);

    /** Built-in depends on {@link #REQUIRED}. */
    public static final Setting<FallbackMode> FALLBACK_MODE =
            new Setting<>("fallbackMode", StageSettings::fallbackMode, null);

    public static final Setting<String> DEFAULT_VALUE =
            new Setting<>("defaultValue", StageSettings::text, BuiltInDefaults.DEFAULT_VALUE);

    public static final List<Setting<?>> ALL = List.of(
            PROVIDER, MODEL, TEMPERATURE, MAX_TOKENS, TOP_P, TOP_K,
            RETRY_COUNT, TIMEOUT_SECONDS, REQUIRED, FALLBACK_MODE, DEFAULT_VALUE);

    private StageSettings() {}

    public static boolean isKnown(String name) {
        return ALL.stream().anyMatch(s -> s.name().equals(name));
    }

    // ------------------------------------------------------------------
    // Readers
    // ------------------------------------------------------------------

    private static String text(JsonNode node, String location) {
        if (!node.isTextual()) {
            throw new ConfigException(location + " must be a string, got " + node.getNodeType());
        }
        return node.asText();
    }

    private static String nonBlankText(JsonNode node, String location) {
        String value = text(node, location);
        if (value.isBlank()) {
            throw new ConfigException(location + " must not be blank");
        }
        return value.strip();
    }

    private static Boolean bool(JsonNode node, String location) {
        if (!node.isBoolean()) {
            throw new ConfigException(location + " must be true or false, got " + node);
        }
        return node.booleanValue();
    }

    private static FallbackMode fallbackMode(JsonNode node, String location) {
        String value = text(node, location);
        return FallbackMode.fromConfig(value).orElseThrow(() -> new ConfigException(
                location + " must be one of use-cache, use-default-value, skip, halt-pipeline; got '" + value + "'"));
    }

    private static Setting.Reader<Double> decimal(double min, double max) {
        return (node, location) -> {
            if (!node.isNumber()) {
                throw new ConfigException(location + " must be a number, got " + node);
            }
            double value = node.doubleValue();
            if (value < min || value > max) {
                throw new ConfigException(location + " must be between " + min + " and " + max + ", got " + value);
            }
            return value;
        };
    }

    /** Seconds with millisecond resolution; anything under one millisecond is rejected. */
    private static Setting.Reader<Double> seconds(double max) {
        return (node, location) -> {
            if (!node.isNumber()) {
                throw new ConfigException(location + " must be a number, got " + node);
            }
            double value = node.doubleValue();
            if (value <= 0 || value > max) {
                throw new ConfigException(location + " must be greater than 0 and at most " + max + ", got " + value);
            }
            if (Math.round(value * 1000) < 1) {
                throw new ConfigException(location + " must be at least 0.001 (one millisecond), got " + value);
            }
            return value;
        };
    }

    private static Setting.Reader<Integer> integer(int min, int max) {
        return (node, location) -> {
            if (!node.isIntegralNumber() || !node.canConvertToInt()) {
                throw new ConfigException(location + " must be an integer, got " + node);
            }
            int value = node.intValue();
            if (value < min || value > max) {
                throw new ConfigException(location + " must be between " + min + " and " + max + ", got " + value);
            }
            return value;
        };
    }
}
