package com.loom.orchestrator.config;

/**
 * Compiled-in lowest configuration layer. Every setting has a value here,
 * directly or derived (model from the provider, fallback mode from
 * {@code required}).
 */
public final class BuiltInDefaults {

    public static final String  PROVIDER        = "gemini";
    public static final double  TEMPERATURE     = 0.7;
    public static final int     MAX_TOKENS      = 8192;
    public static final double  TOP_P           = 0.8;
    public static final int     TOP_K           = 40;
    public static final int     RETRY_COUNT     = 2;
    public static final double  TIMEOUT_SECONDS = 120;
    public static final boolean REQUIRED        = true;
    public static final String  DEFAULT_VALUE   = "";

    /** Fallback for a required stage whose fallback mode is unset. */
    public static final FallbackMode REQUIRED_FALLBACK = FallbackMode.HALT_PIPELINE;

    /** Fallback for an optional stage whose fallback mode is unset. */
    public static final FallbackMode OPTIONAL_FALLBACK = FallbackMode.SKIP;

    private BuiltInDefaults() {}
}
