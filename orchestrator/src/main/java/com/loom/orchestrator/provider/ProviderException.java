package com.loom.orchestrator.provider;

/**
 * Thrown by a {@link TextProvider} when a generation call fails.
 *
 * The kind decides retry eligibility in {@link ProviderGateway}: only
 * {@link FailureKind#PROVIDER_TRANSIENT} failures are retried.
 */
public class ProviderException extends RuntimeException {

    private final FailureKind kind;

    public ProviderException(FailureKind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public ProviderException(FailureKind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public static ProviderException transientFailure(String message, Throwable cause) {
        return new ProviderException(FailureKind.PROVIDER_TRANSIENT, message, cause);
    }

    public static ProviderException unavailable(String message) {
        return new ProviderException(FailureKind.PROVIDER_UNAVAILABLE, message);
    }

    public FailureKind getKind() { return kind; }
}
