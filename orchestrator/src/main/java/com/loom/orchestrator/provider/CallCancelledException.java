package com.loom.orchestrator.provider;

/**
 * Thrown when the thread waiting on a provider call is interrupted.
 * The in-flight call has already been cancelled when this is raised.
 */
public class CallCancelledException extends RuntimeException {

    public CallCancelledException(String providerId, Throwable cause) {
        super("Call to provider '" + providerId + "' was cancelled", cause);
    }
}
