package com.loom.orchestrator.provider;

/**
 * Tagged outcome of one stage attempt.
 *
 * <ul>
 *   <li>{@link Success} carries the raw provider text.</li>
 *   <li>{@link RecoverableFailure} may be retried; the gateway never lets one
 *       escape once the retry budget is spent.</li>
 *   <li>{@link TerminalFailure} is final and goes to the stage's error-boundary policy.</li>
 * </ul>
 */
public sealed interface ExecutionResult
        permits ExecutionResult.Success, ExecutionResult.RecoverableFailure, ExecutionResult.TerminalFailure {

    /** Number of provider attempts spent producing this result (0 when none was made). */
    int attempts();

    record Success(String output, int attempts) implements ExecutionResult {}

    record RecoverableFailure(FailureKind kind, String reason, int attempts) implements ExecutionResult {}

    record TerminalFailure(FailureKind kind, String reason, int attempts) implements ExecutionResult {}

    static Success success(String output) {
        return new Success(output, 1);
    }

    static TerminalFailure terminal(FailureKind kind, String reason) {
        return new TerminalFailure(kind, reason, 0);
    }
}
