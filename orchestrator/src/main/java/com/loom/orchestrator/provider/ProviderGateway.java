package com.loom.orchestrator.provider;

import com.loom.orchestrator.provider.ExecutionResult.RecoverableFailure;
import com.loom.orchestrator.provider.ExecutionResult.Success;
import com.loom.orchestrator.provider.ExecutionResult.TerminalFailure;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single entry point for provider calls.
 *
 * <p>For each call the gateway:
 * <ol>
 *   <li>looks the provider up by id (unknown id: terminal, no attempt made),</li>
 *   <li>runs each attempt on its own worker thread, bounded by the per-call timeout,</li>
 *   <li>turns a {@link ProviderException} into a recoverable or terminal result by its kind,</li>
 *   <li>retries recoverable failures with exponential backoff until {@code 1 + retryCount}
 *       attempts have been made, then escalates the last one to terminal.</li>
 * </ol>
 *
 * <p>Every attempt is timed and counted:
 * <pre>
 *   loom.provider.calls{provider, status="success|transient|timeout|unavailable|busy"}
 *   loom.provider.duration{provider}
 * </pre>
 *
 * <p>The calling thread is the only one that waits. Interrupting it cancels the
 * in-flight attempt and raises {@link CallCancelledException}.
 *
 * <p>At most {@code loom.gateway.max-concurrent-calls} attempts are in flight. A timed-out
 * attempt is interrupted, but a provider that ignores the interrupt keeps its slot until it
 * returns; when every slot is taken, the attempt fails as transient and is retried.
 */
@Component
public class ProviderGateway {

    private static final Logger log = LoggerFactory.getLogger(ProviderGateway.class);

    static final int DEFAULT_MAX_CONCURRENT_CALLS = 16;

    private final ProviderRegistry registry;
    private final MeterRegistry    meterRegistry;
    private final BackoffPolicy    backoff;
    private final Sleeper          sleeper;

    private final ExecutorService  calls;

    public ProviderGateway(ProviderRegistry registry,
                           MeterRegistry meterRegistry,
                           BackoffPolicy backoff,
                           Sleeper sleeper) {
        this(registry, meterRegistry, backoff, sleeper, DEFAULT_MAX_CONCURRENT_CALLS);
    }

    @Autowired
    public ProviderGateway(ProviderRegistry registry,
                           MeterRegistry meterRegistry,
                           BackoffPolicy backoff,
                           Sleeper sleeper,
                           @Value("${loom.gateway.max-concurrent-calls:16}") int maxConcurrentCalls) {
        this.registry      = registry;
        this.meterRegistry = meterRegistry;
        this.backoff       = backoff;
        this.sleeper       = sleeper;
        this.calls         = new ThreadPoolExecutor(0, maxConcurrentCalls, 60, TimeUnit.SECONDS,
                new SynchronousQueue<>(), daemonThreads());
    }

    // ------------------------------------------------------------------
    // Execution
    // ------------------------------------------------------------------

    /**
     * Call {@code providerId} with retry and timeout.
     *
     * @param timeout    bound for each individual attempt
     * @param retryCount retries allowed after the first attempt
     * @return {@link Success} or {@link TerminalFailure}; never {@link RecoverableFailure}
     * @throws CallCancelledException if the calling thread is interrupted
     */
    public ExecutionResult execute(String providerId,
                                   String request,
                                   GenerationParams params,
                                   Duration timeout,
                                   int retryCount) {
        Optional<TextProvider> found = registry.find(providerId);
        if (found.isEmpty()) {
            countCall(providerId, "unavailable");
            return ExecutionResult.terminal(FailureKind.PROVIDER_UNAVAILABLE,
                    "Provider '" + providerId + "' is not installed");
        }
        TextProvider provider = found.get();
        int maxAttempts = 1 + Math.max(0, retryCount);

        RecoverableFailure last = null;
        MDC.put("provider", providerId);
        try {
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                MDC.put("attempt", String.valueOf(attempt));
                ExecutionResult result = attemptOnce(provider, request, params, timeout, attempt);

                if (result instanceof Success s) {
                    if (attempt > 1) {
                        log.info("Provider '{}' succeeded on attempt {}/{}", providerId, attempt, maxAttempts);
                    }
                    return s;
                }
                if (result instanceof TerminalFailure t) {
                    log.warn("Provider '{}' failed terminally on attempt {}: {}", providerId, attempt, t.reason());
                    return t;
                }

                last = (RecoverableFailure) result;
                if (attempt < maxAttempts) {
                    Duration delay = backoff.delayBeforeRetry(attempt);
                    log.warn("Provider '{}' attempt {}/{} failed ({}), retrying in {} ms",
                            providerId, attempt, maxAttempts, last.reason(), delay.toMillis());
                    pause(providerId, delay);
                }
            }
        } finally {
            MDC.remove("provider");
            MDC.remove("attempt");
        }

        log.error("Provider '{}' exhausted {} attempts; last failure: {}", providerId, maxAttempts, last.reason());
        return new TerminalFailure(last.kind(),
                "Retry budget exhausted after %d attempts: %s".formatted(maxAttempts, last.reason()),
                maxAttempts);
    }

    // ------------------------------------------------------------------
    // Validation
    // ------------------------------------------------------------------

    /** Cheap credential / reachability check; never issues a generation call. */
    public ProviderStatus validateProvider(String providerId) {
        return registry.find(providerId)
                .map(this::safeValidate)
                .orElseGet(() -> ProviderStatus.notInstalled(providerId));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private ExecutionResult attemptOnce(TextProvider provider,
                                        String request,
                                        GenerationParams params,
                                        Duration timeout,
                                        int attempt) {
        Future<String> future;
        try {
            future = calls.submit(() -> provider.generate(request, params, timeout));
        } catch (RejectedExecutionException e) {
            countCall(provider.id(), "busy");
            return new RecoverableFailure(FailureKind.PROVIDER_TRANSIENT,
                    "All provider call slots are busy", attempt);
        }
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            String output = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return new Success(output, attempt);
        } catch (TimeoutException e) {
            future.cancel(true);
            status = "timeout";
            return new RecoverableFailure(FailureKind.PROVIDER_TRANSIENT,
                    "Timed out after " + timeout.toMillis() + " ms", attempt);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ProviderException pe) {
                status = pe.getKind().isRetryable() ? "transient" : "unavailable";
                return pe.getKind().isRetryable()
                        ? new RecoverableFailure(pe.getKind(), pe.getMessage(), attempt)
                        : new TerminalFailure(pe.getKind(), pe.getMessage(), attempt);
            }
            status = "unavailable";
            log.error("Unexpected error from provider '{}'", provider.id(), cause);
            return new TerminalFailure(FailureKind.PROVIDER_UNAVAILABLE,
                    "Unexpected error from provider '" + provider.id() + "': " + cause, attempt);
        } catch (InterruptedException e) {
            future.cancel(true);
            status = "cancelled";
            Thread.currentThread().interrupt();
            throw new CallCancelledException(provider.id(), e);
        } finally {
            sample.stop(meterRegistry.timer("loom.provider.duration", "provider", provider.id()));
            countCall(provider.id(), status);
        }
    }

    private void pause(String providerId, Duration delay) {
        if (delay.isZero()) return;
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CallCancelledException(providerId, e);
        }
    }

    private ProviderStatus safeValidate(TextProvider provider) {
        try {
            return provider.validate();
        } catch (RuntimeException e) {
            log.warn("Validation of provider '{}' threw: {}", provider.id(), e.getMessage());
            return new ProviderStatus(provider.id(), null, false, false, null, false,
                    "Validation failed: " + e.getMessage());
        }
    }

    private void countCall(String providerId, String status) {
        meterRegistry.counter("loom.provider.calls", "provider", String.valueOf(providerId), "status", status)
                .increment();
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "provider-call-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    @PreDestroy
    public void shutdown() {
        calls.shutdownNow();
    }
}
