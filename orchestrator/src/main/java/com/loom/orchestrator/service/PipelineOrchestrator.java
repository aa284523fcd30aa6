package com.loom.orchestrator.service;

import com.loom.orchestrator.cache.CacheEntry;
import com.loom.orchestrator.cache.StageCache;
import com.loom.orchestrator.config.ConfigException;
import com.loom.orchestrator.config.ConfigResolver;
import com.loom.orchestrator.config.EffectiveStageConfig;
import com.loom.orchestrator.config.ErrorBoundary;
import com.loom.orchestrator.config.FallbackMode;
import com.loom.orchestrator.config.PipelineConfigLoader;
import com.loom.orchestrator.config.StageSettings;
import com.loom.orchestrator.context.ContextSnapshot;
import com.loom.orchestrator.context.ContextStore;
import com.loom.orchestrator.provider.CallCancelledException;
import com.loom.orchestrator.provider.ExecutionResult;
import com.loom.orchestrator.provider.ExecutionResult.RecoverableFailure;
import com.loom.orchestrator.provider.ExecutionResult.Success;
import com.loom.orchestrator.provider.ExecutionResult.TerminalFailure;
import com.loom.orchestrator.provider.FailureKind;
import com.loom.orchestrator.provider.ProviderGateway;
import com.loom.orchestrator.provider.ProviderRegistry;
import com.loom.orchestrator.provider.ProviderStatus;
import com.loom.orchestrator.stage.Stage;
import com.loom.orchestrator.stage.StageInvocation;
import com.loom.orchestrator.stage.StageRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Runs the configured stages in order over a fresh {@link ContextStore}.
 *
 * <p>For each stage in {@link ConfigResolver#resolutionOrder()}:
 * <ol>
 *   <li>compute its cache key from a context snapshot; a hit is a success
 *       without any provider call,</li>
 *   <li>otherwise execute the stage,</li>
 *   <li>on success write the stage's outputs to the context and cache them,</li>
 *   <li>on failure apply the stage's error boundary: halt the run if it is
 *       required with halt-pipeline, else use-cache, use-default-value or skip.</li>
 * </ol>
 *
 * <p>A stage writes only its declared output keys. Any exception escaping a
 * stage becomes a {@link FailureKind#STAGE_ERROR} failure and goes through the
 * same policy. Interrupting the calling thread aborts the run with
 * {@link PipelineCancelledException}.
 *
 * <p>Metrics:
 * <pre>
 *   loom.stage.outcomes{stage, state}
 *   loom.stage.duration{stage}
 * </pre>
 */
@Service
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final StageRegistry          stages;
    private final ProviderRegistry       providers;
    private final ProviderGateway        gateway;
    private final StageCache             cache;
    private final PipelineConfigLoader   configLoader;
    private final List<ProgressListener> listeners;
    private final MeterRegistry          meterRegistry;
    private final Clock                  clock;

    @Autowired
    public PipelineOrchestrator(StageRegistry stages,
                                ProviderRegistry providers,
                                ProviderGateway gateway,
                                StageCache cache,
                                PipelineConfigLoader configLoader,
                                List<ProgressListener> listeners,
                                MeterRegistry meterRegistry) {
        this(stages, providers, gateway, cache, configLoader, listeners, meterRegistry, Clock.systemUTC());
    }

    PipelineOrchestrator(StageRegistry stages,
                         ProviderRegistry providers,
                         ProviderGateway gateway,
                         StageCache cache,
                         PipelineConfigLoader configLoader,
                         List<ProgressListener> listeners,
                         MeterRegistry meterRegistry,
                         Clock clock) {
        this.stages        = stages;
        this.providers     = providers;
        this.gateway       = gateway;
        this.cache         = cache;
        this.configLoader  = configLoader;
        this.listeners     = List.copyOf(listeners);
        this.meterRegistry = meterRegistry;
        this.clock         = clock;
    }

    // ------------------------------------------------------------------
    // Run
    // ------------------------------------------------------------------

    /**
     * Load the configuration document and run the pipeline.
     *
     * @throws ConfigException before any stage runs, if the configuration is invalid
     * @throws PipelineHaltedException    if a required halt-pipeline stage fails
     * @throws PipelineCancelledException if the calling thread is interrupted
     */
    public RunReport run(RunRequest request) {
        ConfigResolver resolver = ConfigResolver.create(configLoader.load(), stages.names(), providers);
        return run(request, resolver);
    }

    /** Run the pipeline with an already built resolver. */
    public RunReport run(RunRequest request, ConfigResolver resolver) {
        if (request.input() == null) {
            throw new IllegalArgumentException("Run input must not be null");
        }
        String runId = UUID.randomUUID().toString();
        Instant startedAt = clock.instant();
        long started = System.nanoTime();

        if (request.invalidateCache()) {
            cache.clear();
        }
        ContextStore context = new ContextStore();
        context.set(ContextStore.INPUT_KEY, request.input());

        List<StageReport> reports = new ArrayList<>();
        String current = null;
        MDC.put("runId", runId);
        try {
            log.info("Run {} started: {} stage(s) {}", runId,
                    resolver.resolutionOrder().size(), resolver.resolutionOrder());
            for (String stageName : resolver.resolutionOrder()) {
                current = stageName;
                if (Thread.currentThread().isInterrupted()) {
                    log.warn("Run {} interrupted before stage '{}'", runId, stageName);
                    throw new PipelineCancelledException(null,
                            report(runId, RunStatus.CANCELLED, startedAt, started, context, reports), null);
                }
                MDC.put("stage", stageName);
                StageReport report = runStage(runId, stages.get(stageName), resolver.resolve(stageName), context);
                reports.add(report);
                MDC.remove("stage");

                if (report.state() == StageState.FAILED_HALTED) {
                    RunReport partial = report(runId, RunStatus.HALTED, startedAt, started, context, reports);
                    log.error("Run {} halted at stage '{}' [{}]: {}", runId, stageName,
                            report.failureKind(), report.failureReason());
                    throw new PipelineHaltedException(stageName, report.failureKind(), report.failureReason(), partial);
                }
            }
            current = null;

            RunStatus status = reports.stream().anyMatch(StageReport::degraded)
                    ? RunStatus.COMPLETED_WITH_DEGRADATION
                    : RunStatus.COMPLETED;
            RunReport result = report(runId, status, startedAt, started, context, reports);
            log.info("Run {} finished {} in {} ms", runId, status, result.elapsedMillis());
            return result;
        } catch (CallCancelledException e) {
            RunReport partial = report(runId, RunStatus.CANCELLED, startedAt, started, context, reports);
            log.warn("Run {} cancelled during stage '{}'", runId, current);
            throw new PipelineCancelledException(current, partial, e);
        } finally {
            MDC.remove("stage");
            MDC.remove("runId");
        }
    }

    // ------------------------------------------------------------------
    // Validate-only
    // ------------------------------------------------------------------

    /**
     * Resolve every stage and check every referenced provider without running
     * anything. Never issues a generation call.
     *
     * @throws ConfigException if the document itself cannot be read
     */
    public ValidationReport validate() {
        ConfigResolver resolver = ConfigResolver.inspect(configLoader.load(), stages.names(), providers);

        Map<String, ProviderStatus> statuses = new LinkedHashMap<>();
        List<StageValidation> results = new ArrayList<>();
        for (String stageName : resolver.resolutionOrder()) {
            List<String> problems = new ArrayList<>(resolver.problemsFor(stageName));
            String providerId = configuredProvider(resolver, stageName);
            if (providerId != null) {
                ProviderStatus status = statuses.computeIfAbsent(providerId, gateway::validateProvider);
                if (!status.available()) {
                    problems.add("Provider '" + providerId + "' is unavailable: " + status.detail());
                }
            }
            if (!resolver.problemsFor(stageName).isEmpty()) {
                results.add(new StageValidation(stageName, false, providerId, null, problems, Map.of()));
                continue;
            }
            EffectiveStageConfig config = resolver.resolve(stageName);
            results.add(new StageValidation(stageName, problems.isEmpty(), providerId,
                    config.params().model(), problems, config.sources()));
        }

        boolean valid = resolver.orderProblems().isEmpty() && results.stream().allMatch(StageValidation::valid);
        log.info("Validation {}: {} stage(s), providers {}", valid ? "passed" : "failed",
                results.size(), statuses.keySet());
        return new ValidationReport(valid, resolver.resolutionOrder(), resolver.orderProblems(),
                results, new ArrayList<>(statuses.values()));
    }

    /**
     * Provider a stage names, looked up on its own so it is still checked when
     * other settings of the stage are broken. Null when unreadable or not installed.
     */
    private String configuredProvider(ConfigResolver resolver, String stageName) {
        try {
            String providerId = resolver.resolveSetting(stageName, StageSettings.PROVIDER).value();
            return providers.find(providerId).isPresent() ? providerId : null;
        } catch (ConfigException e) {
            // already listed in the stage's problems
            return null;
        }
    }

    /** Credential status of every installed provider. */
    public List<ProviderStatus> providerStatuses() {
        return providers.providerIds().stream()
                .map(gateway::validateProvider)
                .toList();
    }

    // ------------------------------------------------------------------
    // Stage execution
    // ------------------------------------------------------------------

    private StageReport runStage(String runId, Stage stage, EffectiveStageConfig config, ContextStore context) {
        String name = stage.name();
        long started = System.nanoTime();
        emit(StageEvent.of(runId, name, StageState.PENDING, 0));

        ContextSnapshot snapshot = context.snapshot();
        String cacheKey;
        try {
            cacheKey = stage.cacheKey(config, snapshot);
        } catch (RuntimeException e) {
            log.error("Stage '{}' could not compute its cache key", name, e);
            return failed(runId, stage, config, context, started,
                    new TerminalFailure(FailureKind.STAGE_ERROR, "Cache key computation failed: " + e, 0));
        }

        Optional<CacheEntry> hit = cache.lookup(cacheKey);
        if (hit.isPresent()) {
            emit(StageEvent.of(runId, name, StageState.CACHE_HIT, elapsedMillis(started)));
            try {
                List<String> written = writeOutputs(stage, hit.get().output(), context);
                log.info("Stage '{}' served from cache", name);
                return succeeded(runId, name, started, true, 0, written);
            } catch (RuntimeException e) {
                return failed(runId, stage, config, context, started, rejectedOutput(name, e, 0));
            }
        }

        emit(StageEvent.of(runId, name, StageState.INVOKING, elapsedMillis(started)));
        ExecutionResult result = invoke(stage, new StageInvocation(runId, snapshot, config, gateway));

        if (result instanceof Success s) {
            try {
                List<String> written = writeOutputs(stage, s.output(), context);
                cache.store(cacheKey, new CacheEntry(name, s.output(), clock.instant()));
                return succeeded(runId, name, started, false, s.attempts(), written);
            } catch (RuntimeException e) {
                return failed(runId, stage, config, context, started, rejectedOutput(name, e, s.attempts()));
            }
        }
        if (result instanceof RecoverableFailure r) {
            log.warn("Stage '{}' returned a recoverable failure outside the gateway; treating it as terminal", name);
            result = new TerminalFailure(r.kind(), r.reason(), r.attempts());
        }
        return failed(runId, stage, config, context, started, (TerminalFailure) result);
    }

    private ExecutionResult invoke(Stage stage, StageInvocation invocation) {
        try {
            ExecutionResult result = stage.execute(invocation);
            if (result == null) {
                return new TerminalFailure(FailureKind.STAGE_ERROR,
                        "Stage '" + stage.name() + "' returned no result", 0);
            }
            return result;
        } catch (CallCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Stage '{}' threw an unexpected exception", stage.name(), e);
            return new TerminalFailure(FailureKind.STAGE_ERROR,
                    "Stage '" + stage.name() + "' threw " + e.getClass().getSimpleName() + ": " + e.getMessage(), 0);
        }
    }

    /**
     * Write a stage's output through its own key mapping. Keys outside the
     * stage's declaration are rejected before anything is written.
     */
    private List<String> writeOutputs(Stage stage, String output, ContextStore context) {
        Map<String, String> writes = stage.toContextWrites(output);
        Set<String> declared = new LinkedHashSet<>(stage.descriptor().outputKeys());
        for (String key : writes.keySet()) {
            if (!declared.contains(key)) {
                throw new IllegalStateException("Stage '" + stage.name() + "' tried to write undeclared key '"
                        + key + "'; declared keys are " + declared);
            }
        }
        context.writeAll(stage.name(), writes);
        return List.copyOf(writes.keySet());
    }

    private StageReport failed(String runId,
                               Stage stage,
                               EffectiveStageConfig config,
                               ContextStore context,
                               long started,
                               TerminalFailure failure) {
        String name = stage.name();
        ErrorBoundary boundary = config.errorBoundary();

        if (boundary.haltsPipeline()) {
            long elapsed = elapsedMillis(started);
            emit(new StageEvent(runId, name, StageState.FAILED_HALTED, elapsed, failure.kind(), null));
            record(name, StageState.FAILED_HALTED, started);
            return new StageReport(name, StageState.FAILED_HALTED, false, failure.attempts(), elapsed,
                    failure.kind(), failure.reason(), null, List.of());
        }

        FallbackMode applied = boundary.effectiveFallback();
        List<String> written = List.of();
        switch (applied) {
            case USE_CACHE -> {
                Optional<CacheEntry> previous = cache.latestFor(name);
                if (previous.isPresent()) {
                    written = fallbackWrite(stage, context, () -> writeOutputs(stage, previous.get().output(), context));
                } else {
                    log.warn("Stage '{}' has no cached output to fall back on; skipping", name);
                    applied = FallbackMode.SKIP;
                }
            }
            case USE_DEFAULT_VALUE -> {
                Map<String, String> placeholders = new LinkedHashMap<>();
                stage.descriptor().outputKeys().forEach(k -> placeholders.put(k, boundary.defaultValue()));
                written = fallbackWrite(stage, context, () -> {
                    context.writeAll(name, placeholders);
                    return List.copyOf(placeholders.keySet());
                });
            }
            default -> { }
        }
        if (applied != FallbackMode.SKIP && written.isEmpty()) {
            // nothing reached the context, so report what actually happened
            applied = FallbackMode.SKIP;
        }

        log.warn("Stage '{}' failed [{}] after {} attempt(s): {}; fallback {}",
                name, failure.kind(), failure.attempts(), failure.reason(), applied);
        long elapsed = elapsedMillis(started);
        emit(new StageEvent(runId, name, StageState.FAILED_RECOVERED, elapsed, failure.kind(), applied));
        record(name, StageState.FAILED_RECOVERED, started);
        return new StageReport(name, StageState.FAILED_RECOVERED, false, failure.attempts(), elapsed,
                failure.kind(), failure.reason(), applied, written);
    }

    private List<String> fallbackWrite(Stage stage, ContextStore context, FallbackWrite write) {
        try {
            return write.run();
        } catch (RuntimeException e) {
            log.error("Fallback write for stage '{}' failed; continuing without it", stage.name(), e);
            return List.of();
        }
    }

    @FunctionalInterface
    private interface FallbackWrite {
        List<String> run();
    }

    private StageReport succeeded(String runId, String name, long started, boolean cacheHit,
                                  int attempts, List<String> written) {
        long elapsed = elapsedMillis(started);
        emit(StageEvent.of(runId, name, StageState.SUCCEEDED, elapsed));
        record(name, StageState.SUCCEEDED, started);
        return new StageReport(name, StageState.SUCCEEDED, cacheHit, attempts, elapsed,
                null, null, null, written);
    }

    private static TerminalFailure rejectedOutput(String stageName, RuntimeException e, int attempts) {
        log.error("Output of stage '{}' could not be written to the context: {}", stageName, e.getMessage());
        return new TerminalFailure(FailureKind.STAGE_ERROR, e.getMessage(), attempts);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void emit(StageEvent event) {
        for (ProgressListener listener : listeners) {
            try {
                listener.onStageEvent(event);
            } catch (RuntimeException e) {
                log.warn("Progress listener {} failed on {}: {}",
                        listener.getClass().getSimpleName(), event.state(), e.getMessage());
            }
        }
    }

    private void record(String stageName, StageState state, long started) {
        meterRegistry.counter("loom.stage.outcomes", "stage", stageName, "state", state.name()).increment();
        meterRegistry.timer("loom.stage.duration", "stage", stageName)
                .record(Duration.ofNanos(System.nanoTime() - started));
    }

    private RunReport report(String runId, RunStatus status, Instant startedAt, long started,
                             ContextStore context, List<StageReport> reports) {
        return new RunReport(runId, status, startedAt, elapsedMillis(started),
                context.currentValues(), context.history(), reports);
    }

    private static long elapsedMillis(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos).toMillis();
    }
}
