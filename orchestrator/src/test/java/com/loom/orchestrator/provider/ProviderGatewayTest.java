package com.loom.orchestrator.provider;

import com.loom.orchestrator.provider.ExecutionResult.Success;
import com.loom.orchestrator.provider.ExecutionResult.TerminalFailure;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderGatewayTest {

    static final GenerationParams PARAMS = new GenerationParams("m", 0.7, 256, 0.8, 40);
    static final Duration         LONG   = Duration.ofSeconds(10);

    ScriptedProvider     flaky     = new ScriptedProvider("flaky");
    SimpleMeterRegistry  meters    = new SimpleMeterRegistry();
    List<Duration>       pauses    = new CopyOnWriteArrayList<>();
    ProviderGateway      gateway   = new ProviderGateway(
            new ProviderRegistry(List.of(flaky)),
            meters,
            new BackoffPolicy(Duration.ofMillis(100), Duration.ofMillis(250)),
            pauses::add);

    @AfterEach
    void tearDown() {
        gateway.shutdown();
    }

    // ------------------------------------------------------------------
    // Retry budget
    // ------------------------------------------------------------------

    @Test
    void alwaysTransient_withRetryCountTwo_makesThreeAttemptsThenTerminal() {
        flaky.alwaysFail(FailureKind.PROVIDER_TRANSIENT);

        ExecutionResult result = gateway.execute("flaky", "req", PARAMS, LONG, 2);

        assertThat(result).isInstanceOfSatisfying(TerminalFailure.class, t -> {
            assertThat(t.kind()).isEqualTo(FailureKind.PROVIDER_TRANSIENT);
            assertThat(t.attempts()).isEqualTo(3);
            assertThat(t.reason()).contains("exhausted after 3 attempts");
        });
        assertThat(flaky.calls()).isEqualTo(3);
    }

    @Test
    void transientThenSuccess_returnsSuccessWithAttemptCount() {
        flaky.thenFail(FailureKind.PROVIDER_TRANSIENT).thenReturn("done");

        ExecutionResult result = gateway.execute("flaky", "req", PARAMS, LONG, 2);

        assertThat(result).isEqualTo(new Success("done", 2));
        assertThat(flaky.calls()).isEqualTo(2);
    }

    @Test
    void terminalFailure_isNotRetried() {
        flaky.alwaysFail(FailureKind.PROVIDER_UNAVAILABLE);

        ExecutionResult result = gateway.execute("flaky", "req", PARAMS, LONG, 5);

        assertThat(result).isInstanceOfSatisfying(TerminalFailure.class,
                t -> assertThat(t.kind()).isEqualTo(FailureKind.PROVIDER_UNAVAILABLE));
        assertThat(flaky.calls()).isEqualTo(1);
        assertThat(pauses).isEmpty();
    }

    @Test
    void retryCountZero_meansExactlyOneAttempt() {
        flaky.alwaysFail(FailureKind.PROVIDER_TRANSIENT);

        assertThat(gateway.execute("flaky", "req", PARAMS, LONG, 0).attempts()).isEqualTo(1);
        assertThat(flaky.calls()).isEqualTo(1);
    }

    @Test
    void backoff_doublesAndIsCapped() {
        flaky.alwaysFail(FailureKind.PROVIDER_TRANSIENT);

        gateway.execute("flaky", "req", PARAMS, LONG, 3);

        assertThat(pauses).containsExactly(
                Duration.ofMillis(100), Duration.ofMillis(200), Duration.ofMillis(250));
    }

    // ------------------------------------------------------------------
    // Timeout
    // ------------------------------------------------------------------

    @Test
    void timeout_isRecoverableAndCountsTowardTheBudget() {
        flaky.thenHang().thenReturn("second try");

        ExecutionResult result = gateway.execute("flaky", "req", PARAMS, Duration.ofMillis(50), 1);

        assertThat(result).isEqualTo(new Success("second try", 2));
        assertThat(meters.counter("loom.provider.calls", "provider", "flaky", "status", "timeout").count())
                .isEqualTo(1.0);
    }

    @Test
    void timeoutOnEveryAttempt_exhaustsAsTransient() {
        flaky.alwaysHang();

        ExecutionResult result = gateway.execute("flaky", "req", PARAMS, Duration.ofMillis(30), 1);

        assertThat(result).isInstanceOfSatisfying(TerminalFailure.class, t -> {
            assertThat(t.kind()).isEqualTo(FailureKind.PROVIDER_TRANSIENT);
            assertThat(t.reason()).contains("Timed out");
        });
        assertThat(flaky.calls()).isEqualTo(2);
    }

    // ------------------------------------------------------------------
    // Classification
    // ------------------------------------------------------------------

    @Test
    void unknownProvider_isTerminalWithoutAnyAttempt() {
        ExecutionResult result = gateway.execute("nobody", "req", PARAMS, LONG, 3);

        assertThat(result).isInstanceOfSatisfying(TerminalFailure.class, t -> {
            assertThat(t.kind()).isEqualTo(FailureKind.PROVIDER_UNAVAILABLE);
            assertThat(t.attempts()).isZero();
        });
    }

    @Test
    void unexpectedException_isTerminalUnavailable() {
        flaky.always(r -> { throw new IllegalStateException("boom"); });

        ExecutionResult result = gateway.execute("flaky", "req", PARAMS, LONG, 3);

        assertThat(result).isInstanceOfSatisfying(TerminalFailure.class,
                t -> assertThat(t.reason()).contains("boom"));
        assertThat(flaky.calls()).isEqualTo(1);
    }

    // ------------------------------------------------------------------
    // Cancellation
    // ------------------------------------------------------------------

    @Test
    void interruptingTheCaller_cancelsTheCall() throws Exception {
        flaky.alwaysHang();
        AtomicReference<Throwable> thrown = new AtomicReference<>();

        Thread caller = new Thread(() -> {
            try {
                gateway.execute("flaky", "req", PARAMS, LONG, 0);
            } catch (Throwable t) {
                thrown.set(t);
            }
        });
        caller.start();
        assertThat(flaky.awaitFirstCall(Duration.ofSeconds(5))).isTrue();
        caller.interrupt();
        caller.join(5000);

        assertThat(thrown.get()).isInstanceOf(CallCancelledException.class);
        assertThat(meters.counter("loom.provider.calls", "provider", "flaky", "status", "cancelled").count())
                .isEqualTo(1.0);
    }

    // ------------------------------------------------------------------
    // Metrics and validation
    // ------------------------------------------------------------------

    @Test
    void everyAttempt_isTimedAndCounted() {
        flaky.thenFail(FailureKind.PROVIDER_TRANSIENT).thenReturn("ok");

        gateway.execute("flaky", "req", PARAMS, LONG, 2);

        assertThat(meters.timer("loom.provider.duration", "provider", "flaky").count()).isEqualTo(2);
        assertThat(meters.counter("loom.provider.calls", "provider", "flaky", "status", "transient").count())
                .isEqualTo(1.0);
        assertThat(meters.counter("loom.provider.calls", "provider", "flaky", "status", "success").count())
                .isEqualTo(1.0);
    }

    @Test
    void validateProvider_neverGenerates() {
        assertThat(gateway.validateProvider("flaky").available()).isTrue();
        assertThat(gateway.validateProvider("nobody").available()).isFalse();
        assertThat(flaky.calls()).isZero();
    }

    @Test
    void providerIgnoringInterrupts_holdsItsSlotUntilItReturns() {
        CountDownLatch release = new CountDownLatch(1);
        ScriptedProvider stubborn = new ScriptedProvider("stubborn").always(request -> {
            boolean done = false;
            while (!done) {
                try {
                    done = release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException ignored) {
                    // keeps running after the gateway gives up on it
                }
            }
            return "late";
        });
        ProviderGateway single = new ProviderGateway(
                new ProviderRegistry(List.of(stubborn)), meters, BackoffPolicy.NONE, d -> { }, 1);
        try {
            ExecutionResult first = single.execute("stubborn", "req", PARAMS, Duration.ofMillis(50), 0);
            ExecutionResult second = single.execute("stubborn", "req", PARAMS, LONG, 1);

            assertThat(first).isInstanceOfSatisfying(TerminalFailure.class,
                    t -> assertThat(t.reason()).contains("Timed out"));
            assertThat(second).isInstanceOfSatisfying(TerminalFailure.class, t -> {
                assertThat(t.kind()).isEqualTo(FailureKind.PROVIDER_TRANSIENT);
                assertThat(t.reason()).contains("call slots are busy");
            });
            assertThat(stubborn.calls()).isEqualTo(1);
            assertThat(meters.counter("loom.provider.calls", "provider", "stubborn", "status", "busy").count())
                    .isEqualTo(2.0);
        } finally {
            release.countDown();
            single.shutdown();
        }
    }
}
