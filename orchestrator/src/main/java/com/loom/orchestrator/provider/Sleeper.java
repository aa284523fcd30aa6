package com.loom.orchestrator.provider;

import java.time.Duration;

/**
 * Blocking pause between retry attempts.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper threadSleep() {
        return d -> Thread.sleep(d.toMillis());
    }
}
