package com.loom.orchestrator.provider;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class GatewayConfiguration {

    @Bean
    BackoffPolicy backoffPolicy(@Value("${loom.gateway.backoff.base-ms:1000}") long baseMs,
                                @Value("${loom.gateway.backoff.max-ms:30000}") long maxMs) {
        return new BackoffPolicy(Duration.ofMillis(baseMs), Duration.ofMillis(maxMs));
    }

    @Bean
    Sleeper retrySleeper() {
        return Sleeper.threadSleep();
    }
}
