package com.loom.orchestrator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Writes every stage transition to the log. */
@Component
public class LoggingProgressListener implements ProgressListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingProgressListener.class);

    @Override
    public void onStageEvent(StageEvent event) {
        switch (event.state()) {
            case FAILED_HALTED -> log.error("Stage '{}' {} after {} ms [{}]",
                    event.stageName(), event.state(), event.elapsedMillis(), event.failureKind());
            case FAILED_RECOVERED -> log.warn("Stage '{}' {} after {} ms [{}], fallback {}",
                    event.stageName(), event.state(), event.elapsedMillis(), event.failureKind(), event.fallback());
            case SUCCEEDED -> log.info("Stage '{}' {} in {} ms",
                    event.stageName(), event.state(), event.elapsedMillis());
            default -> log.debug("Stage '{}' {}", event.stageName(), event.state());
        }
    }
}
