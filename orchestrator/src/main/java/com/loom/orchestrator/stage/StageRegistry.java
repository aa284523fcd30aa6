package com.loom.orchestrator.stage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Stages known to the application, in registration order.
 *
 * Spring injects every {@link Stage} bean sorted by {@code @Order}; that order
 * is the execution order when the configuration gives none. Output keys must
 * be unique across stages since each key has a single writer.
 */
@Component
public class StageRegistry {

    private static final Logger log = LoggerFactory.getLogger(StageRegistry.class);

    private final Map<String, Stage> stages = new LinkedHashMap<>();

    public StageRegistry(List<Stage> allStages) {
        Map<String, String> keyOwners = new HashMap<>();
        for (Stage stage : allStages) {
            Stage previous = stages.putIfAbsent(stage.name(), stage);
            if (previous != null) {
                throw new IllegalStateException("Duplicate stage name '" + stage.name() + "': "
                        + previous.getClass().getName() + " and " + stage.getClass().getName());
            }
            for (String key : stage.descriptor().outputKeys()) {
                String owner = keyOwners.putIfAbsent(key, stage.name());
                if (owner != null) {
                    throw new IllegalStateException("Output key '" + key + "' declared by both '"
                            + owner + "' and '" + stage.name() + "'");
                }
            }
            log.info("Registered stage '{}' -> {}", stage.name(), stage.descriptor().outputKeys());
        }
    }

    public Optional<Stage> find(String name) {
        return Optional.ofNullable(stages.get(name));
    }

    public Stage get(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException("Unknown stage: " + name));
    }

    /** Stage names in registration order. */
    public List<String> names() {
        return List.copyOf(stages.keySet());
    }
}
