package com.loom.orchestrator.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process registry of text providers.
 *
 * Every {@link TextProvider} bean is collected at startup; adding a backend
 * only requires declaring it as a {@code @Component}.
 */
@Component
public class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final Map<String, TextProvider> providers = new ConcurrentHashMap<>();

    public ProviderRegistry(List<TextProvider> allProviders) {
        for (TextProvider provider : allProviders) {
            TextProvider previous = providers.putIfAbsent(provider.id(), provider);
            if (previous != null) {
                throw new IllegalStateException("Duplicate provider id '" + provider.id() + "': "
                        + previous.getClass().getName() + " and " + provider.getClass().getName());
            }
            log.info("Registered provider '{}' (default model {})", provider.id(), provider.defaultModel());
        }
    }

    public Optional<TextProvider> find(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(providers.get(id));
    }

    public boolean contains(String id) {
        return find(id).isPresent();
    }

    /** Returns all registered provider ids (sorted). */
    public List<String> providerIds() {
        return providers.keySet().stream().sorted().toList();
    }
}
