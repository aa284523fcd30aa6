package com.loom.orchestrator.provider;

import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.function.Function;

/**
 * Reads provider credentials from named environment entries.
 *
 * Values are handed to provider adapters only; anything that is logged or
 * reported goes through {@link #mask(String)}.
 */
@Component
public class CredentialResolver {

    private final Function<String, String> environment;

    public CredentialResolver() {
        this(System::getenv);
    }

    public CredentialResolver(Function<String, String> environment) {
        this.environment = environment;
    }

    /** The credential stored under {@code envName}, or empty when unset or blank. */
    public Optional<String> lookup(String envName) {
        if (envName == null || envName.isBlank()) {
            return Optional.empty();
        }
        String value = environment.apply(envName);
        return (value == null || value.isBlank()) ? Optional.empty() : Optional.of(value.strip());
    }

    /**
     * Render a credential for display: at most the first four characters
     * followed by its length. Short values are hidden entirely.
     */
    public static String mask(String credential) {
        if (credential == null) {
            return null;
        }
        int len = credential.length();
        if (len <= 8) {
            return "**** (%d chars)".formatted(len);
        }
        return "%s**** (%d chars)".formatted(credential.substring(0, 4), len);
    }
}
