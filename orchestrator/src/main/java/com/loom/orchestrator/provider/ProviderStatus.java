package com.loom.orchestrator.provider;

/**
 * Result of a cheap provider check. Never contains the credential itself.
 *
 * @param providerId           provider identifier
 * @param credentialEnv        name of the environment entry holding the credential
 * @param credentialPresent    the entry is set and non-blank
 * @param credentialWellFormed the value matches the provider's key format
 * @param maskedCredential     first characters of the credential followed by its length, or null
 * @param available            provider is usable for generation calls
 * @param detail               human-readable explanation
 */
public record ProviderStatus(
        String  providerId,
        String  credentialEnv,
        boolean credentialPresent,
        boolean credentialWellFormed,
        String  maskedCredential,
        boolean available,
        String  detail) {

    public static ProviderStatus notInstalled(String providerId) {
        return new ProviderStatus(providerId, null, false, false, null, false,
                "Provider '" + providerId + "' is not installed");
    }
}
