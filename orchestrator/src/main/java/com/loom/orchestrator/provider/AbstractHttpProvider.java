package com.loom.orchestrator.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Shared plumbing for providers reached over HTTPS with a JSON body.
 *
 * Subclasses describe the wire format (endpoint, headers, body, response
 * extraction); this class does credential lookup, transport, status
 * classification and the validation check.
 */
public abstract class AbstractHttpProvider implements TextProvider {

    private static final Logger log = LoggerFactory.getLogger(AbstractHttpProvider.class);

    private static final Duration PROBE_TIMEOUT = Duration.ofSeconds(10);
    private static final int      MAX_ERROR_BODY = 500;

    protected final ObjectMapper json;

    private final HttpClient         http;
    private final CredentialResolver credentials;
    private final String             credentialEnv;
    private final String             baseUrl;
    private final boolean            probeReachability;

    protected AbstractHttpProvider(String credentialEnv,
                                   String baseUrl,
                                   boolean probeReachability,
                                   CredentialResolver credentials,
                                   ObjectMapper objectMapper) {
        this.credentialEnv     = credentialEnv;
        this.baseUrl           = stripTrailingSlash(baseUrl);
        this.probeReachability = probeReachability;
        this.credentials       = credentials;
        this.json              = objectMapper;
        this.http              = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // ------------------------------------------------------------------
    // Wire format, supplied by each backend
    // ------------------------------------------------------------------

    /** Path (relative to the base URL) of the generation endpoint. */
    protected abstract String generationPath(GenerationParams params);

    /** Path of a cheap authenticated GET used as a reachability probe. */
    protected abstract String probePath();

    protected abstract Map<String, Object> requestBody(String request, GenerationParams params);

    protected abstract void authenticate(HttpRequest.Builder builder, String credential);

    /** Pull the generated text out of a 2xx response body. */
    protected abstract String extractText(String responseBody) throws IOException;

    /** Superficial format check of a credential value. */
    protected abstract boolean isWellFormed(String credential);

    // ------------------------------------------------------------------
    // TextProvider
    // ------------------------------------------------------------------

    @Override
    public String generate(String request, GenerationParams params, Duration timeout) {
        String credential = credentials.lookup(credentialEnv)
                .orElseThrow(() -> ProviderException.unavailable(
                        "Credential " + credentialEnv + " is not set for provider '" + id() + "'"));

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + generationPath(params)))
                .timeout(timeout)
                .header("content-type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(toJson(requestBody(request, params))));
        authenticate(builder, credential);

        HttpResponse<String> response = send(builder.build());
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new ProviderException(classifyStatus(status),
                    "%s returned HTTP %d: %s".formatted(id(), status, abbreviate(response.body())));
        }

        try {
            String text = extractText(response.body());
            if (text == null) {
                throw new ProviderException(FailureKind.PROVIDER_UNAVAILABLE,
                        id() + " response contained no text");
            }
            return text;
        } catch (IOException e) {
            throw new ProviderException(FailureKind.PROVIDER_UNAVAILABLE,
                    id() + " returned an unreadable response body", e);
        }
    }

    @Override
    public ProviderStatus validate() {
        Optional<String> credential = credentials.lookup(credentialEnv);
        if (credential.isEmpty()) {
            return new ProviderStatus(id(), credentialEnv, false, false, null, false,
                    credentialEnv + " is not set");
        }
        String key    = credential.get();
        String masked = CredentialResolver.mask(key);
        if (!isWellFormed(key)) {
            return new ProviderStatus(id(), credentialEnv, true, false, masked, false,
                    credentialEnv + " does not look like a " + id() + " credential");
        }
        if (!probeReachability) {
            return new ProviderStatus(id(), credentialEnv, true, true, masked, true,
                    "Credential present; reachability not probed");
        }
        return probe(key, masked);
    }

    // ------------------------------------------------------------------
    // Classification
    // ------------------------------------------------------------------

    /**
     * Map a non-2xx HTTP status to a failure kind: rate limits, request
     * timeouts and server-side errors are transient; everything else
     * (bad request, bad credential, unknown model) is not.
     */
    public static FailureKind classifyStatus(int status) {
        if (status == 408 || status == 425 || status == 429 || status >= 500) {
            return FailureKind.PROVIDER_TRANSIENT;
        }
        return FailureKind.PROVIDER_UNAVAILABLE;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private HttpResponse<String> send(HttpRequest request) {
        try {
            return http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw ProviderException.transientFailure(id() + " request timed out", e);
        } catch (IOException e) {
            throw ProviderException.transientFailure(id() + " I/O failure: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ProviderException.transientFailure(id() + " request interrupted", e);
        }
    }

    private ProviderStatus probe(String credential, String masked) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + probePath()))
                .timeout(PROBE_TIMEOUT)
                .GET();
        authenticate(builder, credential);
        try {
            int status = send(builder.build()).statusCode();
            boolean ok = status >= 200 && status < 300;
            return new ProviderStatus(id(), credentialEnv, true, true, masked, ok,
                    ok ? "Reachable" : "Probe returned HTTP " + status);
        } catch (ProviderException e) {
            log.warn("Reachability probe for provider '{}' failed: {}", id(), e.getMessage());
            return new ProviderStatus(id(), credentialEnv, true, true, masked, false, e.getMessage());
        }
    }

    private String toJson(Object body) {
        try {
            return json.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new ProviderException(FailureKind.PROVIDER_UNAVAILABLE,
                    "Could not serialise request for " + id(), e);
        }
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() <= MAX_ERROR_BODY ? body : body.substring(0, MAX_ERROR_BODY) + "...";
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
