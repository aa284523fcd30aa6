package com.loom.orchestrator.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Google Gemini generateContent backend. This is the built-in default provider.
 */
@Component
public class GeminiProvider extends AbstractHttpProvider {

    public static final String ID = "gemini";

    private static final String  DEFAULT_MODEL = "gemini-2.0-flash";
    private static final Pattern KEY_FORMAT    = Pattern.compile("[A-Za-z0-9_\\-]{30,}");

    public GeminiProvider(@Value("${loom.providers.gemini.credential-env:GEMINI_API_KEY}") String credentialEnv,
                          @Value("${loom.providers.gemini.base-url:https://generativelanguage.googleapis.com}") String baseUrl,
                          @Value("${loom.gateway.validate-reachability:false}") boolean probeReachability,
                          CredentialResolver credentials,
                          ObjectMapper objectMapper) {
        super(credentialEnv, baseUrl, probeReachability, credentials, objectMapper);
    }

    @Override public String id()           { return ID; }
    @Override public String defaultModel() { return DEFAULT_MODEL; }

    @Override
    protected String generationPath(GenerationParams params) {
        return "/v1beta/models/" + URLEncoder.encode(params.model(), StandardCharsets.UTF_8) + ":generateContent";
    }

    @Override
    protected String probePath() {
        return "/v1beta/models";
    }

    @Override
    protected Map<String, Object> requestBody(String request, GenerationParams params) {
        return Map.of(
                "contents", List.of(Map.of("parts", List.of(Map.of("text", request)))),
                "generationConfig", Map.of(
                        "temperature",     params.temperature(),
                        "topP",            params.topP(),
                        "topK",            params.topK(),
                        "maxOutputTokens", params.maxTokens())
        );
    }

    @Override
    protected void authenticate(HttpRequest.Builder builder, String credential) {
        builder.header("x-goog-api-key", credential);
    }

    @Override
    protected String extractText(String responseBody) throws IOException {
        JsonNode parts = json.readTree(responseBody)
                .path("candidates").path(0).path("content").path("parts");
        if (!parts.isArray() || parts.isEmpty()) {
            return null;
        }
        StringBuilder sb = new StringBuilder();
        parts.forEach(p -> sb.append(p.path("text").asText("")));
        return sb.toString();
    }

    @Override
    protected boolean isWellFormed(String credential) {
        return KEY_FORMAT.matcher(credential).matches();
    }
}
