package com.loom.orchestrator.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.http.HttpRequest;
import java.util.List;
import java.util.Map;

/**
 * OpenAI Chat Completions backend.
 */
@Component
public class OpenAiProvider extends AbstractHttpProvider {

    public static final String ID = "openai";

    private static final String DEFAULT_MODEL = "gpt-4o-mini";

    public OpenAiProvider(@Value("${loom.providers.openai.credential-env:OPENAI_API_KEY}") String credentialEnv,
                          @Value("${loom.providers.openai.base-url:https://api.openai.com}") String baseUrl,
                          @Value("${loom.gateway.validate-reachability:false}") boolean probeReachability,
                          CredentialResolver credentials,
                          ObjectMapper objectMapper) {
        super(credentialEnv, baseUrl, probeReachability, credentials, objectMapper);
    }

    @Override public String id()           { return ID; }
    @Override public String defaultModel() { return DEFAULT_MODEL; }

    @Override
    protected String generationPath(GenerationParams params) {
        return "/v1/chat/completions";
    }

    @Override
    protected String probePath() {
        return "/v1/models";
    }

    @Override
    protected Map<String, Object> requestBody(String request, GenerationParams params) {
        return Map.of(
                "model",       params.model(),
                "max_tokens",  params.maxTokens(),
                "temperature", params.temperature(),
                "top_p",       params.topP(),
                "messages",    List.of(Map.of("role", "user", "content", request))
        );
    }

    @Override
    protected void authenticate(HttpRequest.Builder builder, String credential) {
        builder.header("Authorization", "Bearer " + credential);
    }

    @Override
    protected String extractText(String responseBody) throws IOException {
        JsonNode content = json.readTree(responseBody)
                .path("choices").path(0).path("message").path("content");
        return content.isTextual() ? content.asText() : null;
    }

    @Override
    protected boolean isWellFormed(String credential) {
        return credential.startsWith("sk-") && credential.length() > 20;
    }
}
