package com.loom.orchestrator.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.http.HttpRequest;
import java.util.List;
import java.util.Map;

/**
 * Anthropic Messages API backend.
 *
 * Sends the stage request as a single user turn and returns the text of the
 * first text content block.
 */
@Component
public class ClaudeProvider extends AbstractHttpProvider {

    public static final String ID = "claude";

    private static final String API_VER       = "2023-06-01";
    private static final String DEFAULT_MODEL = "claude-sonnet-4-5";

    /** One turn of the conversation; role is "user" or "assistant". */
    public record Message(String role, String content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MessagesResponse(List<ContentBlock> content) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record ContentBlock(String type, String text) {}

        /** Text of the first text block, or null when there is none. */
        public String firstText() {
            if (content == null) return null;
            return content.stream()
                    .filter(b -> "text".equals(b.type()))
                    .map(ContentBlock::text)
                    .findFirst()
                    .orElse(null);
        }
    }

    public ClaudeProvider(@Value("${loom.providers.claude.credential-env:ANTHROPIC_API_KEY}") String credentialEnv,
                          @Value("${loom.providers.claude.base-url:https://api.anthropic.com}") String baseUrl,
                          @Value("${loom.gateway.validate-reachability:false}") boolean probeReachability,
                          CredentialResolver credentials,
                          ObjectMapper objectMapper) {
        super(credentialEnv, baseUrl, probeReachability, credentials, objectMapper);
    }

    @Override public String id()           { return ID; }
    @Override public String defaultModel() { return DEFAULT_MODEL; }

    @Override
    protected String generationPath(GenerationParams params) {
        return "/v1/messages";
    }

    @Override
    protected String probePath() {
        return "/v1/models";
    }

    @Override
    protected Map<String, Object> requestBody(String request, GenerationParams params) {
        // top_p is left out: recent models reject temperature and top_p together.
        return Map.of(
                "model",       params.model(),
                "max_tokens",  params.maxTokens(),
                "temperature", params.temperature(),
                "top_k",       params.topK(),
                "messages",    List.of(new Message("user", request))
        );
    }

    @Override
    protected void authenticate(HttpRequest.Builder builder, String credential) {
        builder.header("x-api-key", credential)
               .header("anthropic-version", API_VER);
    }

    @Override
    protected String extractText(String responseBody) throws IOException {
        return json.readValue(responseBody, MessagesResponse.class).firstText();
    }

    @Override
    protected boolean isWellFormed(String credential) {
        return credential.startsWith("sk-ant-") && credential.length() > 20;
    }
}
