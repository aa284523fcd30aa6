package com.loom.orchestrator.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.loom.orchestrator.config.EffectiveStageConfig;
import com.loom.orchestrator.context.ContextSnapshot;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Default cache-key derivation: SHA-256 over canonical JSON of
 * {stage, effective config, value of each interesting key}.
 *
 * An absent interesting key is encoded as JSON {@code null}, so "absent" and
 * "empty string" produce different keys.
 */
public final class CacheKeys {

    private static final ObjectMapper CANONICAL = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    private CacheKeys() {}

    public static String of(String stageName,
                            EffectiveStageConfig config,
                            Iterable<String> interestingKeys,
                            ContextSnapshot snapshot) {
        Map<String, String> inputs = new TreeMap<>();
        for (String key : interestingKeys) {
            inputs.put(key, snapshot.get(key).orElse(null));
        }
        Map<String, Object> material = new LinkedHashMap<>();
        material.put("stage",  stageName);
        material.put("config", config.fingerprint());
        material.put("inputs", inputs);
        return sha256(canonicalJson(material));
    }

    static String canonicalJson(Object value) {
        try {
            return CANONICAL.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize cache-key material", e);
        }
    }

    static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
