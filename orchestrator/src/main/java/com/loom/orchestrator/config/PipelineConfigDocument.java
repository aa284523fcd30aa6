package com.loom.orchestrator.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Parsed, structurally valid pipeline configuration document.
 *
 * <pre>
 * {
 *   "defaults":            { "provider": "claude", "temperature": 0.2 },
 *   "stages":              { "research": { "required": false } },
 *   "stageExecutionOrder": [ "analysis", "research", "assembly" ]
 * }
 * </pre>
 *
 * Setting values are kept as JSON and typed on resolution.
 *
 * @param defaults       the {@code defaults} block (empty object when absent)
 * @param stages         per-stage override blocks, in document order
 * @param executionOrder explicit order, or null when absent or empty
 */
public record PipelineConfigDocument(ObjectNode defaults,
                                     Map<String, ObjectNode> stages,
                                     List<String> executionOrder) {

    public PipelineConfigDocument {
        stages = Collections.unmodifiableMap(new LinkedHashMap<>(stages));
        executionOrder = executionOrder == null || executionOrder.isEmpty() ? null : List.copyOf(executionOrder);
    }

    /** Document with no overrides: every stage resolves to built-ins, in registration order. */
    public static PipelineConfigDocument empty() {
        return new PipelineConfigDocument(JsonNodeFactory.instance.objectNode(), Map.of(), null);
    }

    public Optional<List<String>> explicitOrder() {
        return Optional.ofNullable(executionOrder);
    }

    /** Override block for {@code stageName}; a missing node when the document has none. */
    public JsonNode stageBlock(String stageName) {
        ObjectNode block = stages.get(stageName);
        return block == null ? MissingNode.getInstance() : block;
    }
}
