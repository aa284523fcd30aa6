package com.loom.orchestrator.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads the pipeline configuration document from {@code loom.config.path}.
 *
 * Only the document's shape is checked here (objects where objects belong,
 * a list of names for the order). Setting values are typed and range-checked
 * by {@link ConfigResolver}.
 */
@Component
public class PipelineConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfigLoader.class);

    static final String DEFAULTS = "defaults";
    static final String STAGES   = "stages";
    static final String ORDER    = "stageExecutionOrder";

    private static final Set<String> TOP_LEVEL = Set.of(DEFAULTS, STAGES, ORDER);

    private final ObjectMapper objectMapper;
    private final Path         configPath;

    public PipelineConfigLoader(ObjectMapper objectMapper,
                                @Value("${loom.config.path:loom.config.json}") String configPath) {
        this.objectMapper = objectMapper;
        this.configPath   = Path.of(configPath);
    }


    /**
     * Read and parse the configured file. Called once per run so edits take
     * effect on the next run without a restart.
     *
     * @throws ConfigException if the file is missing, unreadable or malformed
     */
    public PipelineConfigDocument load() {
        String content;
        try {
            content = Files.readString(configPath, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new ConfigException("Configuration file not found at: " + configPath.toAbsolutePath());
        } catch (IOException e) {
            throw new ConfigException("Cannot read configuration file " + configPath + ": " + e.getMessage(), e);
        }
        log.debug("Loaded pipeline configuration from {}", configPath.toAbsolutePath());
        return parse(content, configPath.toString());
    }

    /**
     * Parse a document held in memory.
     *
     * @param source name used in error messages
     */
    public PipelineConfigDocument parse(String content, String source) {
        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new ConfigException("Malformed JSON in " + source + ": " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            throw new ConfigException("Configuration document " + source + " is empty");
        }
        if (!root.isObject()) {
            throw new ConfigException("Configuration document " + source + " must be a JSON object");
        }

        List<String> problems = new ArrayList<>();
        root.fieldNames().forEachRemaining(name -> {
            if (!TOP_LEVEL.contains(name)) {
                log.warn("Ignoring unknown top-level entry '{}' in {}", name, source);
            }
        });

        ObjectNode defaults = readBlock(root.path(DEFAULTS), DEFAULTS, problems);
        Map<String, ObjectNode> stages = readStages(root.path(STAGES), problems);
        List<String> order = readOrder(root.path(ORDER), problems);

        if (!problems.isEmpty()) {
            throw new ConfigException(problems);
        }
        return new PipelineConfigDocument(defaults, stages, order);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private ObjectNode readBlock(JsonNode node, String location, List<String> problems) {
        if (node.isMissingNode() || node.isNull()) {
            return JsonNodeFactory.instance.objectNode();
        }
        if (!node.isObject()) {
            problems.add(location + " must be a JSON object");
            return JsonNodeFactory.instance.objectNode();
        }
        node.fieldNames().forEachRemaining(name -> {
            if (!StageSettings.isKnown(name)) {
                log.warn("Ignoring unknown setting '{}.{}'", location, name);
            }
        });
        return (ObjectNode) node;
    }

    private Map<String, ObjectNode> readStages(JsonNode node, List<String> problems) {
        Map<String, ObjectNode> stages = new LinkedHashMap<>();
        if (node.isMissingNode() || node.isNull()) {
            return stages;
        }
        if (!node.isObject()) {
            problems.add(STAGES + " must be a JSON object keyed by stage name");
            return stages;
        }
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            stages.put(e.getKey(), readBlock(e.getValue(), STAGES + "." + e.getKey(), problems));
        }
        return stages;
    }

    private List<String> readOrder(JsonNode node, List<String> problems) {
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (!node.isArray()) {
            problems.add(ORDER + " must be a list of stage names");
            return null;
        }
        List<String> order = new ArrayList<>();
        for (int i = 0; i < node.size(); i++) {
            JsonNode item = node.get(i);
            if (!item.isTextual() || item.asText().isBlank()) {
                problems.add(ORDER + "[" + i + "] must be a non-blank stage name, got " + item);
            } else {
                order.add(item.asText().strip());
            }
        }
        return order;
    }
}
