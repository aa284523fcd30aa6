package com.loom.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineConfigLoaderTest {

    @TempDir Path dir;

    PipelineConfigLoader loaderFor(Path file) {
        return new PipelineConfigLoader(new ObjectMapper(), file.toString());
    }

    @Test
    void load_readsBlocksAndOrder() throws IOException {
        Path file = dir.resolve("loom.config.json");
        Files.writeString(file, """
                {
                  "defaults": { "provider": "claude" },
                  "stages": { "research": { "required": false }, "analysis": {} },
                  "stageExecutionOrder": ["analysis", "research"]
                }
                """);

        PipelineConfigDocument doc = loaderFor(file).load();

        assertThat(doc.defaults().path("provider").asText()).isEqualTo("claude");
        assertThat(doc.stages()).containsOnlyKeys("research", "analysis");
        assertThat(doc.stages().keySet()).containsExactly("research", "analysis");
        assertThat(doc.explicitOrder()).contains(List.of("analysis", "research"));
    }

    @Test
    void load_missingFile_isAConfigError() {
        assertThatThrownBy(() -> loaderFor(dir.resolve("absent.json")).load())
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void parse_malformedJson_isAConfigError() {
        assertThatThrownBy(() -> loaderFor(dir).parse("{ \"defaults\": ", "broken.json"))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("broken.json");
    }

    @Test
    void parse_wrongShapes_areReported() {
        assertThatThrownBy(() -> loaderFor(dir).parse("""
                { "defaults": [], "stages": { "analysis": 3 }, "stageExecutionOrder": "analysis" }
                """, "shapes.json"))
                .isInstanceOfSatisfying(ConfigException.class, e -> assertThat(e.problems()).hasSize(3));
    }

    @Test
    void parse_nonObjectRoot_isRejected() {
        assertThatThrownBy(() -> loaderFor(dir).parse("[1, 2]", "list.json"))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("JSON object");
    }

    @Test
    void parse_orderWithBlankName_isRejected() {
        assertThatThrownBy(() -> loaderFor(dir).parse("""
                { "stageExecutionOrder": ["analysis", " "] }
                """, "order.json"))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("stageExecutionOrder[1]");
    }

    @Test
    void parse_unknownSettingsAndSections_areTolerated() {
        PipelineConfigDocument doc = loaderFor(dir).parse("""
                { "defaults": { "colour": "blue" }, "project": { "root": "." } }
                """, "extra.json");

        assertThat(doc.explicitOrder()).isEmpty();
        assertThat(doc.stages()).isEmpty();
    }
}
