package com.loom.orchestrator.stage;

import com.loom.orchestrator.provider.ExecutionResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StageRegistryTest {

    static Stage stage(String name, String outputKey) {
        StageDescriptor descriptor = new StageDescriptor(name, List.of(outputKey), List.of());
        return new Stage() {
            @Override public StageDescriptor descriptor() { return descriptor; }
            @Override public ExecutionResult execute(StageInvocation invocation) {
                return ExecutionResult.success(name);
            }
        };
    }

    @Test
    void names_followRegistrationOrder() {
        StageRegistry registry = new StageRegistry(List.of(
                new ProjectAnalysisStage(), new FeatureResearchStage(), new PromptAssemblyStage()));

        assertThat(registry.names()).containsExactly("analysis", "research", "assembly");
        assertThat(registry.find("research")).isPresent();
        assertThat(registry.find("review")).isEmpty();
    }

    @Test
    void duplicateNames_areRejected() {
        assertThatThrownBy(() -> new StageRegistry(List.of(stage("a", "x"), stage("a", "y"))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Duplicate stage name 'a'");
    }

    @Test
    void sharedOutputKeys_areRejected() {
        assertThatThrownBy(() -> new StageRegistry(List.of(stage("a", "shared"), stage("b", "shared"))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("'shared'");
    }

    @Test
    void descriptor_requiresAnOutputKey() {
        assertThatThrownBy(() -> new StageDescriptor("a", List.of(), List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
