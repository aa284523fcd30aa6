package com.loom.orchestrator.stage;

import com.loom.orchestrator.config.EffectiveStageConfig;
import com.loom.orchestrator.config.ErrorBoundary;
import com.loom.orchestrator.config.FallbackMode;
import com.loom.orchestrator.context.ContextSnapshot;
import com.loom.orchestrator.provider.BackoffPolicy;
import com.loom.orchestrator.provider.ExecutionResult;
import com.loom.orchestrator.provider.ExecutionResult.Success;
import com.loom.orchestrator.provider.ExecutionResult.TerminalFailure;
import com.loom.orchestrator.provider.FailureKind;
import com.loom.orchestrator.provider.GenerationParams;
import com.loom.orchestrator.provider.ProviderGateway;
import com.loom.orchestrator.provider.ProviderRegistry;
import com.loom.orchestrator.provider.ScriptedProvider;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PromptStageTest {

    ScriptedProvider provider = new ScriptedProvider("fake");
    ProviderGateway  gateway  = new ProviderGateway(new ProviderRegistry(List.of(provider)),
            new SimpleMeterRegistry(), BackoffPolicy.NONE, d -> { });

    static EffectiveStageConfig config(String stage) {
        return new EffectiveStageConfig(stage, "fake",
                new GenerationParams("fake-model", 0.7, 1024, 0.8, 40),
                0, Duration.ofSeconds(5),
                new ErrorBoundary(true, FallbackMode.HALT_PIPELINE, ""),
                Map.of());
    }

    StageInvocation invocation(Stage stage, Map<String, String> context) {
        return new StageInvocation("run-1", new ContextSnapshot(context, context.size()),
                config(stage.name()), gateway);
    }

    // ------------------------------------------------------------------
    // Rendering
    // ------------------------------------------------------------------

    @Test
    void render_substitutesValuesAndMarksMissingOnes() {
        ContextSnapshot snapshot = new ContextSnapshot(Map.of("input", "Add dark mode", "empty", "  "), 2);

        String rendered = PromptStage.render("Q: {{input}} | A: {{ project_analysis }} | E: {{empty}}", snapshot);

        assertThat(rendered).isEqualTo("Q: Add dark mode | A: (no information available) | E: (no information available)");
    }

    @Test
    void render_keepsDollarSignsAndBackslashesLiteral() {
        ContextSnapshot snapshot = new ContextSnapshot(Map.of("input", "cost is $5 \\ month"), 1);

        assertThat(PromptStage.render("{{input}}", snapshot)).isEqualTo("cost is $5 \\ month");
    }

    @Test
    void templates_referenceExactlyTheInterestingKeys() {
        for (Stage stage : List.of(new ProjectAnalysisStage(), new FeatureResearchStage(), new PromptAssemblyStage())) {
            assertThat(PromptStage.placeholders(templateOf(stage)))
                    .containsExactlyInAnyOrderElementsOf(stage.descriptor().interestingKeys());
        }
    }

    private static String templateOf(Stage stage) {
        if (stage instanceof ProjectAnalysisStage) return StagePrompts.PROJECT_ANALYSIS;
        if (stage instanceof FeatureResearchStage) return StagePrompts.FEATURE_RESEARCH;
        return StagePrompts.PROMPT_ASSEMBLY;
    }

    // ------------------------------------------------------------------
    // Execution
    // ------------------------------------------------------------------

    @Test
    void execute_sendsRenderedRequestAndReturnsProviderText() {
        provider.thenReturn("research notes");
        FeatureResearchStage stage = new FeatureResearchStage();

        ExecutionResult result = stage.execute(invocation(stage,
                Map.of("input", "Add CSV export", "project_analysis", "Spring Boot app")));

        assertThat(result).isEqualTo(new Success("research notes", 1));
        assertThat(provider.lastRequest())
                .contains("Add CSV export")
                .contains("Spring Boot app")
                .doesNotContain("{{");
    }

    @Test
    void execute_blankOutput_isStageOutputInvalid() {
        provider.thenReturn("   \n");
        ProjectAnalysisStage stage = new ProjectAnalysisStage();

        ExecutionResult result = stage.execute(invocation(stage, Map.of("input", "x")));

        assertThat(result).isInstanceOfSatisfying(TerminalFailure.class,
                t -> assertThat(t.kind()).isEqualTo(FailureKind.STAGE_OUTPUT_INVALID));
    }

    @Test
    void execute_providerFailure_isPassedThrough() {
        provider.thenFail(FailureKind.PROVIDER_UNAVAILABLE);
        ProjectAnalysisStage stage = new ProjectAnalysisStage();

        assertThat(stage.execute(invocation(stage, Map.of("input", "x"))))
                .isInstanceOfSatisfying(TerminalFailure.class,
                        t -> assertThat(t.kind()).isEqualTo(FailureKind.PROVIDER_UNAVAILABLE));
    }

    @Test
    void contextWrites_goToThePrimaryOutputKey() {
        assertThat(new ProjectAnalysisStage().toContextWrites("a"))
                .containsExactly(Map.entry(ProjectAnalysisStage.OUTPUT_KEY, "a"));
        assertThat(new PromptAssemblyStage().toContextWrites("  final task \n"))
                .containsExactly(Map.entry(PromptAssemblyStage.OUTPUT_KEY, "final task"));
    }
}
