package com.loom.orchestrator.stage;

import com.loom.orchestrator.context.ContextStore;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Combines the request, analysis and research into one task description.
 * Its output is the final product of the default pipeline.
 */
@Component
@Order(3)
public class PromptAssemblyStage extends PromptStage {

    public static final String NAME       = "assembly";
    public static final String OUTPUT_KEY = "assembled_prompt";

    public PromptAssemblyStage() {
        super(new StageDescriptor(NAME, List.of(OUTPUT_KEY),
                      List.of(ContextStore.INPUT_KEY, ProjectAnalysisStage.OUTPUT_KEY, FeatureResearchStage.OUTPUT_KEY)),
              StagePrompts.PROMPT_ASSEMBLY);
    }

    @Override
    public Map<String, String> toContextWrites(String output) {
        return Map.of(OUTPUT_KEY, output.strip());
    }
}
