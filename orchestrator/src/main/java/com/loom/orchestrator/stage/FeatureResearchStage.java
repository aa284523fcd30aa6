package com.loom.orchestrator.stage;

import com.loom.orchestrator.context.ContextStore;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/** Researches how to implement the requested feature in the analyzed project. */
@Component
@Order(2)
public class FeatureResearchStage extends PromptStage {

    public static final String NAME       = "research";
    public static final String OUTPUT_KEY = "feature_research";

    public FeatureResearchStage() {
        super(new StageDescriptor(NAME, List.of(OUTPUT_KEY),
                      List.of(ContextStore.INPUT_KEY, ProjectAnalysisStage.OUTPUT_KEY)),
              StagePrompts.FEATURE_RESEARCH);
    }
}
