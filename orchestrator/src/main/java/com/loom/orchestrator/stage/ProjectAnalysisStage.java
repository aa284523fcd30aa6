package com.loom.orchestrator.stage;

import com.loom.orchestrator.context.ContextStore;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/** Summarizes the project described in the run input. */
@Component
@Order(1)
public class ProjectAnalysisStage extends PromptStage {

    public static final String NAME       = "analysis";
    public static final String OUTPUT_KEY = "project_analysis";

    public ProjectAnalysisStage() {
        super(new StageDescriptor(NAME, List.of(OUTPUT_KEY), List.of(ContextStore.INPUT_KEY)),
              StagePrompts.PROJECT_ANALYSIS);
    }
}
