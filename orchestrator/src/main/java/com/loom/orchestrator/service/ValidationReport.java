package com.loom.orchestrator.service;

import com.loom.orchestrator.provider.ProviderStatus;

import java.util.List;

/**
 * Result of checking configuration and providers without running any stage.
 *
 * @param order         stages that would run, in order
 * @param orderProblems problems with the configured execution order
 * @param providers     status of every provider referenced by a resolvable stage
 */
public record ValidationReport(boolean valid,
                               List<String> order,
                               List<String> orderProblems,
                               List<StageValidation> stages,
                               List<ProviderStatus> providers) {

    public ValidationReport {
        order         = List.copyOf(order);
        orderProblems = List.copyOf(orderProblems);
        stages        = List.copyOf(stages);
        providers     = List.copyOf(providers);
    }
}
