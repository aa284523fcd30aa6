package com.loom.orchestrator.stage;

import com.loom.orchestrator.context.ContextSnapshot;
import com.loom.orchestrator.provider.ExecutionResult;
import com.loom.orchestrator.provider.ExecutionResult.Success;
import com.loom.orchestrator.provider.ExecutionResult.TerminalFailure;
import com.loom.orchestrator.provider.FailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Base for stages that fill a template from context values, send it to the
 * provider and take the answer verbatim.
 *
 * Placeholders look like {@code {{project_analysis}}}. A key that is not in
 * the context renders as {@link #MISSING}. A blank answer is rejected as
 * {@link FailureKind#STAGE_OUTPUT_INVALID}.
 */
public abstract class PromptStage implements Stage {

    private static final Logger log = LoggerFactory.getLogger(PromptStage.class);

    static final String MISSING = "(no information available)";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([A-Za-z0-9_.-]+)\\s*}}");

    private final StageDescriptor descriptor;
    private final String          template;

    protected PromptStage(StageDescriptor descriptor, String template) {
        this.descriptor = descriptor;
        this.template   = template;
    }

    @Override
    public StageDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public ExecutionResult execute(StageInvocation invocation) {
        String request = render(template, invocation.context());
        log.debug("Stage '{}' request is {} chars", name(), request.length());

        ExecutionResult result = invocation.callProvider(request);
        if (result instanceof Success s && (s.output() == null || s.output().isBlank())) {
            return new TerminalFailure(FailureKind.STAGE_OUTPUT_INVALID,
                    "Stage '" + name() + "' received blank output from provider '"
                            + invocation.config().providerId() + "'",
                    s.attempts());
        }
        return result;
    }

    /** Keys referenced by {@code template}, in order of first appearance. */
    public static List<String> placeholders(String template) {
        Matcher m = PLACEHOLDER.matcher(template);
        return m.results().map(r -> r.group(1)).distinct().toList();
    }

    public static String render(String template, ContextSnapshot context) {
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder(template.length() + 256);
        while (m.find()) {
            String value = context.get(m.group(1))
                    .filter(v -> !v.isBlank())
                    .orElse(MISSING);
            m.appendReplacement(out, Matcher.quoteReplacement(value));
        }
        m.appendTail(out);
        return out.toString();
    }
}
