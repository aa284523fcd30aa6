package com.loom.orchestrator.stage;

/**
 * Instruction templates of the default stages.
 *
 * {@code {{key}}} is replaced by the current context value of {@code key}.
 */
final class StagePrompts {

    private StagePrompts() {}

    static final String PROJECT_ANALYSIS = """
            You are a senior engineer reviewing a software project before new work starts.

            PROJECT DESCRIPTION AND REQUEST:
            {{input}}

            Provide a concise analysis covering:
            1. Project type and technology stack
            2. Main components and their purposes
            3. Architecture overview
            4. Key dependencies
            5. Development setup requirements
            6. Notable patterns or conventions

            Focus on what other engineers need to know to work on this project.
            """;

    static final String FEATURE_RESEARCH = """
            You are researching how to implement a requested feature.

            FEATURE REQUEST:
            {{input}}

            PROJECT ANALYSIS:
            {{project_analysis}}

            Describe:
            1. How comparable projects usually implement this feature
            2. Libraries or standards worth reusing
            3. Risks, edge cases and open questions
            4. A suggested implementation outline that fits the project above
            """;

    static final String PROMPT_ASSEMBLY = """
            Write a single, self-contained development task description that an engineer
            (or a coding assistant) can act on without further context.

            ORIGINAL REQUEST:
            {{input}}

            PROJECT ANALYSIS:
            {{project_analysis}}

            FEATURE RESEARCH:
            {{feature_research}}

            Structure the task as: Summary, Background, Requirements, Acceptance criteria,
            Implementation notes. Do not invent project details that are not stated above.
            """;
}
