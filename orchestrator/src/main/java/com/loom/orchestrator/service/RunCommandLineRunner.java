package com.loom.orchestrator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * Runs the pipeline once from the command line and prints the JSON report.
 *
 * <pre>
 *   java -jar loom-orchestrator.jar --loom.cli.enabled=true \
 *        --spring.main.web-application-type=none \
 *        --input="Add OAuth login to the admin console" [--validate-only] [--invalidate-cache]
 * </pre>
 *
 * Exit codes: 0 completed (degraded included), 1 validation failed, 2 halted, 3 cancelled.
 */
@Component
@ConditionalOnProperty(name = "loom.cli.enabled", havingValue = "true")
public class RunCommandLineRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(RunCommandLineRunner.class);

    static final int EXIT_INVALID   = 1;
    static final int EXIT_HALTED    = 2;
    static final int EXIT_CANCELLED = 3;

    private final PipelineOrchestrator orchestrator;
    private final ObjectMapper         objectMapper;
    private final PrintStream          out;

    private volatile int exitCode = 0;

    @Autowired
    public RunCommandLineRunner(PipelineOrchestrator orchestrator, ObjectMapper objectMapper) {
        this(orchestrator, objectMapper, System.out);
    }

    RunCommandLineRunner(PipelineOrchestrator orchestrator, ObjectMapper objectMapper, PrintStream out) {
        this.orchestrator = orchestrator;
        this.objectMapper = objectMapper;
        this.out          = out;
    }

    @Override
    public void run(String... args) throws JsonProcessingException {
        DefaultApplicationArguments arguments = new DefaultApplicationArguments(args);

        if (arguments.containsOption("validate-only")) {
            ValidationReport report = orchestrator.validate();
            print(report);
            if (!report.valid()) {
                log.error("Validation failed");
                exitCode = EXIT_INVALID;
            }
            return;
        }

        List<String> input = arguments.getOptionValues("input");
        if (input == null || input.isEmpty() || input.get(0).isBlank()) {
            throw new IllegalArgumentException("--input=<text> is required unless --validate-only is given");
        }
        RunRequest request = new RunRequest(input.get(0), arguments.containsOption("invalidate-cache"));
        try {
            print(orchestrator.run(request));
        } catch (PipelineHaltedException e) {
            log.error(e.getMessage());
            exitCode = EXIT_HALTED;
            print(e.getPartialReport());
        } catch (PipelineCancelledException e) {
            log.warn(e.getMessage());
            exitCode = EXIT_CANCELLED;
            print(e.getPartialReport());
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void print(Object report) throws JsonProcessingException {
        out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report));
    }
}
