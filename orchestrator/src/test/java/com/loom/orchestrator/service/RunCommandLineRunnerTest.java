package com.loom.orchestrator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.loom.orchestrator.provider.FailureKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RunCommandLineRunnerTest {

    @Mock PipelineOrchestrator orchestrator;

    ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    ObjectMapper          mapper = new ObjectMapper().registerModule(new JavaTimeModule());

    RunCommandLineRunner runner() {
        return new RunCommandLineRunner(orchestrator, mapper,
                new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    static RunReport report(RunStatus status) {
        return new RunReport("run-9", status, Instant.parse("2026-03-01T10:00:00Z"), 3,
                Map.of("input", "hello"), List.of(), List.of());
    }

    @Test
    void run_printsTheReportAsJson() throws Exception {
        when(orchestrator.run(new RunRequest("hello", true))).thenReturn(report(RunStatus.COMPLETED));

        RunCommandLineRunner runner = runner();

        runner.run("--input=hello", "--invalidate-cache");

        assertThat(buffer.toString(StandardCharsets.UTF_8))
                .contains("\"runId\" : \"run-9\"")
                .contains("\"status\" : \"COMPLETED\"");
        assertThat(runner.getExitCode()).isZero();
    }

    @Test
    void validateOnly_doesNotRun() throws Exception {
        when(orchestrator.validate()).thenReturn(
                new ValidationReport(true, List.of(), List.of(), List.of(), List.of()));

        runner().run("--validate-only");

        verify(orchestrator, never()).run(any(RunRequest.class));
        assertThat(buffer.toString(StandardCharsets.UTF_8)).contains("\"valid\" : true");
    }

    @Test
    void failedValidation_setsANonZeroExitCode() throws Exception {
        when(orchestrator.validate()).thenReturn(
                new ValidationReport(false, List.of(), List.of("unknown stage 'x'"), List.of(), List.of()));
        RunCommandLineRunner runner = runner();

        runner.run("--validate-only");

        assertThat(runner.getExitCode()).isEqualTo(RunCommandLineRunner.EXIT_INVALID);
        assertThat(buffer.toString(StandardCharsets.UTF_8)).contains("\"valid\" : false");
    }

    @Test
    void haltedRun_printsThePartialReport() throws Exception {
        when(orchestrator.run(any(RunRequest.class))).thenThrow(new PipelineHaltedException(
                "analysis", FailureKind.PROVIDER_UNAVAILABLE, "no key", report(RunStatus.HALTED)));

        RunCommandLineRunner runner = runner();

        runner.run("--input=hello");

        assertThat(buffer.toString(StandardCharsets.UTF_8)).contains("\"status\" : \"HALTED\"");
        assertThat(runner.getExitCode()).isEqualTo(RunCommandLineRunner.EXIT_HALTED);
    }

    @Test
    void cancelledRun_printsThePartialReportAndExitsNonZero() throws Exception {
        when(orchestrator.run(any(RunRequest.class))).thenThrow(new PipelineCancelledException(
                "research", report(RunStatus.CANCELLED), new InterruptedException()));
        RunCommandLineRunner runner = runner();

        runner.run("--input=hello");

        assertThat(buffer.toString(StandardCharsets.UTF_8)).contains("\"status\" : \"CANCELLED\"");
        assertThat(runner.getExitCode()).isEqualTo(RunCommandLineRunner.EXIT_CANCELLED);
    }

    @Test
    void missingInput_isRejected() {
        assertThatThrownBy(() -> runner().run())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("--input");
    }
}
