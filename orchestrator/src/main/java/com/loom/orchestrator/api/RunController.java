package com.loom.orchestrator.api;

import com.loom.orchestrator.api.dto.RunResponse;
import com.loom.orchestrator.api.dto.RunSubmitRequest;
import com.loom.orchestrator.config.ConfigException;
import com.loom.orchestrator.provider.ProviderStatus;
import com.loom.orchestrator.service.PipelineCancelledException;
import com.loom.orchestrator.service.PipelineHaltedException;
import com.loom.orchestrator.service.PipelineOrchestrator;
import com.loom.orchestrator.service.RunRequest;
import com.loom.orchestrator.service.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

/**
 * REST API for pipeline runs.
 *
 * POST /runs        run the pipeline (or only validate it) synchronously
 * GET  /providers   credential status of every installed provider
 *
 * Status codes for POST /runs:
 *   200  run completed, possibly with degraded stages; or validation passed
 *   400  input missing
 *   422  configuration invalid, or validation failed
 *   502  a required stage halted the run (body carries the partial report)
 *   503  the run was cancelled
 */
@RestController
public class RunController {

    private static final Logger log = LoggerFactory.getLogger(RunController.class);

    private final PipelineOrchestrator orchestrator;

    public RunController(PipelineOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/runs \
     *     -H "Content-Type: application/json" \
     *     -d '{"input":"Add CSV export to the reports page"}'
     */
    @PostMapping("/runs")
    public ResponseEntity<?> submit(@RequestBody RunSubmitRequest req) {
        if (req.validateOnly()) {
            ValidationReport report = orchestrator.validate();
            return ResponseEntity.status(report.valid() ? HttpStatus.OK : HttpStatus.UNPROCESSABLE_ENTITY)
                    .body(report);
        }
        if (req.input() == null || req.input().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "input is required");
        }
        try {
            return ResponseEntity.ok(RunResponse.from(
                    orchestrator.run(new RunRequest(req.input(), req.invalidateCache()))));
        } catch (PipelineHaltedException e) {
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(RunResponse.halted(e));
        } catch (PipelineCancelledException e) {
            log.warn(e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(RunResponse.from(e.getPartialReport()));
        }
    }

    @GetMapping("/providers")
    public List<ProviderStatus> providers() {
        return orchestrator.providerStatuses();
    }

    @ExceptionHandler(ConfigException.class)
    public ResponseEntity<Map<String, Object>> onConfigError(ConfigException e) {
        log.warn(e.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(Map.of("error", "invalid configuration", "problems", e.problems()));
    }
}
