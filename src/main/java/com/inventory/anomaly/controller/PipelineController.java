package com.inventory.anomaly.controller;

import com.inventory.anomaly.model.RunRequest;
import com.inventory.anomaly.model.RunResult;
import com.inventory.anomaly.repository.PipelineRunRepository;
import com.inventory.anomaly.service.PipelineService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/pipeline")
@Tag(name = "Pipeline", description = "Trigger anomaly detection runs and browse run history")
public class PipelineController {

    private static final int MAX_LIMIT = 100;

    private final PipelineService pipelineService;
    private final PipelineRunRepository runRepository;

    public PipelineController(PipelineService pipelineService, PipelineRunRepository runRepository) {
        this.pipelineService = pipelineService;
        this.runRepository = runRepository;
    }

    @Operation(summary = "Run the pipeline",
            description = "Runs load, clean, features, forecasting, aggregation and detection, then the optional " +
                    "alert and report branches. Blocks until the run ends. Task failures are reported in the " +
                    "result (status=failed), not as HTTP errors; 422 means the run could not start.")
    @PostMapping("/runs")
    public ResponseEntity<RunResult> run(@RequestBody(required = false) RunRequest request) {
        return ResponseEntity.ok(pipelineService.run(request));
    }

    @Operation(summary = "Get a past run")
    @GetMapping("/runs/{runId}")
    public ResponseEntity<RunResult> getRun(
            @Parameter(description = "Run ID", example = "run-20260112-060000-3f9a")
            @PathVariable String runId) {
        RunResult result = runRepository.findById(runId);
        if (result == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(result);
    }

    @Operation(summary = "List recent runs", description = "Most recent first.")
    @GetMapping("/runs")
    public ResponseEntity<?> listRuns(
            @Parameter(description = "Maximum runs to return (1-100)", example = "20")
            @RequestParam(defaultValue = "20") int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "limit must be between 1 and " + MAX_LIMIT, "field", "limit"));
        }
        List<RunResult> runs = runRepository.findRecent(limit);
        return ResponseEntity.ok(runs);
    }
}
