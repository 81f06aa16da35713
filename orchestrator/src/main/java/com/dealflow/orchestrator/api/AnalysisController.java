package com.dealflow.orchestrator.api;

import com.dealflow.orchestrator.api.dto.AnalysisResponse;
import com.dealflow.orchestrator.api.dto.SubmitAnalysisRequest;
import com.dealflow.orchestrator.model.AnalysisJob;
import com.dealflow.orchestrator.model.AnalysisState;
import com.dealflow.orchestrator.model.PipelineInput;
import com.dealflow.orchestrator.service.AnalysisService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for deck analyses.
 *
 * POST /analyses               : submit a deck; the pipeline runs in the background
 * GET  /analyses/{id}          : poll the job state
 * GET  /analyses/{id}/progress : latest progress snapshot
 * GET  /analyses/{id}/report   : the composite report once the run has finished
 */
@RestController
@RequestMapping("/analyses")
public class AnalysisController {

    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {};

    private final AnalysisService analysisService;
    private final ObjectMapper    objectMapper;

    public AnalysisController(AnalysisService analysisService, ObjectMapper objectMapper) {
        this.analysisService = analysisService;
        this.objectMapper    = objectMapper;
    }

    /**
     * Submit a deck for analysis. Returns 202: the job exists, the work has not happened yet.
     * Returns 400 if the request carries neither pages nor text.
     *
     * Example:
     *   curl -X POST http://localhost:8080/analyses \
     *     -H "Content-Type: application/json" \
     *     -d '{"companyNameHint":"Acme","textContent":"Acme builds ..."}'
     */
    @PostMapping
    public ResponseEntity<AnalysisResponse> submit(@RequestBody SubmitAnalysisRequest req) {
        PipelineInput input = req.toInput();
        if (input.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Either pages or textContent is required");
        }
        AnalysisJob job = analysisService.submit(input);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(AnalysisResponse.from(job));
    }

    /** Returns 404 if the job ID is not found. */
    @GetMapping("/{id}")
    public AnalysisResponse getAnalysis(@PathVariable UUID id) {
        return AnalysisResponse.from(load(id));
    }

    /**
     * HTTP 200 : latest snapshot
     * HTTP 204 : the run has not reported any progress yet
     * HTTP 404 : job ID not found
     */
    @GetMapping("/{id}/progress")
    public ResponseEntity<Map<String, Object>> getProgress(@PathVariable UUID id) {
        AnalysisJob job = load(id);
        if (job.getProgressJson() == null) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.ok(parse(job.getProgressJson()));
    }

    /**
     * HTTP 200 : job COMPLETED, report attached
     * HTTP 202 : job still QUEUED or RUNNING
     * HTTP 409 : job FAILED; body carries the error code and message
     * HTTP 404 : job ID not found
     */
    @GetMapping("/{id}/report")
    public ResponseEntity<Map<String, Object>> getReport(@PathVariable UUID id) {
        AnalysisJob job = load(id);

        if (job.getState() == AnalysisState.FAILED) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status",       "failed");
            body.put("jobId",        job.getId().toString());
            body.put("errorCode",    job.getErrorCode());
            body.put("errorMessage", job.getErrorMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
        }
        if (job.getState() != AnalysisState.COMPLETED || job.getReportJson() == null) {
            return ResponseEntity.accepted()
                    .body(Map.of("status", "pending", "jobState", job.getState().name()));
        }

        Map<String, Object> report = parse(job.getReportJson());
        report.put("jobId",    job.getId().toString());
        report.put("jobState", job.getState().name());
        return ResponseEntity.ok(report);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private AnalysisJob load(UUID id) {
        return analysisService.findById(id).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Analysis not found: " + id));
    }

    private Map<String, Object> parse(String storedJson) {
        try {
            return objectMapper.readValue(storedJson, JSON_OBJECT);
        } catch (JsonProcessingException e) {
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR,
                    "Stored analysis data is corrupt", e);
        }
    }
}
