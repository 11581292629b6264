package com.apflow.invoice.orchestrator.api;

import com.apflow.invoice.canonical.ExtractedInvoice;
import com.apflow.invoice.canonical.PipelineRunRecord;
import com.apflow.invoice.orchestrator.PipelineOrchestratorService;
import com.apflow.invoice.orchestrator.PipelineRunRepository;
import com.apflow.invoice.orchestrator.state.PipelineRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * REST entry point for submitting invoices and inspecting pipeline runs.
 */
@RestController
@RequestMapping("/api/invoice-runs")
public class PipelineRunController {

    private static final Logger log = LoggerFactory.getLogger(PipelineRunController.class);

    private final PipelineOrchestratorService orchestratorService;
    private final PipelineRunRepository repository;

    public PipelineRunController(PipelineOrchestratorService orchestratorService, PipelineRunRepository repository) {
        this.orchestratorService = orchestratorService;
        this.repository = repository;
    }

    /**
     * Submit an extracted invoice.
     *
     * Returns 202 with the admitted run, or 200 with the terminal run when
     * {@code wait=true}. A submission id whose run is still active gets 409.
     */
    @PostMapping
    public ResponseEntity<Object> submit(@RequestBody ExtractedInvoice invoice,
                                         @RequestParam(defaultValue = "false") boolean wait) {
        try {
            if (wait) {
                PipelineRun run = orchestratorService.process(invoice);
                return ResponseEntity.ok(run.toRecord());
            }
            PipelineRun run = orchestratorService.enqueue(invoice);
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(run.toRecord());
        } catch (IllegalStateException e) {
            log.warn("Submission refused - submissionId={}, reason={}", invoice.getSubmissionId(), e.getMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping
    public ResponseEntity<List<PipelineRunRecord>> listRuns() {
        List<PipelineRunRecord> runs = orchestratorService.listRuns().stream()
            .map(PipelineRun::toRecord)
            .collect(Collectors.toList());
        return ResponseEntity.ok(runs);
    }

    @GetMapping("/{runId}")
    public ResponseEntity<PipelineRunRecord> getRun(@PathVariable String runId) {
        Optional<PipelineRun> run = orchestratorService.findRun(runId);
        return run.map(r -> ResponseEntity.ok(r.toRecord()))
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * Terminal records of every attempt of a run, oldest first.
     */
    @GetMapping("/{runId}/attempts")
    public ResponseEntity<List<PipelineRunRecord>> getAttempts(@PathVariable String runId) {
        List<PipelineRunRecord> records = repository.getArchivedRecords(runId);
        if (records.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(records);
    }

    @PostMapping("/{runId}/cancel")
    public ResponseEntity<Object> cancel(@PathVariable String runId) {
        if (orchestratorService.findRun(runId).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        if (!orchestratorService.cancel(runId)) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(Map.of("error", "run " + runId + " can no longer be cancelled"));
        }
        return ResponseEntity.accepted().body(Map.of("runId", runId, "cancelRequested", true));
    }
}
