package com.openforge.fleetcore.research;

import com.openforge.fleetcore.research.dto.ResearchRunResponse;
import com.openforge.fleetcore.research.dto.StartResearchRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * REST API for research run lifecycle.
 *
 * Endpoints:
 *   POST   /api/research/runs          start a run for a session
 *   GET    /api/research/runs/{runId}  poll status, coverage, gaps and sources
 *   DELETE /api/research/runs/{runId}  request cancellation
 *
 * Progress is also pushed to /topic/research/{runId} while the loop runs.
 * Each loop runs on the shared researchExecutor, off the HTTP thread.
 */
@Slf4j
@RestController
@RequestMapping("/api/research/runs")
@RequiredArgsConstructor
public class ResearchController {

    private final ResearchLoopService researchLoopService;
    private final ResearchRunRegistry registry;
    private final ExecutorService     researchExecutor;

    // ── Start ────────────────────────────────────────────────────────────────

    /**
     * HTTP 201 on success, 409 when the session already has an active run,
     * 503 when every research thread is busy and the wait queue is full.
     */
    @PostMapping
    public ResponseEntity<ResearchRunResponse> start(@Valid @RequestBody StartResearchRequest request) {
        ResearchRun run;
        try {
            run = researchLoopService.createRun(request.sessionId(), request.query(), request.draftContent());
        } catch (ResearchRunRegistry.ActiveRunException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage());
        }

        final ResearchRun finalRun = run;
        try {
            researchExecutor.submit(() -> {
                try {
                    researchLoopService.run(finalRun);
                } catch (Exception e) {
                    log.error("[Controller] Uncaught exception in research run {}: {}",
                            finalRun.getRunId(), e.getMessage(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            finalRun.fail("Research capacity exhausted");
            log.warn("[Controller] Rejected research run {} for session {}: capacity exhausted",
                    run.getRunId(), run.getSessionId());
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE,
                    "Too many research runs in progress, retry later");
        }

        log.info("[Controller] Started research run {} for session {}", run.getRunId(), run.getSessionId());
        return ResponseEntity.status(HttpStatus.CREATED).body(ResearchRunResponse.from(run));
    }

    // ── Status ───────────────────────────────────────────────────────────────

    @GetMapping("/{runId}")
    public ResponseEntity<ResearchRunResponse> get(@PathVariable String runId) {
        return ResponseEntity.ok(ResearchRunResponse.from(findOrThrow(runId)));
    }

    // ── Cancel ───────────────────────────────────────────────────────────────

    /**
     * The loop stops before its next iteration or search. Cancelling a run
     * that already finished is a 409.
     */
    @DeleteMapping("/{runId}")
    public ResponseEntity<ResearchRunResponse> cancel(@PathVariable String runId) {
        ResearchRun run = findOrThrow(runId);
        if (!run.requestCancel()) {
            throw new ResponseStatusException(HttpStatus.CONFLICT,
                    "Run is already finished, current status: " + run.getStatus());
        }
        log.info("[Controller] Cancellation requested for run {}", runId);
        return ResponseEntity.ok(ResearchRunResponse.from(run));
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private ResearchRun findOrThrow(String runId) {
        return registry.find(runId)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Research run not found: " + runId));
    }
}
