package com.openforge.fleetcore.pipeline;

import com.openforge.fleetcore.citation.CitationEnforcementResult;
import com.openforge.fleetcore.citation.CitationValidation;
import com.openforge.fleetcore.memory.ConversationMemory;
import com.openforge.fleetcore.pipeline.dto.FinalizeAnswerRequest;
import com.openforge.fleetcore.pipeline.dto.PlanRequest;
import com.openforge.fleetcore.pipeline.dto.ValidateCitationsRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
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

/**
 * REST API around answer generation.
 *
 *   POST   /api/assistant/plan                  resolve and classify a query
 *   POST   /api/assistant/answers               enforce citations and record the turn
 *   POST   /api/assistant/citations/validate    check markers against a source list
 *   GET    /api/assistant/sessions/{sessionId}  inspect a session's memory
 *   DELETE /api/assistant/sessions/{sessionId}  forget a session
 */
@RestController
@RequestMapping("/api/assistant")
@RequiredArgsConstructor
public class AssistantController {

    private final AssistantPipeline pipeline;

    @PostMapping("/plan")
    public ResponseEntity<QueryPlan> plan(@Valid @RequestBody PlanRequest request) {
        return ResponseEntity.ok(pipeline.prepare(request.sessionId(), request.query(), request.enableBrowsing()));
    }

    @PostMapping("/answers")
    public ResponseEntity<CitationEnforcementResult> finalizeAnswer(@Valid @RequestBody FinalizeAnswerRequest request) {
        return ResponseEntity.ok(pipeline.finalizeAnswer(
                request.sessionId(),
                request.userQuery(),
                request.answer(),
                request.sourcesOrEmpty(),
                request.technicalDepth()));
    }

    @PostMapping("/citations/validate")
    public ResponseEntity<CitationValidation> validate(@Valid @RequestBody ValidateCitationsRequest request) {
        return ResponseEntity.ok(pipeline.validateCitations(request.content(), request.sourcesOrEmpty()));
    }

    // ── Sessions ─────────────────────────────────────────────────────────────

    @GetMapping("/sessions/{sessionId}")
    public ResponseEntity<ConversationMemory> session(@PathVariable String sessionId) {
        return pipeline.findMemory(sessionId)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Session not found: " + sessionId));
    }

    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<Void> forget(@PathVariable String sessionId) {
        pipeline.forget(sessionId);
        return ResponseEntity.noContent().build();
    }
}
