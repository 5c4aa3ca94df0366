package com.openforge.fleetcore.research.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request body for POST /api/research/runs.
 *
 * @param sessionId    conversation the run belongs to; its memory resolves follow-up references
 * @param query        the user's question
 * @param draftContent optional answer text produced so far, counted as evidence by the gap analysis
 */
public record StartResearchRequest(

        @NotBlank(message = "sessionId must not be blank")
        String sessionId,

        @NotBlank(message = "query must not be blank")
        @Size(max = 4000, message = "query must not exceed 4000 characters")
        String query,

        String draftContent
) {}
