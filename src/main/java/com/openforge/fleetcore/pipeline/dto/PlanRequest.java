package com.openforge.fleetcore.pipeline.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request body for POST /api/assistant/plan.
 */
public record PlanRequest(

        @NotBlank(message = "sessionId must not be blank")
        String sessionId,

        @NotBlank(message = "query must not be blank")
        @Size(max = 4000, message = "query must not exceed 4000 characters")
        String query,

        boolean enableBrowsing
) {}
