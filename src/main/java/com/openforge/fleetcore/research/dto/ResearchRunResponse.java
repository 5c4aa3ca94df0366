package com.openforge.fleetcore.research.dto;

import com.openforge.fleetcore.research.GapAnalysis;
import com.openforge.fleetcore.research.ResearchRun;
import com.openforge.fleetcore.research.SourceCategory;
import com.openforge.fleetcore.search.Source;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Response body for the research run endpoints.
 *
 * Includes the WebSocket subscription path so the client can follow
 * progress right after starting a run.
 */
public record ResearchRunResponse(
        String                       runId,
        String                       sessionId,
        String                       status,
        String                       query,
        String                       entityName,
        int                          iteration,
        String                       stopReason,
        String                       errorMessage,
        GapAnalysis                  lastAnalysis,
        Map<SourceCategory, Integer> coverage,
        List<Source>                 sources,
        String                       wsSubscribePath,   // e.g. /topic/research/{runId}
        Instant                      createdAt,
        Instant                      updatedAt
) {

    public static ResearchRunResponse from(ResearchRun run) {
        return new ResearchRunResponse(
                run.getRunId(),
                run.getSessionId(),
                run.getStatus().name(),
                run.getQuery(),
                run.getEntityName(),
                run.getIteration(),
                run.getStopReason(),
                run.getErrorMessage(),
                run.getLastAnalysis(),
                run.getCoverage(),
                run.sources(),
                "/topic/research/" + run.getRunId(),
                run.getCreatedAt(),
                run.getUpdatedAt()
        );
    }
}
