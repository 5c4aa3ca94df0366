package com.openforge.fleetcore.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.openforge.fleetcore.research.GapAnalysis;
import com.openforge.fleetcore.research.SourceCategory;

import java.util.List;
import java.util.Map;

/**
 * The single event envelope broadcast over WebSocket for a research run.
 *
 * Fields:
 *   runId      the research run this event belongs to
 *   type       discriminator; tells the client how to render the event
 *   content    free-form text (status, stop reason, error message)
 *   payload    structured object for rich events, null otherwise
 *   iteration  research iteration that produced the event, 0 outside the loop
 *   timestamp  epoch millis
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResearchEvent(
        String    runId,
        EventType type,
        String    content,
        Object    payload,
        int       iteration,
        long      timestamp
) {

    // ── Static factory helpers ───────────────────────────────────────────────

    public static ResearchEvent statusChange(String runId, String newStatus, int iteration) {
        return new ResearchEvent(runId, EventType.STATUS_CHANGE, newStatus, null, iteration, now());
    }

    public static ResearchEvent iterationStart(String runId, int iteration) {
        return new ResearchEvent(runId, EventType.ITERATION_START, null, null, iteration, now());
    }

    public static ResearchEvent search(String runId, String query, int resultCount, int iteration) {
        return new ResearchEvent(runId, EventType.SEARCH, query,
                new SearchPayload(query, resultCount), iteration, now());
    }

    public static ResearchEvent coverage(String runId, Map<SourceCategory, Integer> coverage,
                                         List<SourceCategory> missing, int iteration) {
        return new ResearchEvent(runId, EventType.COVERAGE, null,
                new CoveragePayload(coverage, missing), iteration, now());
    }

    public static ResearchEvent gapAnalysis(String runId, GapAnalysis analysis) {
        return new ResearchEvent(runId, EventType.GAP_ANALYSIS, null, analysis, analysis.iteration(), now());
    }

    public static ResearchEvent completed(String runId, String reason, int iteration) {
        return new ResearchEvent(runId, EventType.COMPLETED, reason, null, iteration, now());
    }

    public static ResearchEvent error(String runId, String message, int iteration) {
        return new ResearchEvent(runId, EventType.ERROR, message, null, iteration, now());
    }

    private static long now() {
        return System.currentTimeMillis();
    }

    // ── Nested payload types ─────────────────────────────────────────────────

    public record SearchPayload(String query, int resultCount) {}

    public record CoveragePayload(Map<SourceCategory, Integer> coverage, List<SourceCategory> missing) {}
}
