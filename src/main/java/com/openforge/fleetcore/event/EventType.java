package com.openforge.fleetcore.event;

/**
 * Classifies every event a research run emits over WebSocket.
 *
 * Flow: STATUS_CHANGE(RUNNING) → ITERATION_START(1) → SEARCH … → COVERAGE → GAP_ANALYSIS
 *       → ITERATION_START(2) → … → COMPLETED.
 */
public enum EventType {

    /** Run status changed (e.g. RUNNING → CANCELLED). content = new status. */
    STATUS_CHANGE,

    /** A new research iteration is starting. */
    ITERATION_START,

    /** A search returned. payload = SearchPayload. */
    SEARCH,

    /** Source coverage after merging this iteration's results. payload = CoveragePayload. */
    COVERAGE,

    /** Gap analysis for this iteration. payload = GapAnalysis. */
    GAP_ANALYSIS,

    /** Run finished. content = stop reason. */
    COMPLETED,

    /** Unrecoverable error. content = message. */
    ERROR
}
