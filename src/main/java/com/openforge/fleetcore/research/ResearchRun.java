package com.openforge.fleetcore.research;

import com.openforge.fleetcore.search.Source;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * State of one research loop execution.
 *
 * Written by the loop thread and read by REST callers. Scalar state is
 * volatile; the source set is guarded by this object's monitor. Cancellation
 * is cooperative: {@link #requestCancel()} raises a flag that the loop checks
 * before every iteration and between searches.
 */
@Getter
public class ResearchRun {

    private final String  runId;
    private final String  sessionId;
    private final String  query;
    private final String  entityName;
    private final String  draftContent;
    private final Instant createdAt;

    private volatile RunStatus   status = RunStatus.PENDING;
    private volatile int         iteration;
    private volatile GapAnalysis lastAnalysis;
    private volatile Map<SourceCategory, Integer> coverage = Map.of();
    private volatile String      stopReason;
    private volatile String      errorMessage;
    private volatile boolean     cancelRequested;
    private volatile Instant     updatedAt;

    @Getter(AccessLevel.NONE)
    private final Map<String, Source> sourcesByUrl = new LinkedHashMap<>();

    public ResearchRun(String sessionId, String query, String entityName, String draftContent) {
        this.runId        = UUID.randomUUID().toString();
        this.sessionId    = sessionId;
        this.query        = query;
        this.entityName   = entityName;
        this.draftContent = draftContent == null ? "" : draftContent;
        this.createdAt    = Instant.now();
        this.updatedAt    = createdAt;
    }

    // ── Sources ──────────────────────────────────────────────────────────────

    /**
     * Adds sources not seen before (by URL), stopping at {@code cap}.
     * Returns how many were added.
     */
    public synchronized int mergeSources(List<Source> incoming, int cap) {
        if (incoming == null) return 0;
        int added = 0;
        for (Source source : incoming) {
            if (sourcesByUrl.size() >= cap) break;
            if (source == null || source.urlOrEmpty().isBlank()) continue;
            if (sourcesByUrl.putIfAbsent(source.url(), source) == null) added++;
        }
        touch();
        return added;
    }

    public synchronized List<Source> sources() {
        return Collections.unmodifiableList(new ArrayList<>(sourcesByUrl.values()));
    }

    public synchronized int sourceCount() {
        return sourcesByUrl.size();
    }

    // ── Progress ─────────────────────────────────────────────────────────────

    public void startIteration(int iteration) {
        this.iteration = iteration;
        touch();
    }

    public void recordCoverage(Map<SourceCategory, Integer> coverage) {
        Map<SourceCategory, Integer> copy = new EnumMap<>(SourceCategory.class);
        copy.putAll(coverage);
        this.coverage = Collections.unmodifiableMap(copy);
        touch();
    }

    public void recordAnalysis(GapAnalysis analysis) {
        this.lastAnalysis = analysis;
        touch();
    }

    // ── Lifecycle ────────────────────────────────────────────────────────────

    public synchronized void markRunning() {
        if (status == RunStatus.PENDING) {
            status = RunStatus.RUNNING;
            touch();
        }
    }

    public synchronized void complete(String reason) {
        finish(RunStatus.COMPLETED, reason);
    }

    public synchronized void cancelled() {
        finish(RunStatus.CANCELLED, "Cancelled by user");
    }

    public synchronized void fail(String message) {
        this.errorMessage = message;
        finish(RunStatus.FAILED, "Failed");
    }

    /**
     * Asks the loop to stop. A run that has not started yet is cancelled
     * immediately. Returns false when the run has already finished.
     */
    public synchronized boolean requestCancel() {
        if (status.isTerminal()) return false;
        cancelRequested = true;
        if (status == RunStatus.PENDING) cancelled();
        return true;
    }

    public boolean isActive() {
        return !status.isTerminal();
    }

    private void finish(RunStatus terminal, String reason) {
        if (status.isTerminal()) return;
        this.status     = terminal;
        this.stopReason = reason;
        touch();
    }

    private void touch() {
        this.updatedAt = Instant.now();
    }
}
