package com.openforge.fleetcore.research;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory index of research runs.
 *
 * Runs for one session are strictly sequential: registering a new run while
 * another run of the same session is still active is rejected.
 *
 * Finished runs stay pollable for the configured retention and are pruned
 * on every registration, oldest first once more than max-retained-runs have
 * piled up. Active runs are never pruned.
 */
@Slf4j
@Component
public class ResearchRunRegistry {

    // insertion order breaks ties between runs that finished at the same instant
    private final Map<String, ResearchRun> runs = Collections.synchronizedMap(new LinkedHashMap<>());
    private final Map<String, String>      activeRunBySession = new ConcurrentHashMap<>();

    private final ResearchProperties properties;
    private final Clock              clock;

    @Autowired
    public ResearchRunRegistry(ResearchProperties properties) {
        this(properties, Clock.systemUTC());
    }

    ResearchRunRegistry(ResearchProperties properties, Clock clock) {
        this.properties = properties;
        this.clock      = clock;
    }

    public synchronized ResearchRun register(ResearchRun run) {
        findActiveForSession(run.getSessionId()).ifPresent(active -> {
            throw new ActiveRunException(
                    "Session %s already has an active research run: %s"
                            .formatted(run.getSessionId(), active.getRunId()));
        });
        prune();
        runs.put(run.getRunId(), run);
        activeRunBySession.put(run.getSessionId(), run.getRunId());
        log.debug("[Registry] Registered run {} for session {}", run.getRunId(), run.getSessionId());
        return run;
    }

    public Optional<ResearchRun> find(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    public Optional<ResearchRun> findActiveForSession(String sessionId) {
        String runId = activeRunBySession.get(sessionId);
        return Optional.ofNullable(runId == null ? null : runs.get(runId))
                .filter(ResearchRun::isActive);
    }

    public int size() {
        return runs.size();
    }

    // ── Eviction ─────────────────────────────────────────────────────────────

    /** Drops expired finished runs, then the oldest finished ones above the retained maximum. */
    synchronized void prune() {
        Instant cutoff = clock.instant().minus(properties.retention());
        List<ResearchRun> finished;
        synchronized (runs) {
            finished = runs.values().stream()
                    .filter(r -> !r.isActive())
                    .sorted(Comparator.comparing(ResearchRun::getUpdatedAt))
                    .toList();
        }

        int excess = finished.size() - Math.max(0, properties.maxRetainedRuns());
        int evicted = 0;
        for (ResearchRun run : finished) {
            boolean expired = run.getUpdatedAt().isBefore(cutoff);
            if (!expired && evicted >= excess) break;
            evict(run);
            evicted++;
        }
        if (evicted > 0) {
            log.debug("[Registry] Evicted {} finished run(s), {} remaining", evicted, runs.size());
        }
    }

    private void evict(ResearchRun run) {
        runs.remove(run.getRunId());
        activeRunBySession.remove(run.getSessionId(), run.getRunId());
    }

    public static class ActiveRunException extends RuntimeException {
        public ActiveRunException(String message) { super(message); }
    }
}
