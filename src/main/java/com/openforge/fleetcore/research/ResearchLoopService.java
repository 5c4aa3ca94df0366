package com.openforge.fleetcore.research;

import com.openforge.fleetcore.event.ResearchEvent;
import com.openforge.fleetcore.memory.ConversationMemory;
import com.openforge.fleetcore.memory.ConversationMemoryStore;
import com.openforge.fleetcore.memory.MaritimeEntityExtractor;
import com.openforge.fleetcore.resolver.EntityContextResolver;
import com.openforge.fleetcore.resolver.ResolvedQuery;
import com.openforge.fleetcore.search.SearchClient;
import com.openforge.fleetcore.search.SearchProvider;
import com.openforge.fleetcore.search.SearchQuery;
import com.openforge.fleetcore.search.Source;
import com.openforge.fleetcore.websocket.ResearchEventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * The bounded, cancellable research loop.
 *
 * Loop shape:
 *   search the resolved query, then for each iteration up to max-iterations:
 *     1. CHECK     stop if cancellation was requested
 *     2. SEARCH    run every pending query, merging sources by URL up to max-sources
 *     3. COVERAGE  categorize sources and list the required categories still empty
 *     4. ANALYZE   gap analysis over the draft plus gathered source content
 *     5. DECIDE    stop when no more research is needed, the cap is reached,
 *                  or there is nothing left to search for
 *     6. PLAN      one query per gap (critical first), one per missing category
 *
 * The iteration cap applies whatever the gap analysis says. A failed search
 * is logged and counts as "no new sources"; it never fails the run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@EnableConfigurationProperties(ResearchProperties.class)
public class ResearchLoopService {

    private final SearchProvider          searchProvider;
    private final SourceCategorizer       categorizer;
    private final ResearchGapAnalyzer     gapAnalyzer;
    private final EntityContextResolver   resolver;
    private final MaritimeEntityExtractor entityExtractor;
    private final ConversationMemoryStore memoryStore;
    private final ResearchRunRegistry     registry;
    private final ResearchEventPublisher  publisher;
    private final ResearchProperties      properties;

    // ── Create ───────────────────────────────────────────────────────────────

    /**
     * Resolves the query against the session's memory, picks the entity to
     * profile and registers a PENDING run.
     *
     * @throws ResearchRunRegistry.ActiveRunException if the session already has an active run
     */
    public ResearchRun createRun(String sessionId, String query, String draftContent) {
        ConversationMemory memory = memoryStore.find(sessionId).orElse(null);
        ResolvedQuery resolved = resolver.resolve(query, memory);
        String entity = entityName(resolved);

        ResearchRun run = registry.register(
                new ResearchRun(sessionId, resolved.effectiveQuery(), entity, draftContent));
        log.info("[Research:{}] Created run {} for entity '{}'", sessionId, run.getRunId(), entity);
        return run;
    }

    String entityName(ResolvedQuery resolved) {
        if (resolved.activeEntity() != null) return resolved.activeEntity().name();
        List<String> vessels = entityExtractor.extractVesselNames(resolved.effectiveQuery());
        return vessels.isEmpty() ? resolved.effectiveQuery() : vessels.get(0);
    }

    // ── Main loop ────────────────────────────────────────────────────────────

    public void run(ResearchRun run) {
        String runId = run.getRunId();
        if (run.isCancelRequested()) {
            finishCancelled(run);
            return;
        }

        try {
            run.markRunning();
            publisher.publish(ResearchEvent.statusChange(runId, RunStatus.RUNNING.name(), 0));
            log.info("[Research:{}] Loop started. Query: {}", runId, run.getQuery());

            List<SearchQuery> pending = List.of(SearchQuery.of(run.getQuery()));
            int maxIterations = Math.max(1, properties.maxIterations());

            for (int iteration = 1; iteration <= maxIterations; iteration++) {
                if (run.isCancelRequested()) {
                    finishCancelled(run);
                    return;
                }
                run.startIteration(iteration);
                publisher.publish(ResearchEvent.iterationStart(runId, iteration));

                for (SearchQuery query : pending) {
                    if (run.isCancelRequested()) break;
                    List<Source> results = safeSearch(runId, query);
                    int added = run.mergeSources(results, properties.maxSources());
                    publisher.publish(ResearchEvent.search(runId, query.query(), added, iteration));
                }
                if (run.isCancelRequested()) {
                    finishCancelled(run);
                    return;
                }

                List<Source> sources = run.sources();
                Map<SourceCategory, Integer> coverage = categorizer.computeCoverage(sources);
                List<SourceCategory> missing = categorizer.missingCoverage(coverage);
                run.recordCoverage(coverage);
                publisher.publish(ResearchEvent.coverage(runId, coverage, missing, iteration));

                GapAnalysis analysis = gapAnalyzer.analyze(run.getDraftContent(), run.getEntityName(),
                        sources, iteration);
                run.recordAnalysis(analysis);
                publisher.publish(ResearchEvent.gapAnalysis(runId, analysis));
                log.info("[Research:{}] Iteration {}: {} source(s), completeness {}%, {} gap(s), missing coverage {}",
                        runId, iteration, sources.size(), analysis.completeness(), analysis.gaps().size(), missing);

                if (!analysis.needsAdditionalResearch()) {
                    finishCompleted(run, "Profile complete");
                    return;
                }
                if (iteration == maxIterations) {
                    finishCompleted(run, "Iteration cap reached");
                    return;
                }
                pending = nextQueries(analysis, missing, run.getEntityName());
                if (pending.isEmpty()) {
                    finishCompleted(run, "No further queries");
                    return;
                }
            }
        } catch (Exception e) {
            log.error("[Research:{}] Unhandled exception: {}", runId, e.getMessage(), e);
            run.fail(e.getMessage());
            publisher.publish(ResearchEvent.error(runId, e.getMessage(), run.getIteration()));
            publisher.publish(ResearchEvent.statusChange(runId, RunStatus.FAILED.name(), run.getIteration()));
        }
    }

    // ── Planning ─────────────────────────────────────────────────────────────

    /**
     * Gap queries ordered critical → low, then one site-restricted query for
     * each required source category that is still empty.
     */
    static List<SearchQuery> nextQueries(GapAnalysis analysis, List<SourceCategory> missing, String entity) {
        List<SearchQuery> queries = new ArrayList<>();
        analysis.gaps().stream()
                .sorted(Comparator.comparing(ResearchGap::importance))
                .forEach(gap -> queries.add(SearchQuery.restrictedTo(gap.searchQuery(), gap.targetSites())));
        for (SourceCategory category : missing) {
            queries.add(SearchQuery.restrictedTo(
                    "\"" + entity + "\" " + category.searchTerms(), category.hintSites()));
        }
        return queries;
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private List<Source> safeSearch(String runId, SearchQuery query) {
        try {
            List<Source> results = searchProvider.search(query);
            return results == null ? List.of() : results;
        } catch (SearchClient.SearchException e) {
            log.warn("[Research:{}] Search failed for \"{}\": {}", runId, query.query(), e.getMessage());
            return List.of();
        } catch (RuntimeException e) {
            log.warn("[Research:{}] Search provider error for \"{}\" ({}): {}", runId, query.query(),
                    e.getClass().getSimpleName(), e.getMessage());
            return List.of();
        }
    }

    private void finishCompleted(ResearchRun run, String reason) {
        run.complete(reason);
        publisher.publish(ResearchEvent.completed(run.getRunId(), reason, run.getIteration()));
        publisher.publish(ResearchEvent.statusChange(run.getRunId(), RunStatus.COMPLETED.name(), run.getIteration()));
        log.info("[Research:{}] Completed after {} iteration(s): {}", run.getRunId(), run.getIteration(), reason);
    }

    private void finishCancelled(ResearchRun run) {
        run.cancelled();
        publisher.publish(ResearchEvent.statusChange(run.getRunId(), RunStatus.CANCELLED.name(), run.getIteration()));
        log.info("[Research:{}] Cancelled at iteration {}", run.getRunId(), run.getIteration());
    }
}
