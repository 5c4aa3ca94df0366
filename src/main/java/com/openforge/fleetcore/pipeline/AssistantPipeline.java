package com.openforge.fleetcore.pipeline;

import com.openforge.fleetcore.citation.CitationEnforcementResult;
import com.openforge.fleetcore.citation.CitationEnforcer;
import com.openforge.fleetcore.citation.CitationOptions;
import com.openforge.fleetcore.citation.CitationValidation;
import com.openforge.fleetcore.classifier.Classification;
import com.openforge.fleetcore.classifier.KnowledgeContextBuilder;
import com.openforge.fleetcore.classifier.QueryClassifier;
import com.openforge.fleetcore.memory.ConversationMemory;
import com.openforge.fleetcore.memory.ConversationMemoryStore;
import com.openforge.fleetcore.memory.MemoryAccumulationService;
import com.openforge.fleetcore.resolver.EntityContextResolver;
import com.openforge.fleetcore.resolver.ResolvedQuery;
import com.openforge.fleetcore.search.Source;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Runs the stages around answer generation for one session turn.
 *
 * Call graph:
 *
 *   prepare(sessionId, query, browsing)
 *     ├─ memoryStore.find            (read only, no memory is created here)
 *     ├─ resolver.resolve            follow-up references → entity name
 *     ├─ classifier.classify         none / verification / research
 *     └─ knowledgeContext            only when the classification asks for enrichment
 *
 *   finalizeAnswer(sessionId, query, answer, sources, technical)
 *     ├─ citationEnforcer.enforce
 *     ├─ memoryAccumulation.recordTurn   with the enforced answer
 *     └─ memoryStore.save
 *
 * Answer generation itself happens outside this service, between the two calls.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AssistantPipeline {

    private final ConversationMemoryStore   memoryStore;
    private final EntityContextResolver     resolver;
    private final QueryClassifier           classifier;
    private final KnowledgeContextBuilder   knowledgeContextBuilder;
    private final CitationEnforcer          citationEnforcer;
    private final MemoryAccumulationService memoryAccumulation;

    // ── Before generation ────────────────────────────────────────────────────

    public QueryPlan prepare(String sessionId, String query, boolean enableBrowsing) {
        ConversationMemory memory = memoryStore.find(sessionId).orElse(null);

        ResolvedQuery  resolved       = resolver.resolve(query, memory);
        Classification classification = classifier.classify(resolved, enableBrowsing, memory);

        String knowledgeContext = "";
        String searchQuery      = resolved.effectiveQuery();
        if (classification.enrichQuery() && memory != null) {
            knowledgeContext = knowledgeContextBuilder.buildContext(memory);
            searchQuery      = knowledgeContextBuilder.enrichQuery(searchQuery, memory);
        }

        if (log.isDebugEnabled()) {
            log.debug("[Pipeline:{}] {}", sessionId,
                    classifier.explain(resolved.effectiveQuery(), classification, enableBrowsing));
        }
        return new QueryPlan(resolved, classification, knowledgeContext, searchQuery);
    }

    // ── After generation ─────────────────────────────────────────────────────

    /**
     * Enforces citations on the generated answer and records the turn.
     * Turns of one session are recorded one at a time.
     */
    public CitationEnforcementResult finalizeAnswer(String sessionId, String userQuery, String answer,
                                                    List<Source> sources, boolean technicalDepth) {
        CitationEnforcementResult result =
                citationEnforcer.enforce(answer, sources, CitationOptions.technical(technicalDepth));

        ConversationMemory memory = memoryStore.loadOrCreate(sessionId);
        synchronized (memory) {
            memoryAccumulation.recordTurn(memory, userQuery, result.enforcedContent());
            memoryStore.save(memory);
        }
        log.info("[Pipeline:{}] Turn finalized: citations {}/{} (added {})", sessionId,
                result.diagnostics().finalCitationCount(), result.citationsRequired(), result.citationsAdded());
        return result;
    }

    public CitationValidation validateCitations(String content, List<Source> sources) {
        return citationEnforcer.validate(content, sources);
    }

    // ── Session memory ───────────────────────────────────────────────────────

    public Optional<ConversationMemory> findMemory(String sessionId) {
        return memoryStore.find(sessionId);
    }

    public void forget(String sessionId) {
        memoryStore.delete(sessionId);
        log.info("[Pipeline:{}] Session memory cleared", sessionId);
    }
}
