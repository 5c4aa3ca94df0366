package com.openforge.fleetcore.classifier;

import com.openforge.fleetcore.memory.ConversationMemory;
import com.openforge.fleetcore.memory.MaritimeEntityExtractor;
import com.openforge.fleetcore.resolver.ResolvedQuery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Decides how a query is answered: from knowledge, by one grounded lookup,
 * or by the iterative research loop.
 *
 * Rules are evaluated top to bottom and the first match wins:
 *
 *   1. browsing enabled                         → research
 *   2. system-organization question             → none
 *   3. how-to question                          → none
 *   4. platform, no entity                      → none
 *   5. technical depth ≥ 6 with an entity       → research
 *   6. platform with an entity                  → verification (hybrid)
 *   7. user evaluating fleetcore, with entity   → verification (hybrid)
 *   8. anything else                            → verification
 *
 * Rule 5 runs before rule 6, so a deeply technical platform-plus-entity
 * question goes to research rather than hybrid verification.
 *
 * Never throws. A null or blank query falls through to rule 8.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryClassifier {

    static final int RESEARCH_DEPTH_THRESHOLD = 6;

    private final TechnicalDepthScorer    depthScorer;
    private final MaritimeEntityExtractor entityExtractor;

    // ── Entry points ─────────────────────────────────────────────────────────

    public Classification classify(ResolvedQuery resolved, boolean enableBrowsing, ConversationMemory memory) {
        String query = resolved == null ? "" : resolved.effectiveQuery();
        boolean resolvedContext = resolved != null && resolved.hasContext();
        return classify(query, resolvedContext, enableBrowsing, memory);
    }

    public Classification classify(String query, boolean enableBrowsing, ConversationMemory memory) {
        return classify(query == null ? "" : query, false, enableBrowsing, memory);
    }

    private Classification classify(String query, boolean resolvedContext,
                                    boolean enableBrowsing, ConversationMemory memory) {
        TechnicalDepth depth = depthScorer.score(query, memory);
        Classification result = decide(query, resolvedContext, enableBrowsing, memory, depth);
        log.info("[Classifier] mode={} hybrid={} enrich={} depth={} :: \"{}\"",
                result.mode(), result.isHybrid(), result.enrichQuery(), depth.score(), abbreviate(query));
        return result;
    }

    // ── Decision list ────────────────────────────────────────────────────────

    private Classification decide(String query, boolean resolvedContext, boolean enableBrowsing,
                                  ConversationMemory memory, TechnicalDepth depth) {
        if (enableBrowsing) {
            return Classification.base(query, depth)
                    .mode(QueryMode.RESEARCH).preserveContext(true).enrichQuery(true).build();
        }
        if (ClassificationVocabulary.isSystemOrganizationQuery(query)
                || ClassificationVocabulary.isHowToQuery(query)) {
            return knowledgeOnly(query, depth);
        }

        boolean isPlatform = ClassificationVocabulary.isPlatformQuery(query);
        boolean hasEntity  = hasEntity(query, resolvedContext);

        if (isPlatform && !hasEntity) {
            return knowledgeOnly(query, depth);
        }

        boolean hasFeatures = memory != null && memory.getAccumulatedKnowledge().hasPlatformFeatures();

        if (depth.score() >= RESEARCH_DEPTH_THRESHOLD && hasEntity) {
            boolean preserve = hasFeatures || isPlatform;
            return Classification.base(query, depth)
                    .mode(QueryMode.RESEARCH).preserveContext(preserve).enrichQuery(preserve).build();
        }
        if (isPlatform) {
            return hybrid(query, depth);
        }
        if (isEvaluating(memory) && hasEntity) {
            return hybrid(query, depth);
        }
        return Classification.base(query, depth)
                .mode(QueryMode.VERIFICATION)
                .preserveContext(hasFeatures)
                .enrichQuery(hasFeatures && hasEntity)
                .build();
    }

    private static Classification knowledgeOnly(String query, TechnicalDepth depth) {
        return Classification.base(query, depth).mode(QueryMode.NONE).build();
    }

    private static Classification hybrid(String query, TechnicalDepth depth) {
        return Classification.base(query, depth)
                .mode(QueryMode.VERIFICATION).preserveContext(true).enrichQuery(true).isHybrid(true).build();
    }

    // ── Detection ────────────────────────────────────────────────────────────

    boolean hasEntity(String query, boolean resolvedContext) {
        return resolvedContext
                || ClassificationVocabulary.hasEntityKeyword(query)
                || entityExtractor.mentionsEntity(query);
    }

    private static boolean isEvaluating(ConversationMemory memory) {
        return memory != null && memory.getUserIntent() != null
                && memory.getUserIntent().contains(ClassificationVocabulary.EVALUATION_INTENT);
    }

    /**
     * Multi-line summary of how a query was classified, for debug logging.
     */
    public String explain(String query, Classification classification, boolean enableBrowsing) {
        String q = query == null ? "" : query;
        return "\nMODE CLASSIFICATION\n"
                + "   Query: \"" + abbreviate(q) + "\"\n"
                + "   Mode: " + classification.mode().description() + "\n"
                + "   Detection Flags:\n"
                + "   - Browsing enabled: " + enableBrowsing + "\n"
                + "   - Platform query: " + ClassificationVocabulary.isPlatformQuery(q) + "\n"
                + "   - Entity mention: " + hasEntity(q, false) + "\n"
                + "   - How-to query: " + ClassificationVocabulary.isHowToQuery(q) + "\n"
                + "   - System organization: " + ClassificationVocabulary.isSystemOrganizationQuery(q) + "\n"
                + "   - Technical depth: " + classification.technicalDepthScore()
                + (classification.requiresTechnicalDepth() ? " (required)" : "") + "\n"
                + "   Context Flags:\n"
                + "   - Preserve fleetcore context: " + classification.preserveContext() + "\n"
                + "   - Enrich query: " + classification.enrichQuery() + "\n"
                + "   - Is hybrid query: " + classification.isHybrid() + "\n";
    }

    private static String abbreviate(String query) {
        return query.length() > 80 ? query.substring(0, 80) + "..." : query;
    }
}
