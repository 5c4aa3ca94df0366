package com.openforge.fleetcore.pipeline;

import com.openforge.fleetcore.classifier.Classification;
import com.openforge.fleetcore.resolver.ResolvedQuery;

/**
 * Everything the answer generator needs before it runs.
 *
 * @param resolvedQuery    the query with follow-up references replaced, plus entity context
 * @param classification   answering mode and context flags
 * @param knowledgeContext the conversation-context block, empty unless the query is enriched
 * @param searchQuery      what to send to the search provider; carries the fleetcore prefix when enriched
 */
public record QueryPlan(
        ResolvedQuery  resolvedQuery,
        Classification classification,
        String         knowledgeContext,
        String         searchQuery
) {}
