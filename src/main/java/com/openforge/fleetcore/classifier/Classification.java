package com.openforge.fleetcore.classifier;

import lombok.Builder;

/**
 * How to answer a query, as decided by {@link QueryClassifier}.
 *
 * @param preserveContext carry fleetcore platform context into the answer prompt
 * @param enrichQuery     prefix the search query with the fleetcore knowledge context
 * @param isHybrid        a platform question about a concrete maritime entity
 * @param resolvedQuery   the query text that was classified
 */
@Builder
public record Classification(
        QueryMode mode,
        boolean   preserveContext,
        boolean   enrichQuery,
        boolean   isHybrid,
        String    resolvedQuery,
        boolean   requiresTechnicalDepth,
        int       technicalDepthScore
) {

    static ClassificationBuilder base(String query, TechnicalDepth depth) {
        return Classification.builder()
                .resolvedQuery(query)
                .requiresTechnicalDepth(depth.required())
                .technicalDepthScore(depth.score());
    }
}
