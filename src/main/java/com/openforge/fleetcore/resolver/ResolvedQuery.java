package com.openforge.fleetcore.resolver;

/**
 * Result of running a raw query through {@link EntityContextResolver}.
 *
 * When {@code hasContext} is false the resolved query equals the original,
 * and both {@code entityContext} and {@code activeEntity} are null.
 */
public record ResolvedQuery(
        String originalQuery,
        String resolvedQuery,
        String entityContext,
        boolean hasContext,
        ActiveEntity activeEntity
) {

    public static ResolvedQuery unresolved(String query) {
        return new ResolvedQuery(query, query, null, false, null);
    }

    public static ResolvedQuery resolved(String original, String resolved,
                                         String entityContext, ActiveEntity entity) {
        return new ResolvedQuery(original, resolved, entityContext, true, entity);
    }

    /** The text downstream steps should work with. */
    public String effectiveQuery() {
        return resolvedQuery == null ? "" : resolvedQuery;
    }
}
