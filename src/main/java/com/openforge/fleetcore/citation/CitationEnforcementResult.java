package com.openforge.fleetcore.citation;

import java.util.List;

/**
 * What {@link CitationEnforcer#enforce} did to an answer.
 *
 * {@code citationsFound} is the count after repair and before injection;
 * {@code citationsAdded} is repairs plus injections, split out in
 * {@link Diagnostics}.
 */
public record CitationEnforcementResult(
        String      originalContent,
        String      enforcedContent,
        int         citationsAdded,
        int         citationsFound,
        int         citationsRequired,
        boolean     wasEnforced,
        Diagnostics diagnostics
) {

    public record Diagnostics(
            int          originalCitationCount,
            int          finalCitationCount,
            int          targetCitationCount,
            int          factualStatementsFound,
            int          repairsPerformed,
            int          injectionsPerformed,
            List<String> errors
    ) {
        public Diagnostics {
            errors = List.copyOf(errors);
        }
    }

    public boolean meetsRequirement() {
        return diagnostics.finalCitationCount() >= citationsRequired;
    }
}
