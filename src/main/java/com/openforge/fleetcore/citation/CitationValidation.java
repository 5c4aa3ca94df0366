package com.openforge.fleetcore.citation;

import java.util.List;

/**
 * Outcome of {@link CitationEnforcer#validate}. Errors are markers pointing
 * outside the source list; warnings are linked markers whose URL differs from
 * the source they number.
 */
public record CitationValidation(boolean valid, List<String> errors, List<String> warnings) {

    public CitationValidation {
        errors   = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }
}
