package com.openforge.fleetcore.research;

import java.util.List;

/**
 * One profile field that is still missing, with the search that should fill it.
 *
 * @param searchQuery quoted entity name plus field terms and site restrictions
 * @param targetSites domains most likely to carry the field
 */
public record ResearchGap(
        String        field,
        GapImportance importance,
        String        searchQuery,
        List<String>  targetSites
) {

    public ResearchGap {
        targetSites = targetSites == null ? List.of() : List.copyOf(targetSites);
    }
}
