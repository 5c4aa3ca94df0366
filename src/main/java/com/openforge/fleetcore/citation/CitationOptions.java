package com.openforge.fleetcore.citation;

/**
 * Tuning for one enforcement call.
 *
 * @param technicalDepth raises the citation floor from 3 to 5
 * @param minRequired    explicit minimum, replaces the computed one; still capped at the source count
 */
public record CitationOptions(boolean technicalDepth, Integer minRequired) {

    public static CitationOptions defaults() {
        return new CitationOptions(false, null);
    }

    public static CitationOptions technical(boolean technicalDepth) {
        return new CitationOptions(technicalDepth, null);
    }
}
