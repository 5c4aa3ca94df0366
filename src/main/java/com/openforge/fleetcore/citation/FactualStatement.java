package com.openforge.fleetcore.citation;

/**
 * A span of answer text that states a checkable fact and can carry a citation.
 *
 * @param text  the matched text, trailing whitespace removed
 * @param start offset of the first character in the answer
 * @param kind  which pattern family found it
 */
public record FactualStatement(String text, int start, Kind kind) {

    /** Pattern families, declared in citation priority order. */
    public enum Kind {
        IDENTIFIER,
        OWNERSHIP,
        QUANTITY,
        BUILD_DATE,
        CLASSIFICATION
    }

    public int end() {
        return start + text.length();
    }

    public boolean overlaps(FactualStatement other) {
        return start < other.end() && other.start() < end();
    }
}
