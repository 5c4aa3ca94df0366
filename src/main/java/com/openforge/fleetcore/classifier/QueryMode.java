package com.openforge.fleetcore.classifier;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a query is answered.
 *
 * <ul>
 *   <li>{@link #NONE}: from the model's own knowledge, no lookup</li>
 *   <li>{@link #VERIFICATION}: grounded by a single round of search</li>
 *   <li>{@link #RESEARCH}: grounded by the iterative gap-filling research loop</li>
 * </ul>
 */
public enum QueryMode {

    NONE("KNOWLEDGE MODE - Training data"),
    VERIFICATION("VERIFICATION MODE - Single grounded lookup"),
    RESEARCH("RESEARCH MODE - Deep multi-source");

    private final String description;

    QueryMode(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
