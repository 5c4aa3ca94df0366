package com.openforge.fleetcore.resolver;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What kind of thing the current conversation turn is implicitly about.
 */
public enum EntityType {

    VESSEL,
    COMPANY,
    EQUIPMENT,
    UNKNOWN;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
