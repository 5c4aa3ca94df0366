package com.openforge.fleetcore.research;

import com.fasterxml.jackson.annotation.JsonValue;

/** Declared in priority order: CRITICAL gaps are searched first. */
public enum GapImportance {

    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
