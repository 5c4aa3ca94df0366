package com.openforge.fleetcore.resolver;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The entity a follow-up query refers to. Derived per resolution call and
 * never stored.
 *
 * @param imo   seven-digit IMO number, vessels only, may be null
 * @param specs free-form spec map in discovery order, may be empty
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ActiveEntity(
        String name,
        EntityType type,
        String imo,
        Map<String, String> specs
) {

    public ActiveEntity {
        specs = specs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(specs));
    }

    public static ActiveEntity vessel(String name, String imo, Map<String, String> specs) {
        return new ActiveEntity(name, EntityType.VESSEL, imo, specs);
    }

    public static ActiveEntity company(String name) {
        return new ActiveEntity(name, EntityType.COMPANY, null, Map.of());
    }

    public static ActiveEntity equipment(String name) {
        return new ActiveEntity(name, EntityType.EQUIPMENT, null, Map.of());
    }
}
