package com.openforge.fleetcore.memory;

import lombok.Builder;

import java.util.Map;

/**
 * A vessel discussed in the conversation.
 *
 * Every field except {@code name} is optional and fills in as later turns
 * reveal more about the vessel.
 */
@Builder(toBuilder = true)
public record VesselEntity(
        String              name,
        String              imo,
        String              vesselType,
        String              operator,
        Map<String, String> specs,
        int                 firstMentioned
) {

    /**
     * Combines what this entry knows with a newer observation of the same vessel.
     * Known values are kept; blanks are filled from {@code newer}.
     */
    public VesselEntity mergeWith(VesselEntity newer) {
        return toBuilder()
                .imo(imo != null ? imo : newer.imo())
                .vesselType(vesselType != null ? vesselType : newer.vesselType())
                .operator(operator != null ? operator : newer.operator())
                .specs(specs != null && !specs.isEmpty() ? specs : newer.specs())
                .build();
    }
}
