package com.openforge.fleetcore.memory;

/**
 * A fleetcore platform feature that came up in the conversation.
 *
 * @param messageIndex turn number at which the feature was first seen
 */
public record PlatformFeature(
        String name,
        String explanation,
        int    messageIndex
) {}
