package com.openforge.fleetcore.memory;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Conversation memory settings, bound from "agent.memory":
 *
 * agent:
 *   memory:
 *     recent-message-limit: 10
 */
@ConfigurationProperties(prefix = "agent.memory")
public record MemoryProperties(
        @DefaultValue("10") int recentMessageLimit
) {}
