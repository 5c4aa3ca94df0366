package com.openforge.fleetcore.research;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Research loop limits, read from "agent.research":
 *
 * agent:
 *   research:
 *     max-iterations: 3
 *     max-sources: 30
 *     max-concurrent-runs: 8
 *     queue-capacity: 32
 *     max-retained-runs: 200
 *     retention: 1h
 *
 * @param maxIterations     hard cap on loop iterations, applied whatever the gap analysis says
 * @param maxSources        sources kept per run after URL de-duplication
 * @param maxConcurrentRuns research loops executing at the same time
 * @param queueCapacity     started runs waiting for a free loop thread; beyond this a start is refused
 * @param maxRetainedRuns   finished runs kept for polling, oldest evicted first
 * @param retention         how long a finished run stays pollable
 */
@ConfigurationProperties(prefix = "agent.research")
public record ResearchProperties(
        @DefaultValue("3")   int      maxIterations,
        @DefaultValue("30")  int      maxSources,
        @DefaultValue("8")   int      maxConcurrentRuns,
        @DefaultValue("32")  int      queueCapacity,
        @DefaultValue("200") int      maxRetainedRuns,
        @DefaultValue("1h")  Duration retention
) {

    public ResearchProperties {
        retention = retention == null ? Duration.ofHours(1) : retention;
    }

    /** Loop limits with default concurrency and retention. */
    public static ResearchProperties of(int maxIterations, int maxSources) {
        return new ResearchProperties(maxIterations, maxSources, 8, 32, 200, Duration.ofHours(1));
    }
}
