package com.openforge.fleetcore.config;

import com.openforge.fleetcore.memory.MemoryProperties;
import com.openforge.fleetcore.research.ResearchProperties;
import com.openforge.fleetcore.search.SearchProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Prints a structured startup summary once the application context is ready:
 * server port and Java version, the search provider (API key masked), research
 * loop limits and the memory window size.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final SearchProperties   searchProperties;
    private final ResearchProperties researchProperties;
    private final MemoryProperties   memoryProperties;
    private final Environment        env;

    @Override
    public void run(ApplicationArguments args) {
        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║          fleetcore research  -  Startup Summary          ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Server                                                  ║
                ║    HTTP Port      : {}
                ║    Java Version   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Search Provider                                         ║
                ║    Provider       : {}  [{}]  key={}
                ║    Depth / Max    : {} / {} results
                ╠══════════════════════════════════════════════════════════╣
                ║  Research Loop                                           ║
                ║    Max Iterations : {}
                ║    Max Sources    : {}
                ║    Concurrency    : {} threads, {} queued
                ║    Retention      : {} runs / {}
                ║    Memory Window  : {} messages
                ╚══════════════════════════════════════════════════════════╝
                """,
                env.getProperty("server.port", "8080"),
                System.getProperty("java.version"),

                searchProperties.name(),
                searchProperties.baseUrl(),
                maskKey(searchProperties.apiKey()),
                searchProperties.searchDepth(),
                searchProperties.maxResults(),

                researchProperties.maxIterations(),
                researchProperties.maxSources(),
                researchProperties.maxConcurrentRuns(),
                researchProperties.queueCapacity(),
                researchProperties.maxRetainedRuns(),
                researchProperties.retention(),
                memoryProperties.recentMessageLimit()
        );
    }

    /**
     * Masks an API key: first 6 chars + "..." + last 4 chars.
     * Returns "(not set)" if the key is missing or a placeholder.
     */
    static String maskKey(String key) {
        if (key == null || key.isBlank() || key.startsWith("tvly-placeholder")) {
            return "(not set)";
        }
        if (key.length() <= 10) return "***";
        return key.substring(0, 6) + "..." + key.substring(key.length() - 4);
    }
}
