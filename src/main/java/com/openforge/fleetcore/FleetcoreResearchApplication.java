package com.openforge.fleetcore;

import com.openforge.fleetcore.memory.MemoryProperties;
import com.openforge.fleetcore.research.ResearchProperties;
import com.openforge.fleetcore.search.SearchProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({SearchProperties.class, ResearchProperties.class, MemoryProperties.class})
public class FleetcoreResearchApplication {

    public static void main(String[] args) {
        SpringApplication.run(FleetcoreResearchApplication.class, args);
    }
}
