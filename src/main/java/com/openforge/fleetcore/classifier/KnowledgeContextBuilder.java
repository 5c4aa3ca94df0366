package com.openforge.fleetcore.classifier;

import com.openforge.fleetcore.memory.AccumulatedKnowledge;
import com.openforge.fleetcore.memory.ConversationMemory;
import com.openforge.fleetcore.memory.PlatformFeature;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders what the conversation has established about fleetcore so it can be
 * carried into hybrid and research prompts.
 *
 * Both methods return their neutral value (empty string / unchanged query)
 * until at least one platform feature has been discussed.
 */
@Component
public class KnowledgeContextBuilder {

    private static final int FEATURE_LIMIT = 5;

    public String buildContext(ConversationMemory memory) {
        if (!hasFeatures(memory)) return "";

        AccumulatedKnowledge knowledge = memory.getAccumulatedKnowledge();
        StringBuilder sb = new StringBuilder("\n\n=== CONVERSATION CONTEXT ===\n");

        sb.append("\nFleetcore features discussed:\n");
        List<PlatformFeature> features = knowledge.getPlatformFeatures();
        for (int i = 0; i < Math.min(FEATURE_LIMIT, features.size()); i++) {
            PlatformFeature f = features.get(i);
            sb.append(i + 1).append(". ").append(f.name()).append(": ").append(f.explanation()).append('\n');
        }

        if (!knowledge.getVesselEntities().isEmpty()) {
            sb.append("\nVessels discussed: ")
              .append(String.join(", ", knowledge.getVesselEntities().keySet())).append('\n');
        }
        if (!knowledge.getCompanyEntities().isEmpty()) {
            sb.append("\nCompanies discussed: ")
              .append(String.join(", ", knowledge.getCompanyEntities().keySet())).append('\n');
        }
        if (!memory.getConversationTopic().isBlank()) {
            sb.append("\nConversation topic: ").append(memory.getConversationTopic()).append('\n');
        }
        if (!memory.getUserIntent().isBlank()) {
            sb.append("\nUser intent: ").append(memory.getUserIntent()).append('\n');
        }
        return sb.toString();
    }

    public String enrichQuery(String query, ConversationMemory memory) {
        if (!hasFeatures(memory)) return query;

        String features = memory.getAccumulatedKnowledge().getPlatformFeatures().stream()
                .limit(FEATURE_LIMIT)
                .map(PlatformFeature::name)
                .collect(Collectors.joining(", "));
        return "[Context: User is evaluating fleetcore maritime maintenance system with features: "
                + features + "] " + query;
    }

    private static boolean hasFeatures(ConversationMemory memory) {
        return memory != null && memory.getAccumulatedKnowledge().hasPlatformFeatures();
    }
}
