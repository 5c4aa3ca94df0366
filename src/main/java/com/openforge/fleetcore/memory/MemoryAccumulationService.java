package com.openforge.fleetcore.memory;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Updates a session's {@link ConversationMemory} once a turn has completed.
 *
 * Steps, in order:
 *   1. append the user query and the final answer to the recent-message window
 *   2. record fleetcore features mentioned on either side
 *   3. record vessels and companies found in the query and the answer
 *   4. extend the topic chain ("PMS → maintenance → crew")
 *   5. re-detect the user's intent
 *   6. rebuild the natural-language summary
 *
 * This runs on the caller's side of the pipeline. The resolver, classifier and
 * analyzers never write to memory.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MemoryAccumulationService {

    private static final int MAX_TOPICS_IN_CHAIN   = 5;
    private static final String TOPIC_SEPARATOR     = " → ";

    private static final String INTENT_EVALUATING = "evaluating fleetcore for specific entity";
    private static final String INTENT_LEARNING   = "learning about fleetcore";
    private static final String INTENT_COMPARING  = "comparing options";
    private static final String INTENT_GATHERING  = "gathering information";
    private static final String INTENT_GENERAL    = "general inquiry";

    private record FeaturePattern(Pattern pattern, String name, String explanation) {
        static FeaturePattern of(String regex, String name, String explanation) {
            return new FeaturePattern(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), name, explanation);
        }
    }

    private static final List<FeaturePattern> FEATURE_PATTERNS = List.of(
            FeaturePattern.of("\\bpms\\b|planned maintenance system", "PMS (Planned Maintenance System)",
                    "Core maintenance scheduling and tracking system"),
            FeaturePattern.of("work orders?", "work orders",
                    "Task creation and management workflow"),
            FeaturePattern.of("inventory management|spare parts management", "inventory management",
                    "Parts tracking and stock management"),
            FeaturePattern.of("compliance tracking|compliance management", "compliance tracking",
                    "Regulatory compliance monitoring and reporting"),
            FeaturePattern.of("crew management|crew scheduling", "crew management",
                    "Personnel scheduling and crew roster management"),
            FeaturePattern.of("safety management|sms system", "safety management system",
                    "ISM Code compliance and safety tracking"),
            FeaturePattern.of("procurement|purchasing", "procurement system",
                    "Purchasing and supplier management"),
            FeaturePattern.of("dashboard|analytics|reporting", "analytics & reporting",
                    "Performance metrics and operational intelligence"),
            FeaturePattern.of("schedule[- ]specific hours", "schedule-specific hours tracking",
                    "Each maintenance schedule tracks its own working hours independently"),
            FeaturePattern.of("dual[- ]interval", "dual-interval logic",
                    "Supports both hours-based and time-based maintenance intervals"),
            FeaturePattern.of("task management|task workflow", "task management workflow",
                    "Tracks maintenance tasks from pending to completed"),
            FeaturePattern.of("certificate tracking|certification management", "certificate tracking",
                    "Manages vessel certificates and regulatory documentation"),
            FeaturePattern.of("mobile app|offline mode", "mobile capabilities",
                    "Mobile-first design with offline mode support"),
            FeaturePattern.of("real-time|live updates", "real-time updates",
                    "Live data synchronization across all users")
    );

    private static final List<String> TOPIC_KEYWORDS = List.of(
            "PMS", "maintenance", "scheduling", "fleetcore", "seacore",
            "compliance", "inspection", "safety", "crew", "inventory",
            "procurement", "work orders", "tasks", "certificates");

    private static final Pattern EVALUATING_1 = Pattern.compile(
            "\\b(evaluate|assess|consider|implement|adopt|use|apply)\\b.*\\bfleetcore\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern EVALUATING_2 = Pattern.compile(
            "\\bfleetcore\\b.*\\b(for|with|on)\\b.*\\b(vessel|ship|fleet|company)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern LEARNING = Pattern.compile(
            "\\b(what is|tell me about|explain|how does)\\b.*\\bfleetcore\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern COMPARING = Pattern.compile(
            "\\b(compare|vs|versus|difference|better)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern GATHERING = Pattern.compile(
            "\\b(what|who|where|when|which)\\b", Pattern.CASE_INSENSITIVE);

    private final MaritimeEntityExtractor entityExtractor;
    private final MemoryProperties        properties;

    // ── Entry point ──────────────────────────────────────────────────────────

    /**
     * Records one completed turn. {@code answer} should be the final,
     * citation-enforced text that was shown to the user.
     */
    public void recordTurn(ConversationMemory memory, String userQuery, String answer) {
        String query    = userQuery == null ? "" : userQuery;
        String response = answer == null ? "" : answer;
        int    turn     = memory.getMessageCount() / 2 + 1;

        memory.appendMessage(ConversationMessage.user(query), properties.recentMessageLimit());
        memory.appendMessage(ConversationMessage.assistant(response), properties.recentMessageLimit());

        AccumulatedKnowledge knowledge = memory.getAccumulatedKnowledge();

        int features = 0;
        for (PlatformFeature feature : extractFeatures(query + "\n" + response, turn)) {
            if (knowledge.addPlatformFeature(feature)) features++;
        }

        Set<String> vessels = new LinkedHashSet<>(entityExtractor.extractVesselNames(query));
        vessels.addAll(entityExtractor.extractVesselNames(response));
        for (String vessel : vessels) {
            knowledge.addVessel(entityExtractor.describeVessel(vessel, response, turn));
        }

        Set<String> companies = new LinkedHashSet<>(entityExtractor.extractCompanyNames(query));
        companies.addAll(entityExtractor.extractCompanyNames(response));
        companies.removeAll(vessels);
        for (String company : companies) {
            knowledge.addCompany(entityExtractor.describeCompany(company, response, turn));
        }

        List<String> topics = extractTopics(query + "\n" + response);
        knowledge.addTopics(topics);
        memory.setConversationTopic(extendTopicChain(memory.getConversationTopic(), topics));
        memory.setUserIntent(detectUserIntent(query, memory.getUserIntent()));
        memory.setConversationSummary(summarize(memory));

        log.info("[Memory:{}] Turn {} recorded, features +{}, vessels {}, companies {}, intent='{}'",
                memory.getSessionId(), turn, features, vessels, companies, memory.getUserIntent());
    }

    // ── Extraction ───────────────────────────────────────────────────────────

    List<PlatformFeature> extractFeatures(String text, int messageIndex) {
        List<PlatformFeature> found = new ArrayList<>();
        for (FeaturePattern fp : FEATURE_PATTERNS) {
            if (fp.pattern().matcher(text).find()) {
                found.add(new PlatformFeature(fp.name(), fp.explanation(), messageIndex));
            }
        }
        return found;
    }

    List<String> extractTopics(String text) {
        return TOPIC_KEYWORDS.stream()
                .filter(topic -> Pattern.compile("\\b" + Pattern.quote(topic) + "\\b", Pattern.CASE_INSENSITIVE)
                        .matcher(text).find())
                .collect(Collectors.toList());
    }

    /**
     * Adds the primary new topic to the chain unless it is already there,
     * keeping only the last five links.
     */
    static String extendTopicChain(String currentChain, List<String> newTopics) {
        if (newTopics.isEmpty()) return currentChain;
        List<String> chain = currentChain == null || currentChain.isBlank()
                ? new ArrayList<>()
                : new ArrayList<>(Arrays.asList(currentChain.split(TOPIC_SEPARATOR)));
        String primary = newTopics.get(0);
        if (chain.contains(primary)) return currentChain;
        chain.add(primary);
        if (chain.size() > MAX_TOPICS_IN_CHAIN) {
            chain = chain.subList(chain.size() - MAX_TOPICS_IN_CHAIN, chain.size());
        }
        return String.join(TOPIC_SEPARATOR, chain);
    }

    static String detectUserIntent(String query, String currentIntent) {
        boolean hasCurrent = currentIntent != null && !currentIntent.isBlank();
        if (EVALUATING_1.matcher(query).find() || EVALUATING_2.matcher(query).find()) {
            return INTENT_EVALUATING;
        }
        if (LEARNING.matcher(query).find())  return INTENT_LEARNING;
        if (COMPARING.matcher(query).find()) return INTENT_COMPARING;
        if (GATHERING.matcher(query).find()) return hasCurrent ? currentIntent : INTENT_GATHERING;
        return hasCurrent ? currentIntent : INTENT_GENERAL;
    }

    static String summarize(ConversationMemory memory) {
        AccumulatedKnowledge knowledge = memory.getAccumulatedKnowledge();
        List<String> parts = new ArrayList<>();

        if (!memory.getConversationTopic().isBlank()) {
            parts.add("Conversation has covered: " + memory.getConversationTopic() + ".");
        }
        if (!memory.getUserIntent().isBlank()) {
            parts.add("User's goal: " + memory.getUserIntent() + ".");
        }
        if (knowledge.hasPlatformFeatures()) {
            parts.add("Discussed fleetcore features: " + knowledge.getPlatformFeatures().stream()
                    .limit(5).map(PlatformFeature::name).collect(Collectors.joining(", ")) + ".");
        }
        if (!knowledge.getVesselEntities().isEmpty()) {
            parts.add("Vessels discussed: " + knowledge.getVesselEntities().values().stream()
                    .map(MemoryAccumulationService::describe)
                    .collect(Collectors.joining("; ")) + ".");
        }
        if (!knowledge.getCompanyEntities().isEmpty()) {
            parts.add("Companies mentioned: "
                    + String.join(", ", knowledge.getCompanyEntities().keySet()) + ".");
        }
        return String.join(" ", parts);
    }

    private static String describe(VesselEntity vessel) {
        StringBuilder sb = new StringBuilder(vessel.name());
        if (vessel.vesselType() != null) sb.append(" (").append(vessel.vesselType()).append(')');
        if (vessel.imo() != null)        sb.append(" IMO: ").append(vessel.imo());
        if (vessel.operator() != null)   sb.append(" operated by ").append(vessel.operator());
        return sb.toString();
    }
}
