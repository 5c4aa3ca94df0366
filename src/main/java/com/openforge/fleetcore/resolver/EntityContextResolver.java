package com.openforge.fleetcore.resolver;

import com.openforge.fleetcore.memory.AccumulatedKnowledge;
import com.openforge.fleetcore.memory.ConversationMemory;
import com.openforge.fleetcore.memory.ConversationMessage;
import com.openforge.fleetcore.memory.PlatformFeature;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns a raw user query into a pronoun-resolved query anchored on the entity
 * the conversation is currently about.
 *
 * Pipeline:
 *   1. {@link FollowUpDetector} decides whether the query leans on earlier turns
 *   2. pick the active entity: newest vessel, else newest company, else an
 *      equipment-like proper noun ("Caterpillar 3516C") in the last 3 messages
 *   3. substitute pronouns and type-specific phrases with the entity name
 *   4. build a descriptive entity-context block for the prompt
 *
 * Pure with respect to its inputs: memory is read, never written. When no
 * entity can be found the query comes back unchanged with hasContext=false.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EntityContextResolver {

    private static final int RECENT_MESSAGES_SCANNED = 3;
    private static final int CONTEXT_FEATURE_LIMIT   = 3;

    private static final Pattern EQUIPMENT_NAME =
            Pattern.compile("\\b([A-Z][a-z]+\\s+\\d+[A-Z0-9-]+)\\b");

    private static final Pattern POSSESSIVE  = Pattern.compile("(?i)^(its|their)$");
    private static final String  PRONOUNS    = "its|their|it|this|that";
    private static final String  VESSEL_REFS = "the vessel|the ship";
    private static final String  COMPANY_REFS = "the company|the operator";

    private final FollowUpDetector followUpDetector;

    // ── Entry point ──────────────────────────────────────────────────────────

    public ResolvedQuery resolve(String query, ConversationMemory memory) {
        String original = query == null ? "" : query;

        if (!followUpDetector.isFollowUp(original, memory)) {
            return ResolvedQuery.unresolved(original);
        }

        Optional<ActiveEntity> active = findActiveEntity(memory);
        if (active.isEmpty()) {
            log.debug("[Resolver:{}] Follow-up detected but no active entity in memory",
                    memory.getSessionId());
            return ResolvedQuery.unresolved(original);
        }

        ActiveEntity entity   = active.get();
        String       resolved = substitute(original, entity);
        String       context  = buildEntityContext(entity, memory);

        log.info("[Resolver:{}] \"{}\" → \"{}\" (active entity: {} / {})",
                memory.getSessionId(), original, resolved, entity.name(), entity.type());
        return ResolvedQuery.resolved(original, resolved, context, entity);
    }

    // ── Active entity ────────────────────────────────────────────────────────

    Optional<ActiveEntity> findActiveEntity(ConversationMemory memory) {
        if (memory == null) return Optional.empty();
        AccumulatedKnowledge knowledge = memory.getAccumulatedKnowledge();

        Optional<ActiveEntity> vessel = knowledge.latestVessel()
                .map(v -> ActiveEntity.vessel(v.name(), v.imo(), v.specs()));
        if (vessel.isPresent()) return vessel;

        Optional<ActiveEntity> company = knowledge.latestCompany()
                .map(c -> ActiveEntity.company(c.name()));
        if (company.isPresent()) return company;

        String recentText = memory.lastMessages(RECENT_MESSAGES_SCANNED).stream()
                .map(ConversationMessage::content)
                .collect(Collectors.joining(" "));
        Matcher m = EQUIPMENT_NAME.matcher(recentText);
        return m.find() ? Optional.of(ActiveEntity.equipment(m.group(1))) : Optional.empty();
    }

    // ── Substitution ─────────────────────────────────────────────────────────

    /**
     * Single left-to-right pass, so text introduced by a replacement is never
     * matched again. Possessives ("its", "their") become "Name's"; everything
     * else becomes the bare name.
     */
    static String substitute(String query, ActiveEntity entity) {
        String alternatives = PRONOUNS;
        if (entity.type() == EntityType.VESSEL)  alternatives = VESSEL_REFS + "|" + alternatives;
        if (entity.type() == EntityType.COMPANY) alternatives = COMPANY_REFS + "|" + alternatives;

        Pattern pattern = Pattern.compile("\\b(" + alternatives + ")\\b", Pattern.CASE_INSENSITIVE);
        Matcher m = pattern.matcher(query);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String replacement = POSSESSIVE.matcher(m.group(1)).matches()
                    ? entity.name() + "'s"
                    : entity.name();
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    // ── Entity context ───────────────────────────────────────────────────────

    static String buildEntityContext(ActiveEntity entity, ConversationMemory memory) {
        List<String> parts = new ArrayList<>();
        parts.add("ACTIVE ENTITY: " + entity.name());

        switch (entity.type()) {
            case VESSEL -> {
                parts.add("Type: Vessel");
                if (entity.imo() != null) parts.add("IMO: " + entity.imo());
                if (!entity.specs().isEmpty()) {
                    parts.add("Specs: " + entity.specs().entrySet().stream()
                            .map(e -> e.getKey() + ": " + e.getValue())
                            .collect(Collectors.joining(", ")));
                }
            }
            case COMPANY   -> parts.add("Type: Maritime Company/Operator");
            case EQUIPMENT -> parts.add("Type: Equipment/Machinery");
            default        -> { }
        }

        if (memory != null && !memory.getConversationSummary().isBlank()) {
            parts.add("\nCONVERSATION SUMMARY:\n" + memory.getConversationSummary());
        }

        if (memory != null && memory.getAccumulatedKnowledge().hasPlatformFeatures()) {
            String features = memory.getAccumulatedKnowledge().getPlatformFeatures().stream()
                    .limit(CONTEXT_FEATURE_LIMIT)
                    .map(PlatformFeature::name)
                    .collect(Collectors.joining(", "));
            parts.add("\nFLEETCORE CONTEXT: User is evaluating fleetcore platform (features discussed: "
                    + features + ")");
        }
        return String.join("\n", parts);
    }
}
