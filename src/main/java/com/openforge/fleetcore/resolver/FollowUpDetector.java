package com.openforge.fleetcore.resolver;

import com.openforge.fleetcore.memory.ConversationMemory;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Decides whether a query leans on earlier turns of the conversation.
 *
 * Four independent signals, OR'd together. Every one of them is gated on the
 * session already holding at least one message: a first question is never a
 * follow-up, however short or pronoun-heavy it is.
 *
 *   short   : at most 4 tokens, under 20 characters, with an interrogative word
 *   pronoun : "it", "its", "their", "the vessel", "the engines", ...
 *   phrase  : "tell me", "what about", "more details", ...
 *   action  : a bare action verb with no explicit subject ("how do I track")
 */
@Component
public class FollowUpDetector {

    private static final int SHORT_MAX_TOKENS = 4;
    private static final int SHORT_MAX_CHARS  = 20;

    private static final Pattern INTERROGATIVE = ci(
            "\\b(what|how|why|when|where|which|who|can|could|would|should)\\b");

    private static final Pattern REFERENTIAL = ci(
            "\\b(it|its|that|this|those|these|them|their|the above|same)\\b"
            + "|\\bthe (vessel|ship|boat|company|operator|owner|fleet|organization)\\b"
            + "|\\bthe (engines?|main engine|propulsion|propeller|shaft|gearbox|auxiliar(?:y|ies)"
            + "|generators?|compressor|pump|boiler|switchboard|radar|ecdis|hull|rudder"
            + "|crane|winch|equipment|machinery|specs|specifications|capacity|crew"
            + "|certificates?|class|classification|maintenance|history|flag|registry)\\b");

    private static final Pattern CONTINUATION = ci(
            "\\b(tell me|show me|give me|what about|how about|what if"
            + "|can you|could you|would you|also|ok|okay)\\b"
            + "|\\b(what's|what is|whats|who's|who is|whos)\\b"
            + "|\\b(how much|how many|more|details?|info)\\b");

    private static final Pattern ACTION_VERB = ci(
            "\\b(use|apply|works?|implement|integrate|handle|manage|track|monitor|find|show|give)\\b");

    private static final Pattern EXPLICIT_SUBJECT = ci(
            "(fleetcore|pms|system|platform|vessel name|ship name|company name)");

    public boolean isFollowUp(String query, ConversationMemory memory) {
        if (memory == null || !memory.hasPriorMessages()) return false;
        if (query == null || query.isBlank()) return false;

        String trimmed = query.trim();
        return isShortQuestion(trimmed)
                || REFERENTIAL.matcher(trimmed).find()
                || CONTINUATION.matcher(trimmed).find()
                || hasActionWithoutSubject(trimmed);
    }

    // ── Signals ──────────────────────────────────────────────────────────────

    static boolean isShortQuestion(String query) {
        return query.split("\\s+").length <= SHORT_MAX_TOKENS
                && query.length() < SHORT_MAX_CHARS
                && INTERROGATIVE.matcher(query).find();
    }

    static boolean hasActionWithoutSubject(String query) {
        return ACTION_VERB.matcher(query).find() && !EXPLICIT_SUBJECT.matcher(query).find();
    }

    private static Pattern ci(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }
}
