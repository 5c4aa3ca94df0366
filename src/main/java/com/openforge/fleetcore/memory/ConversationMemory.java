package com.openforge.fleetcore.memory;

import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-session conversation state.
 *
 * Owned by the caller and loaded from the {@link ConversationMemoryStore} at
 * the start of each turn. The resolver, classifier and analyzers only read it;
 * {@link MemoryAccumulationService} is the one place that writes it after a
 * turn completes.
 *
 * recentMessages is a sliding window: once it exceeds the configured limit
 * the oldest entries are dropped, while messageCount keeps the total.
 */
@Getter
@Setter
public class ConversationMemory {

    private final String               sessionId;
    private final List<ConversationMessage> recentMessages = new ArrayList<>();
    private final AccumulatedKnowledge accumulatedKnowledge = new AccumulatedKnowledge();

    private int     messageCount;
    private String  conversationTopic   = "";
    private String  userIntent          = "";
    private String  conversationSummary = "";
    private Instant createdAt;
    private Instant updatedAt;

    public ConversationMemory(String sessionId) {
        this.sessionId = sessionId;
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    // ── Messages ─────────────────────────────────────────────────────────────

    /**
     * Appends a message and trims the window so that at most {@code limit}
     * recent messages remain.
     */
    public void appendMessage(ConversationMessage message, int limit) {
        recentMessages.add(message);
        messageCount++;
        int overflow = recentMessages.size() - Math.max(1, limit);
        if (overflow > 0) {
            recentMessages.subList(0, overflow).clear();
        }
        touch();
    }

    /** True once at least one turn has been recorded. */
    public boolean hasPriorMessages() {
        return messageCount > 0 && !recentMessages.isEmpty();
    }

    /** The last {@code n} messages, oldest first. */
    public List<ConversationMessage> lastMessages(int n) {
        int from = Math.max(0, recentMessages.size() - n);
        return Collections.unmodifiableList(recentMessages.subList(from, recentMessages.size()));
    }

    public void touch() {
        this.updatedAt = Instant.now();
    }
}
