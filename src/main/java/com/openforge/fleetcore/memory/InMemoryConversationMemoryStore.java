package com.openforge.fleetcore.memory;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default single-node session store.
 *
 * Memories live for the lifetime of the JVM. Replace with a shared store
 * (Redis, a KV service) for multi-node deployments.
 */
@Slf4j
@Component
public class InMemoryConversationMemoryStore implements ConversationMemoryStore {

    private final Map<String, ConversationMemory> memories = new ConcurrentHashMap<>();

    @Override
    public Optional<ConversationMemory> find(String sessionId) {
        return Optional.ofNullable(memories.get(sessionId));
    }

    @Override
    public ConversationMemory loadOrCreate(String sessionId) {
        return memories.computeIfAbsent(sessionId, id -> {
            log.debug("[MemoryStore] Creating memory for session {}", id);
            return new ConversationMemory(id);
        });
    }

    @Override
    public void save(ConversationMemory memory) {
        memory.touch();
        memories.put(memory.getSessionId(), memory);
    }

    @Override
    public void delete(String sessionId) {
        if (memories.remove(sessionId) != null) {
            log.info("[MemoryStore] Deleted memory for session {}", sessionId);
        }
    }
}
