package com.openforge.fleetcore.memory;

import java.util.Optional;

/**
 * Session store seam. Supplies and persists {@link ConversationMemory}
 * instances; the service never opens or closes the backing store itself.
 */
public interface ConversationMemoryStore {

    Optional<ConversationMemory> find(String sessionId);

    /** Returns the stored memory, creating and saving an empty one on first use. */
    ConversationMemory loadOrCreate(String sessionId);

    void save(ConversationMemory memory);

    void delete(String sessionId);
}
