package com.openforge.fleetcore.memory;

/**
 * A single turn entry kept in the bounded recent-message window.
 *
 * role is either "user" or "assistant".
 */
public record ConversationMessage(
        String role,
        String content,
        long   timestamp
) {

    public static ConversationMessage user(String content) {
        return new ConversationMessage("user", content, System.currentTimeMillis());
    }

    public static ConversationMessage assistant(String content) {
        return new ConversationMessage("assistant", content, System.currentTimeMillis());
    }

    public boolean isUser() {
        return "user".equals(role);
    }
}
