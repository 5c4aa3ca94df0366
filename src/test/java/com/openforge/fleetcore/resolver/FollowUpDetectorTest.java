package com.openforge.fleetcore.resolver;

import com.openforge.fleetcore.memory.ConversationMemory;
import com.openforge.fleetcore.memory.ConversationMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class FollowUpDetectorTest {

    private final FollowUpDetector detector = new FollowUpDetector();
    private ConversationMemory memory;

    @BeforeEach
    void setUp() {
        memory = new ConversationMemory("s");
        memory.appendMessage(ConversationMessage.user("Tell me about MV Ever Given"), 10);
        memory.appendMessage(ConversationMessage.assistant("MV Ever Given is a container ship."), 10);
    }

    @Test
    @DisplayName("the first question of a session is never a follow-up")
    void firstQuestion() {
        assertThat(detector.isFollowUp("its engines", new ConversationMemory("new"))).isFalse();
        assertThat(detector.isFollowUp("its engines", null)).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "Who owns?",
            "its engines",
            "What about the main engine",
            "more details please",
            "how do I track maintenance"
    })
    @DisplayName("follow-up signals are recognized")
    void followUps(String query) {
        assertThat(detector.isFollowUp(query, memory)).isTrue();
    }

    @Test
    @DisplayName("blank queries are not follow-ups")
    void blank() {
        assertThat(detector.isFollowUp("   ", memory)).isFalse();
    }

    @Test
    @DisplayName("an action verb with an explicit subject is not a bare action")
    void actionWithSubject() {
        assertThat(FollowUpDetector.hasActionWithoutSubject("track hours in fleetcore")).isFalse();
        assertThat(FollowUpDetector.hasActionWithoutSubject("how do I track running hours")).isTrue();
    }

    @Test
    @DisplayName("short questions need an interrogative")
    void shortQuestion() {
        assertThat(FollowUpDetector.isShortQuestion("Who owns?")).isTrue();
        assertThat(FollowUpDetector.isShortQuestion("Ever Given")).isFalse();
        assertThat(FollowUpDetector.isShortQuestion("What is the registered owner of MV Ever Given")).isFalse();
    }
}
