package com.ai.onboarding.service;

import com.ai.onboarding.entity.ConversationMessage;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import(ConversationStore.class)
class ConversationStoreTest {

    @Autowired
    private ConversationStore store;

    @Test
    void keepsTranscriptInOrderPerUser() {
        store.appendAssistant(1L, "What's your 5-digit zip code?");
        store.appendUser(1L, "90210");
        store.appendUser(2L, "someone else");
        store.appendAssistant(1L, "Great! What's your full name?");

        List<ConversationMessage> history = store.getHistory(1L);

        assertThat(history).extracting(ConversationMessage::getRole)
                .containsExactly("assistant", "user", "assistant");
        assertThat(history).extracting(ConversationMessage::getContent)
                .containsExactly("What's your 5-digit zip code?", "90210", "Great! What's your full name?");
    }

    @Test
    void longMessagesAreCapped() {
        store.appendUser(3L, "x".repeat(5000));
        store.appendUser(3L, null);

        List<ConversationMessage> history = store.getHistory(3L);

        assertThat(history).hasSize(1);
        assertThat(history.get(0).getContent()).hasSize(ConversationStore.MAX_CONTENT);
    }

    @Test
    void truncationDoesNotSplitASurrogatePair() {
        String content = "a".repeat(ConversationStore.MAX_CONTENT - 1) + "\uD83D\uDE97" + "tail";

        String stored = ConversationStore.truncate(content);

        assertThat(stored).hasSize(ConversationStore.MAX_CONTENT - 1);
        assertThat(Character.isHighSurrogate(stored.charAt(stored.length() - 1))).isFalse();
        assertThat(ConversationStore.truncate("short")).isEqualTo("short");
    }
}
