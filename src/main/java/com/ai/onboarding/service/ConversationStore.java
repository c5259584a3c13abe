package com.ai.onboarding.service;

import com.ai.onboarding.entity.ConversationMessage;
import com.ai.onboarding.repository.ConversationMessageRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * DB-backed transcript of each user's onboarding chat.
 */
@Component
public class ConversationStore {

    private static final Logger log = LoggerFactory.getLogger(ConversationStore.class);

    static final int MAX_CONTENT = 4000;

    private final ConversationMessageRepository repository;

    public ConversationStore(ConversationMessageRepository repository) {
        this.repository = repository;
    }

    @Transactional(readOnly = true)
    List<ConversationMessage> getHistory(Long userId) {
        return repository.findByUserIdOrderByCreatedAtAscIdAsc(userId);
    }

    @Transactional
    public void appendUser(Long userId, String text) {
        append(userId, "user", text);
        log.debug("[{}] User: {}", userId, text);
    }

    @Transactional
    public void appendAssistant(Long userId, String text) {
        append(userId, "assistant", text);
        log.debug("[{}] Assistant: {}", userId, text);
    }

    private void append(Long userId, String role, String content) {
        if (userId == null || content == null) return;
        ConversationMessage msg = ConversationMessage.builder()
                .userId(userId)
                .role(role)
                .content(truncate(content))
                .build();
        repository.save(msg);
    }

    static String truncate(String content) {
        if (content.length() <= MAX_CONTENT) return content;
        int end = Character.isHighSurrogate(content.charAt(MAX_CONTENT - 1)) ? MAX_CONTENT - 1 : MAX_CONTENT;
        return content.substring(0, end);
    }
}
