package com.ai.onboarding.service;

import com.ai.onboarding.conversation.ConversationEngine;
import com.ai.onboarding.conversation.ConversationState;
import com.ai.onboarding.conversation.ValidatedValue;
import com.ai.onboarding.conversation.ValidationResult;
import com.ai.onboarding.dto.ChatReply;
import com.ai.onboarding.entity.UserProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Drives one onboarding chat: greets or resumes on connect, then for every user message
 * validates, stores, advances and asks the next question. Turns of the same session key
 * are processed one at a time.
 */
@Service
public class OnboardingFlowService {

    private static final Logger log = LoggerFactory.getLogger(OnboardingFlowService.class);

    private final ConversationEngine engine;
    private final UserProfileService userProfileService;
    private final OnboardingSessionService sessionService;
    private final ConversationStore conversationStore;
    private final PromptRewriter promptRewriter;

    static final int LOCK_STRIPES = 64;

    private final Object[] sessionLocks = new Object[LOCK_STRIPES];

    public OnboardingFlowService(ConversationEngine engine,
                                 UserProfileService userProfileService,
                                 OnboardingSessionService sessionService,
                                 ConversationStore conversationStore,
                                 PromptRewriter promptRewriter) {
        this.engine = engine;
        this.userProfileService = userProfileService;
        this.sessionService = sessionService;
        this.conversationStore = conversationStore;
        this.promptRewriter = promptRewriter;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            sessionLocks[i] = new Object();
        }
    }

    /**
     * First message of a connection. A new session is greeted and moved past {@code start};
     * an existing one is asked its current question again.
     */
    public ChatReply openConversation(String sessionKey) {
        synchronized (lockFor(sessionKey)) {
            UserProfile user = userProfileService.getOrCreate(sessionKey);
            SessionSnapshot snapshot = sessionService.load(user.getId());
            ConversationState state = snapshot.getState();

            if (state == ConversationState.START) {
                String greeting = promptRewriter.rewrite(state, engine.getPrompt(state), user.getFullName());
                conversationStore.appendAssistant(user.getId(), greeting);
                ConversationState next = sessionService.commitTurn(user.getId(), state, ValidatedValue.text(""));
                return new ChatReply(greeting, state, next, engine.progress(next), true);
            }

            log.info("Resuming onboarding | userId={} state={}", user.getId(), state.getValue());
            String prompt = promptRewriter.rewrite(state, engine.getPrompt(state), user.getFullName());
            conversationStore.appendAssistant(user.getId(), prompt);
            return new ChatReply(prompt, state, state, engine.progress(state), false);
        }
    }

    public ChatReply handleUserMessage(String sessionKey, String userText) {
        synchronized (lockFor(sessionKey)) {
            UserProfile user = userProfileService.getOrCreate(sessionKey);
            Long userId = user.getId();
            conversationStore.appendUser(userId, userText);

            ConversationState current = sessionService.load(userId).getState();
            ValidationResult result = engine.validate(current, userText);
            if (!result.isOk()) {
                log.warn("Rejected answer | userId={} state={} reason={}", userId, current.getValue(), result.getError());
                String guidance = promptRewriter.rewriteError(current, userText, result.getError());
                conversationStore.appendAssistant(userId, guidance);
                return new ChatReply(guidance, current, current, engine.progress(current), false);
            }

            ConversationState next = sessionService.commitTurn(userId, current, result.getValue());
            if (next.isTerminal() && !current.isTerminal()) {
                log.info("Onboarding completed | userId={}", userId);
            }
            String userName = userProfileService.findById(userId)
                    .map(UserProfile::getFullName)
                    .orElse(null);
            String reply = promptRewriter.rewrite(next, engine.getPrompt(next), userName);
            conversationStore.appendAssistant(userId, reply);
            return new ChatReply(reply, next, next, engine.progress(next), true);
        }
    }

    /** Striped so the lock table stays fixed however many session keys connect. */
    Object lockFor(String sessionKey) {
        return sessionLocks[Math.floorMod(sessionKey.hashCode(), LOCK_STRIPES)];
    }
}
