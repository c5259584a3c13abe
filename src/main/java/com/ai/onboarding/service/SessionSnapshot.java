package com.ai.onboarding.service;

import com.ai.onboarding.conversation.ConversationState;
import com.ai.onboarding.conversation.SessionData;

/**
 * Stored state and decoded scratch data of one onboarding session, as read at the start of a turn.
 */
public final class SessionSnapshot {

    private final ConversationState state;
    private final SessionData data;

    public SessionSnapshot(ConversationState state, SessionData data) {
        this.state = state;
        this.data = data;
    }

    public ConversationState getState() {
        return state;
    }

    public SessionData getData() {
        return data;
    }
}
