package com.ai.onboarding.dto;

import com.ai.onboarding.conversation.ConversationState;

/**
 * What the assistant says after a turn, and where the conversation stands afterwards.
 * {@code promptState} is the state the text asks about; {@code currentState} is the stored state.
 */
public final class ChatReply {

    private final String content;
    private final ConversationState promptState;
    private final ConversationState currentState;
    private final int progress;
    private final boolean advanced;

    public ChatReply(String content, ConversationState promptState, ConversationState currentState,
                     int progress, boolean advanced) {
        this.content = content != null ? content : "";
        this.promptState = promptState;
        this.currentState = currentState;
        this.progress = progress;
        this.advanced = advanced;
    }

    public String getContent() {
        return content;
    }

    public ConversationState getPromptState() {
        return promptState;
    }

    public ConversationState getCurrentState() {
        return currentState;
    }

    public int getProgress() {
        return progress;
    }

    /** False when the answer was rejected and the same question is asked again. */
    public boolean isAdvanced() {
        return advanced;
    }
}
