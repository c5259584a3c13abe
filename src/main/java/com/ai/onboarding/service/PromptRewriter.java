package com.ai.onboarding.service;

import com.ai.onboarding.conversation.ConversationState;

/**
 * Turns canned prompts into conversational text. Implementations must never fail the turn:
 * when rephrasing is not possible they return the canned text.
 */
public interface PromptRewriter {

    String rewrite(ConversationState state, String basePrompt, String userName);

    String rewriteError(ConversationState state, String userInput, String errorMessage);
}
