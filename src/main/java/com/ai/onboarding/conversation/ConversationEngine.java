package com.ai.onboarding.conversation;

import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Entry point to the onboarding state machine: prompts, answer validation, transitions and progress.
 * Pure and thread-safe; performs no I/O and keeps no state between calls. Callers must only advance
 * with a value that came out of a successful {@link #validate}.
 */
@Component
public class ConversationEngine {

    private final InputValidators validators;

    public ConversationEngine() {
        this(Clock.systemUTC());
    }

    public ConversationEngine(Clock clock) {
        this.validators = new InputValidators(clock);
    }

    public String getPrompt(ConversationState state) {
        return StatePrompts.get(state);
    }

    public ValidationResult validate(ConversationState state, String rawInput) {
        return validators.validate(state, rawInput);
    }

    public ConversationState nextState(ConversationState current, ValidatedValue value, SessionData sessionData) {
        return StateTransitions.next(current, value, sessionData);
    }

    public int progress(ConversationState state) {
        return ProgressTracker.progress(state);
    }
}
