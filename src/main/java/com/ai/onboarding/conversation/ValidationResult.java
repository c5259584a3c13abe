package com.ai.onboarding.conversation;

/**
 * Outcome of validating one user answer: either a {@link ValidatedValue} or a guidance message.
 * Failures are returned, not thrown, and must not advance the conversation.
 */
public final class ValidationResult {

    private final ValidatedValue value;
    private final String error;

    private ValidationResult(ValidatedValue value, String error) {
        this.value = value;
        this.error = error;
    }

    public static ValidationResult ok(ValidatedValue value) {
        return new ValidationResult(value, null);
    }

    public static ValidationResult error(String message) {
        return new ValidationResult(null, message);
    }

    public boolean isOk() {
        return value != null;
    }

    public ValidatedValue getValue() {
        if (value == null) {
            throw new IllegalStateException("Validation failed: " + error);
        }
        return value;
    }

    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return isOk() ? "ok(" + value + ")" : "error(" + error + ")";
    }
}
