package com.ai.onboarding.conversation;

@FunctionalInterface
public interface InputValidator {

    ValidationResult validate(String rawInput);
}
