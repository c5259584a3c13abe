package com.ai.onboarding.conversation;

public enum LicenseStatus {
    VALID("valid"),
    SUSPENDED("suspended");

    private final String code;

    LicenseStatus(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /** Case-insensitive lookup; returns null when the text is not a known code. */
    public static LicenseStatus fromCode(String text) {
        if (text == null) return null;
        String normalized = text.trim().toLowerCase();
        for (LicenseStatus v : values()) {
            if (v.code.equals(normalized)) return v;
        }
        return null;
    }
}
