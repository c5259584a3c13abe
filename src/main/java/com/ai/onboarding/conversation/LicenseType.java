package com.ai.onboarding.conversation;

/**
 * Kind of driver license held.
 */
public enum LicenseType {
    FOREIGN("foreign"),
    PERSONAL("personal"),
    COMMERCIAL("commercial");

    private final String code;

    LicenseType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /** Case-insensitive lookup; returns null when the text is not a known code. */
    public static LicenseType fromCode(String text) {
        if (text == null) return null;
        String normalized = text.trim().toLowerCase();
        for (LicenseType v : values()) {
            if (v.code.equals(normalized)) return v;
        }
        return null;
    }
}
