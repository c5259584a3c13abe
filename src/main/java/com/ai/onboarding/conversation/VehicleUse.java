package com.ai.onboarding.conversation;

/**
 * Primary use of a vehicle.
 */
public enum VehicleUse {
    COMMUTING("commuting"),
    BUSINESS("business"),
    COMMERCIAL("commercial"),
    FARMING("farming");

    private final String code;

    VehicleUse(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /** Case-insensitive lookup; returns null when the text is not a known code. */
    public static VehicleUse fromCode(String text) {
        if (text == null) return null;
        String normalized = text.trim().toLowerCase();
        for (VehicleUse v : values()) {
            if (v.code.equals(normalized)) return v;
        }
        return null;
    }
}
