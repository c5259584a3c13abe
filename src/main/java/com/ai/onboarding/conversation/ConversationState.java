package com.ai.onboarding.conversation;

/**
 * Steps of the insurance onboarding dialogue, in canonical order.
 * {@link #START} is the only initial state and {@link #COMPLETED} the only terminal one.
 */
public enum ConversationState {
    START("start"),
    COLLECTING_ZIP("collecting_zip"),
    COLLECTING_NAME("collecting_name"),
    COLLECTING_EMAIL("collecting_email"),
    VEHICLE_INTRO("vehicle_intro"),
    COLLECTING_VEHICLE_INFO("collecting_vehicle_info"),
    COLLECTING_VEHICLE_USE("collecting_vehicle_use"),
    COLLECTING_BLIND_SPOT("collecting_blind_spot"),
    COLLECTING_COMMUTE_DAYS("collecting_commute_days"),
    COLLECTING_COMMUTE_MILES("collecting_commute_miles"),
    COLLECTING_ANNUAL_MILEAGE("collecting_annual_mileage"),
    ASK_MORE_VEHICLES("ask_more_vehicles"),
    COLLECTING_LICENSE_TYPE("collecting_license_type"),
    COLLECTING_LICENSE_STATUS("collecting_license_status"),
    COMPLETED("completed");

    private final String value;

    ConversationState(String value) {
        this.value = value;
    }

    /** Wire/storage name, e.g. {@code collecting_zip}. */
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED;
    }

    public static ConversationState fromValue(String value) {
        for (ConversationState state : values()) {
            if (state.value.equals(value)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown conversation state: " + value);
    }
}
