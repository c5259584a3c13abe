package com.ai.onboarding.conversation;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Percentage of onboarding completed at each state. Non-decreasing along the forward path;
 * looping back for another vehicle drops back to the vehicle intro value.
 */
public final class ProgressTracker {

    private static final Map<ConversationState, Integer> PROGRESS;

    static {
        Map<ConversationState, Integer> p = new EnumMap<>(ConversationState.class);
        p.put(ConversationState.START, 0);
        p.put(ConversationState.COLLECTING_ZIP, 10);
        p.put(ConversationState.COLLECTING_NAME, 20);
        p.put(ConversationState.COLLECTING_EMAIL, 30);
        p.put(ConversationState.VEHICLE_INTRO, 35);
        p.put(ConversationState.COLLECTING_VEHICLE_INFO, 40);
        p.put(ConversationState.COLLECTING_VEHICLE_USE, 50);
        p.put(ConversationState.COLLECTING_BLIND_SPOT, 60);
        p.put(ConversationState.COLLECTING_COMMUTE_DAYS, 65);
        p.put(ConversationState.COLLECTING_COMMUTE_MILES, 70);
        p.put(ConversationState.COLLECTING_ANNUAL_MILEAGE, 70);
        p.put(ConversationState.ASK_MORE_VEHICLES, 75);
        p.put(ConversationState.COLLECTING_LICENSE_TYPE, 85);
        p.put(ConversationState.COLLECTING_LICENSE_STATUS, 95);
        p.put(ConversationState.COMPLETED, 100);
        PROGRESS = Collections.unmodifiableMap(p);
    }

    private ProgressTracker() {
    }

    public static int progress(ConversationState state) {
        return PROGRESS.get(state);
    }
}
