package com.ai.onboarding.conversation;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Canned question per state. Also the fallback text whenever rephrasing is unavailable.
 */
public final class StatePrompts {

    private static final Map<ConversationState, String> PROMPTS;

    static {
        Map<ConversationState, String> p = new EnumMap<>(ConversationState.class);
        p.put(ConversationState.START,
                "Hello! I'll help you with your insurance onboarding. Let's start by getting your zip code.");
        p.put(ConversationState.COLLECTING_ZIP, "What's your 5-digit zip code?");
        p.put(ConversationState.COLLECTING_NAME, "Great! What's your full name?");
        p.put(ConversationState.COLLECTING_EMAIL, "Thanks! What's your email address?");
        p.put(ConversationState.VEHICLE_INTRO,
                "Perfect! Now let's add your vehicle. I'll need either your VIN or your vehicle's year, make, and body type.");
        p.put(ConversationState.COLLECTING_VEHICLE_INFO,
                "Please provide either your VIN or Year Make Body-Type (like '2022 Honda Civic').");
        p.put(ConversationState.COLLECTING_VEHICLE_USE,
                "How do you primarily use this vehicle? (commuting, commercial, farming, or business)");
        p.put(ConversationState.COLLECTING_BLIND_SPOT, "Does this vehicle have blind spot warning? (Yes or No)");
        p.put(ConversationState.COLLECTING_COMMUTE_DAYS, "How many days per week do you commute with this vehicle?");
        p.put(ConversationState.COLLECTING_COMMUTE_MILES, "What's your one-way distance to work/school in miles?");
        p.put(ConversationState.COLLECTING_ANNUAL_MILEAGE, "What's the estimated annual mileage for this vehicle?");
        p.put(ConversationState.ASK_MORE_VEHICLES, "Would you like to add another vehicle? (Yes or No)");
        p.put(ConversationState.COLLECTING_LICENSE_TYPE,
                "What type of license do you have? (Foreign, Personal, or Commercial)");
        p.put(ConversationState.COLLECTING_LICENSE_STATUS, "What's your license status? (Valid or Suspended)");
        p.put(ConversationState.COMPLETED, "Thank you! Your onboarding is complete.");
        PROMPTS = Collections.unmodifiableMap(p);
    }

    private StatePrompts() {
    }

    public static String get(ConversationState state) {
        return PROMPTS.getOrDefault(state, "");
    }
}
