package com.ai.onboarding.conversation;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import static com.ai.onboarding.conversation.ConversationState.*;

/**
 * Transition table of the onboarding dialogue.
 */
public final class StateTransitions {

    private static final Map<ConversationState, Transition> TABLE;

    static {
        Map<ConversationState, Transition> t = new EnumMap<>(ConversationState.class);
        t.put(START, Transition.to(COLLECTING_ZIP));
        t.put(COLLECTING_ZIP, Transition.to(COLLECTING_NAME));
        t.put(COLLECTING_NAME, Transition.to(COLLECTING_EMAIL));
        t.put(COLLECTING_EMAIL, Transition.to(VEHICLE_INTRO));
        t.put(VEHICLE_INTRO, Transition.to(COLLECTING_VEHICLE_INFO));
        t.put(COLLECTING_VEHICLE_INFO, Transition.to(COLLECTING_VEHICLE_USE));
        t.put(COLLECTING_VEHICLE_USE, Transition.to(COLLECTING_BLIND_SPOT));
        t.put(COLLECTING_BLIND_SPOT, Transition.branch(Transition.Branch.BY_VEHICLE_USE));
        t.put(COLLECTING_COMMUTE_DAYS, Transition.to(COLLECTING_COMMUTE_MILES));
        t.put(COLLECTING_COMMUTE_MILES, Transition.to(ASK_MORE_VEHICLES));
        t.put(COLLECTING_ANNUAL_MILEAGE, Transition.to(ASK_MORE_VEHICLES));
        t.put(ASK_MORE_VEHICLES, Transition.branch(Transition.Branch.MORE_VEHICLES));
        t.put(COLLECTING_LICENSE_TYPE, Transition.branch(Transition.Branch.BY_LICENSE_TYPE));
        t.put(COLLECTING_LICENSE_STATUS, Transition.to(COMPLETED));
        t.put(COMPLETED, Transition.to(COMPLETED));
        TABLE = Collections.unmodifiableMap(t);
    }

    private StateTransitions() {
    }

    static Transition of(ConversationState state) {
        return TABLE.get(state);
    }

    /**
     * Successor of {@code current}. {@code value} must come from a successful validation for
     * {@code current}; the blind-spot branch reads the vehicle use from {@code sessionData}.
     */
    public static ConversationState next(ConversationState current, ValidatedValue value, SessionData sessionData) {
        Transition transition = TABLE.get(current);
        if (transition.isFixed()) {
            return transition.getFixed();
        }
        switch (transition.getBranch()) {
            case BY_VEHICLE_USE:
                String use = sessionData != null ? sessionData.getCurrentVehicle().getVehicleUse() : null;
                return VehicleUse.COMMUTING.getCode().equals(use)
                        ? COLLECTING_COMMUTE_DAYS
                        : COLLECTING_ANNUAL_MILEAGE;
            case MORE_VEHICLES:
                return value.asFlag() ? VEHICLE_INTRO : COLLECTING_LICENSE_TYPE;
            case BY_LICENSE_TYPE:
                return LicenseType.FOREIGN.getCode().equals(value.asText())
                        ? COMPLETED
                        : COLLECTING_LICENSE_STATUS;
            default:
                throw new IllegalStateException("Unhandled branch " + transition.getBranch());
        }
    }
}
