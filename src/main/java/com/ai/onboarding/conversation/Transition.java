package com.ai.onboarding.conversation;

/**
 * Outgoing edge of a state: a fixed successor, or one of the few data-dependent branches.
 */
public final class Transition {

    public enum Branch {
        /** Commuting vehicles go on to commute days, everything else to annual mileage. */
        BY_VEHICLE_USE,
        /** Another vehicle loops back to the vehicle intro. */
        MORE_VEHICLES,
        /** Foreign licenses skip the status question. */
        BY_LICENSE_TYPE
    }

    private final ConversationState fixed;
    private final Branch branch;

    private Transition(ConversationState fixed, Branch branch) {
        this.fixed = fixed;
        this.branch = branch;
    }

    public static Transition to(ConversationState next) {
        return new Transition(next, null);
    }

    public static Transition branch(Branch branch) {
        return new Transition(null, branch);
    }

    public boolean isFixed() {
        return fixed != null;
    }

    public ConversationState getFixed() {
        return fixed;
    }

    public Branch getBranch() {
        return branch;
    }

    @Override
    public String toString() {
        return isFixed() ? "-> " + fixed : "branch " + branch;
    }
}
