package com.ai.onboarding.conversation;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.ToString;

/**
 * Per-conversation scratch record owned by the caller. The engine only reads it;
 * the orchestration layer fills {@code current_vehicle} across several turns and
 * resets it once the vehicle is saved.
 */
@ToString
public class SessionData {

    @JsonProperty("current_vehicle")
    private CurrentVehicle currentVehicle = new CurrentVehicle();

    public CurrentVehicle getCurrentVehicle() {
        if (currentVehicle == null) {
            currentVehicle = new CurrentVehicle();
        }
        return currentVehicle;
    }

    public void setCurrentVehicle(CurrentVehicle currentVehicle) {
        this.currentVehicle = currentVehicle != null ? currentVehicle : new CurrentVehicle();
    }

    public void resetCurrentVehicle() {
        this.currentVehicle = new CurrentVehicle();
    }
}
