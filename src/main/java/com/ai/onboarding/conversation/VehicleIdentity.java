package com.ai.onboarding.conversation;

import java.util.Objects;

/**
 * Identifies a vehicle either by VIN or by year, make and body type.
 * Exactly one of the two forms is populated.
 */
public final class VehicleIdentity {

    private final String vin;
    private final Integer year;
    private final String make;
    private final String bodyType;

    private VehicleIdentity(String vin, Integer year, String make, String bodyType) {
        this.vin = vin;
        this.year = year;
        this.make = make;
        this.bodyType = bodyType;
    }

    public static VehicleIdentity ofVin(String vin) {
        return new VehicleIdentity(Objects.requireNonNull(vin, "vin"), null, null, null);
    }

    public static VehicleIdentity ofDescription(int year, String make, String bodyType) {
        return new VehicleIdentity(null, year, make, bodyType);
    }

    public boolean hasVin() {
        return vin != null;
    }

    public String getVin() {
        return vin;
    }

    public Integer getYear() {
        return year;
    }

    public String getMake() {
        return make;
    }

    public String getBodyType() {
        return bodyType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VehicleIdentity)) return false;
        VehicleIdentity that = (VehicleIdentity) o;
        return Objects.equals(vin, that.vin)
                && Objects.equals(year, that.year)
                && Objects.equals(make, that.make)
                && Objects.equals(bodyType, that.bodyType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(vin, year, make, bodyType);
    }

    @Override
    public String toString() {
        return hasVin()
                ? "VehicleIdentity{vin=" + vin + "}"
                : "VehicleIdentity{year=" + year + ", make=" + make + ", bodyType=" + bodyType + "}";
    }
}
