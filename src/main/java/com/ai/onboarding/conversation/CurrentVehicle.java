package com.ai.onboarding.conversation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Vehicle fields gathered so far for the vehicle currently being described.
 */
@Getter
@Setter
@NoArgsConstructor
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CurrentVehicle {

    private String vin;

    private Integer year;

    private String make;

    @JsonProperty("body_type")
    private String bodyType;

    @JsonProperty("vehicle_use")
    private String vehicleUse;

    @JsonProperty("blind_spot_warning")
    private Boolean blindSpotWarning;

    @JsonProperty("days_per_week")
    private Integer daysPerWeek;

    @JsonProperty("one_way_miles")
    private Integer oneWayMiles;

    @JsonProperty("annual_mileage")
    private Integer annualMileage;

    /** Starts a fresh vehicle from its identity; any earlier fields are dropped. */
    public static CurrentVehicle from(VehicleIdentity identity) {
        CurrentVehicle vehicle = new CurrentVehicle();
        vehicle.vin = identity.getVin();
        vehicle.year = identity.getYear();
        vehicle.make = identity.getMake();
        vehicle.bodyType = identity.getBodyType();
        return vehicle;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return vin == null && year == null && make == null && bodyType == null && vehicleUse == null
                && blindSpotWarning == null && daysPerWeek == null && oneWayMiles == null && annualMileage == null;
    }
}
