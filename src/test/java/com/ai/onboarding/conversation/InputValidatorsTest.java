package com.ai.onboarding.conversation;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class InputValidatorsTest {

    private static final Clock JUNE_2025 = Clock.fixed(Instant.parse("2025-06-01T12:00:00Z"), ZoneOffset.UTC);

    private final InputValidators validators = new InputValidators(JUNE_2025);

    @Test
    void zipAcceptsFiveDigitsAfterTrim() {
        ValidationResult result = validators.validate(ConversationState.COLLECTING_ZIP, "  90210 ");

        assertThat(result.isOk()).isTrue();
        assertThat(result.getValue().asText()).isEqualTo("90210");
    }

    @ParameterizedTest
    @ValueSource(strings = {"9021", "902100", "9021a", "", "90 210"})
    void zipRejectsAnythingElse(String input) {
        ValidationResult result = validators.validate(ConversationState.COLLECTING_ZIP, input);

        assertThat(result.isOk()).isFalse();
        assertThat(result.getError()).isEqualTo(InputValidators.ZIP_ERROR);
    }

    @Test
    void zipIsIdempotentOnNormalizedValue() {
        String first = validators.validate(ConversationState.COLLECTING_ZIP, "12345").getValue().asText();
        String second = validators.validate(ConversationState.COLLECTING_ZIP, first).getValue().asText();

        assertThat(second).isEqualTo(first).isEqualTo("12345");
    }

    @Test
    void nameNeedsTwoTokens() {
        assertThat(validators.validate(ConversationState.COLLECTING_NAME, " Jane   Doe ").getValue().asText())
                .isEqualTo("Jane   Doe");
        assertThat(validators.validate(ConversationState.COLLECTING_NAME, "Cher").getError())
                .isEqualTo(InputValidators.NAME_ERROR);
        assertThat(validators.validate(ConversationState.COLLECTING_NAME, "   ").isOk()).isFalse();
    }

    @Test
    void emailIsLowercasedAndShapeChecked() {
        assertThat(validators.validate(ConversationState.COLLECTING_EMAIL, " Jane.Doe@Example.COM ").getValue().asText())
                .isEqualTo("jane.doe@example.com");
        assertThat(validators.validate(ConversationState.COLLECTING_EMAIL, "a@b@c.com").isOk()).isFalse();
        assertThat(validators.validate(ConversationState.COLLECTING_EMAIL, "jane@example").isOk()).isFalse();
        assertThat(validators.validate(ConversationState.COLLECTING_EMAIL, "Not-An-Email").getError())
                .isEqualTo(InputValidators.EMAIL_ERROR);
    }

    @Test
    void vinIsUppercased() {
        ValidationResult result = validators.validate(ConversationState.COLLECTING_VEHICLE_INFO, "1hgcm82633a004352");

        assertThat(result.getValue().asVehicle()).isEqualTo(VehicleIdentity.ofVin("1HGCM82633A004352"));
    }

    @Test
    void vinWithForbiddenLettersFallsBackAndFails() {
        // last character is an I
        ValidationResult result = validators.validate(ConversationState.COLLECTING_VEHICLE_INFO, "1HGCM82633A00435I");

        assertThat(result.isOk()).isFalse();
        assertThat(result.getError()).isEqualTo(InputValidators.VEHICLE_INFO_ERROR);
    }

    @Test
    void yearMakeBodyTypeIsTitleCased() {
        VehicleIdentity identity = validators.validate(ConversationState.COLLECTING_VEHICLE_INFO, "2019 mercedes-benz SUV")
                .getValue().asVehicle();

        assertThat(identity.hasVin()).isFalse();
        assertThat(identity.getYear()).isEqualTo(2019);
        assertThat(identity.getMake()).isEqualTo("Mercedes-Benz");
        assertThat(identity.getBodyType()).isEqualTo("Suv");
    }

    @Test
    void bodyTypeKeepsTheRestOfTheInput() {
        VehicleIdentity identity = validators.validate(ConversationState.COLLECTING_VEHICLE_INFO, "2022 Honda civic sedan")
                .getValue().asVehicle();

        assertThat(identity.getBodyType()).isEqualTo("Civic Sedan");
    }

    @Test
    void vehicleYearBoundsFollowTheClock() {
        assertThat(validators.validate(ConversationState.COLLECTING_VEHICLE_INFO, "1900 Ford Truck").isOk()).isTrue();
        assertThat(validators.validate(ConversationState.COLLECTING_VEHICLE_INFO, "2026 Ford Truck").isOk()).isTrue();
        assertThat(validators.validate(ConversationState.COLLECTING_VEHICLE_INFO, "1899 Ford Truck").isOk()).isFalse();
        assertThat(validators.validate(ConversationState.COLLECTING_VEHICLE_INFO, "2027 Ford Truck").isOk()).isFalse();
        assertThat(validators.validate(ConversationState.COLLECTING_VEHICLE_INFO, "Honda Civic").isOk()).isFalse();
        assertThat(validators.validate(ConversationState.COLLECTING_VEHICLE_INFO, "new Honda Civic").isOk()).isFalse();
    }

    @Test
    void vehicleUseIsCaseInsensitive() {
        assertThat(validators.validate(ConversationState.COLLECTING_VEHICLE_USE, " Commuting ").getValue().asText())
                .isEqualTo("commuting");
        assertThat(validators.validate(ConversationState.COLLECTING_VEHICLE_USE, "FARMING").getValue().asText())
                .isEqualTo("farming");
        assertThat(validators.validate(ConversationState.COLLECTING_VEHICLE_USE, "pleasure").getError())
                .isEqualTo(InputValidators.VEHICLE_USE_ERROR);
    }

    @ParameterizedTest
    @ValueSource(strings = {"yes", "Y", "yeah", "YEP", "sure", "ok", "Okay"})
    void yesSynonyms(String input) {
        assertThat(validators.validate(ConversationState.COLLECTING_BLIND_SPOT, input).getValue().asFlag()).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"no", "N", "nope", "Nah"})
    void noSynonyms(String input) {
        assertThat(validators.validate(ConversationState.ASK_MORE_VEHICLES, input).getValue().asFlag()).isFalse();
    }

    @Test
    void yesNoRejectsOtherText() {
        assertThat(validators.validate(ConversationState.ASK_MORE_VEHICLES, "maybe").getError())
                .isEqualTo(InputValidators.YES_NO_ERROR);
        assertThat(validators.validate(ConversationState.COLLECTING_BLIND_SPOT, "yes please").isOk()).isFalse();
    }

    @Test
    void commuteDaysBoundaries() {
        assertThat(validators.validate(ConversationState.COLLECTING_COMMUTE_DAYS, "0").isOk()).isFalse();
        assertThat(validators.validate(ConversationState.COLLECTING_COMMUTE_DAYS, "8").isOk()).isFalse();
        assertThat(validators.validate(ConversationState.COLLECTING_COMMUTE_DAYS, "1").getValue().asNumber()).isEqualTo(1);
        assertThat(validators.validate(ConversationState.COLLECTING_COMMUTE_DAYS, " 7 ").getValue().asNumber()).isEqualTo(7);
        assertThat(validators.validate(ConversationState.COLLECTING_COMMUTE_DAYS, "five").getError())
                .isEqualTo(InputValidators.DAYS_ERROR);
    }

    @Test
    void commuteMilesBoundaries() {
        assertThat(validators.validate(ConversationState.COLLECTING_COMMUTE_MILES, "0").isOk()).isFalse();
        assertThat(validators.validate(ConversationState.COLLECTING_COMMUTE_MILES, "1").isOk()).isTrue();
        assertThat(validators.validate(ConversationState.COLLECTING_COMMUTE_MILES, "999").getValue().asNumber()).isEqualTo(999);
        assertThat(validators.validate(ConversationState.COLLECTING_COMMUTE_MILES, "1000").getError())
                .isEqualTo(InputValidators.MILES_ERROR);
        assertThat(validators.validate(ConversationState.COLLECTING_COMMUTE_MILES, "12.5").isOk()).isFalse();
    }

    @Test
    void annualMileageBoundariesAndThousandsSeparators() {
        assertThat(validators.validate(ConversationState.COLLECTING_ANNUAL_MILEAGE, "499999").getValue().asNumber())
                .isEqualTo(499_999);
        assertThat(validators.validate(ConversationState.COLLECTING_ANNUAL_MILEAGE, "500000").getError())
                .isEqualTo(InputValidators.MILEAGE_ERROR);
        assertThat(validators.validate(ConversationState.COLLECTING_ANNUAL_MILEAGE, "12,000").getValue().asNumber())
                .isEqualTo(12_000);
        assertThat(validators.validate(ConversationState.COLLECTING_ANNUAL_MILEAGE, "0").isOk()).isFalse();
    }

    @Test
    void licenseCodes() {
        assertThat(validators.validate(ConversationState.COLLECTING_LICENSE_TYPE, "Personal").getValue().asText())
                .isEqualTo("personal");
        assertThat(validators.validate(ConversationState.COLLECTING_LICENSE_TYPE, "learner").getError())
                .isEqualTo(InputValidators.LICENSE_TYPE_ERROR);
        assertThat(validators.validate(ConversationState.COLLECTING_LICENSE_STATUS, "SUSPENDED").getValue().asText())
                .isEqualTo("suspended");
        assertThat(validators.validate(ConversationState.COLLECTING_LICENSE_STATUS, "expired").getError())
                .isEqualTo(InputValidators.LICENSE_STATUS_ERROR);
    }

    @Test
    void statesWithoutValidatorPassInputThrough() {
        assertThat(validators.hasValidator(ConversationState.START)).isFalse();
        assertThat(validators.hasValidator(ConversationState.VEHICLE_INTRO)).isFalse();
        assertThat(validators.hasValidator(ConversationState.COMPLETED)).isFalse();

        assertThat(validators.validate(ConversationState.VEHICLE_INTRO, " sounds good ").getValue().asText())
                .isEqualTo(" sounds good ");
        assertThat(validators.validate(ConversationState.COMPLETED, null).getValue().asText()).isEmpty();
    }

    @Test
    void titleCaseCapitalizesAfterNonLetters() {
        assertThat(InputValidators.titleCase("f-150")).isEqualTo("F-150");
        assertThat(InputValidators.titleCase("4runner")).isEqualTo("4Runner");
        assertThat(InputValidators.titleCase("TOYOTA")).isEqualTo("Toyota");
    }
}
