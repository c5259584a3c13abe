package com.ai.onboarding.conversation;

import org.apache.commons.lang3.StringUtils;

import java.time.Clock;
import java.time.Year;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Per-state validators for user answers. States without an entry accept any input verbatim.
 */
public final class InputValidators {

    static final String ZIP_ERROR = "Please provide a valid 5-digit zip code.";
    static final String NAME_ERROR = "Please provide your full name (first and last).";
    static final String EMAIL_ERROR = "Please provide a valid email address.";
    static final String VEHICLE_INFO_ERROR = "Please provide either a 17-character VIN or 'Year Make Body-Type'.";
    static final String VEHICLE_USE_ERROR = "Please choose: commuting, commercial, farming, or business.";
    static final String YES_NO_ERROR = "Please answer Yes or No.";
    static final String DAYS_ERROR = "Please enter a number between 1 and 7.";
    static final String MILES_ERROR = "Please enter the number of miles (1-999).";
    static final String MILEAGE_ERROR = "Please enter annual mileage (e.g., 12000).";
    static final String LICENSE_TYPE_ERROR = "Please choose: Foreign, Personal, or Commercial.";
    static final String LICENSE_STATUS_ERROR = "Please choose: Valid or Suspended.";

    static final int MIN_VEHICLE_YEAR = 1900;

    private static final Pattern ZIP = Pattern.compile("\\d{5}");
    private static final Pattern EMAIL = Pattern.compile("[^@]+@[^@]+\\.[^@]+");
    /** 17 characters, I/O/Q excluded. */
    private static final Pattern VIN = Pattern.compile("[A-HJ-NPR-Z0-9]{17}");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Set<String> YES = Set.of("yes", "y", "yeah", "yep", "sure", "ok", "okay");
    private static final Set<String> NO = Set.of("no", "n", "nope", "nah");

    private final Clock clock;
    private final Map<ConversationState, InputValidator> validators;

    public InputValidators(Clock clock) {
        this.clock = clock;
        Map<ConversationState, InputValidator> table = new EnumMap<>(ConversationState.class);
        table.put(ConversationState.COLLECTING_ZIP, this::validateZip);
        table.put(ConversationState.COLLECTING_NAME, this::validateName);
        table.put(ConversationState.COLLECTING_EMAIL, this::validateEmail);
        table.put(ConversationState.COLLECTING_VEHICLE_INFO, this::validateVehicleInfo);
        table.put(ConversationState.COLLECTING_VEHICLE_USE, this::validateVehicleUse);
        table.put(ConversationState.COLLECTING_BLIND_SPOT, this::validateYesNo);
        table.put(ConversationState.COLLECTING_COMMUTE_DAYS, this::validateDays);
        table.put(ConversationState.COLLECTING_COMMUTE_MILES, this::validateMiles);
        table.put(ConversationState.COLLECTING_ANNUAL_MILEAGE, this::validateMileage);
        table.put(ConversationState.ASK_MORE_VEHICLES, this::validateYesNo);
        table.put(ConversationState.COLLECTING_LICENSE_TYPE, this::validateLicenseType);
        table.put(ConversationState.COLLECTING_LICENSE_STATUS, this::validateLicenseStatus);
        this.validators = Collections.unmodifiableMap(table);
    }

    public ValidationResult validate(ConversationState state, String rawInput) {
        String input = rawInput != null ? rawInput : "";
        InputValidator validator = validators.get(state);
        if (validator == null) {
            return ValidationResult.ok(ValidatedValue.text(input));
        }
        return validator.validate(input);
    }

    boolean hasValidator(ConversationState state) {
        return validators.containsKey(state);
    }

    ValidationResult validateZip(String text) {
        String zip = text.trim();
        return ZIP.matcher(zip).matches()
                ? ValidationResult.ok(ValidatedValue.text(zip))
                : ValidationResult.error(ZIP_ERROR);
    }

    ValidationResult validateName(String text) {
        String name = text.trim();
        if (StringUtils.isNotEmpty(name) && WHITESPACE.split(name).length >= 2) {
            return ValidationResult.ok(ValidatedValue.text(name));
        }
        return ValidationResult.error(NAME_ERROR);
    }

    ValidationResult validateEmail(String text) {
        String email = text.trim().toLowerCase();
        return EMAIL.matcher(email).matches()
                ? ValidationResult.ok(ValidatedValue.text(email))
                : ValidationResult.error(EMAIL_ERROR);
    }

    ValidationResult validateVehicleInfo(String text) {
        String trimmed = text.trim();
        String vin = trimmed.toUpperCase();
        if (VIN.matcher(vin).matches()) {
            return ValidationResult.ok(ValidatedValue.vehicle(VehicleIdentity.ofVin(vin)));
        }

        // year, make, then the rest as body type
        String[] parts = trimmed.isEmpty() ? new String[0] : WHITESPACE.split(trimmed, 3);
        if (parts.length == 3) {
            Integer year = parseInt(parts[0]);
            int maxYear = Year.now(clock).getValue() + 1;
            if (year != null && year >= MIN_VEHICLE_YEAR && year <= maxYear) {
                return ValidationResult.ok(ValidatedValue.vehicle(
                        VehicleIdentity.ofDescription(year, titleCase(parts[1]), titleCase(parts[2]))));
            }
        }
        return ValidationResult.error(VEHICLE_INFO_ERROR);
    }

    ValidationResult validateVehicleUse(String text) {
        VehicleUse use = VehicleUse.fromCode(text);
        return use != null
                ? ValidationResult.ok(ValidatedValue.text(use.getCode()))
                : ValidationResult.error(VEHICLE_USE_ERROR);
    }

    ValidationResult validateYesNo(String text) {
        String answer = text.trim().toLowerCase();
        if (YES.contains(answer)) {
            return ValidationResult.ok(ValidatedValue.flag(true));
        }
        if (NO.contains(answer)) {
            return ValidationResult.ok(ValidatedValue.flag(false));
        }
        return ValidationResult.error(YES_NO_ERROR);
    }

    ValidationResult validateDays(String text) {
        return boundedInt(text.trim(), 1, 7, DAYS_ERROR);
    }

    ValidationResult validateMiles(String text) {
        return boundedInt(text.trim(), 1, 999, MILES_ERROR);
    }

    ValidationResult validateMileage(String text) {
        return boundedInt(text.trim().replace(",", ""), 1, 499_999, MILEAGE_ERROR);
    }

    ValidationResult validateLicenseType(String text) {
        LicenseType type = LicenseType.fromCode(text);
        return type != null
                ? ValidationResult.ok(ValidatedValue.text(type.getCode()))
                : ValidationResult.error(LICENSE_TYPE_ERROR);
    }

    ValidationResult validateLicenseStatus(String text) {
        LicenseStatus status = LicenseStatus.fromCode(text);
        return status != null
                ? ValidationResult.ok(ValidatedValue.text(status.getCode()))
                : ValidationResult.error(LICENSE_STATUS_ERROR);
    }

    private static ValidationResult boundedInt(String text, int min, int max, String error) {
        Integer n = parseInt(text);
        if (n != null && n >= min && n <= max) {
            return ValidationResult.ok(ValidatedValue.number(n));
        }
        return ValidationResult.error(error);
    }

    private static Integer parseInt(String text) {
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** "mercedes-benz" -> "Mercedes-Benz", "CIVIC sedan" -> "Civic Sedan". */
    static String titleCase(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        boolean startOfWord = true;
        for (char c : text.toCharArray()) {
            if (Character.isLetter(c)) {
                sb.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
                startOfWord = false;
            } else {
                sb.append(c);
                startOfWord = true;
            }
        }
        return sb.toString();
    }
}
