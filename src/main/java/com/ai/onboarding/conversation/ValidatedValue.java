package com.ai.onboarding.conversation;

import java.util.Objects;

/**
 * Typed result of a successful validation. The {@link Kind} tells which accessor is meaningful.
 */
public final class ValidatedValue {

    public enum Kind {
        TEXT,
        FLAG,
        NUMBER,
        VEHICLE
    }

    private final Kind kind;
    private final Object value;

    private ValidatedValue(Kind kind, Object value) {
        this.kind = kind;
        this.value = Objects.requireNonNull(value, "value");
    }

    public static ValidatedValue text(String text) {
        return new ValidatedValue(Kind.TEXT, text);
    }

    public static ValidatedValue flag(boolean flag) {
        return new ValidatedValue(Kind.FLAG, flag);
    }

    public static ValidatedValue number(int number) {
        return new ValidatedValue(Kind.NUMBER, number);
    }

    public static ValidatedValue vehicle(VehicleIdentity identity) {
        return new ValidatedValue(Kind.VEHICLE, identity);
    }

    public Kind getKind() {
        return kind;
    }

    public String asText() {
        return (String) require(Kind.TEXT);
    }

    public boolean asFlag() {
        return (Boolean) require(Kind.FLAG);
    }

    public int asNumber() {
        return (Integer) require(Kind.NUMBER);
    }

    public VehicleIdentity asVehicle() {
        return (VehicleIdentity) require(Kind.VEHICLE);
    }

    private Object require(Kind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Value is " + kind + ", not " + expected);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValidatedValue)) return false;
        ValidatedValue that = (ValidatedValue) o;
        return kind == that.kind && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return kind + ":" + value;
    }
}
