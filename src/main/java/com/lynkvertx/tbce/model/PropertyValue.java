package com.lynkvertx.tbce.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.OptionalDouble;

/**
 * A numeric catalog field as read from a resolved library record.
 * Keeps "missing", "zero or negative" and "not a number" apart, even though the checks
 * substitute the same default for all three.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PropertyValue {

    public enum State {
        PRESENT,
        MISSING,
        NON_POSITIVE,
        INVALID
    }

    State state;

    /** Parsed value; NaN unless the field held a number */
    double raw;

    public static PropertyValue missing() {
        return new PropertyValue(State.MISSING, Double.NaN);
    }

    public static PropertyValue of(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return new PropertyValue(State.INVALID, Double.NaN);
        }
        return new PropertyValue(value > 0 ? State.PRESENT : State.NON_POSITIVE, value);
    }

    /**
     * Read a field value as stored in a catalog map: a {@link Number}, a numeric string, or absent.
     */
    public static PropertyValue parse(Object value) {
        if (value == null) return missing();
        if (value instanceof Number) return of(((Number) value).doubleValue());
        String text = value.toString().trim();
        if (text.isEmpty()) return missing();
        try {
            return of(Double.parseDouble(text));
        } catch (NumberFormatException e) {
            return new PropertyValue(State.INVALID, Double.NaN);
        }
    }

    public boolean isPresent() {
        return state == State.PRESENT;
    }

    /** The value when present (positive and finite), otherwise the given default */
    public double orDefault(double defaultValue) {
        return isPresent() ? raw : defaultValue;
    }

    public OptionalDouble toOptional() {
        return isPresent() ? OptionalDouble.of(raw) : OptionalDouble.empty();
    }
}
