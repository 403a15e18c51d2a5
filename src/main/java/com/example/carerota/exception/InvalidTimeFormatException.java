package com.example.carerota.exception;

/**
 * A wall-clock time string that is not a valid {@code HH:MM} value.
 */
public class InvalidTimeFormatException extends IllegalArgumentException {

    private final String value;

    public InvalidTimeFormatException(String value) {
        super("Invalid time format (expected HH:MM): " + value);
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
