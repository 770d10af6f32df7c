package com.domogeek.common.exception;

/**
 * Thrown when a caller-supplied date or year cannot be evaluated.
 */
public class InvalidDateException extends DomogeekException {

    private static final String ERROR_CODE = "DMG-4001";

    private final String value;

    public InvalidDateException(String value, String message) {
        super(ERROR_CODE, message);
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
