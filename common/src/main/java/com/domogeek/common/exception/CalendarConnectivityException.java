package com.domogeek.common.exception;

/**
 * Thrown when the remote calendar server cannot be validated at startup.
 */
public class CalendarConnectivityException extends DomogeekException {

    private static final String ERROR_CODE = "DMG-2001";

    public CalendarConnectivityException(String message) {
        super(ERROR_CODE, message);
    }

    public CalendarConnectivityException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
