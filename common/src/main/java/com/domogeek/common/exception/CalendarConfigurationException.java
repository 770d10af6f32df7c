package com.domogeek.common.exception;

/**
 * Thrown when the calendar cannot be configured, e.g. an unknown time zone id.
 * Fatal: the service must not start with it. The message names the offending
 * property.
 */
public class CalendarConfigurationException extends DomogeekException {

    private static final String ERROR_CODE = "DMG-1001";

    public CalendarConfigurationException(String property, String message, Throwable cause) {
        super(ERROR_CODE, property + ": " + message, cause);
    }
}
