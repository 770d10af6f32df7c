package com.domogeek.common.exception;

/**
 * Thrown when a remote calendar query fails (transport error, bad status,
 * unparseable response).
 */
public class CalendarLookupException extends DomogeekException {

    private static final String ERROR_CODE = "DMG-2002";

    private final String calendarPath;
    private final Integer statusCode;

    public CalendarLookupException(String calendarPath, String message) {
        this(calendarPath, message, (Throwable) null);
    }

    public CalendarLookupException(String calendarPath, String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
        this.calendarPath = calendarPath;
        this.statusCode = null;
    }

    public CalendarLookupException(String calendarPath, String message, Integer statusCode) {
        super(ERROR_CODE, message);
        this.calendarPath = calendarPath;
        this.statusCode = statusCode;
    }

    public String getCalendarPath() {
        return calendarPath;
    }

    /**
     * HTTP status returned by the server, {@code null} when no response was received.
     */
    public Integer getStatusCode() {
        return statusCode;
    }
}
