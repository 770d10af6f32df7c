package com.domogeek.common.exception;

/*
 * 10/17/2026 - 9:40 AM
 * @author domogeek
 */

/**
 * Base exception for all Domogeek application exceptions
 */
public class DomogeekException extends RuntimeException {

    private final String errorCode;

    public DomogeekException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public DomogeekException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
