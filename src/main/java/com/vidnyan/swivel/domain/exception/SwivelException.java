package com.vidnyan.swivel.domain.exception;

/**
 * Base exception for failures that are not validation findings.
 */
public class SwivelException extends RuntimeException {

    public SwivelException(String message) {
        super(message);
    }

    public SwivelException(String message, Throwable cause) {
        super(message, cause);
    }
}
