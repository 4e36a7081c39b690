package com.vidnyan.swivel.domain.exception;

/**
 * The sandbox process could not be prepared, started or observed.
 * This is an infrastructure fault; program crashes and timeouts are findings, not exceptions.
 */
public class SandboxException extends SwivelException {

    public SandboxException(String message) {
        super(message);
    }

    public SandboxException(String message, Throwable cause) {
        super(message, cause);
    }
}
