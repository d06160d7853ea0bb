package com.issuepilot.orchestrator.session;

/**
 * Thrown when a session cannot be started or controlled.
 */
public class SessionException extends RuntimeException {

    public SessionException(String message) {
        super(message);
    }

    public SessionException(String message, Throwable cause) {
        super(message, cause);
    }
}
