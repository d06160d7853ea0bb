package com.issuepilot.orchestrator.tracker;

/**
 * Thrown when the tracker API returns an error or is unreachable.
 *
 * Transient failures (I/O errors, rate limiting, 5xx) are retried by
 * {@link RetryingTrackerClient}; everything else surfaces immediately.
 */
public class TrackerException extends RuntimeException {

    private final int     statusCode;
    private final boolean transientFailure;

    public TrackerException(String message, int statusCode, boolean transientFailure) {
        this(message, statusCode, transientFailure, null);
    }

    public TrackerException(String message, int statusCode, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.statusCode       = statusCode;
        this.transientFailure = transientFailure;
    }

    /** I/O failure: no HTTP status. */
    public static TrackerException io(String message, Throwable cause) {
        return new TrackerException(message, -1, true, cause);
    }

    /** HTTP status, or -1 for I/O failures. */
    public int getStatusCode() {
        return statusCode;
    }

    public boolean isTransient() {
        return transientFailure;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }
}
