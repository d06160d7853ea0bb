package com.issuepilot.orchestrator.executor;

/**
 * Thrown when a local command (git, tmux) cannot be started, times out, or
 * exits non-zero where success was required.
 */
public class ExecutorException extends RuntimeException {

    private final int exitCode;

    public ExecutorException(String message) {
        this(message, -1, null);
    }

    public ExecutorException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public ExecutorException(String message, int exitCode, Throwable cause) {
        super(message, cause);
        this.exitCode = exitCode;
    }

    /** Process exit code, or -1 when the process never produced one. */
    public int getExitCode() {
        return exitCode;
    }
}
