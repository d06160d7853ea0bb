package com.issuepilot.orchestrator.workspace;

/**
 * Thrown when a workspace cannot be created, written or removed.
 */
public class WorkspaceException extends RuntimeException {

    public WorkspaceException(String message) {
        super(message);
    }

    public WorkspaceException(String message, Throwable cause) {
        super(message, cause);
    }
}
