package com.issuepilot.orchestrator.model;

/**
 * Result of polling a session.
 *
 * COMPLETED only when a well-formed completion marker exists; a session that
 * vanished without one is DEAD.
 */
public enum SessionStatus {
    RUNNING,
    COMPLETED,
    DEAD
}
