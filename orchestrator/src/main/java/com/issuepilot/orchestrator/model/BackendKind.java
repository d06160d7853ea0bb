package com.issuepilot.orchestrator.model;

/** Which coding agent CLI runs inside a session. */
public enum BackendKind {
    CLAUDE,
    CODEX
}
