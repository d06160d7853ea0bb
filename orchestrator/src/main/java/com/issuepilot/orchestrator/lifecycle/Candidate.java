package com.issuepilot.orchestrator.lifecycle;

import com.issuepilot.orchestrator.model.Issue;

/**
 * An issue the pool may start a lifecycle for, and how it became eligible.
 */
public record Candidate(Issue issue, Kind kind) {

    public enum Kind {
        /** IN_PROGRESS with no worker here: orchestrator restart or stale owner. */
        RESUME,
        /** BLOCKED, and a human has posted an ANSWER since. */
        ANSWERED,
        /** READY with every blocker DONE. */
        READY
    }
}
