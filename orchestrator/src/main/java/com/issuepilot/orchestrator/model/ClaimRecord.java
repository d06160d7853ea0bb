package com.issuepilot.orchestrator.model;

import java.time.Instant;

/**
 * Proof that this orchestrator owns an issue for the current claim epoch.
 *
 * {@code commentId} points at the claim comment; heartbeats edit that comment
 * in place.
 */
public record ClaimRecord(
        IssueRef issueRef,
        String ownerId,
        Instant claimedAt,
        Instant heartbeatAt,
        long commentId
) {

    public ClaimRecord withHeartbeat(Instant at) {
        return new ClaimRecord(issueRef, ownerId, claimedAt, at, commentId);
    }
}
