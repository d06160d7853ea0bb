package com.issuepilot.orchestrator.model;

/**
 * How a lifecycle run ended. CONTENDED means another writer won the claim;
 * nothing was written for it.
 */
public enum RunOutcome {
    DONE,
    IN_REVIEW,
    BLOCKED,
    FAILED,
    ABANDONED,
    CONTENDED;

    /** Tracker status written when a claim is released with this outcome. */
    public IssueStatus releaseStatus() {
        return switch (this) {
            case DONE      -> IssueStatus.DONE;
            case IN_REVIEW -> IssueStatus.IN_REVIEW;
            case BLOCKED, FAILED -> IssueStatus.BLOCKED;
            case ABANDONED -> IssueStatus.READY;
            case CONTENDED -> throw new IllegalStateException("Contended runs hold no claim");
        };
    }
}
