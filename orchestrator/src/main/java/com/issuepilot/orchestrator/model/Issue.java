package com.issuepilot.orchestrator.model;

import java.util.Set;

/**
 * Read-mostly snapshot of a tracker issue, refreshed every polling cycle.
 *
 * Mutations go through the tracker client; this record is never written back.
 */
public record Issue(
        IssueRef ref,
        String title,
        String body,
        IssueStatus status,
        Set<String> labels,
        String assignee,
        Set<IssueRef> blockingIds
) {

    public Issue {
        labels      = labels == null ? Set.of() : Set.copyOf(labels);
        blockingIds = blockingIds == null ? Set.of() : Set.copyOf(blockingIds);
        body        = body == null ? "" : body;
    }

    public boolean hasLabel(String label) {
        return labels.stream().anyMatch(l -> l.equalsIgnoreCase(label));
    }

    public Issue withStatus(IssueStatus newStatus) {
        return new Issue(ref, title, body, newStatus, labels, assignee, blockingIds);
    }

    public Issue withBlockingIds(Set<IssueRef> blockers) {
        return new Issue(ref, title, body, status, labels, assignee, blockers);
    }
}
