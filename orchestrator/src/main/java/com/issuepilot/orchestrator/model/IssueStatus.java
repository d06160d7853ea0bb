package com.issuepilot.orchestrator.model;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Closed set of workflow states an issue can be in.
 *
 * The tracker stores the status as a single {@code status:*} label. Anything
 * that does not map cleanly (no label, two labels, unknown label) is read as
 * BACKLOG, which is never claimed.
 */
public enum IssueStatus {
    BACKLOG("status:backlog"),
    READY("status:ready"),
    IN_PROGRESS("status:in-progress"),
    BLOCKED("status:blocked"),
    IN_REVIEW("status:in-review"),
    DONE("status:done");

    public static final String LABEL_PREFIX = "status:";

    private final String label;

    IssueStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Optional<IssueStatus> fromLabel(String label) {
        for (IssueStatus s : values()) {
            if (s.label.equalsIgnoreCase(label)) return Optional.of(s);
        }
        return Optional.empty();
    }

    /**
     * Validate the status once, at ingestion time.
     *
     * @param closed a closed issue is DONE regardless of its labels
     */
    public static IssueStatus fromLabels(Collection<String> labels, boolean closed) {
        if (closed) return DONE;
        List<String> statusLabels = labels.stream()
                .filter(l -> l.toLowerCase().startsWith(LABEL_PREFIX))
                .toList();
        if (statusLabels.size() != 1) return BACKLOG;
        return fromLabel(statusLabels.get(0)).orElse(BACKLOG);
    }
}
