package com.issuepilot.orchestrator.model;

/**
 * Execution-target routing. Issues without a target label are taken by every
 * filter.
 */
public enum TargetFilter {
    LOCAL("agent:local"),
    REMOTE("agent:remote"),
    ANY(null);

    public static final String LOCAL_LABEL  = "agent:local";
    public static final String REMOTE_LABEL = "agent:remote";

    private final String label;

    TargetFilter(String label) {
        this.label = label;
    }

    public boolean accepts(Issue issue) {
        if (this == ANY) return true;
        boolean local  = issue.hasLabel(LOCAL_LABEL);
        boolean remote = issue.hasLabel(REMOTE_LABEL);
        if (!local && !remote) return true;
        return issue.hasLabel(label);
    }

    public static TargetFilter parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown target '" + value + "' (expected local, remote or any)", e);
        }
    }
}
