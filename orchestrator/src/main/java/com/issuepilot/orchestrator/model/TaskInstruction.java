package com.issuepilot.orchestrator.model;

/**
 * Rendered task file for one issue. Written once into the workspace and never
 * modified afterwards.
 */
public record TaskInstruction(
        IssueRef issueRef,
        String title,
        String body,
        String branchName,
        String document
) {
}
