package com.issuepilot.orchestrator.model;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Isolated git checkout dedicated to one issue.
 */
public record Workspace(IssueRef issueRef, Path rootPath, String branchName, Instant createdAt) {

    public Path resolve(String fileName) {
        return rootPath.resolve(fileName);
    }
}
