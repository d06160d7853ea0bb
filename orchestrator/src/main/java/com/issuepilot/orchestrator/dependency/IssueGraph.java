package com.issuepilot.orchestrator.dependency;

import com.issuepilot.orchestrator.model.Issue;
import com.issuepilot.orchestrator.model.IssueRef;

import java.util.Optional;

/**
 * Read access to issues and their blocking edges.
 */
public interface IssueGraph {

    /**
     * @return the issue with {@code blockingIds} populated, or empty if it
     *         does not exist or could not be read
     */
    Optional<Issue> lookup(IssueRef ref);
}
