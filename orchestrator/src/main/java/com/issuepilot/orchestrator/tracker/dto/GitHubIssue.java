package com.issuepilot.orchestrator.tracker.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Subset of the REST v3 issue object.
 *
 * {@code pull_request} is only present when the "issue" is actually a PR;
 * the issues listing returns both.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GitHubIssue(
        int number,
        String title,
        String body,
        String state,
        List<GitHubLabel> labels,
        GitHubUser assignee,
        String repository_url,
        JsonNode pull_request
) {

    public boolean isPullRequest() {
        return pull_request != null && !pull_request.isNull();
    }

    public boolean isClosed() {
        return "closed".equalsIgnoreCase(state);
    }

    public List<String> labelNames() {
        return labels == null ? List.of() : labels.stream().map(GitHubLabel::name).toList();
    }

    /** "owner/name" taken from repository_url, or null when absent. */
    public String repoFullName() {
        if (repository_url == null) return null;
        int idx = repository_url.indexOf("/repos/");
        return idx < 0 ? null : repository_url.substring(idx + "/repos/".length());
    }
}
