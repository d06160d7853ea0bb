package com.issuepilot.orchestrator.tracker.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GitHubComment(long id, String body, GitHubUser user, String created_at) {}
