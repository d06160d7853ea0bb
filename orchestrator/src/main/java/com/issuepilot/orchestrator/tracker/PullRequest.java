package com.issuepilot.orchestrator.tracker;

public record PullRequest(int number, String url) {}
