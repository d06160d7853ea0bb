package com.issuepilot.orchestrator.api.dto;

import java.time.Duration;

/**
 * Request body for POST /pool/drain and POST /pool/start.
 *
 * Every field is optional and falls back to issuepilot.pool.* when null.
 * target is one of local, remote or any; checkInterval is an ISO-8601
 * duration such as PT30S.
 */
public record DrainRequest(Integer concurrency, String target, Integer maxIssues, Duration checkInterval) {
}
