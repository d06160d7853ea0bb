package com.issuepilot.orchestrator.tracker;

import java.time.Instant;

/** Issue comment as returned by the tracker, in posting order. */
public record TrackerComment(long id, String author, String body, Instant createdAt) {}
