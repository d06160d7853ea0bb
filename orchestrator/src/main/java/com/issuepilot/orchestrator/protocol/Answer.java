package com.issuepilot.orchestrator.protocol;

import java.time.Instant;

/** Human reply to a BLOCKED message. */
public record Answer(String text, Instant postedAt) {}
