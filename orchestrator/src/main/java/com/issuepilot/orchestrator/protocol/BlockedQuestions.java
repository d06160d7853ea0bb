package com.issuepilot.orchestrator.protocol;

import java.time.Instant;
import java.util.List;

/**
 * Questions raised by a backend that cannot proceed without a human.
 * Never empty.
 */
public record BlockedQuestions(List<String> questions, Instant postedAt) {

    public BlockedQuestions {
        questions = List.copyOf(questions);
        if (questions.isEmpty()) {
            throw new IllegalArgumentException("A BLOCKED message needs at least one question");
        }
    }
}
