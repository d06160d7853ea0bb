package com.issuepilot.orchestrator.model;

import java.util.List;

/**
 * Parsed contents of the completion marker file a backend writes when it is
 * finished (or blocked).
 */
public record CompletionMarker(
        String taskId,
        String summary,
        List<String> filesChanged,
        List<String> commandsRun,
        String status,
        List<String> blockedQuestions
) {

    public CompletionMarker {
        filesChanged     = filesChanged == null ? List.of() : List.copyOf(filesChanged);
        commandsRun      = commandsRun == null ? List.of() : List.copyOf(commandsRun);
        blockedQuestions = blockedQuestions == null ? List.of() : List.copyOf(blockedQuestions);
    }

    public boolean isBlocked() {
        return "blocked".equalsIgnoreCase(status) || !blockedQuestions.isEmpty();
    }
}
