package com.issuepilot.orchestrator.protocol;

import java.time.Instant;
import java.util.List;

/**
 * Bodies of the comments the orchestrator posts on an issue.
 */
public final class StatusComments {

    private static final int DIAGNOSTIC_LIMIT = 4000;

    private StatusComments() {}

    public static String claim(ClaimMarker marker, String host, String workspacePath) {
        return "**Agent Claim**\n\n"
                + "Owner: `" + marker.owner() + "`\n"
                + "Host: `" + host + "`\n"
                + "Workspace: `" + (workspacePath == null ? "pending" : workspacePath) + "`\n"
                + "Started: " + marker.claimedAt() + "\n"
                + "Heartbeat: " + marker.heartbeatAt() + "\n\n"
                + marker.render();
    }

    public static String release(String owner, String outcome, String note) {
        return "**Agent Released** (" + outcome + ")\n\n" + note + "\n\n"
                + ClaimMarker.renderRelease(owner, outcome);
    }

    /**
     * Numbered questions only: the body must parse back as the same BLOCKED
     * message.
     */
    public static String blocked(List<String> questions, String agentLabel) {
        StringBuilder sb = new StringBuilder("**BLOCKED - Agent Needs Input**\n\n");
        for (int i = 0; i < questions.size(); i++) {
            sb.append(i + 1).append(". ").append(questions.get(i).strip()).append('\n');
        }
        sb.append("\nReply with a comment starting with `ANSWER:` and re-add the `").append(agentLabel)
          .append("` label to resume in the same workspace.");
        return sb.toString();
    }

    public static String resuming(String answerFile) {
        return "**Agent Resuming**\n\nContinuing with the provided answers (`" + answerFile + "`).";
    }

    public static String failed(String reason, String diagnostic, Instant at, String agentLabel) {
        StringBuilder sb = new StringBuilder("**Agent Failed**\n\n")
                .append("Reason: ").append(reason).append('\n')
                .append("Time: ").append(at).append('\n');
        if (diagnostic != null && !diagnostic.isBlank()) {
            sb.append("\n<details><summary>Session output</summary>\n\n```\n")
              .append(tail(diagnostic, DIAGNOSTIC_LIMIT))
              .append("\n```\n</details>\n");
        }
        sb.append("\nStatus: Blocked. To retry, move the issue back to Ready and re-add the `")
          .append(agentLabel).append("` label.");
        return sb.toString();
    }

    public static String done(String summary, List<String> filesChanged, String pullRequestUrl) {
        StringBuilder sb = new StringBuilder("**Agent Complete**\n\n")
                .append(summary == null ? "" : summary.strip()).append('\n');
        if (!filesChanged.isEmpty()) {
            sb.append("\nFiles changed:\n");
            filesChanged.forEach(f -> sb.append("`").append(f).append("`\n"));
        }
        if (pullRequestUrl != null) {
            sb.append("\nPull request: ").append(pullRequestUrl).append('\n');
        }
        return sb.toString();
    }

    static String tail(String text, int max) {
        return text.length() <= max ? text : "..." + text.substring(text.length() - max);
    }
}
