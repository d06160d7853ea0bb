package com.issuepilot.orchestrator.workspace;

import com.issuepilot.orchestrator.config.IssuePilotProperties;
import com.issuepilot.orchestrator.model.Issue;
import com.issuepilot.orchestrator.model.TaskInstruction;
import org.springframework.stereotype.Component;

/**
 * Builds the task file a backend reads when its session starts.
 *
 * The document has four parts: the issue itself, the working policy, how to
 * ask for help (BLOCKED), and how to signal completion (marker file).
 */
@Component
public class InstructionRenderer {

    static final String POLICY = """
            ## Working Rules
            1. Never commit to main/master. Work only on the branch named below.
            2. Never push to the default branch. The orchestrator opens the pull request.
            3. No destructive operations (force pushes, history rewrites, deleting other branches).
            4. Run the project's tests if it has any, and fix what you break.
            5. Ask before large refactors (more than 5 files, or more than 100 lines in one file).
            6. Commit messages describe the change and reference the issue number.
            """;

    private final String markerFile;
    private final String answerFile;
    private final String agentLabel;
    private final String reviewer;

    public InstructionRenderer(IssuePilotProperties props) {
        this.markerFile = props.getWorkspace().getMarkerFile();
        this.answerFile = props.getWorkspace().getAnswerFile();
        this.agentLabel = props.getTracker().getAgentLabel();
        this.reviewer   = props.getTracker().getBlockedReviewer();
    }

    public TaskInstruction render(Issue issue, String branchName) {
        String taskId = taskId(issue);
        StringBuilder doc = new StringBuilder()
                .append("# Task ").append(taskId).append(": ").append(issue.title()).append("\n\n")
                .append(issue.body().strip()).append("\n\n")
                .append(POLICY)
                .append("\n## Blocked Protocol\n")
                .append("If you cannot continue without information from a human:\n")
                .append("1. Post an issue comment that starts with `BLOCKED:` followed by numbered questions.\n")
                .append("2. Assign the issue to ").append(reviewer == null ? "a maintainer" : "`" + reviewer + "`")
                .append(" and remove the `").append(agentLabel).append("` label.\n")
                .append("3. Write the completion marker below with `\"status\": \"blocked\"` and your questions in ")
                .append("`\"blocked_questions\"`, then exit.\n")
                .append("Answers arrive as comments starting with `ANSWER:`; when you are resumed they are also in `")
                .append(answerFile).append("`.\n")
                .append("\n## Completion Protocol\n")
                .append("When finished:\n")
                .append("1. Commit your changes on `").append(branchName).append("`.\n")
                .append("2. Push the branch: `git push origin ").append(branchName).append("`.\n")
                .append("3. Write `").append(markerFile).append("` in the repository root:\n\n")
                .append("```json\n")
                .append("{\n")
                .append("  \"task_id\": \"").append(taskId).append("\",\n")
                .append("  \"summary\": \"<what you changed and why>\",\n")
                .append("  \"files_changed\": [\"...\"],\n")
                .append("  \"commands_run\": [\"...\"]\n")
                .append("}\n")
                .append("```\n");
        return new TaskInstruction(issue.ref(), issue.title(), issue.body(), branchName, doc.toString());
    }

    public static String taskId(Issue issue) {
        return "issue-" + issue.ref().number();
    }
}
