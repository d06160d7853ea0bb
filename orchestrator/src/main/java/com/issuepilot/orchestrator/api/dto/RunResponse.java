package com.issuepilot.orchestrator.api.dto;

import com.issuepilot.orchestrator.model.BackendKind;
import com.issuepilot.orchestrator.model.IssueRun;
import com.issuepilot.orchestrator.model.LifecycleState;
import com.issuepilot.orchestrator.model.RunOutcome;

import java.time.Instant;
import java.util.UUID;

/**
 * One lifecycle epoch as returned by GET /runs and GET /runs/{id}.
 *
 * diagnostic holds the failure reason and captured session output for
 * FAILED runs, or the open questions for BLOCKED ones.
 */
public record RunResponse(
        UUID           id,
        String         issue,
        String         ownerId,
        LifecycleState state,
        RunOutcome     outcome,
        String         workspacePath,
        String         branchName,
        BackendKind    backend,
        String         model,
        int            nudgeCount,
        int            restartCount,
        Instant        startedAt,
        Instant        updatedAt,
        Instant        finishedAt,
        Instant        workspaceRemovedAt,
        String         diagnostic
) {
    public static RunResponse from(IssueRun r) {
        return new RunResponse(
                r.getId(),
                r.issueRef().toString(),
                r.getOwnerId(),
                r.getState(),
                r.getOutcome(),
                r.getWorkspacePath(),
                r.getBranchName(),
                r.getBackend(),
                r.getModel(),
                r.getNudgeCount(),
                r.getRestartCount(),
                r.getStartedAt(),
                r.getUpdatedAt(),
                r.getFinishedAt(),
                r.getWorkspaceRemovedAt(),
                r.getDiagnostic()
        );
    }
}
