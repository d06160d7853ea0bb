package com.issuepilot.orchestrator.lifecycle;

import com.issuepilot.orchestrator.model.IssueRef;
import com.issuepilot.orchestrator.model.LifecycleState;
import com.issuepilot.orchestrator.model.RunOutcome;

/** What one lifecycle run ended with. */
public record LifecycleResult(IssueRef issue, LifecycleState finalState, RunOutcome outcome, String detail) {

    public static LifecycleResult contended(IssueRef issue) {
        return new LifecycleResult(issue, LifecycleState.RELEASED, RunOutcome.CONTENDED, "claim not acquired");
    }
}
