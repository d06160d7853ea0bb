package com.issuepilot.orchestrator.pool;

import com.issuepilot.orchestrator.model.IssueRef;

import java.util.List;

public record PoolStatus(boolean running,
                         boolean continuous,
                         int slots,
                         List<IssueRef> activeIssues,
                         int completed,
                         int failed,
                         int blocked) {

    public int idleSlots() {
        return Math.max(0, slots - activeIssues.size());
    }
}
