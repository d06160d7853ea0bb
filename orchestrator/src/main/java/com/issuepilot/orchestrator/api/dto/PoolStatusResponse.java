package com.issuepilot.orchestrator.api.dto;

import com.issuepilot.orchestrator.model.IssueRef;
import com.issuepilot.orchestrator.pool.DrainReport;
import com.issuepilot.orchestrator.pool.PoolStatus;

import java.util.List;

/** Response body for GET /pool/status. lastDrain is null until a drain has finished. */
public record PoolStatusResponse(
        boolean        running,
        boolean        continuous,
        int            slots,
        int            idleSlots,
        List<String>   activeIssues,
        int            completed,
        int            failed,
        int            blocked,
        DrainSummary   lastDrain
) {
    public record DrainSummary(int started, int done, int blocked, int failed, int abandoned,
                               List<String> cycle, String configurationError, String failure) {

        static DrainSummary from(DrainReport r) {
            return new DrainSummary(r.started(), r.done(), r.blocked(), r.failed(), r.abandoned(),
                    r.cycle().stream().map(IssueRef::toString).toList(),
                    r.configurationError(), r.failure());
        }
    }

    public static PoolStatusResponse from(PoolStatus s, DrainReport last) {
        return new PoolStatusResponse(
                s.running(),
                s.continuous(),
                s.slots(),
                s.idleSlots(),
                s.activeIssues().stream().map(IssueRef::toString).sorted().toList(),
                s.completed(),
                s.failed(),
                s.blocked(),
                last == null ? null : DrainSummary.from(last)
        );
    }
}
