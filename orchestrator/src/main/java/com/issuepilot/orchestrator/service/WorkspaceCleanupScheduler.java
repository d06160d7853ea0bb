package com.issuepilot.orchestrator.service;

import com.issuepilot.orchestrator.config.IssuePilotProperties;
import com.issuepilot.orchestrator.model.IssueRef;
import com.issuepilot.orchestrator.model.IssueRun;
import com.issuepilot.orchestrator.model.RunOutcome;
import com.issuepilot.orchestrator.pool.AgentPool;
import com.issuepilot.orchestrator.session.SessionController;
import com.issuepilot.orchestrator.workspace.WorkspaceException;
import com.issuepilot.orchestrator.workspace.WorkspaceManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * Removes workspaces of finished runs once the retention period has passed.
 *
 * BLOCKED workspaces are never removed: they hold the work an answer will
 * resume. A workspace is also skipped while its issue is active in this
 * pool or a session with its name is still alive. Those checks are repeated
 * under the workspace's lock right before the delete, together with a check
 * that no newer run of the issue has started.
 */
@Component
public class WorkspaceCleanupScheduler {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceCleanupScheduler.class);

    private final RunLedger            ledger;
    private final WorkspaceManager     workspaces;
    private final SessionController    sessions;
    private final AgentPool            pool;
    private final Clock                clock;
    private final IssuePilotProperties props;

    public WorkspaceCleanupScheduler(RunLedger ledger,
                                     WorkspaceManager workspaces,
                                     SessionController sessions,
                                     AgentPool pool,
                                     Clock clock,
                                     IssuePilotProperties props) {
        this.ledger     = ledger;
        this.workspaces = workspaces;
        this.sessions   = sessions;
        this.pool       = pool;
        this.clock      = clock;
        this.props      = props;
    }

    @Scheduled(fixedDelayString = "${issuepilot.workspace.cleanup-interval:PT30M}",
               initialDelayString = "${issuepilot.workspace.cleanup-interval:PT30M}")
    public void tick() {
        int removed = cleanup();
        if (removed > 0) {
            log.info("Removed {} expired workspace(s)", removed);
        }
    }

    /** @return number of workspaces removed */
    public int cleanup() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(props.getWorkspace().getRetention());
        Set<IssueRef> active = Set.copyOf(pool.status().activeIssues());

        int removed = 0;
        for (IssueRun run : ledger.expiredWorkspaces(cleanableOutcomes(), cutoff)) {
            IssueRef ref = run.issueRef();
            if (active.contains(ref)) {
                log.debug("Skipping workspace of {}: issue is active", ref);
                continue;
            }
            if (sessions.isAlive(sessions.sessionName(ref))) {
                log.warn("Skipping workspace of {}: session {} is still alive", ref, sessions.sessionName(ref));
                continue;
            }
            try {
                // The issue may have been dispatched again since the snapshot above.
                if (!workspaces.removeIf(ref, Path.of(run.getWorkspacePath()), () -> stillRemovable(run))) {
                    log.info("Skipping workspace of {}: issue was picked up again", ref);
                    continue;
                }
                ledger.markWorkspaceRemoved(run.getId(), now);
                removed++;
            } catch (WorkspaceException e) {
                log.warn("Could not remove workspace {} of {}: {}", run.getWorkspacePath(), ref, e.getMessage());
            }
        }
        return removed;
    }

    private boolean stillRemovable(IssueRun run) {
        IssueRef ref = run.issueRef();
        if (pool.isActive(ref) || sessions.isAlive(sessions.sessionName(ref))) {
            return false;
        }
        return ledger.latestRun(ref).map(latest -> latest.getId().equals(run.getId())).orElse(false);
    }

    Set<RunOutcome> cleanableOutcomes() {
        if (props.getWorkspace().isCleanupOnlyDone()) {
            return EnumSet.of(RunOutcome.DONE);
        }
        return EnumSet.of(RunOutcome.DONE, RunOutcome.IN_REVIEW, RunOutcome.FAILED, RunOutcome.ABANDONED);
    }
}
