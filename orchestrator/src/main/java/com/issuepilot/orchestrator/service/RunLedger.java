package com.issuepilot.orchestrator.service;

import com.issuepilot.orchestrator.model.IssueRef;
import com.issuepilot.orchestrator.model.IssueRun;
import com.issuepilot.orchestrator.model.LifecycleState;
import com.issuepilot.orchestrator.model.RunOutcome;
import com.issuepilot.orchestrator.model.Session;
import com.issuepilot.orchestrator.model.Workspace;
import com.issuepilot.orchestrator.repository.IssueRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistent record of every claim epoch this orchestrator has run.
 *
 * Written by lifecycle workers as they move through their states; read by the
 * control API and by workspace cleanup. All public methods that touch the DB
 * are @Transactional.
 */
@Service
public class RunLedger {

    private static final Logger log = LoggerFactory.getLogger(RunLedger.class);

    private final IssueRunRepository runRepo;

    public RunLedger(IssueRunRepository runRepo) {
        this.runRepo = runRepo;
    }

    // ------------------------------------------------------------------
    // Writes (lifecycle workers)
    // ------------------------------------------------------------------

    /** Start a new epoch right after a successful claim. */
    @Transactional
    public IssueRun open(IssueRef ref, String ownerId) {
        IssueRun run = runRepo.save(new IssueRun(ref, ownerId));
        log.debug("Opened run {} for {}", run.getId(), ref);
        return run;
    }

    @Transactional
    public void transition(UUID runId, LifecycleState state) {
        runRepo.findById(runId).ifPresent(run -> {
            run.setState(state);
            runRepo.save(run);
        });
    }

    @Transactional
    public void attachWorkspace(UUID runId, Workspace workspace) {
        runRepo.findById(runId).ifPresent(run -> {
            run.setWorkspacePath(workspace.rootPath().toString());
            run.setBranchName(workspace.branchName());
            runRepo.save(run);
        });
    }

    /** Copy backend, model and restart count from the live session. Nudges are counted separately. */
    @Transactional
    public void recordSession(UUID runId, Session session) {
        runRepo.findById(runId).ifPresent(run -> {
            run.setBackend(session.getBackend());
            run.setModel(session.getModel());
            run.setRestartCount(session.getRestartCount());
            runRepo.save(run);
        });
    }

    @Transactional
    public void incrementNudges(UUID runId) {
        runRepo.findById(runId).ifPresent(run -> {
            run.setNudgeCount(run.getNudgeCount() + 1);
            runRepo.save(run);
        });
    }

    /** Close the epoch with its terminal state and outcome. */
    @Transactional
    public void finish(UUID runId, LifecycleState state, RunOutcome outcome, String diagnostic, Instant at) {
        runRepo.findById(runId).ifPresent(run -> {
            run.setState(state);
            run.setOutcome(outcome);
            run.setDiagnostic(diagnostic);
            run.setFinishedAt(at);
            runRepo.save(run);
            log.info("Run {} for {} finished: {} ({})", runId, run.issueRef(), state, outcome);
        });
    }

    // ------------------------------------------------------------------
    // Cleanup
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public List<IssueRun> expiredWorkspaces(Collection<RunOutcome> outcomes, Instant finishedBefore) {
        return runRepo.findExpiredWorkspaces(outcomes, finishedBefore);
    }

    /** Most recent epoch of one issue. */
    @Transactional(readOnly = true)
    public Optional<IssueRun> latestRun(IssueRef ref) {
        return runRepo.findFirstByRepoAndIssueNumberOrderByStartedAtDesc(ref.repo(), ref.number());
    }

    @Transactional
    public void markWorkspaceRemoved(UUID runId, Instant at) {
        runRepo.findById(runId).ifPresent(run -> {
            run.setWorkspaceRemovedAt(at);
            runRepo.save(run);
        });
    }

    // ------------------------------------------------------------------
    // Reads (control API)
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public Optional<IssueRun> findById(UUID id) {
        return runRepo.findById(id);
    }

    /** All epochs of one issue, newest first. */
    @Transactional(readOnly = true)
    public List<IssueRun> history(IssueRef ref) {
        return runRepo.findByRepoAndIssueNumberOrderByStartedAtDesc(ref.repo(), ref.number());
    }

    @Transactional(readOnly = true)
    public List<IssueRun> recent() {
        return runRepo.findTop50ByOrderByStartedAtDesc();
    }
}
