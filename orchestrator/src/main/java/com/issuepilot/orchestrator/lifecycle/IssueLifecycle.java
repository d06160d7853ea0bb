package com.issuepilot.orchestrator.lifecycle;

import com.issuepilot.orchestrator.claim.ClaimManager;
import com.issuepilot.orchestrator.config.IssuePilotProperties;
import com.issuepilot.orchestrator.config.IssuePilotProperties.BackendChoice;
import com.issuepilot.orchestrator.executor.Sleeper;
import com.issuepilot.orchestrator.model.ClaimRecord;
import com.issuepilot.orchestrator.model.CompletionMarker;
import com.issuepilot.orchestrator.model.Issue;
import com.issuepilot.orchestrator.model.IssueRef;
import com.issuepilot.orchestrator.model.IssueRun;
import com.issuepilot.orchestrator.model.LifecycleState;
import com.issuepilot.orchestrator.model.RunOutcome;
import com.issuepilot.orchestrator.model.Session;
import com.issuepilot.orchestrator.model.SessionStatus;
import com.issuepilot.orchestrator.model.Workspace;
import com.issuepilot.orchestrator.protocol.Answer;
import com.issuepilot.orchestrator.protocol.BlockedQuestions;
import com.issuepilot.orchestrator.protocol.IssueProtocol;
import com.issuepilot.orchestrator.protocol.StatusComments;
import com.issuepilot.orchestrator.service.RunLedger;
import com.issuepilot.orchestrator.session.BackendSelector;
import com.issuepilot.orchestrator.session.LivenessPolicy;
import com.issuepilot.orchestrator.session.SessionController;
import com.issuepilot.orchestrator.tracker.PullRequest;
import com.issuepilot.orchestrator.tracker.TrackerClient;
import com.issuepilot.orchestrator.tracker.TrackerException;
import com.issuepilot.orchestrator.workspace.CompletionMarkerReader;
import com.issuepilot.orchestrator.workspace.InstructionRenderer;
import com.issuepilot.orchestrator.workspace.WorkspaceException;
import com.issuepilot.orchestrator.workspace.WorkspaceManager;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Drives one issue from claim to a terminal state.
 *
 * For a given candidate, this class:
 *   1. Claims the issue (or resumes a stranded claim)
 *   2. Materializes the workspace and writes the task file
 *   3. Starts a backend session and supervises it:
 *        → poll every pollInterval, heartbeat the claim
 *        → nudge a quiet session, restart a stuck or dead one
 *   4. Evaluates the completion marker: done, blocked or failed
 *   5. Reconciles the outcome into the tracker and releases the claim
 *
 * Runs on a pool worker thread and blocks until the issue is terminal.
 * Interrupting the thread abandons the run: the session is stopped first,
 * then the issue goes back to READY.
 */
@Component
public class IssueLifecycle {

    private static final Logger log = LoggerFactory.getLogger(IssueLifecycle.class);

    private final TrackerClient          tracker;
    private final ClaimManager           claims;
    private final WorkspaceManager       workspaces;
    private final InstructionRenderer    renderer;
    private final CompletionMarkerReader markers;
    private final SessionController      sessions;
    private final LivenessPolicy         liveness;
    private final BackendSelector        backends;
    private final RunLedger              ledger;
    private final Sleeper                sleeper;
    private final Clock                  clock;
    private final MeterRegistry          meterRegistry;
    private final IssuePilotProperties   props;

    public IssueLifecycle(TrackerClient tracker,
                          ClaimManager claims,
                          WorkspaceManager workspaces,
                          InstructionRenderer renderer,
                          CompletionMarkerReader markers,
                          SessionController sessions,
                          LivenessPolicy liveness,
                          BackendSelector backends,
                          RunLedger ledger,
                          Sleeper sleeper,
                          Clock clock,
                          MeterRegistry meterRegistry,
                          IssuePilotProperties props) {
        this.tracker       = tracker;
        this.claims        = claims;
        this.workspaces    = workspaces;
        this.renderer      = renderer;
        this.markers       = markers;
        this.sessions      = sessions;
        this.liveness      = liveness;
        this.backends      = backends;
        this.ledger        = ledger;
        this.sleeper       = sleeper;
        this.clock         = clock;
        this.meterRegistry = meterRegistry;
        this.props         = props;
    }

    // ------------------------------------------------------------------
    // Entry point, called by AgentPool for each candidate
    // ------------------------------------------------------------------

    public LifecycleResult run(Candidate candidate) {
        Issue issue = candidate.issue();
        IssueRef ref = issue.ref();

        // Every log line from this worker carries the issue.
        MDC.put("issue", ref.toString());
        MDC.put("repo", ref.repo());
        MDC.put("owner", claims.ownerId());
        Timer.Sample sample = Timer.start(meterRegistry);

        RunContext ctx = new RunContext(issue, candidate.kind(), clock.instant());
        LifecycleResult result;
        try {
            result = execute(ctx);
        } catch (InterruptedException e) {
            // The throw cleared the flag; abandon() reads it to hand the interrupt back to the pool.
            Thread.currentThread().interrupt();
            result = abandon(ctx, "worker interrupted");
        } catch (RuntimeException e) {
            if (Thread.currentThread().isInterrupted()) {
                result = abandon(ctx, "worker interrupted");
            } else if (ctx.claim == null) {
                // Nothing is held; the tracker is untouched.
                log.error("Lifecycle for {} failed before claiming: {}", ref, e.getMessage(), e);
                result = new LifecycleResult(ref, LifecycleState.FAILED, RunOutcome.CONTENDED,
                        "error before claim: " + e.getMessage());
            } else {
                log.error("Unhandled error in lifecycle for {}: {}", ref, e.getMessage(), e);
                result = fail(ctx, "Unhandled error: " + e.getMessage(), diagnostic(ctx));
            }
        } finally {
            MDC.clear();
        }

        if (result.outcome() != RunOutcome.CONTENDED) {
            sample.stop(meterRegistry.timer("issuepilot.issue.duration", "outcome", result.outcome().name()));
            meterRegistry.counter("issuepilot.issue.outcomes", "outcome", result.outcome().name()).increment();
        }
        return result;
    }

    // ------------------------------------------------------------------
    // States
    // ------------------------------------------------------------------

    private LifecycleResult execute(RunContext ctx) throws InterruptedException {
        IssueRef ref = ctx.issue.ref();
        String workspacePath = workspaces.pathFor(ref).toString();

        ctx.transition(LifecycleState.CLAIMING);
        Optional<ClaimRecord> claim = ctx.kind == Candidate.Kind.RESUME
                ? claims.resume(ctx.issue, workspacePath)
                : claims.claim(ctx.issue, workspacePath);
        if (claim.isEmpty()) {
            ctx.transition(LifecycleState.RELEASED);
            return LifecycleResult.contended(ref);
        }
        ctx.claim = claim.get();
        ctx.lastHeartbeat = clock.instant();
        record(() -> {
            IssueRun run = ledger.open(ref, claims.ownerId());
            ctx.runId = run.getId();
        });

        // -------- PREPARING --------
        ctx.transition(LifecycleState.PREPARING);
        ctx.workspace = workspaces.materialize(ctx.issue);
        record(() -> ledger.attachWorkspace(ctx.runId, ctx.workspace));
        workspaces.writeInstructions(ctx.workspace, renderer.render(ctx.issue, ctx.workspace.branchName()));

        String prompt = kickoffPrompt();
        if (ctx.kind == Candidate.Kind.ANSWERED) {
            Optional<Answer> answer = IssueProtocol.pendingAnswer(tracker.listComments(ref));
            workspaces.archiveCompletionMarker(ctx.workspace);
            if (answer.isPresent()) {
                workspaces.writeAnswer(ctx.workspace, answer.get());
                prompt = prompt + " Answers to your earlier questions are in "
                        + props.getWorkspace().getAnswerFile() + ".";
                tracker.postComment(ref, StatusComments.resuming(props.getWorkspace().getAnswerFile()));
            }
        } else if (ctx.kind == Candidate.Kind.RESUME) {
            Optional<CompletionMarker> finished = markers.read(ctx.workspace);
            if (finished.isPresent()) {
                log.info("{} already has a completion marker, evaluating without a new session", ref);
                ctx.transition(LifecycleState.EVALUATING);
                return evaluate(ctx, finished.get());
            }
        } else {
            // A reopened issue may still carry the marker of its previous run.
            workspaces.archiveCompletionMarker(ctx.workspace);
        }

        // -------- RUNNING --------
        ctx.transition(LifecycleState.RUNNING);
        BackendChoice choice = backends.select(ctx.issue);
        ctx.prompt  = prompt;
        ctx.session = sessions.start(ctx.workspace, choice.getBackend(), choice.getModel(), prompt);
        record(() -> ledger.recordSession(ctx.runId, ctx.session));
        return supervise(ctx);
    }

    private LifecycleResult supervise(RunContext ctx) throws InterruptedException {
        Duration pollInterval = props.getSession().getPollInterval();
        Duration maxDuration  = props.getSession().getMaxDuration();
        Session session = ctx.session;

        while (true) {
            sleeper.sleep(pollInterval);
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException();
            }
            Instant now = clock.instant();
            heartbeatIfDue(ctx, now);

            SessionStatus status = sessions.poll(session);
            if (status == SessionStatus.COMPLETED) {
                ctx.transition(LifecycleState.EVALUATING);
                Optional<CompletionMarker> marker = markers.read(ctx.workspace);
                if (marker.isEmpty()) {
                    // Removed or rewritten between poll and read.
                    return fail(ctx, "Completion marker became unreadable", session.getLastOutput());
                }
                return evaluate(ctx, marker.get());
            }

            if (status == SessionStatus.DEAD) {
                Optional<BlockedQuestions> blocked = IssueProtocol.latestBlocked(
                        tracker.listComments(ctx.issue.ref()), ctx.claim.claimedAt());
                if (blocked.isPresent()) {
                    log.info("Session for {} exited after posting BLOCKED", ctx.issue.ref());
                    return block(ctx, blocked.get().questions(), true);
                }
                if (liveness.canRestart(session)) {
                    log.warn("Session {} died without a completion marker", session.getName());
                    restart(ctx);
                    continue;
                }
                return fail(ctx, "Session exited without a completion marker after "
                        + session.getRestartCount() + " restart(s)", session.getLastOutput());
            }

            // RUNNING
            if (ctx.state == LifecycleState.NUDGING && session.getNudgeCount() == 0) {
                // Activity after a nudge.
                ctx.transition(LifecycleState.RUNNING);
            }
            if (Duration.between(ctx.startedAt, now).compareTo(maxDuration) > 0) {
                return fail(ctx, "Exceeded maximum run time of " + maxDuration.toMinutes() + " minutes",
                        sessions.captureOutput(session));
            }

            switch (liveness.decide(session, now)) {
                case NUDGE -> {
                    if (ctx.state != LifecycleState.NUDGING) ctx.transition(LifecycleState.NUDGING);
                    sessions.nudge(session, nudgeMessage(ctx.issue));
                    meterRegistry.counter("issuepilot.session.nudges").increment();
                    record(() -> ledger.incrementNudges(ctx.runId));
                }
                case RESTART -> restart(ctx);
                case FAIL -> {
                    return fail(ctx, "No activity after " + session.getNudgeCount() + " nudge(s) and "
                            + session.getRestartCount() + " restart(s)", sessions.captureOutput(session));
                }
                case NONE -> { }
            }
        }
    }

    private void restart(RunContext ctx) {
        if (ctx.state == LifecycleState.NUDGING) ctx.transition(LifecycleState.RUNNING);
        sessions.restart(ctx.session, ctx.prompt);
        meterRegistry.counter("issuepilot.session.restarts").increment();
        record(() -> ledger.recordSession(ctx.runId, ctx.session));
    }

    private LifecycleResult evaluate(RunContext ctx, CompletionMarker marker) {
        String expectedTask = InstructionRenderer.taskId(ctx.issue);
        if (!expectedTask.equals(marker.taskId())) {
            log.warn("Completion marker task_id '{}' does not match '{}'", marker.taskId(), expectedTask);
        }

        if (marker.isBlocked()) {
            Optional<BlockedQuestions> posted = IssueProtocol.latestBlocked(
                    tracker.listComments(ctx.issue.ref()), ctx.claim.claimedAt());
            List<String> questions = !marker.blockedQuestions().isEmpty()
                    ? marker.blockedQuestions()
                    : posted.map(BlockedQuestions::questions)
                            .orElse(List.of("The agent reported it is blocked: " + marker.summary()));
            return block(ctx, questions, posted.isPresent());
        }
        if (markers.isRefusal(marker)) {
            return fail(ctx, "Backend declined the task", marker.summary());
        }
        return complete(ctx, marker);
    }

    // ------------------------------------------------------------------
    // Terminal states
    // ------------------------------------------------------------------

    private LifecycleResult complete(RunContext ctx, CompletionMarker marker) {
        IssueRef ref = ctx.issue.ref();
        ctx.transition(LifecycleState.COMPLETING);
        stopSession(ctx);

        try {
            List<String> dirty = workspaces.uncommittedChanges(ctx.workspace);
            if (!dirty.isEmpty()) {
                log.warn("{} finished with uncommitted changes: {}", ref, dirty);
            }
        } catch (WorkspaceException e) {
            log.warn("Could not inspect working tree of {}: {}", ref, e.getMessage());
        }

        String prUrl = null;
        if (props.getTracker().isOpenPullRequests()) {
            try {
                PullRequest pr = tracker.openPullRequest(ref, ctx.workspace.branchName(),
                        props.getTracker().getBaseBranch(),
                        ctx.issue.title() + " (#" + ref.number() + ")",
                        "Closes #" + ref.number() + "\n\n" + marker.summary());
                prUrl = pr.url();
            } catch (TrackerException e) {
                return fail(ctx, "Work finished but the pull request could not be opened: " + e.getMessage(),
                        marker.summary());
            }
        }

        ctx.transition(LifecycleState.DONE);
        RunOutcome outcome = prUrl != null && props.getTracker().isReviewOnPullRequest()
                ? RunOutcome.IN_REVIEW : RunOutcome.DONE;
        String agentLabel = props.getTracker().getAgentLabel();
        String comment = StatusComments.done(marker.summary(), marker.filesChanged(), prUrl);
        bestEffort("post completion comment", () -> tracker.postComment(ref, comment));
        bestEffort("remove agent label", () -> tracker.removeLabel(ref, agentLabel));
        bestEffort("release claim", () -> claims.release(ctx.claim, outcome, "Completed."));
        finishLedger(ctx, LifecycleState.DONE, outcome, null);
        log.info("{} done{}", ref, prUrl == null ? "" : " (" + prUrl + ")");
        return new LifecycleResult(ref, LifecycleState.DONE, outcome, prUrl);
    }

    /**
     * @param alreadyPosted the backend posted its own BLOCKED comment; do not repeat it
     */
    private LifecycleResult block(RunContext ctx, List<String> questions, boolean alreadyPosted) {
        IssueRef ref = ctx.issue.ref();
        ctx.transition(LifecycleState.BLOCKED);
        stopSession(ctx);

        String agentLabel = props.getTracker().getAgentLabel();
        String reviewer   = props.getTracker().getBlockedReviewer();
        if (!alreadyPosted) {
            bestEffort("post BLOCKED comment",
                    () -> tracker.postComment(ref, StatusComments.blocked(questions, agentLabel)));
        }
        bestEffort("remove agent label", () -> tracker.removeLabel(ref, agentLabel));
        if (reviewer != null && !reviewer.isBlank()) {
            bestEffort("assign reviewer", () -> tracker.assign(ref, reviewer));
        }
        bestEffort("release claim", () -> claims.release(ctx.claim, RunOutcome.BLOCKED, "Waiting for an ANSWER."));
        String detail = String.join(" | ", questions);
        finishLedger(ctx, LifecycleState.BLOCKED, RunOutcome.BLOCKED, detail);
        log.info("{} blocked with {} question(s); workspace kept at {}", ref, questions.size(),
                ctx.workspace == null ? "-" : ctx.workspace.rootPath());
        return new LifecycleResult(ref, LifecycleState.BLOCKED, RunOutcome.BLOCKED, detail);
    }

    private LifecycleResult fail(RunContext ctx, String reason, String diagnostic) {
        IssueRef ref = ctx.issue.ref();
        if (ctx.state.canTransitionTo(LifecycleState.FAILED)) {
            ctx.transition(LifecycleState.FAILED);
        } else if (ctx.state.isTerminal()) {
            // Already reconciled; a second terminal write would duplicate comments.
            log.error("Failure after terminal state {} for {}: {}", ctx.state, ref, reason);
            return new LifecycleResult(ref, ctx.state, RunOutcome.FAILED, reason);
        }
        stopSession(ctx);

        String agentLabel = props.getTracker().getAgentLabel();
        String reviewer   = props.getTracker().getBlockedReviewer();
        String comment = StatusComments.failed(reason, diagnostic, clock.instant(), agentLabel);
        bestEffort("post failure comment", () -> tracker.postComment(ref, comment));
        bestEffort("add failed label", () -> tracker.addLabels(ref, List.of(props.getTracker().getFailedLabel())));
        bestEffort("remove agent label", () -> tracker.removeLabel(ref, agentLabel));
        if (reviewer != null && !reviewer.isBlank()) {
            bestEffort("assign reviewer", () -> tracker.assign(ref, reviewer));
        }
        bestEffort("release claim", () -> claims.release(ctx.claim, RunOutcome.FAILED, reason));
        finishLedger(ctx, LifecycleState.FAILED, RunOutcome.FAILED, reason + "\n\n" + (diagnostic == null ? "" : diagnostic));
        log.error("{} failed: {}", ref, reason);
        return new LifecycleResult(ref, LifecycleState.FAILED, RunOutcome.FAILED, reason);
    }

    /** Cancellation: stop the session, then hand the issue back as READY. */
    private LifecycleResult abandon(RunContext ctx, String why) {
        IssueRef ref = ctx.issue.ref();
        // Clear the flag so the tracker calls below are not cut short; restored at the end.
        boolean interrupted = Thread.interrupted();
        try {
            if (ctx.claim == null) {
                return LifecycleResult.contended(ref);
            }
            log.warn("Abandoning {}: {}", ref, why);
            stopSession(ctx);
            bestEffort("release claim", () -> claims.release(ctx.claim, RunOutcome.ABANDONED, "Run cancelled: " + why));
            if (ctx.state.canTransitionTo(LifecycleState.RELEASED)) {
                ctx.transition(LifecycleState.RELEASED);
            }
            finishLedger(ctx, LifecycleState.RELEASED, RunOutcome.ABANDONED, why);
            return new LifecycleResult(ref, LifecycleState.RELEASED, RunOutcome.ABANDONED, why);
        } finally {
            if (interrupted) Thread.currentThread().interrupt();
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void heartbeatIfDue(RunContext ctx, Instant now) {
        if (Duration.between(ctx.lastHeartbeat, now).compareTo(props.getClaim().getHeartbeatInterval()) < 0) {
            return;
        }
        try {
            ctx.claim = claims.heartbeat(ctx.claim, ctx.workspace.rootPath().toString());
            ctx.lastHeartbeat = now;
        } catch (TrackerException e) {
            // Next tick tries again; the stale window is several heartbeats wide.
            log.warn("Heartbeat for {} failed: {}", ctx.issue.ref(), e.getMessage());
        }
    }

    private void stopSession(RunContext ctx) {
        if (ctx.session == null) return;
        try {
            sessions.stop(ctx.session);
        } catch (RuntimeException e) {
            log.warn("Could not stop session {}: {}", ctx.session.getName(), e.getMessage());
        }
        record(() -> ledger.recordSession(ctx.runId, ctx.session));
    }

    private String diagnostic(RunContext ctx) {
        return ctx.session == null ? "" : ctx.session.getLastOutput();
    }

    private String kickoffPrompt() {
        return props.getSession().getKickoffPrompt()
                .replace("{instruction_file}", props.getWorkspace().getInstructionFile());
    }

    private String nudgeMessage(Issue issue) {
        return props.getSession().getNudgeMessage()
                .replace("{task_id}", InstructionRenderer.taskId(issue))
                .replace("{task_title}", issue.title());
    }

    private void finishLedger(RunContext ctx, LifecycleState state, RunOutcome outcome, String diagnostic) {
        record(() -> ledger.finish(ctx.runId, state, outcome, diagnostic, clock.instant()));
    }

    /** Terminal tracker writes: one failing must not stop the others. */
    private void bestEffort(String what, Runnable action) {
        try {
            action.run();
        } catch (TrackerException e) {
            log.error("Could not {} for {}: {}", what, MDC.get("issue"), e.getMessage());
        }
    }

    /** Ledger writes are audit only; a database hiccup must not fail the issue. */
    private void record(Runnable action) {
        try {
            action.run();
        } catch (DataAccessException e) {
            log.warn("Run ledger write failed: {}", e.getMessage());
        }
    }

    /** Mutable state of one run; confined to the worker thread. */
    private final class RunContext {
        final Issue          issue;
        final Candidate.Kind kind;
        final Instant        startedAt;

        LifecycleState state = LifecycleState.SELECTING;
        ClaimRecord    claim;
        Instant        lastHeartbeat;
        Workspace      workspace;
        Session        session;
        String         prompt;
        UUID           runId;

        RunContext(Issue issue, Candidate.Kind kind, Instant startedAt) {
            this.issue     = issue;
            this.kind      = kind;
            this.startedAt = startedAt;
        }

        void transition(LifecycleState next) {
            if (!state.canTransitionTo(next)) {
                throw new IllegalStateException("Illegal transition " + state + " -> " + next + " for " + issue.ref());
            }
            log.debug("{}: {} -> {}", issue.ref(), state, next);
            state = next;
            MDC.put("state", next.name());
            if (runId != null) {
                record(() -> ledger.transition(runId, next));
            }
        }
    }
}
