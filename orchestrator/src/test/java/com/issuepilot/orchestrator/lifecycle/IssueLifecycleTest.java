package com.issuepilot.orchestrator.lifecycle;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.issuepilot.orchestrator.claim.ClaimManager;
import com.issuepilot.orchestrator.config.IssuePilotProperties;
import com.issuepilot.orchestrator.executor.Sleeper;
import com.issuepilot.orchestrator.model.IssueRef;
import com.issuepilot.orchestrator.model.IssueRun;
import com.issuepilot.orchestrator.model.IssueStatus;
import com.issuepilot.orchestrator.model.LifecycleState;
import com.issuepilot.orchestrator.model.RunOutcome;
import com.issuepilot.orchestrator.model.SessionStatus;
import com.issuepilot.orchestrator.service.RunLedger;
import com.issuepilot.orchestrator.session.BackendSelector;
import com.issuepilot.orchestrator.session.LivenessPolicy;
import com.issuepilot.orchestrator.support.FakeGitOperations;
import com.issuepilot.orchestrator.support.FakeSessionController;
import com.issuepilot.orchestrator.support.FakeTrackerClient;
import com.issuepilot.orchestrator.support.MutableClock;
import com.issuepilot.orchestrator.support.TestProperties;
import com.issuepilot.orchestrator.workspace.CompletionMarkerReader;
import com.issuepilot.orchestrator.workspace.InstructionRenderer;
import com.issuepilot.orchestrator.workspace.WorkspaceManager;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Scenario tests for the per-issue state machine.
 *
 * Everything external is faked in memory: the tracker, git and the backend
 * sessions. The clock only moves when the lifecycle "sleeps" between polls,
 * so each poll is exactly one minute of simulated time.
 */
@ExtendWith(MockitoExtension.class)
class IssueLifecycleTest {

    static final IssueRef REF    = new IssueRef("acme/app", 7);
    static final UUID     RUN_ID = UUID.randomUUID();

    static final String DONE_MARKER = """
            {"task_id":"issue-7","summary":"Fixed the login redirect","files_changed":["src/Login.java"]}
            """;
    static final String BLOCKED_MARKER = """
            {"task_id":"issue-7","summary":"Need a decision","status":"blocked",
             "blocked_questions":["Which auth provider?","Keep the legacy endpoint?"]}
            """;

    @TempDir Path tempDir;
    @Mock RunLedger ledger;
    @Mock IssueRun  run;

    MutableClock          clock;
    FakeTrackerClient     tracker;
    FakeGitOperations     git;
    FakeSessionController sessions;
    SimpleMeterRegistry   meters;
    IssuePilotProperties  props;
    IssueLifecycle        lifecycle;

    @BeforeEach
    void setUp() {
        clock    = new MutableClock(Instant.parse("2026-03-02T09:00:00Z"));
        tracker  = new FakeTrackerClient(clock);
        git      = new FakeGitOperations();
        sessions = new FakeSessionController(clock);
        meters   = new SimpleMeterRegistry();
        props    = TestProperties.create(tempDir);

        lenient().when(run.getId()).thenReturn(RUN_ID);
        lenient().when(ledger.open(any(), any())).thenReturn(run);

        lifecycle = newLifecycle(clock.sleeper());

        tracker.add(REF, "Fix login redirect", IssueStatus.READY);
    }

    private IssueLifecycle newLifecycle(Sleeper sleeper) {
        ClaimManager claims = new ClaimManager(tracker, "orch-a", "host-a",
                Duration.ofMinutes(15), clock, meters);
        return new IssueLifecycle(
                tracker,
                claims,
                new WorkspaceManager(git, props, clock),
                new InstructionRenderer(props),
                new CompletionMarkerReader(new ObjectMapper(), props),
                sessions,
                new LivenessPolicy(props),
                new BackendSelector(props),
                ledger,
                sleeper,
                clock,
                meters,
                props);
    }

    // ------------------------------------------------------------------
    // Done
    // ------------------------------------------------------------------

    @Test
    void run_backendWritesMarker_issueDoneWithPullRequest() {
        sessions.active().completes(DONE_MARKER);

        LifecycleResult result = lifecycle.run(ready());

        assertThat(result.finalState()).isEqualTo(LifecycleState.DONE);
        assertThat(result.outcome()).isEqualTo(RunOutcome.DONE);
        assertThat(tracker.status(REF)).isEqualTo(IssueStatus.DONE);
        assertThat(tracker.labels(REF)).doesNotContain("agent");
        assertThat(tracker.pullRequests()).containsExactly("agent/7-fix-login-redirect");
        assertThat(tracker.commentBodies(REF))
                .anyMatch(b -> b.startsWith("**Agent Complete**") && b.contains("src/Login.java"))
                .anyMatch(b -> b.contains("issuepilot:release owner=orch-a outcome=DONE"));
        assertThat(sessions.events()).last().isEqualTo("stop");
        assertThat(meters.counter("issuepilot.issue.outcomes", "outcome", "DONE").count()).isEqualTo(1.0);
        verify(ledger).finish(eq(RUN_ID), eq(LifecycleState.DONE), eq(RunOutcome.DONE), any(), any());
    }

    @Test
    void run_readyIssue_writesTaskFileIntoWorkspace() throws Exception {
        sessions.completes(DONE_MARKER);

        lifecycle.run(ready());

        Path workspace = tempDir.resolve("worktrees/acme__app/7");
        assertThat(Files.readString(workspace.resolve("TASK.md")))
                .contains("issue-7")
                .contains("Fix login redirect");
        assertThat(sessions.events().get(0)).startsWith("start " + workspace.toAbsolutePath().normalize());
    }

    @Test
    void run_reviewOnPullRequest_releasesAsInReview() {
        props.getTracker().setReviewOnPullRequest(true);
        sessions.completes(DONE_MARKER);

        LifecycleResult result = lifecycle.run(ready());

        assertThat(result.outcome()).isEqualTo(RunOutcome.IN_REVIEW);
        assertThat(tracker.status(REF)).isEqualTo(IssueStatus.IN_REVIEW);
    }

    // ------------------------------------------------------------------
    // Liveness: nudge, restart, budget
    // ------------------------------------------------------------------

    @Test
    void run_idleSession_nudgedTwiceThenRestartedInSameWorkspace() {
        // t=1 quiet, t=2 and t=3 nudges, t=4 restart, t=5 activity, t=6 done
        sessions.idle(4).active().completes(DONE_MARKER);

        LifecycleResult result = lifecycle.run(ready());

        assertThat(result.finalState()).isEqualTo(LifecycleState.DONE);
        assertThat(sessions.count("nudge")).isEqualTo(2);
        assertThat(sessions.count("restart")).isEqualTo(1);
        String workspace = tempDir.resolve("worktrees/acme__app/7").toAbsolutePath().normalize().toString();
        assertThat(sessions.events()).contains("restart " + workspace);
        assertThat(git.cloneCount()).isEqualTo(1);
        assertThat(meters.counter("issuepilot.session.nudges").count()).isEqualTo(2.0);
        assertThat(meters.counter("issuepilot.session.restarts").count()).isEqualTo(1.0);
    }

    @Test
    void run_singleNudgeBudget_oneNudgeThenOneRestart() {
        props.getSession().setMaxNudges(1);
        lifecycle = newLifecycle(clock.sleeper());
        // t=1 quiet, t=2 nudge, t=3 restart, t=4 activity, t=5 done
        sessions.idle(3).active().completes(DONE_MARKER);

        LifecycleResult result = lifecycle.run(ready());

        assertThat(result.finalState()).isEqualTo(LifecycleState.DONE);
        assertThat(sessions.count("nudge")).isEqualTo(1);
        assertThat(sessions.count("restart")).isEqualTo(1);
        List<String> liveness = sessions.events().stream()
                .filter(e -> e.startsWith("nudge") || e.startsWith("restart"))
                .map(e -> e.split(" ")[0])
                .toList();
        assertThat(liveness).containsExactly("nudge", "restart");
    }

    @Test
    void run_nudgeMessage_namesTask() {
        sessions.idle(2).completes(DONE_MARKER);

        lifecycle.run(ready());

        assertThat(sessions.events())
                .anyMatch(e -> e.startsWith("nudge ") && e.contains("issue-7") && e.contains("Fix login redirect"));
    }

    @Test
    void run_restartBudgetExhausted_failsExactlyOnce() {
        // Never any output: nudge, nudge, restart, nudge, nudge, give up.
        LifecycleResult result = lifecycle.run(ready());

        assertThat(result.finalState()).isEqualTo(LifecycleState.FAILED);
        assertThat(result.outcome()).isEqualTo(RunOutcome.FAILED);
        assertThat(sessions.count("restart")).isEqualTo(1);
        assertThat(sessions.count("nudge")).isEqualTo(4);
        assertThat(sessions.count("poll")).isEqualTo(8);

        assertThat(tracker.commentBodies(REF).stream().filter(b -> b.startsWith("**Agent Failed**")))
                .hasSize(1);
        assertThat(tracker.status(REF)).isEqualTo(IssueStatus.BLOCKED);
        assertThat(tracker.labels(REF)).contains("agent:failed").doesNotContain("agent");
        assertThat(tracker.assignees(REF)).containsExactly("maintainer");

        // FAILED is the last state and nothing returns to RUNNING after it.
        ArgumentCaptor<LifecycleState> states = ArgumentCaptor.forClass(LifecycleState.class);
        verify(ledger, atLeastOnce()).transition(eq(RUN_ID), states.capture());
        List<LifecycleState> seen = states.getAllValues();
        assertThat(seen).last().isEqualTo(LifecycleState.FAILED);
        assertThat(seen.stream().filter(s -> s == LifecycleState.FAILED)).hasSize(1);
        verify(ledger, times(1)).finish(eq(RUN_ID), eq(LifecycleState.FAILED), eq(RunOutcome.FAILED), any(), any());
    }

    @Test
    void run_sessionDiesTwice_failsWithCapturedOutput() {
        sessions.dies().dies();

        LifecycleResult result = lifecycle.run(ready());

        assertThat(result.finalState()).isEqualTo(LifecycleState.FAILED);
        assertThat(sessions.count("restart")).isEqualTo(1);
        assertThat(tracker.commentBodies(REF))
                .anyMatch(b -> b.startsWith("**Agent Failed**") && b.contains("without a completion marker"));
    }

    @Test
    void run_maxDurationExceeded_fails() {
        props.getSession().setMaxDuration(Duration.ofMinutes(3));
        sessions.active().active().active().active();

        LifecycleResult result = lifecycle.run(ready());

        assertThat(result.finalState()).isEqualTo(LifecycleState.FAILED);
        assertThat(result.detail()).contains("maximum run time");
    }

    @Test
    void run_longSession_heartbeatsClaimComment() {
        sessions.active().active().completes(DONE_MARKER);

        lifecycle.run(ready());

        // Claimed at 09:00, heartbeat due on the second poll.
        assertThat(tracker.commentBodies(REF))
                .anyMatch(b -> b.contains("issuepilot:claim owner=orch-a claimed=2026-03-02T09:00:00Z heartbeat=2026-03-02T09:02:00Z"));
    }

    // ------------------------------------------------------------------
    // Blocked / answer / resume
    // ------------------------------------------------------------------

    @Test
    void run_blockedThenAnswered_resumesInSameWorkspace() {
        sessions.completes(BLOCKED_MARKER);

        LifecycleResult first = lifecycle.run(ready());

        assertThat(first.finalState()).isEqualTo(LifecycleState.BLOCKED);
        assertThat(tracker.status(REF)).isEqualTo(IssueStatus.BLOCKED);
        assertThat(tracker.assignees(REF)).containsExactly("maintainer");
        assertThat(tracker.commentBodies(REF))
                .anyMatch(b -> b.startsWith("**BLOCKED")
                        && b.contains("1. Which auth provider?")
                        && b.contains("2. Keep the legacy endpoint?"));

        // A maintainer answers and re-adds the label.
        clock.advance(Duration.ofHours(1));
        tracker.addHumanComment(REF, "maintainer", "ANSWER: Use the OAuth provider, drop the legacy endpoint.");
        tracker.addLabels(REF, List.of("agent"));
        sessions.completes(DONE_MARKER);

        LifecycleResult second = lifecycle.run(new Candidate(tracker.getIssue(REF), Candidate.Kind.ANSWERED));

        assertThat(second.finalState()).isEqualTo(LifecycleState.DONE);
        assertThat(tracker.status(REF)).isEqualTo(IssueStatus.DONE);
        assertThat(git.cloneCount()).isEqualTo(1);

        Path workspace = tempDir.resolve("worktrees/acme__app/7").toAbsolutePath().normalize();
        List<String> starts = sessions.events().stream().filter(e -> e.startsWith("start ")).toList();
        assertThat(starts).hasSize(2).allMatch(e -> e.startsWith("start " + workspace));
        assertThat(starts.get(1)).contains("TASK_ANSWER.md");
        assertThat(workspace.resolve("TASK_ANSWER.md")).content().contains("Use the OAuth provider");
        assertThat(tracker.commentBodies(REF)).anyMatch(b -> b.startsWith("**Agent Resuming**"));
    }

    @Test
    void run_sessionExitsAfterPostingBlocked_doesNotRepeatQuestions() {
        sessions.then(s -> {
            tracker.addHumanComment(REF, "issuepilot-bot", "BLOCKED:\n1. Which database should the cache use?");
            return SessionStatus.DEAD;
        });

        LifecycleResult result = lifecycle.run(ready());

        assertThat(result.finalState()).isEqualTo(LifecycleState.BLOCKED);
        assertThat(sessions.count("restart")).isZero();
        assertThat(tracker.commentBodies(REF)).noneMatch(b -> b.startsWith("**BLOCKED"));
        assertThat(tracker.status(REF)).isEqualTo(IssueStatus.BLOCKED);
    }

    // ------------------------------------------------------------------
    // Evaluation edge cases
    // ------------------------------------------------------------------

    @Test
    void run_refusalSummary_failsInsteadOfCompleting() {
        sessions.completes("""
                {"task_id":"issue-7","summary":"I'm sorry, but I cannot help with that request."}
                """);

        LifecycleResult result = lifecycle.run(ready());

        assertThat(result.finalState()).isEqualTo(LifecycleState.FAILED);
        assertThat(tracker.pullRequests()).isEmpty();
    }

    @Test
    void run_resumeWithMarkerAlreadyPresent_evaluatesWithoutNewSession() throws Exception {
        Path workspace = tempDir.resolve("worktrees/acme__app/7");
        Files.createDirectories(workspace.resolve(".git"));
        Files.writeString(workspace.resolve("TASK_DONE.json"), DONE_MARKER);
        tracker.setStatus(REF, IssueStatus.IN_PROGRESS);

        LifecycleResult result = lifecycle.run(new Candidate(tracker.getIssue(REF), Candidate.Kind.RESUME));

        assertThat(result.finalState()).isEqualTo(LifecycleState.DONE);
        assertThat(sessions.count("start")).isZero();
        assertThat(git.cloneCount()).isZero();
    }

    // ------------------------------------------------------------------
    // Contention / cancellation
    // ------------------------------------------------------------------

    @Test
    void run_issueAlreadyTaken_returnsContendedWithoutSideEffects() {
        tracker.setStatus(REF, IssueStatus.IN_PROGRESS);

        LifecycleResult result = lifecycle.run(new Candidate(tracker.getIssue(REF).withStatus(IssueStatus.READY),
                Candidate.Kind.READY));

        assertThat(result.outcome()).isEqualTo(RunOutcome.CONTENDED);
        assertThat(sessions.events()).isEmpty();
        assertThat(tracker.commentBodies(REF)).isEmpty();
        verify(ledger, never()).open(any(), any());
    }

    @Test
    void run_interrupted_stopsSessionAndHandsIssueBack() {
        sessions.then(s -> {
            Thread.currentThread().interrupt();
            return SessionStatus.RUNNING;
        });

        LifecycleResult result = lifecycle.run(ready());

        // The interrupt flag is restored for the pool.
        assertThat(Thread.interrupted()).isTrue();
        assertThat(result.outcome()).isEqualTo(RunOutcome.ABANDONED);
        assertThat(result.finalState()).isEqualTo(LifecycleState.RELEASED);
        assertThat(sessions.events()).contains("stop");
        assertThat(tracker.status(REF)).isEqualTo(IssueStatus.READY);
        assertThat(tracker.commentBodies(REF)).anyMatch(b -> b.contains("outcome=ABANDONED"));
    }

    @Test
    void run_sleepInterruptedWithFlagCleared_interruptStillReachesPool() {
        // Thread.sleep clears the flag before throwing
        lifecycle = newLifecycle(d -> { throw new InterruptedException("sleep interrupted"); });

        LifecycleResult result = lifecycle.run(ready());

        assertThat(Thread.interrupted()).isTrue();
        assertThat(result.outcome()).isEqualTo(RunOutcome.ABANDONED);
        assertThat(sessions.events()).contains("stop");
        assertThat(tracker.status(REF)).isEqualTo(IssueStatus.READY);
    }

    private Candidate ready() {
        return new Candidate(tracker.getIssue(REF), Candidate.Kind.READY);
    }
}
