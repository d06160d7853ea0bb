package com.issuepilot.orchestrator.claim;

import com.issuepilot.orchestrator.model.ClaimRecord;
import com.issuepilot.orchestrator.model.IssueRef;
import com.issuepilot.orchestrator.model.IssueStatus;
import com.issuepilot.orchestrator.model.RunOutcome;
import com.issuepilot.orchestrator.protocol.ClaimMarker;
import com.issuepilot.orchestrator.protocol.StatusComments;
import com.issuepilot.orchestrator.support.FakeTrackerClient;
import com.issuepilot.orchestrator.support.MutableClock;
import com.issuepilot.orchestrator.tracker.TrackerComment;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BrokenBarrierException;
import java.util.concurrent.Callable;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Claim protocol against an in-memory tracker shared by several orchestrators.
 */
class ClaimManagerTest {

    static final IssueRef REF = new IssueRef("acme/app", 12);
    static final Duration STALE_AFTER = Duration.ofMinutes(15);

    MutableClock        clock;
    FakeTrackerClient   tracker;
    SimpleMeterRegistry meters;

    @BeforeEach
    void setUp() {
        clock   = new MutableClock(Instant.parse("2026-03-02T09:00:00Z"));
        tracker = new FakeTrackerClient(clock);
        meters  = new SimpleMeterRegistry();
        tracker.add(REF, "Add rate limiting", IssueStatus.READY);
    }

    // ------------------------------------------------------------------
    // claim()
    // ------------------------------------------------------------------

    @Test
    void claim_readyIssue_movesToInProgressAndPostsMarker() {
        Optional<ClaimRecord> claim = manager("orch-a").claim(tracker.getIssue(REF), "/ws/12");

        assertThat(claim).isPresent();
        assertThat(claim.get().ownerId()).isEqualTo("orch-a");
        assertThat(tracker.status(REF)).isEqualTo(IssueStatus.IN_PROGRESS);
        assertThat(tracker.commentBodies(REF)).singleElement()
                .satisfies(b -> assertThat(ClaimMarker.parse(b)).map(ClaimMarker::owner).contains("orch-a"));
        assertThat(meters.counter("issuepilot.claims", "result", "claimed").count()).isEqualTo(1.0);
    }

    @Test
    void claim_blockedWithoutAnswer_refused() {
        tracker.setStatus(REF, IssueStatus.BLOCKED);
        tracker.addHumanComment(REF, "bot", "BLOCKED: which region?");

        assertThat(manager("orch-a").claim(tracker.getIssue(REF), "/ws/12")).isEmpty();
        assertThat(tracker.status(REF)).isEqualTo(IssueStatus.BLOCKED);
    }

    @Test
    void claim_blockedWithAnswer_claimed() {
        tracker.setStatus(REF, IssueStatus.BLOCKED);
        tracker.addHumanComment(REF, "bot", "BLOCKED: which region?");
        tracker.addHumanComment(REF, "maintainer", "ANSWER: eu-west-1");

        assertThat(manager("orch-a").claim(tracker.getIssue(REF), "/ws/12")).isPresent();
        assertThat(tracker.status(REF)).isEqualTo(IssueStatus.IN_PROGRESS);
    }

    @Test
    void claim_concurrentOrchestrators_exactlyOneWins() throws Exception {
        List<Optional<ClaimRecord>> results = race(5);

        assertThat(results.stream().filter(Optional::isPresent)).hasSize(1);
        assertThat(tracker.status(REF)).isEqualTo(IssueStatus.IN_PROGRESS);
    }

    @Test
    void claim_nonAtomicStatusWrite_commentOrderPicksSingleWinner() throws Exception {
        // Every racer passes the status check before any of them writes.
        CyclicBarrier barrier = new CyclicBarrier(3);
        tracker.setBeforeStatusWrite(() -> {
            try {
                barrier.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException | BrokenBarrierException | TimeoutException e) {
                throw new IllegalStateException(e);
            }
        });

        List<Optional<ClaimRecord>> results = race(3);

        assertThat(results.stream().filter(Optional::isPresent)).hasSize(1);
        ClaimRecord winner = results.stream().flatMap(Optional::stream).findFirst().orElseThrow();
        List<TrackerComment> comments = tracker.listComments(REF);
        // The winner's comment is the only live claim marker; losers withdrew theirs.
        assertThat(comments.stream().filter(c -> ClaimMarker.parse(c.body()).isPresent()))
                .singleElement()
                .satisfies(c -> assertThat(c.id()).isEqualTo(winner.commentId()));
        assertThat(comments.stream().filter(c -> c.body().contains("withdrawn"))).hasSize(2);
    }

    // ------------------------------------------------------------------
    // resume()
    // ------------------------------------------------------------------

    @Test
    void resume_ownClaim_refreshesHeartbeatInPlace() {
        ClaimRecord first = manager("orch-a").claim(tracker.getIssue(REF), "/ws/12").orElseThrow();
        clock.advance(Duration.ofMinutes(30));

        ClaimRecord resumed = manager("orch-a").resume(tracker.getIssue(REF), "/ws/12").orElseThrow();

        assertThat(resumed.commentId()).isEqualTo(first.commentId());
        assertThat(resumed.claimedAt()).isEqualTo(first.claimedAt());
        assertThat(resumed.heartbeatAt()).isEqualTo(clock.instant());
        assertThat(tracker.commentBodies(REF)).hasSize(1);
    }

    @Test
    void resume_foreignFreshClaim_refused() {
        manager("orch-a").claim(tracker.getIssue(REF), "/ws/12").orElseThrow();
        clock.advance(Duration.ofMinutes(5));

        Optional<ClaimRecord> taken = manager("orch-b").resume(tracker.getIssue(REF), "/ws/12");

        assertThat(taken).isEmpty();
        assertThat(meters.counter("issuepilot.claims", "result", "contended").count()).isEqualTo(1.0);
    }

    @Test
    void resume_foreignStaleClaim_takenOver() {
        manager("orch-a").claim(tracker.getIssue(REF), "/ws/12").orElseThrow();
        clock.advance(STALE_AFTER.plusMinutes(1));

        ClaimRecord taken = manager("orch-b").resume(tracker.getIssue(REF), "/ws/12").orElseThrow();

        assertThat(taken.ownerId()).isEqualTo("orch-b");
        assertThat(tracker.commentBodies(REF))
                .anyMatch(b -> b.contains("issuepilot:release owner=orch-a outcome=STALE"));
        // A later resume by the original owner sees orch-b's epoch and backs off.
        clock.advance(Duration.ofMinutes(1));
        assertThat(manager("orch-a").resume(tracker.getIssue(REF), "/ws/12")).isEmpty();
    }

    @Test
    void resume_heartbeatKeepsClaimFresh() {
        ClaimManager a = manager("orch-a");
        ClaimRecord claim = a.claim(tracker.getIssue(REF), "/ws/12").orElseThrow();
        for (int i = 0; i < 10; i++) {
            clock.advance(Duration.ofMinutes(2));
            claim = a.heartbeat(claim, "/ws/12");
        }

        assertThat(manager("orch-b").resume(tracker.getIssue(REF), "/ws/12")).isEmpty();
    }

    @Test
    void resume_inProgressWithoutMarker_claimed() {
        tracker.setStatus(REF, IssueStatus.IN_PROGRESS);

        assertThat(manager("orch-b").resume(tracker.getIssue(REF), "/ws/12")).isPresent();
    }

    // ------------------------------------------------------------------
    // release()
    // ------------------------------------------------------------------

    @Test
    void release_eachOutcome_writesMatchingStatus() {
        assertReleasedAs(RunOutcome.DONE, IssueStatus.DONE);
        assertReleasedAs(RunOutcome.IN_REVIEW, IssueStatus.IN_REVIEW);
        assertReleasedAs(RunOutcome.BLOCKED, IssueStatus.BLOCKED);
        assertReleasedAs(RunOutcome.FAILED, IssueStatus.BLOCKED);
        assertReleasedAs(RunOutcome.ABANDONED, IssueStatus.READY);
    }

    @Test
    void release_statusChangedByHuman_leavesItAndStillClosesEpoch() {
        ClaimManager a = manager("orch-a");
        ClaimRecord claim = a.claim(tracker.getIssue(REF), "/ws/12").orElseThrow();
        tracker.setStatus(REF, IssueStatus.BACKLOG);

        boolean written = a.release(claim, RunOutcome.DONE, "done");

        assertThat(written).isFalse();
        assertThat(tracker.status(REF)).isEqualTo(IssueStatus.BACKLOG);
        assertThat(ClaimManager.currentEpochClaim(tracker.listComments(REF))).isEmpty();
    }

    @Test
    void claim_afterCrashedEpoch_closesOrphanAndWins() {
        // orch-a claimed, then died; a human moved the issue back to Ready.
        manager("orch-a").claim(tracker.getIssue(REF), "/ws/12").orElseThrow();
        tracker.setStatus(REF, IssueStatus.READY);

        Optional<ClaimRecord> claim = manager("orch-b").claim(tracker.getIssue(REF), "/ws/12");

        assertThat(claim).isPresent();
        assertThat(tracker.commentBodies(REF))
                .anyMatch(b -> b.contains("issuepilot:release owner=orch-a outcome=RESET"));
    }

    @Test
    void currentEpochClaim_ignoresClaimsBeforeLatestRelease() {
        Instant t = clock.instant();
        List<TrackerComment> comments = List.of(
                new TrackerComment(1, "bot", StatusComments.claim(new ClaimMarker("a", t, t), "h", "/ws"), t),
                new TrackerComment(2, "bot", StatusComments.release("a", "DONE", "ok"), t),
                new TrackerComment(3, "bot", StatusComments.claim(new ClaimMarker("b", t, t), "h", "/ws"), t),
                new TrackerComment(4, "bot", StatusComments.claim(new ClaimMarker("c", t, t), "h", "/ws"), t));

        assertThat(ClaimManager.currentEpochClaim(comments)).map(TrackerComment::id).contains(3L);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private ClaimManager manager(String owner) {
        return new ClaimManager(tracker, owner, "host-" + owner, STALE_AFTER, clock, meters);
    }

    private List<Optional<ClaimRecord>> race(int orchestrators) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(orchestrators);
        try {
            List<Callable<Optional<ClaimRecord>>> attempts = new ArrayList<>();
            for (int i = 0; i < orchestrators; i++) {
                ClaimManager m = manager("orch-" + i);
                attempts.add(() -> m.claim(tracker.getIssue(REF), "/ws/12"));
            }
            List<Optional<ClaimRecord>> results = new ArrayList<>();
            for (Future<Optional<ClaimRecord>> f : pool.invokeAll(attempts)) {
                results.add(f.get(10, TimeUnit.SECONDS));
            }
            return results;
        } finally {
            pool.shutdownNow();
        }
    }

    private void assertReleasedAs(RunOutcome outcome, IssueStatus expected) {
        tracker.setStatus(REF, IssueStatus.READY);
        ClaimManager a = manager("orch-a");
        ClaimRecord claim = a.claim(tracker.getIssue(REF), "/ws/12").orElseThrow();

        assertThat(a.release(claim, outcome, "note")).isTrue();
        assertThat(tracker.status(REF)).as("status after %s", outcome).isEqualTo(expected);
    }
}
