package com.issuepilot.orchestrator.claim;

import com.issuepilot.orchestrator.config.IssuePilotProperties;
import com.issuepilot.orchestrator.model.ClaimRecord;
import com.issuepilot.orchestrator.model.Issue;
import com.issuepilot.orchestrator.model.IssueRef;
import com.issuepilot.orchestrator.model.IssueStatus;
import com.issuepilot.orchestrator.model.RunOutcome;
import com.issuepilot.orchestrator.protocol.ClaimMarker;
import com.issuepilot.orchestrator.protocol.IssueProtocol;
import com.issuepilot.orchestrator.protocol.StatusComments;
import com.issuepilot.orchestrator.tracker.TrackerClient;
import com.issuepilot.orchestrator.tracker.TrackerComment;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Exclusive ownership of issues, built on the tracker alone.
 *
 * Two layers:
 *   1. Status compare-and-set (READY → IN_PROGRESS). Only one writer should
 *      pass, but GitHub labels are not transactional.
 *   2. Claim comment confirmation. After writing the status, each claimant
 *      posts a comment with a hidden claim marker and re-reads the thread:
 *      the earliest claim marker after the latest release marker wins. Losers
 *      withdraw their comment and back off without touching the status.
 *
 * A lost claim is never retried here; the pool moves on to another issue.
 */
@Component
public class ClaimManager {

    private static final Logger log = LoggerFactory.getLogger(ClaimManager.class);

    private final TrackerClient tracker;
    private final String        ownerId;
    private final String        host;
    private final Duration      staleAfter;
    private final Clock         clock;
    private final MeterRegistry meterRegistry;

    @Autowired
    public ClaimManager(TrackerClient tracker, IssuePilotProperties props, Clock clock, MeterRegistry meterRegistry) {
        this(tracker, resolveOwnerId(props.getClaim().getOwnerId()), hostName(),
             props.getClaim().getStaleAfter(), clock, meterRegistry);
    }

    public ClaimManager(TrackerClient tracker, String ownerId, String host, Duration staleAfter,
                        Clock clock, MeterRegistry meterRegistry) {
        this.tracker       = tracker;
        this.ownerId       = ownerId;
        this.host          = host;
        this.staleAfter    = staleAfter;
        this.clock         = clock;
        this.meterRegistry = meterRegistry;
    }

    public String ownerId() {
        return ownerId;
    }

    // ------------------------------------------------------------------
    // Claim / resume
    // ------------------------------------------------------------------

    /**
     * Claim a READY issue, or a BLOCKED one whose questions have been answered.
     *
     * @return empty when the issue is not claimable or another orchestrator won
     */
    public Optional<ClaimRecord> claim(Issue issue, String workspacePath) {
        IssueRef ref = issue.ref();
        Issue current = tracker.getIssue(ref);

        if (current.status() != IssueStatus.READY && current.status() != IssueStatus.BLOCKED) {
            log.debug("{} is {} and not claimable", ref, current.status());
            return contended(ref);
        }
        List<TrackerComment> comments = tracker.listComments(ref);
        if (current.status() == IssueStatus.BLOCKED && IssueProtocol.pendingAnswer(comments).isEmpty()) {
            log.debug("{} is BLOCKED and still waiting for an ANSWER", ref);
            return contended(ref);
        }

        if (!tracker.compareAndSetStatus(ref, current.status(), IssueStatus.IN_PROGRESS)) {
            log.info("Lost status race for {}", ref);
            return contended(ref);
        }
        closeOrphanEpoch(ref, comments);
        return postAndConfirm(ref, workspacePath, "claimed");
    }

    /**
     * Take an IN_PROGRESS issue back after an orchestrator restart.
     *
     * Allowed when the current epoch is ours, has no claim marker at all, or
     * belongs to an owner whose heartbeat is older than {@code staleAfter}.
     */
    public Optional<ClaimRecord> resume(Issue issue, String workspacePath) {
        IssueRef ref = issue.ref();
        Issue current = tracker.getIssue(ref);
        if (current.status() != IssueStatus.IN_PROGRESS) {
            return contended(ref);
        }

        List<TrackerComment> comments = tracker.listComments(ref);
        Optional<TrackerComment> epochClaim = currentEpochClaim(comments);
        if (epochClaim.isPresent()) {
            TrackerComment comment = epochClaim.get();
            ClaimMarker marker = ClaimMarker.parse(comment.body()).orElseThrow();
            if (marker.owner().equals(ownerId)) {
                Instant now = clock.instant();
                ClaimMarker refreshed = new ClaimMarker(ownerId, marker.claimedAt(), now);
                tracker.editComment(ref, comment.id(), StatusComments.claim(refreshed, host, workspacePath));
                log.info("Resuming own claim on {} (claimed {})", ref, marker.claimedAt());
                meterRegistry.counter("issuepilot.claims", "result", "resumed").increment();
                return Optional.of(new ClaimRecord(ref, ownerId, marker.claimedAt(), now, comment.id()));
            }
            Duration silent = Duration.between(marker.heartbeatAt(), clock.instant());
            if (silent.compareTo(staleAfter) < 0) {
                log.debug("{} is held by {} (heartbeat {}s ago)", ref, marker.owner(), silent.toSeconds());
                return contended(ref);
            }
            log.warn("Taking over {} from {}: no heartbeat for {}s", ref, marker.owner(), silent.toSeconds());
            tracker.postComment(ref, StatusComments.release(marker.owner(), "STALE",
                    "Heartbeat from `" + marker.owner() + "` stopped at " + marker.heartbeatAt()
                    + "; taken over by `" + ownerId + "`."));
        } else {
            log.warn("{} is IN_PROGRESS without a claim marker, claiming it", ref);
        }
        return postAndConfirm(ref, workspacePath, "taken_over");
    }

    // ------------------------------------------------------------------
    // Heartbeat / release
    // ------------------------------------------------------------------

    /** Rewrite the claim comment with a fresh heartbeat. */
    public ClaimRecord heartbeat(ClaimRecord claim, String workspacePath) {
        Instant now = clock.instant();
        ClaimMarker marker = new ClaimMarker(ownerId, claim.claimedAt(), now);
        tracker.editComment(claim.issueRef(), claim.commentId(), StatusComments.claim(marker, host, workspacePath));
        return claim.withHeartbeat(now);
    }

    /**
     * End the claim epoch: write the status for {@code outcome} and post a
     * release marker.
     *
     * @return false if the status had been changed by someone else meanwhile
     *         (the release marker is posted regardless)
     */
    public boolean release(ClaimRecord claim, RunOutcome outcome, String note) {
        IssueRef ref = claim.issueRef();
        IssueStatus target = outcome.releaseStatus();
        boolean written = tracker.compareAndSetStatus(ref, IssueStatus.IN_PROGRESS, target);
        if (!written) {
            log.warn("Status of {} changed while we held the claim; leaving it as is", ref);
        }
        tracker.postComment(ref, StatusComments.release(ownerId, outcome.name(), note));
        log.info("Released {} as {} (status {})", ref, outcome, written ? target : "unchanged");
        return written;
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private Optional<ClaimRecord> postAndConfirm(IssueRef ref, String workspacePath, String result) {
        Instant now = clock.instant();
        ClaimMarker marker = new ClaimMarker(ownerId, now, now);
        TrackerComment posted = tracker.postComment(ref, StatusComments.claim(marker, host, workspacePath));

        Optional<TrackerComment> winner = currentEpochClaim(tracker.listComments(ref));
        if (winner.isPresent() && winner.get().id() != posted.id()) {
            String other = ClaimMarker.parse(winner.get().body()).map(ClaimMarker::owner).orElse("unknown");
            log.info("Claim on {} confirmed for {}, withdrawing ours", ref, other);
            tracker.editComment(ref, posted.id(),
                    "~~Agent Claim~~ withdrawn: `" + ownerId + "` lost the claim to `" + other + "`.");
            return contended(ref);
        }

        log.info("Claimed {} as {}", ref, ownerId);
        meterRegistry.counter("issuepilot.claims", "result", result).increment();
        return Optional.of(new ClaimRecord(ref, ownerId, now, now, posted.id()));
    }

    /**
     * A claim left open by a crashed run would otherwise win every later
     * confirmation. The issue was moved out of IN_PROGRESS since, so nobody
     * holds it.
     */
    private void closeOrphanEpoch(IssueRef ref, List<TrackerComment> comments) {
        currentEpochClaim(comments)
                .flatMap(c -> ClaimMarker.parse(c.body()))
                .ifPresent(orphan -> {
                    log.info("Closing unreleased claim of {} on {}", orphan.owner(), ref);
                    tracker.postComment(ref, StatusComments.release(orphan.owner(), "RESET",
                            "Issue left IN_PROGRESS since " + orphan.claimedAt() + "; claim closed."));
                });
    }

    /** Earliest claim comment after the latest release marker. */
    static Optional<TrackerComment> currentEpochClaim(List<TrackerComment> comments) {
        int start = 0;
        for (int i = 0; i < comments.size(); i++) {
            if (ClaimMarker.isRelease(comments.get(i).body())) start = i + 1;
        }
        for (int i = start; i < comments.size(); i++) {
            if (ClaimMarker.parse(comments.get(i).body()).isPresent()) {
                return Optional.of(comments.get(i));
            }
        }
        return Optional.empty();
    }

    private Optional<ClaimRecord> contended(IssueRef ref) {
        meterRegistry.counter("issuepilot.claims", "result", "contended").increment();
        return Optional.empty();
    }

    private static String resolveOwnerId(String configured) {
        if (configured != null && !configured.isBlank()) return configured;
        return hostName() + "-" + ProcessHandle.current().pid();
    }

    private static String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.warn("Could not resolve local host name, using 'localhost': {}", e.getMessage());
            return "localhost";
        }
    }
}
