package com.issuepilot.orchestrator.tracker;

import com.issuepilot.orchestrator.executor.Sleeper;
import com.issuepilot.orchestrator.model.Issue;
import com.issuepilot.orchestrator.model.IssueRef;
import com.issuepilot.orchestrator.model.IssueStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Decorator that retries transient tracker failures with bounded exponential
 * backoff (base, 2×base, 4×base … capped at maxDelay).
 *
 * Non-transient failures and the last transient failure propagate unchanged.
 * {@code compareAndSetStatus} is retried too. The write of a failed attempt may
 * still have landed, so a retry that finds the issue already at the target
 * status counts as success.
 */
public class RetryingTrackerClient implements TrackerClient {

    private static final Logger log = LoggerFactory.getLogger(RetryingTrackerClient.class);

    private final TrackerClient delegate;
    private final int           maxRetries;
    private final Duration      baseDelay;
    private final Duration      maxDelay;
    private final Sleeper       sleeper;

    public RetryingTrackerClient(TrackerClient delegate, int maxRetries,
                                 Duration baseDelay, Duration maxDelay, Sleeper sleeper) {
        this.delegate   = delegate;
        this.maxRetries = maxRetries;
        this.baseDelay  = baseDelay;
        this.maxDelay   = maxDelay;
        this.sleeper    = sleeper;
    }

    @Override
    public List<Issue> listOpenIssues(String repo, String label) {
        return withRetry("listOpenIssues " + repo, () -> delegate.listOpenIssues(repo, label));
    }

    @Override
    public Issue getIssue(IssueRef ref) {
        return withRetry("getIssue " + ref, () -> delegate.getIssue(ref));
    }

    @Override
    public Set<IssueRef> getBlockers(IssueRef ref) {
        return withRetry("getBlockers " + ref, () -> delegate.getBlockers(ref));
    }

    @Override
    public boolean compareAndSetStatus(IssueRef ref, IssueStatus expected, IssueStatus next) {
        AtomicBoolean retrying = new AtomicBoolean();
        return withRetry("compareAndSetStatus " + ref, () -> {
            if (retrying.getAndSet(true) && delegate.getIssue(ref).status() == next) {
                log.info("Status of {} is already {} after a failed attempt, taking it as written", ref, next);
                return true;
            }
            return delegate.compareAndSetStatus(ref, expected, next);
        });
    }

    @Override
    public List<TrackerComment> listComments(IssueRef ref) {
        return withRetry("listComments " + ref, () -> delegate.listComments(ref));
    }

    @Override
    public TrackerComment postComment(IssueRef ref, String body) {
        return withRetry("postComment " + ref, () -> delegate.postComment(ref, body));
    }

    @Override
    public void editComment(IssueRef ref, long commentId, String body) {
        withRetry("editComment " + ref, () -> {
            delegate.editComment(ref, commentId, body);
            return null;
        });
    }

    @Override
    public void addLabels(IssueRef ref, Collection<String> labels) {
        withRetry("addLabels " + ref, () -> {
            delegate.addLabels(ref, labels);
            return null;
        });
    }

    @Override
    public void removeLabel(IssueRef ref, String label) {
        withRetry("removeLabel " + ref, () -> {
            delegate.removeLabel(ref, label);
            return null;
        });
    }

    @Override
    public void assign(IssueRef ref, String login) {
        withRetry("assign " + ref, () -> {
            delegate.assign(ref, login);
            return null;
        });
    }

    @Override
    public PullRequest openPullRequest(IssueRef ref, String head, String base, String title, String body) {
        return withRetry("openPullRequest " + ref,
                () -> delegate.openPullRequest(ref, head, base, title, body));
    }

    // ------------------------------------------------------------------
    // Backoff
    // ------------------------------------------------------------------

    private <T> T withRetry(String opName, Supplier<T> call) {
        for (int attempt = 0; ; attempt++) {
            try {
                return call.get();
            } catch (TrackerException e) {
                if (!e.isTransient() || attempt >= maxRetries) {
                    throw e;
                }
                Duration delay = delayFor(attempt);
                log.warn("{} failed ({}), retry {}/{} in {} ms",
                        opName, e.getMessage(), attempt + 1, maxRetries, delay.toMillis());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new TrackerException(opName + " interrupted during backoff", e.getStatusCode(), false, ie);
                }
            }
        }
    }

    Duration delayFor(int attempt) {
        Duration delay = baseDelay.multipliedBy(1L << Math.min(attempt, 20));
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }
}
