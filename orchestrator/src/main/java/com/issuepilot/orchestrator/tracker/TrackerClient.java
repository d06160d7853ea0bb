package com.issuepilot.orchestrator.tracker;

import com.issuepilot.orchestrator.model.Issue;
import com.issuepilot.orchestrator.model.IssueRef;
import com.issuepilot.orchestrator.model.IssueStatus;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * CRUD view of the issue tracker.
 *
 * The tracker is the only state shared between orchestrator instances: the
 * status field is the claim lock and comments carry the claim protocol.
 * Every method may throw {@link TrackerException}.
 */
public interface TrackerClient {

    /** Open issues carrying {@code label} in one repository. Pull requests are excluded. */
    List<Issue> listOpenIssues(String repo, String label);

    /** Current snapshot of one issue; {@code blockingIds} is left empty. */
    Issue getIssue(IssueRef ref);

    /** Issues recorded by the tracker as blocking {@code ref}. */
    Set<IssueRef> getBlockers(IssueRef ref);

    /**
     * Re-read the status and move it to {@code next} only if it still equals
     * {@code expected}.
     *
     * @return false when the status had already changed; nothing is written
     */
    boolean compareAndSetStatus(IssueRef ref, IssueStatus expected, IssueStatus next);

    /** All comments on the issue, oldest first. */
    List<TrackerComment> listComments(IssueRef ref);

    TrackerComment postComment(IssueRef ref, String body);

    void editComment(IssueRef ref, long commentId, String body);

    void addLabels(IssueRef ref, Collection<String> labels);

    /** Removing a label the issue does not carry is not an error. */
    void removeLabel(IssueRef ref, String label);

    void assign(IssueRef ref, String login);

    /** Open a pull request, or return the open one that already exists for {@code head}. */
    PullRequest openPullRequest(IssueRef ref, String head, String base, String title, String body);
}
