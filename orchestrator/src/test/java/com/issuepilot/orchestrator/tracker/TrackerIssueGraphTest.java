package com.issuepilot.orchestrator.tracker;

import com.issuepilot.orchestrator.model.Issue;
import com.issuepilot.orchestrator.model.IssueRef;
import com.issuepilot.orchestrator.model.IssueStatus;
import com.issuepilot.orchestrator.support.FakeTrackerClient;
import com.issuepilot.orchestrator.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class TrackerIssueGraphTest {

    final FakeTrackerClient tracker = new FakeTrackerClient(new MutableClock(Instant.parse("2026-03-02T09:00:00Z")));

    @Test
    void lookup_unionOfTrackerLinksAndBodyReferences() {
        IssueRef ref = new IssueRef("acme/app", 5);
        tracker.add(ref, "API change", IssueStatus.READY)
               .withBody(ref, "Needs the schema first.\nDepends on #2, acme/api#9")
               .blockedBy(ref, new IssueRef("acme/app", 3));

        Optional<Issue> issue = new TrackerIssueGraph(tracker).lookup(ref);

        assertThat(issue).isPresent();
        assertThat(issue.get().blockingIds()).containsExactlyInAnyOrder(
                new IssueRef("acme/app", 2), new IssueRef("acme/api", 9), new IssueRef("acme/app", 3));
    }

    @Test
    void lookup_unreadableIssue_emptyAndCached() {
        TrackerIssueGraph graph = new TrackerIssueGraph(tracker);
        IssueRef missing = new IssueRef("acme/app", 404);

        assertThat(graph.lookup(missing)).isEmpty();

        tracker.add(missing, "created later", IssueStatus.DONE);
        assertThat(graph.lookup(missing)).isEmpty();
    }
}
