package com.issuepilot.orchestrator.tracker;

import com.issuepilot.orchestrator.dependency.IssueGraph;
import com.issuepilot.orchestrator.model.Issue;
import com.issuepilot.orchestrator.model.IssueRef;
import com.issuepilot.orchestrator.protocol.IssueProtocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Issue graph backed by the tracker, memoized for one polling cycle.
 *
 * Blocking edges are the union of the tracker's dependency links and
 * "Depends on #n" lines in the issue body. Any read failure makes the issue
 * unknown, which the resolver treats as blocking.
 *
 * Not thread-safe; build a fresh instance per cycle.
 */
public class TrackerIssueGraph implements IssueGraph {

    private static final Logger log = LoggerFactory.getLogger(TrackerIssueGraph.class);

    private final TrackerClient tracker;
    private final Map<IssueRef, Issue>           listed   = new HashMap<>();
    private final Map<IssueRef, Optional<Issue>> resolved = new HashMap<>();

    public TrackerIssueGraph(TrackerClient tracker) {
        this.tracker = tracker;
    }

    /** Reuse snapshots from a listing call instead of fetching each issue again. */
    public TrackerIssueGraph seed(Collection<Issue> issues) {
        issues.forEach(i -> listed.put(i.ref(), i));
        return this;
    }

    @Override
    public Optional<Issue> lookup(IssueRef ref) {
        Optional<Issue> cached = resolved.get(ref);
        if (cached != null) return cached;

        Optional<Issue> result;
        try {
            Issue base = listed.containsKey(ref) ? listed.get(ref) : tracker.getIssue(ref);
            Set<IssueRef> blockers = new LinkedHashSet<>(tracker.getBlockers(ref));
            blockers.addAll(IssueProtocol.parseDependencies(base.body(), ref.repo()));
            result = Optional.of(base.withBlockingIds(blockers));
        } catch (TrackerException e) {
            log.warn("Could not read {} for dependency check, treating as blocking: {}", ref, e.getMessage());
            result = Optional.empty();
        }
        resolved.put(ref, result);
        return result;
    }
}
