package com.issuepilot.orchestrator.lifecycle;

import com.issuepilot.orchestrator.config.IssuePilotProperties;
import com.issuepilot.orchestrator.dependency.DependencyResolver;
import com.issuepilot.orchestrator.model.Issue;
import com.issuepilot.orchestrator.model.IssueRef;
import com.issuepilot.orchestrator.model.TargetFilter;
import com.issuepilot.orchestrator.protocol.IssueProtocol;
import com.issuepilot.orchestrator.tracker.TrackerClient;
import com.issuepilot.orchestrator.tracker.TrackerIssueGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the list of issues worth trying to claim this cycle.
 *
 * Order: resumes first (someone's work is stranded), then answered BLOCKED
 * issues, then fresh READY ones; oldest issue number first within each group.
 * Being on the list guarantees nothing: the claim itself decides.
 */
@Component
public class CandidateSelector {

    private static final Logger log = LoggerFactory.getLogger(CandidateSelector.class);

    private final TrackerClient      tracker;
    private final DependencyResolver resolver;
    private final List<String>       repos;
    private final String             agentLabel;
    private final boolean            resumeInProgress;

    public CandidateSelector(TrackerClient tracker, DependencyResolver resolver, IssuePilotProperties props) {
        this.tracker          = tracker;
        this.resolver         = resolver;
        this.repos            = props.getTracker().getRepos();
        this.agentLabel       = props.getTracker().getAgentLabel();
        this.resumeInProgress = props.getPool().isResumeInProgress();
    }

    /**
     * @param exclude issues already running in this pool
     * @throws com.issuepilot.orchestrator.dependency.DependencyCycleException
     *         if a READY issue sits on a blocking cycle
     */
    public List<Candidate> select(TargetFilter target, Set<IssueRef> exclude) {
        List<Candidate> candidates = new ArrayList<>();
        for (String repo : repos) {
            List<Issue> issues = tracker.listOpenIssues(repo, agentLabel);
            TrackerIssueGraph graph = new TrackerIssueGraph(tracker).seed(issues);
            for (Issue issue : issues) {
                if (exclude.contains(issue.ref()) || !target.accepts(issue)) continue;
                classify(issue, graph).ifPresent(candidates::add);
            }
        }
        candidates.sort(Comparator
                .comparing((Candidate c) -> c.kind().ordinal())
                .thenComparing(c -> c.issue().ref().repo())
                .thenComparingInt(c -> c.issue().ref().number()));
        log.debug("{} candidate(s) for target {}", candidates.size(), target);
        return candidates;
    }

    private Optional<Candidate> classify(Issue issue, TrackerIssueGraph graph) {
        switch (issue.status()) {
            case READY -> {
                Optional<Issue> withEdges = graph.lookup(issue.ref());
                if (withEdges.isPresent() && resolver.eligible(withEdges.get(), graph)) {
                    return Optional.of(new Candidate(withEdges.get(), Candidate.Kind.READY));
                }
                return Optional.empty();
            }
            case BLOCKED -> {
                boolean answered = IssueProtocol.pendingAnswer(tracker.listComments(issue.ref())).isPresent();
                return answered ? Optional.of(new Candidate(issue, Candidate.Kind.ANSWERED)) : Optional.empty();
            }
            case IN_PROGRESS -> {
                return resumeInProgress ? Optional.of(new Candidate(issue, Candidate.Kind.RESUME)) : Optional.empty();
            }
            default -> {
                return Optional.empty();
            }
        }
    }
}
