package com.issuepilot.orchestrator.dependency;

import com.issuepilot.orchestrator.model.IssueRef;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The blocking graph contains a cycle. This is a configuration error in the
 * tracker: none of the issues on the cycle can ever become eligible.
 */
public class DependencyCycleException extends RuntimeException {

    private final List<IssueRef> cycle;

    public DependencyCycleException(List<IssueRef> cycle) {
        super("Dependency cycle: " + cycle.stream().map(IssueRef::toString).collect(Collectors.joining(" -> ")));
        this.cycle = List.copyOf(cycle);
    }

    /** Issues on the cycle, first element repeated at the end. */
    public List<IssueRef> getCycle() {
        return cycle;
    }
}
