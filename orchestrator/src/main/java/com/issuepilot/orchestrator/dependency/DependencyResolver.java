package com.issuepilot.orchestrator.dependency;

import com.issuepilot.orchestrator.model.Issue;
import com.issuepilot.orchestrator.model.IssueRef;
import com.issuepilot.orchestrator.model.IssueStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether an issue may be claimed given its blocking edges.
 *
 * An issue is eligible iff every issue that blocks it is DONE. A blocker that
 * cannot be read counts as open. Edges out of DONE issues are ignored: a
 * finished issue cannot hold anything back.
 */
@Component
public class DependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    /** Outcome of evaluating one issue. */
    public record Evaluation(IssueRef issue, Set<IssueRef> openBlockers, Set<IssueRef> missingBlockers) {

        public boolean eligible() {
            return openBlockers.isEmpty() && missingBlockers.isEmpty();
        }
    }

    private enum Mark { IN_PROGRESS, FINISHED }

    /**
     * @throws DependencyCycleException if the not-yet-done part of the graph
     *         reachable from {@code issue} contains a cycle
     */
    public boolean eligible(Issue issue, IssueGraph graph) {
        return evaluate(issue, graph).eligible();
    }

    public Evaluation evaluate(Issue issue, IssueGraph graph) {
        detectCycle(issue, graph);

        Set<IssueRef> open    = new LinkedHashSet<>();
        Set<IssueRef> missing = new LinkedHashSet<>();
        for (IssueRef blockerRef : issue.blockingIds()) {
            Optional<Issue> blocker = graph.lookup(blockerRef);
            if (blocker.isEmpty()) {
                missing.add(blockerRef);
            } else if (blocker.get().status() != IssueStatus.DONE) {
                open.add(blockerRef);
            }
        }
        Evaluation result = new Evaluation(issue.ref(), open, missing);
        if (!result.eligible()) {
            log.debug("{} not eligible: open blockers {}, unreadable blockers {}", issue.ref(), open, missing);
        }
        return result;
    }

    /**
     * Iterative depth-first search with three colours. A grey node reached again
     * is a back edge, i.e. a cycle; a black node reached again is just a
     * shared dependency (diamond).
     */
    private void detectCycle(Issue root, IssueGraph graph) {
        Map<IssueRef, Mark> marks = new HashMap<>();
        Map<IssueRef, List<IssueRef>> edges = new HashMap<>();
        Deque<Frame> stack = new ArrayDeque<>();

        marks.put(root.ref(), Mark.IN_PROGRESS);
        edges.put(root.ref(), List.copyOf(root.blockingIds()));
        stack.push(new Frame(root.ref()));

        while (!stack.isEmpty()) {
            Frame top = stack.peek();
            List<IssueRef> next = edges.get(top.ref);
            if (top.index >= next.size()) {
                marks.put(top.ref, Mark.FINISHED);
                stack.pop();
                continue;
            }
            IssueRef child = next.get(top.index++);
            Mark mark = marks.get(child);
            if (mark == Mark.IN_PROGRESS) {
                throw new DependencyCycleException(cyclePath(stack, child));
            }
            if (mark == Mark.FINISHED) {
                continue;
            }
            Optional<Issue> childIssue = graph.lookup(child);
            if (childIssue.isEmpty() || childIssue.get().status() == IssueStatus.DONE) {
                marks.put(child, Mark.FINISHED);
                continue;
            }
            marks.put(child, Mark.IN_PROGRESS);
            edges.put(child, List.copyOf(childIssue.get().blockingIds()));
            stack.push(new Frame(child));
        }
    }

    private static List<IssueRef> cyclePath(Deque<Frame> stack, IssueRef repeated) {
        List<IssueRef> path = new ArrayList<>();
        // Stack iterates top-down; walk bottom-up to get edge order.
        List<Frame> frames = new ArrayList<>(stack);
        boolean inCycle = false;
        for (int i = frames.size() - 1; i >= 0; i--) {
            IssueRef ref = frames.get(i).ref;
            if (ref.equals(repeated)) inCycle = true;
            if (inCycle) path.add(ref);
        }
        path.add(repeated);
        return path;
    }

    private static final class Frame {
        final IssueRef ref;
        int index;

        Frame(IssueRef ref) {
            this.ref = ref;
        }
    }
}
