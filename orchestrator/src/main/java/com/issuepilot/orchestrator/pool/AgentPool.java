package com.issuepilot.orchestrator.pool;

import com.issuepilot.orchestrator.dependency.DependencyCycleException;
import com.issuepilot.orchestrator.lifecycle.Candidate;
import com.issuepilot.orchestrator.lifecycle.CandidateSelector;
import com.issuepilot.orchestrator.lifecycle.IssueLifecycle;
import com.issuepilot.orchestrator.lifecycle.LifecycleResult;
import com.issuepilot.orchestrator.model.IssueRef;
import com.issuepilot.orchestrator.model.LifecycleState;
import com.issuepilot.orchestrator.model.RunOutcome;
import com.issuepilot.orchestrator.tracker.TrackerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs issue lifecycles on a fixed pool of worker threads.
 *
 * The coordinator loop (the thread calling {@link #drain}) is the only
 * thread that selects candidates and dispatches them. Workers each run one
 * {@link IssueLifecycle} to completion and hand the result back through a
 * queue, so pool bookkeeping is never touched from two threads at once.
 *
 * Two modes:
 *   bounded    → stop once nothing is running and a fresh fetch finds no
 *                candidate (each issue is attempted at most once per drain)
 *   continuous → keep polling every checkInterval until {@link #stop()}
 *
 * Either mode stops early after maxIssues lifecycles, or on a dependency
 * cycle: no new claims, running workers are waited for, and the drain
 * reports a configuration error.
 */
@Component
public class AgentPool {

    private static final Logger log = LoggerFactory.getLogger(AgentPool.class);

    // Longest the coordinator waits before re-checking for a stop request.
    private static final long WAIT_SLICE_MS = 1000;

    private final CandidateSelector selector;
    private final IssueLifecycle    lifecycle;

    private final AtomicBoolean running = new AtomicBoolean();
    private final Set<IssueRef>              active  = ConcurrentHashMap.newKeySet();
    private final Map<IssueRef, Future<?>>   futures = new ConcurrentHashMap<>();

    // Lifetime totals, reported by status().
    private final AtomicInteger completed = new AtomicInteger();
    private final AtomicInteger failed    = new AtomicInteger();
    private final AtomicInteger blocked   = new AtomicInteger();

    private volatile boolean     stopRequested;
    private volatile PoolOptions current;
    private volatile DrainReport lastReport;

    public AgentPool(CandidateSelector selector, IssueLifecycle lifecycle) {
        this.selector  = selector;
        this.lifecycle = lifecycle;
    }

    // ------------------------------------------------------------------
    // Control
    // ------------------------------------------------------------------

    /**
     * Run a drain on the calling thread and block until it ends.
     *
     * @throws PoolBusyException if another drain is running
     */
    public DrainReport drain(PoolOptions options) {
        acquire(options);
        return runDrain(options);
    }

    /** Run a drain on a background thread. */
    public void start(PoolOptions options) {
        acquire(options);
        Thread coordinator = new Thread(() -> runDrain(options), "issuepilot-pool");
        coordinator.start();
    }

    /**
     * Interrupt every worker. Each one stops its session and hands its issue
     * back before the drain returns.
     */
    public void stop() {
        if (!running.get()) return;
        stopRequested = true;
        log.warn("Stop requested: cancelling {} running lifecycle(s)", futures.size());
        futures.values().forEach(f -> f.cancel(true));
    }

    /** True while a lifecycle for {@code ref} is dispatched or running. */
    public boolean isActive(IssueRef ref) {
        return active.contains(ref);
    }

    public boolean isRunning() {
        return running.get();
    }

    public PoolStatus status() {
        PoolOptions options = current;
        return new PoolStatus(
                running.get(),
                options != null && options.continuous(),
                options == null ? 0 : options.maxConcurrency(),
                List.copyOf(active),
                completed.get(),
                failed.get(),
                blocked.get());
    }

    /** Report of the most recent finished drain, or null. */
    public DrainReport lastReport() {
        return lastReport;
    }

    // ------------------------------------------------------------------
    // Internals
    // ------------------------------------------------------------------

    private void acquire(PoolOptions options) {
        if (!running.compareAndSet(false, true)) {
            throw new PoolBusyException("A drain is already running");
        }
        stopRequested = false;
        current = options;
    }

    private DrainReport runDrain(PoolOptions options) {
        ExecutorService workers = Executors.newFixedThreadPool(options.maxConcurrency());
        try {
            DrainReport report = new Drain(options, workers).run();
            lastReport = report;
            log.info("Drain finished: started={} done={} blocked={} failed={} abandoned={}{}",
                    report.started(), report.done(), report.blocked(), report.failed(), report.abandoned(),
                    report.clean() ? "" : " error=" + (report.configurationError() != null
                            ? report.configurationError() : report.failure()));
            return report;
        } finally {
            workers.shutdownNow();
            futures.clear();
            active.clear();
            running.set(false);
        }
    }

    /** State of one drain; only the coordinator thread touches it. */
    private final class Drain {

        private final PoolOptions     options;
        private final ExecutorService workers;
        private final BlockingQueue<LifecycleResult> finished = new LinkedBlockingQueue<>();

        // Bounded mode: every issue dispatched in this drain.
        private final Set<IssueRef> attempted = new HashSet<>();
        // Continuous mode: contended issues and when, skipped for one check interval.
        private final Map<IssueRef, Long> contendedAt = new HashMap<>();

        private int started;
        private int done;
        private int blockedCount;
        private int failedCount;
        private int abandoned;
        private List<IssueRef> cycle = List.of();
        private String configurationError;
        private String failure;

        Drain(PoolOptions options, ExecutorService workers) {
            this.options = options;
            this.workers = workers;
        }

        DrainReport run() {
            log.info("Drain starting: concurrency={} target={} maxIssues={} continuous={}",
                    options.maxConcurrency(), options.target(),
                    options.limited() ? options.maxIssues() : "unlimited", options.continuous());
            boolean interrupted = false;
            try {
                while (!stopRequested) {
                    boolean limitReached = options.limited() && started >= options.maxIssues();
                    int dispatched = 0;
                    if (!limitReached && active.size() < options.maxConcurrency()) {
                        List<Candidate> candidates;
                        try {
                            candidates = selector.select(options.target(), excluded());
                        } catch (DependencyCycleException e) {
                            configurationError = e.getMessage();
                            cycle = e.getCycle();
                            log.error("Dependency cycle, no new issues will be claimed: {}", e.getMessage());
                            break;
                        } catch (TrackerException e) {
                            if (!options.continuous()) {
                                failure = "Could not list candidates: " + e.getMessage();
                                log.error(failure);
                                break;
                            }
                            log.warn("Could not list candidates, retrying in {}: {}",
                                    options.checkInterval(), e.getMessage());
                            candidates = List.of();
                        }
                        dispatched = dispatchAll(candidates);
                    }

                    if (active.isEmpty() && dispatched == 0
                            && (!options.continuous() || (options.limited() && started >= options.maxIssues()))) {
                        break;
                    }
                    // A free slot or the next check, whichever comes first.
                    awaitResults(options.checkInterval());
                }
            } catch (InterruptedException e) {
                interrupted = true;
                stop();
            } catch (RuntimeException e) {
                failure = "Pool error: " + e.getMessage();
                log.error("Drain aborted: {}", e.getMessage(), e);
            }

            interrupted |= waitForWorkers();
            if (interrupted) Thread.currentThread().interrupt();
            if (stopRequested && failure == null && configurationError == null && !options.continuous()) {
                failure = "Stopped before the queue was drained";
            }
            return new DrainReport(started, done, blockedCount, failedCount, abandoned,
                    cycle, configurationError, failure);
        }

        private int dispatchAll(List<Candidate> candidates) {
            int dispatched = 0;
            for (Candidate candidate : candidates) {
                if (stopRequested) break;
                if (active.size() >= options.maxConcurrency()) break;
                if (options.limited() && started >= options.maxIssues()) break;
                IssueRef ref = candidate.issue().ref();
                if (active.contains(ref)) continue;

                // Registered before it can run, so stop() always sees it.
                FutureTask<Void> task = new FutureTask<>(() -> finished.add(runOne(candidate)), null);
                futures.put(ref, task);
                if (stopRequested) {
                    // stop() may have walked the map before the put.
                    futures.remove(ref);
                    task.cancel(true);
                    break;
                }
                active.add(ref);
                attempted.add(ref);
                started++;
                dispatched++;
                log.info("Dispatching {} ({})", ref, candidate.kind());
                workers.execute(task);
            }
            return dispatched;
        }

        private LifecycleResult runOne(Candidate candidate) {
            try {
                return lifecycle.run(candidate);
            } catch (RuntimeException e) {
                log.error("Unhandled error in lifecycle for {}: {}", candidate.issue().ref(), e.getMessage(), e);
                return new LifecycleResult(candidate.issue().ref(), LifecycleState.FAILED,
                        RunOutcome.FAILED, "Unhandled exception: " + e.getMessage());
            }
        }

        private void awaitResults(Duration timeout) throws InterruptedException {
            long deadline = System.nanoTime() + timeout.toNanos();
            while (!stopRequested) {
                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remainingMs <= 0) return;
                LifecycleResult result = finished.poll(Math.min(remainingMs, WAIT_SLICE_MS), TimeUnit.MILLISECONDS);
                if (result != null) {
                    account(result);
                    for (LifecycleResult more; (more = finished.poll()) != null; ) {
                        account(more);
                    }
                    return;
                }
            }
        }

        /** @return true if the coordinator was interrupted while waiting */
        private boolean waitForWorkers() {
            boolean interrupted = Thread.interrupted();
            workers.shutdown();
            while (!active.isEmpty()) {
                if (stopRequested) {
                    // No-op for futures stop() already cancelled; never interrupts a worker twice.
                    futures.values().forEach(f -> f.cancel(true));
                }
                try {
                    LifecycleResult result = finished.poll(WAIT_SLICE_MS, TimeUnit.MILLISECONDS);
                    if (result != null) {
                        account(result);
                    } else if (workers.isTerminated()) {
                        break;
                    }
                } catch (InterruptedException e) {
                    interrupted = true;
                    stop();
                }
            }
            for (LifecycleResult more; (more = finished.poll()) != null; ) {
                account(more);
            }
            if (!active.isEmpty()) {
                // Cancelled before a worker picked them up: never claimed.
                log.info("{} dispatched issue(s) cancelled before starting: {}", active.size(), active);
                started -= active.size();
            }
            return interrupted;
        }

        private void account(LifecycleResult result) {
            IssueRef ref = result.issue();
            active.remove(ref);
            futures.remove(ref);
            switch (result.outcome()) {
                case DONE, IN_REVIEW -> { done++; completed.incrementAndGet(); }
                case BLOCKED -> { blockedCount++; blocked.incrementAndGet(); }
                case FAILED -> { failedCount++; failed.incrementAndGet(); }
                case ABANDONED -> abandoned++;
                case CONTENDED -> {
                    // Someone else holds it; does not count against maxIssues.
                    started--;
                    contendedAt.put(ref, System.nanoTime());
                }
            }
            log.info("{} finished: {} ({})", ref, result.outcome(), result.finalState());
        }

        private Set<IssueRef> excluded() {
            Set<IssueRef> excluded = new HashSet<>(active);
            if (!options.continuous()) {
                excluded.addAll(attempted);
            } else {
                long now = System.nanoTime();
                contendedAt.values().removeIf(at -> now - at >= options.checkInterval().toNanos());
                excluded.addAll(contendedAt.keySet());
            }
            return excluded;
        }
    }
}
