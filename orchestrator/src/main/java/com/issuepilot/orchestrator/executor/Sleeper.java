package com.issuepilot.orchestrator.executor;

import java.time.Duration;

/**
 * Blocking pause used by worker loops and retry backoff. Tests substitute a
 * recording implementation so no real time passes.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    Sleeper SYSTEM = d -> Thread.sleep(d.toMillis());
}
