package com.issuepilot.orchestrator.pool;

import com.issuepilot.orchestrator.model.IssueRef;

import java.util.List;

/**
 * Summary of a finished drain.
 *
 * @param configurationError set when the drain stopped on a misconfiguration
 *                           such as a dependency cycle
 * @param failure            set when the drain stopped on anything else
 */
public record DrainReport(int started,
                          int done,
                          int blocked,
                          int failed,
                          int abandoned,
                          List<IssueRef> cycle,
                          String configurationError,
                          String failure) {

    public DrainReport {
        cycle = cycle == null ? List.of() : List.copyOf(cycle);
    }

    /** 0 on a clean drain, 2 on a configuration error, 1 otherwise. */
    public int exitCode() {
        if (configurationError != null) return 2;
        if (failure != null) return 1;
        return 0;
    }

    public boolean clean() {
        return exitCode() == 0;
    }
}
