package com.issuepilot.orchestrator.model;

import java.time.Instant;

/**
 * One running backend process bound to a workspace.
 *
 * Owned by a single lifecycle worker; never shared between threads.
 */
public class Session {

    private final String    name;
    private final Workspace workspace;
    private final BackendKind backend;
    private final String    model;

    private Instant startedAt;
    private Instant lastActivityAt;
    private int     nudgeCount;
    private int     restartCount;

    // Hash of the last captured pane contents; a change means the backend is doing something.
    private String outputFingerprint;

    // Last captured terminal output, kept for the failure diagnostic once the process is gone.
    private String lastOutput = "";

    public Session(String name, Workspace workspace, BackendKind backend, String model, Instant startedAt) {
        this.name           = name;
        this.workspace      = workspace;
        this.backend        = backend;
        this.model          = model;
        this.startedAt      = startedAt;
        this.lastActivityAt = startedAt;
    }

    // ------------------------------------------------------------------
    // State transitions
    // ------------------------------------------------------------------

    /** New output was observed: the backend is alive and working. */
    public void recordActivity(Instant at, String fingerprint) {
        this.lastActivityAt    = at;
        this.outputFingerprint = fingerprint;
        this.nudgeCount        = 0;
    }

    public void recordNudge() {
        this.nudgeCount++;
    }

    /** Fresh process in the same workspace: counters for the idle window start over. */
    public void recordRestart(Instant at) {
        this.restartCount++;
        this.nudgeCount     = 0;
        this.startedAt      = at;
        this.lastActivityAt = at;
        this.outputFingerprint = null;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String      getName()              { return name; }
    public Workspace   getWorkspace()         { return workspace; }
    public BackendKind getBackend()           { return backend; }
    public String      getModel()             { return model; }
    public Instant     getStartedAt()         { return startedAt; }
    public Instant     getLastActivityAt()    { return lastActivityAt; }
    public int         getNudgeCount()        { return nudgeCount; }
    public int         getRestartCount()      { return restartCount; }
    public String      getOutputFingerprint() { return outputFingerprint; }
    public String      getLastOutput()        { return lastOutput; }

    public void setOutputFingerprint(String fingerprint) { this.outputFingerprint = fingerprint; }
    public void setLastOutput(String output)             { this.lastOutput = output == null ? "" : output; }
}
