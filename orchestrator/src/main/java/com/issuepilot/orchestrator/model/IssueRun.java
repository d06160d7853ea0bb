package com.issuepilot.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One claim epoch of one issue, as seen by this orchestrator.
 *
 * Audit trail and workspace-cleanup input. The tracker remains the authority
 * on who owns an issue; this row is never consulted for claiming.
 *
 * DB table: issue_runs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "issue_runs")
public class IssueRun {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String repo;

    @Column(name = "issue_number", nullable = false)
    private int issueNumber;

    @Column(name = "owner_id", nullable = false)
    private String ownerId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private LifecycleState state = LifecycleState.CLAIMING;

    // Null while the run is still in flight.
    @Enumerated(EnumType.STRING)
    private RunOutcome outcome;

    @Column(name = "workspace_path")
    private String workspacePath;

    @Column(name = "branch_name")
    private String branchName;

    @Enumerated(EnumType.STRING)
    private BackendKind backend;

    private String model;

    @Column(name = "nudge_count", nullable = false)
    private int nudgeCount = 0;

    @Column(name = "restart_count", nullable = false)
    private int restartCount = 0;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @Column(name = "finished_at")
    private Instant finishedAt;

    // Set by the cleanup job once the checkout is gone.
    @Column(name = "workspace_removed_at")
    private Instant workspaceRemovedAt;

    // Failure reason or captured session output, shown in the tracker comment as well.
    @Column(columnDefinition = "TEXT")
    private String diagnostic;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected IssueRun() {}   // required by JPA

    public IssueRun(IssueRef ref, String ownerId) {
        this.repo        = ref.repo();
        this.issueNumber = ref.number();
        this.ownerId     = ownerId;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID           getId()                 { return id; }
    public String         getRepo()               { return repo; }
    public int            getIssueNumber()        { return issueNumber; }
    public String         getOwnerId()            { return ownerId; }
    public LifecycleState getState()              { return state; }
    public RunOutcome     getOutcome()            { return outcome; }
    public String         getWorkspacePath()      { return workspacePath; }
    public String         getBranchName()         { return branchName; }
    public BackendKind    getBackend()            { return backend; }
    public String         getModel()              { return model; }
    public int            getNudgeCount()         { return nudgeCount; }
    public int            getRestartCount()       { return restartCount; }
    public Instant        getStartedAt()          { return startedAt; }
    public Instant        getUpdatedAt()          { return updatedAt; }
    public Instant        getFinishedAt()         { return finishedAt; }
    public Instant        getWorkspaceRemovedAt() { return workspaceRemovedAt; }
    public String         getDiagnostic()         { return diagnostic; }

    public IssueRef issueRef() { return new IssueRef(repo, issueNumber); }

    public void setState(LifecycleState state)       { this.state = state; this.updatedAt = Instant.now(); }
    public void setOutcome(RunOutcome outcome)       { this.outcome = outcome; }
    public void setWorkspacePath(String path)        { this.workspacePath = path; }
    public void setBranchName(String branchName)     { this.branchName = branchName; }
    public void setBackend(BackendKind backend)      { this.backend = backend; }
    public void setModel(String model)               { this.model = model; }
    public void setNudgeCount(int nudgeCount)        { this.nudgeCount = nudgeCount; }
    public void setRestartCount(int restartCount)    { this.restartCount = restartCount; }
    public void setFinishedAt(Instant t)             { this.finishedAt = t; }
    public void setWorkspaceRemovedAt(Instant t)     { this.workspaceRemovedAt = t; }
    public void setDiagnostic(String diagnostic)     { this.diagnostic = diagnostic; }
}
