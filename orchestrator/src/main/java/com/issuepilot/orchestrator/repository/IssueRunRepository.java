package com.issuepilot.orchestrator.repository;

import com.issuepilot.orchestrator.model.IssueRun;
import com.issuepilot.orchestrator.model.RunOutcome;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + cleanup queries for the issue_runs table.
 */
public interface IssueRunRepository extends JpaRepository<IssueRun, UUID> {

    /** Every epoch of one issue, newest first. */
    List<IssueRun> findByRepoAndIssueNumberOrderByStartedAtDesc(String repo, int issueNumber);

    Optional<IssueRun> findFirstByRepoAndIssueNumberOrderByStartedAtDesc(String repo, int issueNumber);

    List<IssueRun> findTop50ByOrderByStartedAtDesc();

    /**
     * Workspaces eligible for removal.
     *
     * Only the latest run of an issue counts: an older DONE run whose issue was
     * later re-opened and claimed again shares the same workspace path.
     */
    @Query("""
            SELECT r FROM IssueRun r
            WHERE r.outcome IN :outcomes
              AND r.finishedAt < :cutoff
              AND r.workspacePath IS NOT NULL
              AND r.workspaceRemovedAt IS NULL
              AND r.startedAt = (
                  SELECT MAX(r2.startedAt) FROM IssueRun r2
                  WHERE r2.repo = r.repo AND r2.issueNumber = r.issueNumber)
            ORDER BY r.finishedAt ASC
            """)
    List<IssueRun> findExpiredWorkspaces(@Param("outcomes") Collection<RunOutcome> outcomes,
                                         @Param("cutoff") Instant cutoff);

    long countByOutcome(RunOutcome outcome);
}
