package com.issuepilot.orchestrator.service;

import com.issuepilot.orchestrator.model.BackendKind;
import com.issuepilot.orchestrator.model.IssueRef;
import com.issuepilot.orchestrator.model.IssueRun;
import com.issuepilot.orchestrator.model.LifecycleState;
import com.issuepilot.orchestrator.model.RunOutcome;
import com.issuepilot.orchestrator.model.Session;
import com.issuepilot.orchestrator.model.Workspace;
import com.issuepilot.orchestrator.repository.IssueRunRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * RunLedger against a mocked repository: no Spring context, no database.
 */
@ExtendWith(MockitoExtension.class)
class RunLedgerTest {

    static final IssueRef REF    = new IssueRef("acme/app", 7);
    static final UUID     RUN_ID = UUID.randomUUID();

    @Mock IssueRunRepository runRepo;

    RunLedger ledger;
    IssueRun  run;

    @BeforeEach
    void setUp() {
        ledger = new RunLedger(runRepo);
        run    = new IssueRun(REF, "orch-a");
    }

    @Test
    void open_savesNewRunForOwner() {
        when(runRepo.save(any())).thenAnswer(inv -> inv.getArgument(0));

        IssueRun opened = ledger.open(REF, "orch-a");

        assertThat(opened.issueRef()).isEqualTo(REF);
        assertThat(opened.getOwnerId()).isEqualTo("orch-a");
        assertThat(opened.getState()).isEqualTo(LifecycleState.CLAIMING);
    }

    @Test
    void attachWorkspaceAndSession_copiedOntoRun() {
        when(runRepo.findById(RUN_ID)).thenReturn(Optional.of(run));
        Workspace ws = new Workspace(REF, Path.of("/ws/acme__app/7"), "agent/7-fix", Instant.EPOCH);
        Session session = new Session("ip-acme-app-7", ws, BackendKind.CODEX, "gpt-5-codex", Instant.EPOCH);
        session.recordRestart(Instant.EPOCH);

        ledger.attachWorkspace(RUN_ID, ws);
        ledger.recordSession(RUN_ID, session);
        ledger.incrementNudges(RUN_ID);
        ledger.incrementNudges(RUN_ID);

        assertThat(run.getWorkspacePath()).isEqualTo(Path.of("/ws/acme__app/7").toString());
        assertThat(run.getBranchName()).isEqualTo("agent/7-fix");
        assertThat(run.getBackend()).isEqualTo(BackendKind.CODEX);
        assertThat(run.getRestartCount()).isEqualTo(1);
        assertThat(run.getNudgeCount()).isEqualTo(2);
    }

    @Test
    void finish_recordsTerminalStateOutcomeAndDiagnostic() {
        when(runRepo.findById(RUN_ID)).thenReturn(Optional.of(run));
        Instant at = Instant.parse("2026-03-02T10:00:00Z");

        ledger.finish(RUN_ID, LifecycleState.FAILED, RunOutcome.FAILED, "No activity", at);

        assertThat(run.getState()).isEqualTo(LifecycleState.FAILED);
        assertThat(run.getOutcome()).isEqualTo(RunOutcome.FAILED);
        assertThat(run.getDiagnostic()).isEqualTo("No activity");
        assertThat(run.getFinishedAt()).isEqualTo(at);
        verify(runRepo).save(run);
    }

    @Test
    void transition_unknownRun_ignored() {
        when(runRepo.findById(RUN_ID)).thenReturn(Optional.empty());

        ledger.transition(RUN_ID, LifecycleState.RUNNING);

        verify(runRepo, never()).save(any());
    }
}
