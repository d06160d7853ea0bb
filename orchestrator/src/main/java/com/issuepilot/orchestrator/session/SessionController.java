package com.issuepilot.orchestrator.session;

import com.issuepilot.orchestrator.model.BackendKind;
import com.issuepilot.orchestrator.model.IssueRef;
import com.issuepilot.orchestrator.model.Session;
import com.issuepilot.orchestrator.model.SessionStatus;
import com.issuepilot.orchestrator.model.Workspace;

/**
 * Launches and supervises backend processes, one per issue.
 *
 * Session names are derived from the issue, so starting a session whose
 * process is already running attaches to it instead of launching a second one.
 */
public interface SessionController {

    String sessionName(IssueRef ref);

    /** Launch the backend in {@code workspace} and hand it {@code prompt}, or attach to a live one. */
    Session start(Workspace workspace, BackendKind backend, String model, String prompt);

    /**
     * Check on a session. Records activity on the session as a side effect.
     *
     * @return COMPLETED only if a well-formed completion marker exists
     */
    SessionStatus poll(Session session);

    /** Type a reminder into an idle session. */
    void nudge(Session session, String message);

    /** Kill the process and launch a fresh one in the same workspace. */
    void restart(Session session, String prompt);

    void stop(Session session);

    boolean isAlive(String sessionName);

    /** Recent terminal output, for diagnostics. Empty if the session is gone. */
    String captureOutput(Session session);
}
