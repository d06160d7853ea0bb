package com.issuepilot.orchestrator.session;

import com.issuepilot.orchestrator.config.IssuePilotProperties;
import com.issuepilot.orchestrator.executor.CommandResult;
import com.issuepilot.orchestrator.executor.CommandRunner;
import com.issuepilot.orchestrator.executor.ExecutorException;
import com.issuepilot.orchestrator.executor.Sleeper;
import com.issuepilot.orchestrator.model.BackendKind;
import com.issuepilot.orchestrator.model.IssueRef;
import com.issuepilot.orchestrator.model.Session;
import com.issuepilot.orchestrator.model.SessionStatus;
import com.issuepilot.orchestrator.model.Workspace;
import com.issuepilot.orchestrator.workspace.CompletionMarkerReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

/**
 * Runs each backend inside a detached tmux session.
 *
 * tmux keeps the interactive CLI alive without a terminal attached, lets us
 * type into it (kickoff prompt, nudges) and read its screen back. Activity is
 * detected by hashing the captured pane: a changed screen means the backend
 * is doing something.
 */
@Component
public class TmuxSessionController implements SessionController {

    private static final Logger log = LoggerFactory.getLogger(TmuxSessionController.class);

    // Interactive CLIs need a moment before they accept typed input.
    static final Duration STARTUP_DELAY = Duration.ofSeconds(5);

    private final CommandRunner          runner;
    private final CompletionMarkerReader markers;
    private final Sleeper                sleeper;
    private final Clock                  clock;
    private final String                 tmux;
    private final int                    captureLines;
    private final Map<BackendKind, String> commands;
    private final String                 instructionFile;

    public TmuxSessionController(CommandRunner runner,
                                 CompletionMarkerReader markers,
                                 Sleeper sleeper,
                                 Clock clock,
                                 IssuePilotProperties props) {
        this.runner          = runner;
        this.markers         = markers;
        this.sleeper         = sleeper;
        this.clock           = clock;
        this.tmux            = props.getSession().getTmuxBinary();
        this.captureLines    = props.getSession().getCaptureLines();
        this.commands        = props.getSession().getCommands();
        this.instructionFile = props.getWorkspace().getInstructionFile();
    }

    @Override
    public String sessionName(IssueRef ref) {
        String raw = "ip-" + ref.owner() + "-" + ref.name() + "-" + ref.number();
        // tmux treats '.' and ':' as target separators.
        return raw.replaceAll("[^A-Za-z0-9_-]", "-");
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    @Override
    public Session start(Workspace workspace, BackendKind backend, String model, String prompt) {
        String name = sessionName(workspace.issueRef());
        Session session = new Session(name, workspace, backend, model, clock.instant());
        if (isAlive(name)) {
            log.info("Session {} already running, attaching", name);
            session.setOutputFingerprint(fingerprint(captureOutput(session)));
            return session;
        }
        launch(session, prompt);
        return session;
    }

    @Override
    public SessionStatus poll(Session session) {
        if (markers.read(session.getWorkspace()).isPresent()) {
            return SessionStatus.COMPLETED;
        }
        if (!isAlive(session.getName())) {
            // The marker may have been written just before the process exited.
            return markers.read(session.getWorkspace()).isPresent() ? SessionStatus.COMPLETED : SessionStatus.DEAD;
        }
        String output = captureOutput(session);
        session.setLastOutput(output);
        String fp = fingerprint(output);
        if (!fp.equals(session.getOutputFingerprint())) {
            session.recordActivity(clock.instant(), fp);
        }
        return SessionStatus.RUNNING;
    }

    @Override
    public void nudge(Session session, String message) {
        log.info("Nudging {} (nudge {})", session.getName(), session.getNudgeCount() + 1);
        type(session.getName(), message);
        session.recordNudge();
        // Our own keystrokes change the screen; that is not backend activity.
        session.setOutputFingerprint(fingerprint(captureOutput(session)));
    }

    @Override
    public void restart(Session session, String prompt) {
        log.warn("Restarting {} (restart {})", session.getName(), session.getRestartCount() + 1);
        kill(session.getName());
        session.recordRestart(clock.instant());
        launch(session, prompt);
    }

    @Override
    public void stop(Session session) {
        if (isAlive(session.getName())) {
            kill(session.getName());
            log.info("Stopped session {}", session.getName());
        }
    }

    @Override
    public boolean isAlive(String sessionName) {
        // '=' forces an exact match instead of tmux's prefix matching.
        return runner.run(List.of(tmux, "has-session", "-t", "=" + sessionName), null).ok();
    }

    @Override
    public String captureOutput(Session session) {
        CommandResult result = runner.run(List.of(tmux, "capture-pane", "-p", "-J",
                "-t", "=" + session.getName() + ":", "-S", "-" + captureLines), null);
        return result.ok() ? result.stdout() : "";
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private void launch(Session session, String prompt) {
        String template = commands.get(session.getBackend());
        if (template == null) {
            throw new SessionException("No command configured for backend " + session.getBackend());
        }
        String command = template.replace("{model}", session.getModel());
        Workspace ws = session.getWorkspace();

        List<String> cmd = new ArrayList<>(List.of(tmux, "new-session", "-d",
                "-s", session.getName(),
                "-c", ws.rootPath().toString(),
                "-e", "ISSUEPILOT_ISSUE=" + ws.issueRef(),
                "-e", "ISSUEPILOT_TASK_FILE=" + ws.resolve(instructionFile),
                command));
        try {
            runner.runChecked(cmd, ws.rootPath());
        } catch (ExecutorException e) {
            throw new SessionException("Could not start session " + session.getName(), e);
        }
        log.info("Started {} session {} ({}) in {}", session.getBackend(), session.getName(),
                session.getModel(), ws.rootPath());

        try {
            sleeper.sleep(STARTUP_DELAY);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            kill(session.getName());
            throw new SessionException("Interrupted while starting " + session.getName(), e);
        }
        type(session.getName(), prompt);
        session.setOutputFingerprint(fingerprint(captureOutput(session)));
    }

    /** Send literal text, then Enter as a separate key. */
    private void type(String name, String text) {
        try {
            runner.runChecked(List.of(tmux, "send-keys", "-t", "=" + name + ":", "-l", text), null);
            runner.runChecked(List.of(tmux, "send-keys", "-t", "=" + name + ":", "Enter"), null);
        } catch (ExecutorException e) {
            throw new SessionException("Could not type into session " + name, e);
        }
    }

    private void kill(String name) {
        CommandResult result = runner.run(List.of(tmux, "kill-session", "-t", "=" + name), null);
        if (!result.ok()) {
            log.debug("kill-session {} exited {}: {}", name, result.exitCode(), result.stderr().strip());
        }
    }

    static String fingerprint(String text) {
        try {
            MessageDigest sha = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(sha.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
