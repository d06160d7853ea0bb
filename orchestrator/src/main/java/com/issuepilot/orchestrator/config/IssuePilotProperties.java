package com.issuepilot.orchestrator.config;

import com.issuepilot.orchestrator.model.BackendKind;
import com.issuepilot.orchestrator.model.TargetFilter;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "issuepilot")
public class IssuePilotProperties {

    private TrackerConfig tracker = new TrackerConfig();
    private WorkspaceConfig workspace = new WorkspaceConfig();
    private SessionConfig session = new SessionConfig();
    private ClaimConfig claim = new ClaimConfig();
    private PoolConfig pool = new PoolConfig();
    private Map<String, BackendChoice> difficulty = new LinkedHashMap<>(Map.of(
            "easy", new BackendChoice(BackendKind.CLAUDE, "claude-haiku-4-5"),
            "medium", new BackendChoice(BackendKind.CLAUDE, "claude-sonnet-4-5"),
            "hard", new BackendChoice(BackendKind.CLAUDE, "claude-opus-4-5")));
    private BackendChoice defaultBackend = new BackendChoice(BackendKind.CLAUDE, "claude-haiku-4-5");

    public static class TrackerConfig {
        private String apiUrl = "https://api.github.com";
        private String token;
        private List<String> repos = new ArrayList<>();
        private String agentLabel = "agent";
        private String failedLabel = "agent:failed";
        private String blockedReviewer;
        private String baseBranch = "main";
        private boolean openPullRequests = true;
        // Release as IN_REVIEW instead of DONE once a pull request is open.
        private boolean reviewOnPullRequest = false;
        private int maxRetries = 5;
        private Duration retryBaseDelay = Duration.ofSeconds(1);
        private Duration retryMaxDelay = Duration.ofSeconds(30);
        private Duration requestTimeout = Duration.ofSeconds(30);

        public String getApiUrl() { return apiUrl; }
        public void setApiUrl(String apiUrl) { this.apiUrl = apiUrl; }
        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }
        public List<String> getRepos() { return repos; }
        public void setRepos(List<String> repos) { this.repos = repos; }
        public String getAgentLabel() { return agentLabel; }
        public void setAgentLabel(String agentLabel) { this.agentLabel = agentLabel; }
        public String getFailedLabel() { return failedLabel; }
        public void setFailedLabel(String failedLabel) { this.failedLabel = failedLabel; }
        public String getBlockedReviewer() { return blockedReviewer; }
        public void setBlockedReviewer(String blockedReviewer) { this.blockedReviewer = blockedReviewer; }
        public String getBaseBranch() { return baseBranch; }
        public void setBaseBranch(String baseBranch) { this.baseBranch = baseBranch; }
        public boolean isOpenPullRequests() { return openPullRequests; }
        public void setOpenPullRequests(boolean openPullRequests) { this.openPullRequests = openPullRequests; }
        public boolean isReviewOnPullRequest() { return reviewOnPullRequest; }
        public void setReviewOnPullRequest(boolean reviewOnPullRequest) { this.reviewOnPullRequest = reviewOnPullRequest; }
        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public Duration getRetryBaseDelay() { return retryBaseDelay; }
        public void setRetryBaseDelay(Duration retryBaseDelay) { this.retryBaseDelay = retryBaseDelay; }
        public Duration getRetryMaxDelay() { return retryMaxDelay; }
        public void setRetryMaxDelay(Duration retryMaxDelay) { this.retryMaxDelay = retryMaxDelay; }
        public Duration getRequestTimeout() { return requestTimeout; }
        public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = positive("tracker.request-timeout", requestTimeout); }
    }

    public static class WorkspaceConfig {
        private Path root = Path.of(".issuepilot");
        // Clone URL template; {repo} is replaced with owner/name.
        private String cloneUrl = "https://github.com/{repo}.git";
        private Duration retention = Duration.ofHours(72);
        private boolean cleanupOnlyDone = true;
        private String instructionFile = "TASK.md";
        private String markerFile = "TASK_DONE.json";
        private String answerFile = "TASK_ANSWER.md";

        public Path getRoot() { return root; }
        public void setRoot(Path root) { this.root = root; }
        public String getCloneUrl() { return cloneUrl; }
        public void setCloneUrl(String cloneUrl) { this.cloneUrl = cloneUrl; }
        public Duration getRetention() { return retention; }
        public void setRetention(Duration retention) { this.retention = positive("workspace.retention", retention); }
        public boolean isCleanupOnlyDone() { return cleanupOnlyDone; }
        public void setCleanupOnlyDone(boolean cleanupOnlyDone) { this.cleanupOnlyDone = cleanupOnlyDone; }
        public String getInstructionFile() { return instructionFile; }
        public void setInstructionFile(String instructionFile) { this.instructionFile = instructionFile; }
        public String getMarkerFile() { return markerFile; }
        public void setMarkerFile(String markerFile) { this.markerFile = markerFile; }
        public String getAnswerFile() { return answerFile; }
        public void setAnswerFile(String answerFile) { this.answerFile = answerFile; }
    }

    public static class SessionConfig {
        private String tmuxBinary = "tmux";
        private Duration pollInterval = Duration.ofSeconds(30);
        private Duration idleWindow = Duration.ofMinutes(15);
        private Duration nudgeInterval = Duration.ofMinutes(5);
        private int maxNudges = 3;
        private int maxRestarts = 1;
        private Duration maxDuration = Duration.ofHours(4);
        private int captureLines = 200;
        private String nudgeMessage = "HEALTH_CHECK: please continue work on {task_id} ({task_title}). "
                + "If blocked, post a BLOCKED comment and exit.";
        private String kickoffPrompt = "Read {instruction_file} in the current directory and complete the task it describes.";
        private Map<BackendKind, String> commands = new LinkedHashMap<>(Map.of(
                BackendKind.CLAUDE, "claude --permission-mode dontAsk --dangerously-skip-permissions --model {model}",
                BackendKind.CODEX, "codex --ask-for-approval never --full-auto --sandbox danger-full-access --model {model}"));

        public String getTmuxBinary() { return tmuxBinary; }
        public void setTmuxBinary(String tmuxBinary) { this.tmuxBinary = tmuxBinary; }
        public Duration getPollInterval() { return pollInterval; }
        public void setPollInterval(Duration pollInterval) { this.pollInterval = positive("session.poll-interval", pollInterval); }
        public Duration getIdleWindow() { return idleWindow; }
        public void setIdleWindow(Duration idleWindow) { this.idleWindow = positive("session.idle-window", idleWindow); }
        public Duration getNudgeInterval() { return nudgeInterval; }
        public void setNudgeInterval(Duration nudgeInterval) { this.nudgeInterval = positive("session.nudge-interval", nudgeInterval); }
        public int getMaxNudges() { return maxNudges; }
        public void setMaxNudges(int maxNudges) { this.maxNudges = notNegative("session.max-nudges", maxNudges); }
        public int getMaxRestarts() { return maxRestarts; }
        public void setMaxRestarts(int maxRestarts) { this.maxRestarts = notNegative("session.max-restarts", maxRestarts); }
        public Duration getMaxDuration() { return maxDuration; }
        public void setMaxDuration(Duration maxDuration) { this.maxDuration = positive("session.max-duration", maxDuration); }
        public int getCaptureLines() { return captureLines; }
        public void setCaptureLines(int captureLines) { this.captureLines = captureLines; }
        public String getNudgeMessage() { return nudgeMessage; }
        public void setNudgeMessage(String nudgeMessage) { this.nudgeMessage = nudgeMessage; }
        public String getKickoffPrompt() { return kickoffPrompt; }
        public void setKickoffPrompt(String kickoffPrompt) { this.kickoffPrompt = kickoffPrompt; }
        public Map<BackendKind, String> getCommands() { return commands; }
        public void setCommands(Map<BackendKind, String> commands) { this.commands = commands; }
    }

    public static class ClaimConfig {
        // Defaults to <hostname>-<pid> when blank.
        private String ownerId;
        private Duration heartbeatInterval = Duration.ofMinutes(2);
        private Duration staleAfter = Duration.ofMinutes(15);

        public String getOwnerId() { return ownerId; }
        public void setOwnerId(String ownerId) { this.ownerId = ownerId; }
        public Duration getHeartbeatInterval() { return heartbeatInterval; }
        public void setHeartbeatInterval(Duration heartbeatInterval) { this.heartbeatInterval = positive("claim.heartbeat-interval", heartbeatInterval); }
        public Duration getStaleAfter() { return staleAfter; }
        public void setStaleAfter(Duration staleAfter) { this.staleAfter = positive("claim.stale-after", staleAfter); }
    }

    public static class PoolConfig {
        private int concurrency = 2;
        private TargetFilter target = TargetFilter.ANY;
        private Duration checkInterval = Duration.ofSeconds(60);
        // 0 = unlimited
        private int maxIssues = 0;
        private boolean autoStart = false;
        private boolean resumeInProgress = true;

        public int getConcurrency() { return concurrency; }
        public void setConcurrency(int concurrency) { this.concurrency = atLeastOne("pool.concurrency", concurrency); }
        public TargetFilter getTarget() { return target; }
        public void setTarget(TargetFilter target) { this.target = target; }
        public Duration getCheckInterval() { return checkInterval; }
        public void setCheckInterval(Duration checkInterval) { this.checkInterval = positive("pool.check-interval", checkInterval); }
        public int getMaxIssues() { return maxIssues; }
        public void setMaxIssues(int maxIssues) { this.maxIssues = maxIssues; }
        public boolean isAutoStart() { return autoStart; }
        public void setAutoStart(boolean autoStart) { this.autoStart = autoStart; }
        public boolean isResumeInProgress() { return resumeInProgress; }
        public void setResumeInProgress(boolean resumeInProgress) { this.resumeInProgress = resumeInProgress; }
    }

    public static class BackendChoice {
        private BackendKind backend = BackendKind.CLAUDE;
        private String model;

        public BackendChoice() {}

        public BackendChoice(BackendKind backend, String model) {
            this.backend = backend;
            this.model = model;
        }

        public BackendKind getBackend() { return backend; }
        public void setBackend(BackendKind backend) { this.backend = backend; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
    }

    public TrackerConfig getTracker() { return tracker; }
    public void setTracker(TrackerConfig tracker) { this.tracker = tracker; }
    public WorkspaceConfig getWorkspace() { return workspace; }
    public void setWorkspace(WorkspaceConfig workspace) { this.workspace = workspace; }
    public SessionConfig getSession() { return session; }
    public void setSession(SessionConfig session) { this.session = session; }
    public ClaimConfig getClaim() { return claim; }
    public void setClaim(ClaimConfig claim) { this.claim = claim; }
    public PoolConfig getPool() { return pool; }
    public void setPool(PoolConfig pool) { this.pool = pool; }
    public Map<String, BackendChoice> getDifficulty() { return difficulty; }
    public void setDifficulty(Map<String, BackendChoice> difficulty) { this.difficulty = difficulty; }
    public BackendChoice getDefaultBackend() { return defaultBackend; }
    public void setDefaultBackend(BackendChoice defaultBackend) { this.defaultBackend = defaultBackend; }

    // ------------------------------------------------------------------
    // Binding checks; the binder reports the failing property at startup.
    // ------------------------------------------------------------------

    static Duration positive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException("issuepilot." + name + " must be positive, got " + value);
        }
        return value;
    }

    static int notNegative(String name, int value) {
        if (value < 0) {
            throw new IllegalArgumentException("issuepilot." + name + " must not be negative, got " + value);
        }
        return value;
    }

    static int atLeastOne(String name, int value) {
        if (value < 1) {
            throw new IllegalArgumentException("issuepilot." + name + " must be at least 1, got " + value);
        }
        return value;
    }
}
