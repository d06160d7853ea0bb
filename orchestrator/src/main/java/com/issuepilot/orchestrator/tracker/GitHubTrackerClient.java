package com.issuepilot.orchestrator.tracker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.issuepilot.orchestrator.config.IssuePilotProperties;
import com.issuepilot.orchestrator.model.Issue;
import com.issuepilot.orchestrator.model.IssueRef;
import com.issuepilot.orchestrator.model.IssueStatus;
import com.issuepilot.orchestrator.tracker.dto.GitHubComment;
import com.issuepilot.orchestrator.tracker.dto.GitHubIssue;
import com.issuepilot.orchestrator.tracker.dto.GitHubPullRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * GitHub REST v3 implementation of the tracker.
 *
 * Status lives in a single {@code status:*} label per issue; blockers come
 * from the issue-dependencies endpoint. Uses java.net.http.HttpClient so
 * every header and status code is visible.
 *
 * Called from lifecycle worker threads, so blocking I/O is fine here.
 */
@Component
public class GitHubTrackerClient implements TrackerClient {

    private static final Logger log = LoggerFactory.getLogger(GitHubTrackerClient.class);

    private static final int PAGE_SIZE = 100;

    private static final TypeReference<List<GitHubIssue>>   ISSUE_LIST   = new TypeReference<>() {};
    private static final TypeReference<List<GitHubComment>> COMMENT_LIST = new TypeReference<>() {};
    private static final TypeReference<List<GitHubPullRequest>> PR_LIST  = new TypeReference<>() {};

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       token;
    private final Duration     requestTimeout;

    @Autowired
    public GitHubTrackerClient(IssuePilotProperties props, ObjectMapper objectMapper) {
        this(props.getTracker().getApiUrl(), props.getTracker().getToken(),
             props.getTracker().getRequestTimeout(), objectMapper);
    }

    public GitHubTrackerClient(String baseUrl, String token, Duration requestTimeout, ObjectMapper objectMapper) {
        this.baseUrl        = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.token          = token;
        this.requestTimeout = requestTimeout;
        this.json           = objectMapper;
        this.http           = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // ------------------------------------------------------------------
    // Issues
    // ------------------------------------------------------------------

    @Override
    public List<Issue> listOpenIssues(String repo, String label) {
        List<Issue> result = new ArrayList<>();
        for (int page = 1; ; page++) {
            String path = "/repos/" + repo + "/issues?state=open&labels=" + encode(label)
                    + "&per_page=" + PAGE_SIZE + "&page=" + page;
            List<GitHubIssue> batch = parse(send("GET", path, null, "listOpenIssues " + repo), ISSUE_LIST);
            for (GitHubIssue gh : batch) {
                if (!gh.isPullRequest()) {
                    result.add(toIssue(repo, gh));
                }
            }
            if (batch.size() < PAGE_SIZE) break;
        }
        log.debug("Listed {} open '{}' issues in {}", result.size(), label, repo);
        return result;
    }

    @Override
    public Issue getIssue(IssueRef ref) {
        String body = send("GET", issuePath(ref), null, "getIssue " + ref);
        return toIssue(ref.repo(), parse(body, GitHubIssue.class));
    }

    @Override
    public Set<IssueRef> getBlockers(IssueRef ref) {
        String body;
        try {
            body = send("GET", issuePath(ref) + "/dependencies/blocked_by?per_page=" + PAGE_SIZE,
                        null, "getBlockers " + ref);
        } catch (TrackerException e) {
            if (e.isNotFound()) {
                // Dependencies not enabled for this repository.
                return Set.of();
            }
            throw e;
        }
        Set<IssueRef> blockers = new LinkedHashSet<>();
        for (GitHubIssue gh : parse(body, ISSUE_LIST)) {
            String repo = gh.repoFullName() != null ? gh.repoFullName() : ref.repo();
            blockers.add(new IssueRef(repo, gh.number()));
        }
        return blockers;
    }

    /**
     * Not atomic on GitHub: a concurrent writer can slip in between the read and
     * the label write. The claim comment protocol catches that case.
     *
     * The whole label set is replaced in one request, so a failed write leaves
     * the old status in place rather than an issue with no status at all.
     */
    @Override
    public boolean compareAndSetStatus(IssueRef ref, IssueStatus expected, IssueStatus next) {
        GitHubIssue current = parse(send("GET", issuePath(ref), null, "getIssue " + ref), GitHubIssue.class);
        IssueStatus actual = IssueStatus.fromLabels(current.labelNames(), current.isClosed());
        if (actual != expected) {
            log.info("Status of {} is {} (expected {}), not moving to {}", ref, actual, expected, next);
            return false;
        }
        List<String> labels = new ArrayList<>();
        for (String label : current.labelNames()) {
            if (!label.toLowerCase().startsWith(IssueStatus.LABEL_PREFIX)) {
                labels.add(label);
            }
        }
        labels.add(next.label());
        send("PUT", issuePath(ref) + "/labels", toJson(Map.of("labels", labels)), "setLabels " + ref);
        log.info("Status of {} moved {} -> {}", ref, expected, next);
        return true;
    }

    // ------------------------------------------------------------------
    // Comments
    // ------------------------------------------------------------------

    @Override
    public List<TrackerComment> listComments(IssueRef ref) {
        List<TrackerComment> result = new ArrayList<>();
        for (int page = 1; ; page++) {
            String path = issuePath(ref) + "/comments?per_page=" + PAGE_SIZE + "&page=" + page;
            List<GitHubComment> batch = parse(send("GET", path, null, "listComments " + ref), COMMENT_LIST);
            batch.forEach(c -> result.add(toComment(c)));
            if (batch.size() < PAGE_SIZE) break;
        }
        return result;
    }

    @Override
    public TrackerComment postComment(IssueRef ref, String body) {
        String resp = send("POST", issuePath(ref) + "/comments", toJson(Map.of("body", body)),
                           "postComment " + ref);
        return toComment(parse(resp, GitHubComment.class));
    }

    @Override
    public void editComment(IssueRef ref, long commentId, String body) {
        send("PATCH", "/repos/" + ref.repo() + "/issues/comments/" + commentId,
             toJson(Map.of("body", body)), "editComment " + commentId + " on " + ref);
    }

    // ------------------------------------------------------------------
    // Labels / assignees / pull requests
    // ------------------------------------------------------------------

    @Override
    public void addLabels(IssueRef ref, Collection<String> labels) {
        if (labels.isEmpty()) return;
        send("POST", issuePath(ref) + "/labels", toJson(Map.of("labels", List.copyOf(labels))),
             "addLabels " + ref);
    }

    @Override
    public void removeLabel(IssueRef ref, String label) {
        try {
            send("DELETE", issuePath(ref) + "/labels/" + encode(label).replace("+", "%20"), null,
                 "removeLabel " + label + " from " + ref);
        } catch (TrackerException e) {
            if (!e.isNotFound()) throw e;
        }
    }

    @Override
    public void assign(IssueRef ref, String login) {
        send("POST", issuePath(ref) + "/assignees", toJson(Map.of("assignees", List.of(login))),
             "assign " + login + " to " + ref);
    }

    @Override
    public PullRequest openPullRequest(IssueRef ref, String head, String base, String title, String body) {
        try {
            String resp = send("POST", "/repos/" + ref.repo() + "/pulls",
                    toJson(Map.of("title", title, "head", head, "base", base, "body", body)),
                    "openPullRequest " + head);
            GitHubPullRequest pr = parse(resp, GitHubPullRequest.class);
            log.info("Opened PR #{} for {} ({})", pr.number(), ref, pr.html_url());
            return new PullRequest(pr.number(), pr.html_url());
        } catch (TrackerException e) {
            // 422: a PR for this head already exists.
            if (e.getStatusCode() != 422) throw e;
            String path = "/repos/" + ref.repo() + "/pulls?state=open&head="
                    + encode(ref.owner() + ":" + head);
            List<GitHubPullRequest> open = parse(send("GET", path, null, "findPullRequest " + head), PR_LIST);
            if (open.isEmpty()) throw e;
            return new PullRequest(open.get(0).number(), open.get(0).html_url());
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private Issue toIssue(String repo, GitHubIssue gh) {
        Set<String> labels = new HashSet<>(gh.labelNames());
        return new Issue(
                new IssueRef(repo, gh.number()),
                gh.title(),
                gh.body(),
                IssueStatus.fromLabels(labels, gh.isClosed()),
                labels,
                gh.assignee() == null ? null : gh.assignee().login(),
                Set.of());
    }

    private static TrackerComment toComment(GitHubComment c) {
        return new TrackerComment(
                c.id(),
                c.user() == null ? null : c.user().login(),
                c.body() == null ? "" : c.body(),
                c.created_at() == null ? Instant.EPOCH : Instant.parse(c.created_at()));
    }

    private static String issuePath(IssueRef ref) {
        return "/repos/" + ref.repo() + "/issues/" + ref.number();
    }

    /** Send a request; returns the body of a 2xx response. */
    private String send(String method, String path, String jsonBody, String opName) {
        HttpRequest.Builder req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(requestTimeout)
                .header("Accept", "application/vnd.github+json")
                .header("X-GitHub-Api-Version", "2022-11-28");
        if (token != null && !token.isBlank()) {
            req.header("Authorization", "Bearer " + token);
        }
        if (jsonBody != null) {
            req.header("Content-Type", "application/json")
               .method(method, HttpRequest.BodyPublishers.ofString(jsonBody));
        } else {
            req.method(method, HttpRequest.BodyPublishers.noBody());
        }

        HttpResponse<String> resp;
        try {
            resp = http.send(req.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw TrackerException.io(opName + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TrackerException(opName + " interrupted", -1, false, e);
        }

        int status = resp.statusCode();
        if (status < 200 || status >= 300) {
            throw new TrackerException(
                    opName + " failed: HTTP " + status + ": " + abbreviate(resp.body()),
                    status, isTransient(status, resp.body()));
        }
        return resp.body();
    }

    static boolean isTransient(int status, String body) {
        if (status == 429 || status >= 500) return true;
        // Secondary rate limits come back as 403.
        return status == 403 && body != null && body.toLowerCase().contains("rate limit");
    }

    private <T> T parse(String body, Class<T> type) {
        try {
            return json.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new TrackerException("Unparseable tracker response: " + abbreviate(body), -1, false, e);
        }
    }

    private <T> T parse(String body, TypeReference<T> type) {
        try {
            return json.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new TrackerException("Unparseable tracker response: " + abbreviate(body), -1, false, e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new TrackerException("JSON serialization failed", -1, false, e);
        }
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    private static String abbreviate(String s) {
        if (s == null) return "";
        return s.length() > 300 ? s.substring(0, 300) + "..." : s;
    }
}
