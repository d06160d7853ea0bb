package com.issuepilot.orchestrator.workspace;

import com.issuepilot.orchestrator.executor.CommandResult;
import com.issuepilot.orchestrator.executor.CommandRunner;
import com.issuepilot.orchestrator.executor.ExecutorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * The handful of git commands a workspace needs.
 *
 * Shells out to the {@code git} CLI through {@link CommandRunner}, which
 * masks credentials embedded in remote URLs before anything is logged.
 */
@Component
public class GitOperations {

    private static final Logger log = LoggerFactory.getLogger(GitOperations.class);

    private static final Duration CLONE_TIMEOUT = Duration.ofMinutes(15);

    private final CommandRunner runner;

    public GitOperations(CommandRunner runner) {
        this.runner = runner;
    }

    public void cloneRepo(String remoteUrl, Path target) {
        log.info("Cloning {} into {}", CommandRunner.mask(remoteUrl), target);
        CommandResult result = runner.run(List.of("git", "clone", remoteUrl, target.toString()),
                                          target.getParent(), CLONE_TIMEOUT);
        if (!result.ok()) {
            throw new WorkspaceException("git clone of " + CommandRunner.mask(remoteUrl) + " failed: "
                    + CommandRunner.mask(result.stderr().strip()));
        }
    }

    public void fetch(Path repo) {
        git(repo, "fetch", "--prune", "origin");
    }

    /**
     * Check out {@code branch}, creating it from {@code origin/<base>} if it does
     * not exist locally. An existing branch keeps its commits.
     */
    public void ensureBranch(Path repo, String branch, String base) {
        if (runner.run(List.of("git", "rev-parse", "--verify", "--quiet", "refs/heads/" + branch), repo).ok()) {
            String current = git(repo, "rev-parse", "--abbrev-ref", "HEAD").stdout().strip();
            if (!current.equals(branch)) {
                git(repo, "checkout", branch);
            }
            return;
        }
        if (runner.run(List.of("git", "rev-parse", "--verify", "--quiet", "refs/remotes/origin/" + branch), repo).ok()) {
            // Pushed by an earlier run whose local checkout is gone.
            git(repo, "checkout", "-b", branch, "origin/" + branch);
        } else {
            git(repo, "checkout", "-b", branch, "origin/" + base);
        }
        log.info("Checked out new branch {} in {}", branch, repo);
    }

    /** Paths with uncommitted changes, from {@code git status --porcelain}. */
    public List<String> uncommittedChanges(Path repo) {
        String out = git(repo, "status", "--porcelain").stdout();
        List<String> paths = new ArrayList<>();
        for (String line : out.split("\n")) {
            if (line.length() > 3) paths.add(line.substring(3).strip());
        }
        return paths;
    }

    public boolean isRepository(Path dir) {
        return dir.resolve(".git").toFile().exists();
    }

    private CommandResult git(Path repo, String... args) {
        List<String> cmd = new ArrayList<>();
        cmd.add("git");
        cmd.addAll(Arrays.asList(args));
        try {
            return runner.runChecked(cmd, repo);
        } catch (ExecutorException e) {
            throw new WorkspaceException(e.getMessage(), e);
        }
    }
}
