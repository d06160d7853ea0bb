package com.issuepilot.orchestrator.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * Runs local commands (git, tmux) with a deadline.
 *
 * Everything the orchestrator does on the host goes through here, so this is
 * the one place where command lines are logged and credentials in URLs are
 * masked.
 */
@Component
public class CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(CommandRunner.class);

    private static final Pattern URL_CREDENTIALS = Pattern.compile("(https?://)([^:/@\\s]+:[^@\\s]+|[^:/@\\s]+)@");

    private static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(5);

    /** Run with the default 5-minute deadline. */
    public CommandResult run(List<String> command, Path workDir) {
        return run(command, workDir, DEFAULT_TIMEOUT);
    }

    /**
     * Run a command and wait for it to exit.
     *
     * @param workDir working directory, or null to inherit
     * @throws ExecutorException if the process cannot start, or exceeds the timeout
     */
    public CommandResult run(List<String> command, Path workDir, Duration timeout) {
        String printable = mask(String.join(" ", command));
        log.debug("exec: {} (cwd={})", printable, workDir);

        ProcessBuilder pb = new ProcessBuilder(command);
        if (workDir != null) {
            pb.directory(workDir.toFile());
        }
        pb.environment().put("GIT_TERMINAL_PROMPT", "0");

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new ExecutorException("Could not start: " + printable, e);
        }

        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()));
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new ExecutorException("Timed out after " + timeout.toSeconds() + "s: " + printable);
            }
            return new CommandResult(process.exitValue(), stdout.get(), stderr.get());
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ExecutorException("Interrupted while running: " + printable, e);
        } catch (ExecutionException e) {
            throw new ExecutorException("Could not read output of: " + printable, e.getCause());
        }
    }

    /**
     * Run a command that must succeed.
     *
     * @throws ExecutorException carrying stderr when the exit code is non-zero
     */
    public CommandResult runChecked(List<String> command, Path workDir) {
        CommandResult result = run(command, workDir);
        if (!result.ok()) {
            throw new ExecutorException(
                    mask(String.join(" ", command)) + " exited " + result.exitCode()
                    + ": " + mask(result.stderr().strip()),
                    result.exitCode(), null);
        }
        return result;
    }

    /** Replace user:token@ in any URL with ***@. */
    public static String mask(String text) {
        if (text == null) return null;
        return URL_CREDENTIALS.matcher(text).replaceAll("$1***@");
    }

    private static String drain(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
