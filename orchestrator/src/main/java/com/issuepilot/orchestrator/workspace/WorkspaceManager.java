package com.issuepilot.orchestrator.workspace;

import com.issuepilot.orchestrator.config.IssuePilotProperties;
import com.issuepilot.orchestrator.model.Issue;
import com.issuepilot.orchestrator.model.IssueRef;
import com.issuepilot.orchestrator.model.TaskInstruction;
import com.issuepilot.orchestrator.model.Workspace;
import com.issuepilot.orchestrator.protocol.Answer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;
import java.util.stream.Stream;

/**
 * Owns the on-disk checkouts, one per issue.
 *
 * Layout: {@code <root>/worktrees/<owner>__<repo>/<number>}, branch
 * {@code agent/<number>-<slug>}. Both are pure functions of the issue, so a
 * resumed or restarted run always lands in the same place.
 */
@Component
public class WorkspaceManager {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceManager.class);

    private static final int    SLUG_MAX = 40;
    private static final String STATE_DIR = ".issuepilot";

    private final GitOperations git;
    private final Clock         clock;
    private final Path          root;
    private final String        cloneUrlTemplate;
    private final String        token;
    private final String        baseBranch;
    private final String        instructionFile;
    private final String        markerFile;
    private final String        answerFile;

    // One lock per issue, shared by materialize and removeIf.
    private final Map<IssueRef, ReentrantLock> locks = new ConcurrentHashMap<>();

    public WorkspaceManager(GitOperations git, IssuePilotProperties props, Clock clock) {
        this.git              = git;
        this.clock            = clock;
        this.root             = props.getWorkspace().getRoot().toAbsolutePath().normalize();
        this.cloneUrlTemplate = props.getWorkspace().getCloneUrl();
        this.token            = props.getTracker().getToken();
        this.baseBranch       = props.getTracker().getBaseBranch();
        this.instructionFile  = props.getWorkspace().getInstructionFile();
        this.markerFile       = props.getWorkspace().getMarkerFile();
        this.answerFile       = props.getWorkspace().getAnswerFile();
    }

    // ------------------------------------------------------------------
    // Naming
    // ------------------------------------------------------------------

    public Path pathFor(IssueRef ref) {
        return root.resolve("worktrees")
                   .resolve(ref.owner() + "__" + ref.name())
                   .resolve(String.valueOf(ref.number()));
    }

    public static String branchFor(Issue issue) {
        return "agent/" + issue.ref().number() + "-" + slug(issue.title());
    }

    static String slug(String title) {
        String s = title == null ? "" : title.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-+|-+$", "");
        if (s.length() > SLUG_MAX) {
            s = s.substring(0, SLUG_MAX).replaceAll("-+$", "");
        }
        return s.isEmpty() ? "task" : s;
    }

    // ------------------------------------------------------------------
    // Materialize
    // ------------------------------------------------------------------

    /**
     * Make sure the issue's checkout exists and is on its branch.
     *
     * Idempotent: an existing checkout is fetched and reused, never
     * re-cloned, so commits from an earlier session survive.
     */
    public Workspace materialize(Issue issue) {
        Path path   = pathFor(issue.ref());
        String branch = branchFor(issue);

        ReentrantLock lock = lockFor(issue.ref());
        lock.lock();
        try {
            if (git.isRepository(path)) {
                log.info("Reusing workspace {} for {}", path, issue.ref());
                git.fetch(path);
            } else {
                if (Files.exists(path) && !isEmptyDirectory(path)) {
                    throw new WorkspaceException(path + " exists but is not a git checkout");
                }
                createDirectories(path.getParent());
                git.cloneRepo(cloneUrl(issue.ref().repo()), path);
            }
            git.ensureBranch(path, branch, baseBranch);
            excludeControlFiles(path);
            return new Workspace(issue.ref(), path, branch, createdAt(path));
        } finally {
            lock.unlock();
        }
    }

    // ------------------------------------------------------------------
    // Control files
    // ------------------------------------------------------------------

    /**
     * Write the task file once. A task file that already exists is left as it
     * is: the instruction a session started with never changes under it.
     *
     * @return true if the file was written by this call
     */
    public boolean writeInstructions(Workspace workspace, TaskInstruction instruction) {
        Path target = workspace.resolve(instructionFile);
        if (Files.exists(target)) {
            log.debug("{} already present in {}, keeping it", instructionFile, workspace.rootPath());
            return false;
        }
        try {
            writeAtomically(target, instruction.document(), false);
            log.info("Wrote {} for {}", instructionFile, workspace.issueRef());
            return true;
        } catch (FileAlreadyExistsException e) {
            return false;
        }
    }

    public Path instructionPath(Workspace workspace) {
        return workspace.resolve(instructionFile);
    }

    /** Hand a human answer to the next session. Replaces any earlier answer. */
    public void writeAnswer(Workspace workspace, Answer answer) {
        String doc = "# Answer from maintainer\n\n"
                + "Posted: " + answer.postedAt() + "\n\n"
                + answer.text().strip() + "\n\n"
                + "Continue the task in " + instructionFile + " using this answer.\n";
        try {
            writeAtomically(workspace.resolve(answerFile), doc, true);
        } catch (FileAlreadyExistsException e) {
            throw new WorkspaceException("Unexpected conflict writing " + answerFile, e);
        }
    }

    /**
     * Move a consumed completion marker out of the way so the next session in
     * this workspace starts without one.
     *
     * @return true if a marker was archived
     */
    public boolean archiveCompletionMarker(Workspace workspace) {
        Path marker = workspace.resolve(markerFile);
        if (!Files.exists(marker)) return false;
        Path archiveDir = workspace.resolve(STATE_DIR).resolve("markers");
        createDirectories(archiveDir);
        Path archived = archiveDir.resolve(clock.instant().toEpochMilli() + "-" + markerFile);
        try {
            Files.move(marker, archived, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new WorkspaceException("Could not archive " + marker, e);
        }
        log.info("Archived completion marker to {}", archived);
        return true;
    }

    public List<String> uncommittedChanges(Workspace workspace) {
        return git.uncommittedChanges(workspace.rootPath());
    }

    // ------------------------------------------------------------------
    // Removal
    // ------------------------------------------------------------------

    /**
     * Delete an issue's workspace if {@code stillRemovable} holds. The check and
     * the delete run under the issue's lock, so they never overlap a
     * {@link #materialize} of the same issue.
     *
     * @return true if the workspace was removed
     */
    public boolean removeIf(IssueRef ref, Path path, BooleanSupplier stillRemovable) {
        ReentrantLock lock = lockFor(ref);
        lock.lock();
        try {
            if (!stillRemovable.getAsBoolean()) {
                return false;
            }
            remove(path);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** Delete a workspace directory tree. Missing directories are fine. */
    public void remove(Path path) {
        Path normalized = path.toAbsolutePath().normalize();
        if (!normalized.startsWith(root.resolve("worktrees"))) {
            throw new WorkspaceException("Refusing to delete " + normalized + " outside " + root);
        }
        if (!Files.exists(normalized)) return;
        try (Stream<Path> walk = Files.walk(normalized)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(p);
            }
        } catch (IOException e) {
            throw new WorkspaceException("Could not delete " + normalized, e);
        }
        log.info("Removed workspace {}", normalized);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private ReentrantLock lockFor(IssueRef ref) {
        return locks.computeIfAbsent(ref, r -> new ReentrantLock());
    }

    String cloneUrl(String repo) {
        String url = cloneUrlTemplate.replace("{repo}", repo);
        if (token != null && !token.isBlank() && url.startsWith("https://") && !url.contains("@")) {
            url = "https://x-access-token:" + token + "@" + url.substring("https://".length());
        }
        return url;
    }

    /** Temp file in the same directory, fsync, then an atomic rename. */
    private static void writeAtomically(Path target, String content, boolean replace)
            throws FileAlreadyExistsException {
        Path tmp = null;
        try {
            tmp = Files.createTempFile(target.getParent(), "." + target.getFileName(), ".tmp");
            try (FileChannel ch = FileChannel.open(tmp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ch.write(ByteBuffer.wrap(content.getBytes(StandardCharsets.UTF_8)));
                ch.force(true);
            }
            if (replace) {
                moveAtomically(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            } else {
                moveAtomically(tmp, target);
            }
            tmp = null;
        } catch (FileAlreadyExistsException e) {
            throw e;
        } catch (IOException e) {
            throw new WorkspaceException("Could not write " + target, e);
        } finally {
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException e) {
                    log.warn("Could not delete temp file {}: {}", tmp, e.getMessage());
                }
            }
        }
    }

    private static void moveAtomically(Path from, Path to, StandardCopyOption... extra) throws IOException {
        StandardCopyOption[] options = new StandardCopyOption[extra.length + 1];
        options[0] = StandardCopyOption.ATOMIC_MOVE;
        System.arraycopy(extra, 0, options, 1, extra.length);
        if (extra.length == 0 && Files.exists(to)) {
            // ATOMIC_MOVE replaces silently on POSIX.
            throw new FileAlreadyExistsException(to.toString());
        }
        try {
            Files.move(from, to, options);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from, to, extra);
        }
    }

    /** Keep orchestrator control files out of the backend's commits. */
    private void excludeControlFiles(Path repo) {
        Path exclude = repo.resolve(".git").resolve("info").resolve("exclude");
        try {
            createDirectories(exclude.getParent());
            String existing = Files.exists(exclude) ? Files.readString(exclude) : "";
            StringBuilder add = new StringBuilder();
            for (String name : List.of(instructionFile, markerFile, answerFile, STATE_DIR + "/")) {
                if (!existing.lines().anyMatch(name::equals)) add.append(name).append('\n');
            }
            if (!add.isEmpty()) {
                String prefix = existing.isEmpty() || existing.endsWith("\n") ? "" : "\n";
                Files.writeString(exclude, prefix + add, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            }
        } catch (IOException e) {
            throw new WorkspaceException("Could not update " + exclude, e);
        }
    }

    private Instant createdAt(Path path) {
        try {
            return Files.readAttributes(path, BasicFileAttributes.class).creationTime().toInstant();
        } catch (IOException e) {
            log.debug("No creation time for {}: {}", path, e.getMessage());
            return clock.instant();
        }
    }

    private static boolean isEmptyDirectory(Path path) {
        try (Stream<Path> entries = Files.list(path)) {
            return entries.findAny().isEmpty();
        } catch (IOException e) {
            return false;
        }
    }

    private static void createDirectories(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new WorkspaceException("Could not create " + dir, e);
        }
    }
}
