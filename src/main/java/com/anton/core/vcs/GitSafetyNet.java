package com.anton.core.vcs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Keeps the working tree in a known-good state around task attempts.
 *
 * <p>Shells out to the {@code git} CLI with fixed argument lists and an explicit timeout per
 * call. Calls are serialized by the run lock; nothing here locks on its own.
 */
public class GitSafetyNet {

    private static final Logger log = LoggerFactory.getLogger(GitSafetyNet.class);

    static final Duration QUICK_TIMEOUT = Duration.ofMillis(1500);
    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final Path workDir;
    private final Duration timeout;

    public GitSafetyNet(Path workDir) {
        this(workDir, DEFAULT_TIMEOUT);
    }

    public GitSafetyNet(Path workDir, Duration timeout) {
        this.workDir = workDir;
        this.timeout = timeout;
    }

    public boolean isInsideWorkTree() {
        GitResult res = runGit(QUICK_TIMEOUT, "rev-parse", "--is-inside-work-tree");
        return res.ok() && res.stdout().trim().startsWith("true");
    }

    /**
     * True when {@code git status --porcelain} reports anything. Outside a repository, false.
     *
     * @throws VcsException if the status itself cannot be read
     */
    public boolean isDirty() {
        if (!isInsideWorkTree()) {
            return false;
        }
        GitResult res = runGit(QUICK_TIMEOUT, "status", "--porcelain");
        if (!res.ok()) {
            throw new VcsException("git status failed: " + res.detail());
        }
        return !res.stdout().isBlank();
    }

    /**
     * @throws DirtyWorkingTreeException if there are uncommitted changes
     */
    public void ensureClean() {
        if (isDirty()) {
            throw new DirtyWorkingTreeException("Working tree not clean. Commit or stash first.");
        }
    }

    /** Diff of the working tree against HEAD, empty outside a repository. */
    public String workingDiff() {
        if (!isInsideWorkTree()) {
            return "";
        }
        return runGit(timeout, "diff", "HEAD").stdout();
    }

    /** Paths changed or added relative to HEAD, untracked files included. */
    public List<String> changedFiles() {
        GitResult res = runGit(timeout, "status", "--porcelain", "--untracked-files=all");
        if (!res.ok()) {
            throw new VcsException("git status failed: " + res.detail());
        }
        return parsePorcelain(res.stdout());
    }

    public List<String> untrackedFiles() {
        GitResult res = runGit(timeout, "ls-files", "--others", "--exclude-standard");
        return lines(res.stdout());
    }

    /**
     * Stages everything and commits.
     *
     * @return the new short hash, or empty when there was nothing to commit
     * @throws VcsException on a genuine git failure
     */
    public Optional<String> commitAll(String message) {
        GitResult add = runGit(timeout, "add", "-A");
        if (!add.ok()) {
            throw new VcsException("git add failed: " + add.detail());
        }
        GitResult commit = runGit(timeout, "commit", "-m", message);
        if (!commit.ok()) {
            GitResult status = runGit(QUICK_TIMEOUT, "status", "--porcelain");
            if (status.ok() && status.stdout().isBlank()) {
                log.info("Nothing to commit for '{}'", message);
                return Optional.empty();
            }
            throw new VcsException("git commit failed: " + commit.detail());
        }
        String hash = runGit(timeout, "rev-parse", "--short", "HEAD").stdout().trim();
        log.info("Committed {}: {}", hash, message);
        return Optional.of(hash);
    }

    /**
     * Folds the current changes into the most recent commit, keeping its message.
     *
     * @return the short hash of the rewritten commit
     */
    public String amend() {
        GitResult add = runGit(timeout, "add", "-A");
        if (!add.ok()) {
            throw new VcsException("git add failed: " + add.detail());
        }
        GitResult res = runGit(timeout, "commit", "--amend", "--no-edit");
        if (!res.ok()) {
            throw new VcsException("git commit --amend failed: " + res.detail());
        }
        String hash = runGit(timeout, "rev-parse", "--short", "HEAD").stdout().trim();
        log.info("Amended commit {}", hash);
        return hash;
    }

    /** The patch introduced by a single commit. */
    public String commitDiff(String hash) {
        GitResult res = runGit(timeout, "show", "--format=", "--patch", hash);
        if (!res.ok()) {
            throw new VcsException("git show failed: " + res.detail());
        }
        return res.stdout();
    }

    /** Discards the most recent commit and its changes. */
    public void dropLastCommit() {
        GitResult res = runGit(timeout, "reset", "--hard", "HEAD~1");
        if (!res.ok()) {
            throw new VcsException("git reset failed: " + res.detail());
        }
        log.info("Dropped last commit");
    }

    /**
     * Reverts tracked changes and removes untracked files an attempt created.
     *
     * @param untrackedBefore untracked files present before the attempt, which are kept
     * @param aggressive      remove every untracked file and directory instead
     */
    public void rollback(Set<String> untrackedBefore, boolean aggressive) {
        GitResult restore = runGit(timeout, "checkout", "--", ".");
        if (!restore.ok()) {
            log.warn("git checkout -- . failed: {}", restore.detail());
        }
        if (aggressive) {
            GitResult clean = runGit(timeout, "clean", "-fd");
            if (!clean.ok()) {
                throw new VcsException("git clean failed: " + clean.detail());
            }
            return;
        }
        List<String> created = new ArrayList<>();
        for (String file : untrackedFiles()) {
            if (!untrackedBefore.contains(file)) {
                created.add(file);
            }
        }
        if (!created.isEmpty()) {
            log.info("Removing {} newly created files: {}", created.size(),
                    created.size() > 5 ? created.subList(0, 5) + "..." : created);
            removeUntracked(created);
        }
    }

    /**
     * Reverts the given paths only: tracked files are checked out from HEAD, untracked ones removed.
     */
    public void restorePaths(Collection<String> paths) {
        if (paths.isEmpty()) {
            return;
        }
        Set<String> untracked = Set.copyOf(untrackedFiles());
        List<String> tracked = new ArrayList<>();
        List<String> created = new ArrayList<>();
        for (String path : paths) {
            (untracked.contains(path) ? created : tracked).add(path);
        }
        if (!tracked.isEmpty()) {
            List<String> args = new ArrayList<>(List.of("checkout", "HEAD", "--"));
            args.addAll(tracked);
            GitResult res = runGit(timeout, args.toArray(String[]::new));
            if (!res.ok()) {
                throw new VcsException("git checkout paths failed: " + res.detail());
            }
        }
        removeUntracked(created);
    }

    public void removeUntracked(Collection<String> files) {
        if (files.isEmpty()) {
            return;
        }
        List<String> args = new ArrayList<>(List.of("clean", "-f", "--"));
        args.addAll(files);
        GitResult res = runGit(timeout, args.toArray(String[]::new));
        if (!res.ok()) {
            throw new VcsException("git clean files failed: " + res.detail());
        }
    }

    public void createBranch(String name) {
        GitResult res = runGit(timeout, "checkout", "-b", name);
        if (!res.ok()) {
            throw new VcsException("git checkout -b failed: " + res.detail());
        }
        log.info("Created branch '{}'", name);
    }

    /**
     * Runs a git command with a timeout. A command that outlives its timeout is killed and
     * reported as a {@link VcsException}.
     */
    GitResult runGit(Duration limit, String... args) {
        List<String> command = new ArrayList<>(args.length + 1);
        command.add("git");
        command.addAll(Arrays.asList(args));
        log.debug("Running: {}", command);

        Process process;
        try {
            ProcessBuilder pb = new ProcessBuilder(command).directory(workDir.toFile());
            pb.environment().put("GIT_TERMINAL_PROMPT", "0");
            process = pb.start();
        } catch (IOException e) {
            throw new VcsException("Failed to start git " + args[0] + ": " + e.getMessage(), e);
        }

        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> read(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> read(process.getErrorStream()));
        try {
            if (!process.waitFor(limit.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new VcsException("git %s timed out after %dms".formatted(args[0], limit.toMillis()));
            }
            GitResult result = new GitResult(process.exitValue(), stdout.get(), stderr.get());
            if (!result.ok()) {
                log.debug("git {} exited {}: {}", args[0], result.exitCode(), result.detail());
            }
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new VcsException("Interrupted while running git " + args[0], e);
        } catch (ExecutionException e) {
            throw new VcsException("Failed to read git output: " + e.getCause().getMessage(), e.getCause());
        }
    }

    static List<String> parsePorcelain(String output) {
        List<String> paths = new ArrayList<>();
        for (String line : output.split("\\r?\\n")) {
            if (line.length() < 4) {
                continue;
            }
            String path = line.substring(3).trim();
            int arrow = path.indexOf(" -> ");
            if (arrow >= 0) {
                path = path.substring(arrow + 4);
            }
            if (path.startsWith("\"") && path.endsWith("\"") && path.length() > 1) {
                path = path.substring(1, path.length() - 1);
            }
            paths.add(path);
        }
        return paths;
    }

    private static List<String> lines(String output) {
        List<String> result = new ArrayList<>();
        for (String line : output.split("\\r?\\n")) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty()) {
                result.add(trimmed);
            }
        }
        return result;
    }

    private static String read(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
