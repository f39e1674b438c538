package com.backlogstore.core.git;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link GitClient} that shells out to the {@code git} CLI via
 * {@link ProcessBuilder} rather than depending on JGit.
 *
 * <p>Every call is bounded by a timeout, and a semaphore caps how many git
 * processes run at once so a wide branch scan cannot flood the machine.
 */
public class CliGitClient implements GitClient {

    private static final Logger log = LoggerFactory.getLogger(CliGitClient.class);

    private final Path workDir;
    private final String executable;
    private final Duration timeout;
    private final Semaphore permits;
    /** Two readers (stdout, stderr) per running process; sized so a permitted process never waits for one. */
    private final ExecutorService outputReaders;

    public CliGitClient(Path workDir, String executable, Duration timeout, int maxProcesses) {
        this.workDir = workDir;
        this.executable = executable;
        this.timeout = timeout;
        int processes = Math.max(1, maxProcesses);
        this.permits = new Semaphore(processes);
        var counter = new AtomicInteger();
        this.outputReaders = Executors.newFixedThreadPool(processes * 2, r -> {
            Thread t = new Thread(r, "git-output-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    void shutdown() {
        outputReaders.shutdown();
        try {
            if (!outputReaders.awaitTermination(5, TimeUnit.SECONDS)) {
                outputReaders.shutdownNow();
            }
        } catch (InterruptedException e) {
            outputReaders.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public boolean isRepository() {
        try {
            return run("rev-parse", "--git-dir").exitCode() == 0;
        } catch (GitCommandException e) {
            log.debug("git not usable in {}: {}", workDir, e.getMessage());
            return false;
        }
    }

    @Override
    public String currentBranch() {
        return required("rev-parse", "--abbrev-ref", "HEAD").trim();
    }

    @Override
    public List<BranchInfo> listLocalBranches() {
        return parseRefs(required("for-each-ref",
                "--format=%(refname:short) %(committerdate:unix)", "refs/heads/"), false);
    }

    @Override
    public List<BranchInfo> listRemoteBranches() {
        var branches = new ArrayList<BranchInfo>();
        for (BranchInfo branch : parseRefs(required("for-each-ref",
                "--format=%(refname:short) %(committerdate:unix)", "refs/remotes/"), true)) {
            // origin/HEAD shows up as the bare remote name
            if (branch.name().endsWith("/HEAD") || !branch.name().contains("/")) {
                continue;
            }
            branches.add(branch);
        }
        return branches;
    }

    @Override
    public List<String> listFiles(String ref, String dir) {
        GitResult result = run("ls-tree", "--name-only", ref, withTrailingSlash(dir));
        if (result.exitCode() != 0) {
            return List.of();
        }
        var names = new ArrayList<String>();
        for (String line : result.stdout().split("\n")) {
            if (!line.isBlank()) {
                names.add(fileName(line.trim()));
            }
        }
        return names;
    }

    @Override
    public Optional<String> readFile(String ref, String path) {
        GitResult result = run("show", ref + ":" + normalize(path));
        return result.exitCode() == 0 ? Optional.of(result.stdout()) : Optional.empty();
    }

    @Override
    public Map<String, Instant> fileModifiedTimes(String ref, String dir) {
        GitResult result = run("log", "--format=%x00%ct", "--name-only", ref, "--", normalize(dir));
        var times = new HashMap<String, Instant>();
        if (result.exitCode() != 0) {
            return times;
        }
        Instant current = null;
        for (String line : result.stdout().split("\n")) {
            if (line.startsWith("\0")) {
                current = parseEpoch(line.substring(1).trim());
            } else if (!line.isBlank() && current != null) {
                // log is newest first, so the first time seen per file is its last change
                times.putIfAbsent(fileName(line.trim()), current);
            }
        }
        return times;
    }

    @Override
    public boolean pathExists(String ref, String path) {
        return run("cat-file", "-e", ref + ":" + normalize(path)).exitCode() == 0;
    }

    /** Runs git and fails unless it exits with 0. */
    String required(String... args) {
        GitResult result = run(args);
        if (result.exitCode() != 0) {
            throw new GitCommandException("git %s exited with code %d: %s"
                    .formatted(String.join(" ", args), result.exitCode(), result.stderr().trim()));
        }
        return result.stdout();
    }

    /**
     * Runs one git command in the work directory. Package-private so tests can
     * intercept commands without a real repository.
     */
    GitResult run(String... args) {
        var command = new ArrayList<String>();
        command.add(executable);
        // keep non-ASCII file names unquoted in ls-tree and log output
        command.add("-c");
        command.add("core.quotepath=off");
        command.addAll(List.of(args));
        log.debug("Running: {}", command);

        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GitCommandException("Interrupted waiting to run git", e);
        }
        try {
            var process = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .start();
            process.getOutputStream().close();
            CompletableFuture<String> stdout =
                    CompletableFuture.supplyAsync(() -> drain(process.getInputStream()), outputReaders);
            CompletableFuture<String> stderr =
                    CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()), outputReaders);

            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                throw new GitCommandException("git %s timed out after %s".formatted(String.join(" ", args), timeout));
            }
            var result = new GitResult(process.exitValue(), stdout.get(), stderr.get());
            if (result.exitCode() != 0) {
                log.debug("git {} exited with code {}", args.length > 0 ? args[0] : "", result.exitCode());
            }
            return result;
        } catch (IOException e) {
            throw new GitCommandException("Failed to start " + executable, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GitCommandException("Interrupted while running git", e);
        } catch (ExecutionException e) {
            throw new GitCommandException("Failed to read git output", e.getCause());
        } finally {
            permits.release();
        }
    }

    record GitResult(int exitCode, String stdout, String stderr) {
    }

    private static String drain(InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static List<BranchInfo> parseRefs(String output, boolean remote) {
        var branches = new ArrayList<BranchInfo>();
        for (String line : output.split("\n")) {
            String trimmed = line.trim();
            int space = trimmed.lastIndexOf(' ');
            if (space <= 0) {
                continue;
            }
            Instant time = parseEpoch(trimmed.substring(space + 1));
            if (time != null) {
                branches.add(new BranchInfo(trimmed.substring(0, space), time, remote));
            }
        }
        return branches;
    }

    private static Instant parseEpoch(String seconds) {
        try {
            return Instant.ofEpochSecond(Long.parseLong(seconds));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String normalize(String path) {
        return path.replace('\\', '/');
    }

    private static String withTrailingSlash(String dir) {
        String normalized = normalize(dir);
        return normalized.endsWith("/") ? normalized : normalized + "/";
    }

    private static String fileName(String path) {
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }
}
