package com.backlogstore.core.store;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the {@code onStatusChange} shell command after a task changes status.
 *
 * <p>The command sees {@code $TASK_ID}, {@code $OLD_STATUS}, {@code $NEW_STATUS}
 * and {@code $TASK_TITLE} as environment variables and runs in the workspace
 * root. A per-task command wins over the workspace one. Failures and timeouts
 * are logged; they never fail the update that triggered them.
 */
public class StatusChangeHook {

    private static final Logger log = LoggerFactory.getLogger(StatusChangeHook.class);

    private final Path workDir;
    private final Duration timeout;
    private final ExecutorService outputReaders;

    public StatusChangeHook(Path workDir, Duration timeout) {
        this.workDir = workDir;
        this.timeout = timeout;
        var counter = new AtomicInteger();
        this.outputReaders = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "status-hook-output-" + counter.incrementAndGet());
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

    /**
     * @return whether a command was started
     */
    public boolean run(String taskCommand, String globalCommand,
                       String taskId, String oldStatus, String newStatus, String taskTitle) {
        String command = taskCommand != null && !taskCommand.isBlank() ? taskCommand : globalCommand;
        if (command == null || command.isBlank()) {
            return false;
        }
        if (oldStatus != null && oldStatus.equals(newStatus)) {
            return false;
        }
        Map<String, String> env = Map.of(
                "TASK_ID", taskId,
                "OLD_STATUS", oldStatus == null ? "" : oldStatus,
                "NEW_STATUS", newStatus == null ? "" : newStatus,
                "TASK_TITLE", taskTitle == null ? "" : taskTitle);
        log.info("Running onStatusChange for {}: {} -> {}", taskId, oldStatus, newStatus);
        try {
            int exitCode = execute(List.of("sh", "-c", command), env);
            if (exitCode != 0) {
                log.warn("onStatusChange for {} exited with code {}", taskId, exitCode);
            }
        } catch (IOException e) {
            log.warn("onStatusChange for {} could not be started: {}", taskId, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while running onStatusChange for {}", taskId);
        }
        return true;
    }

    /**
     * Runs the command and waits for it. Package-private so tests can capture
     * the invocation instead of spawning a shell.
     *
     * @return the exit code, or {@code -1} when the command timed out
     */
    int execute(List<String> command, Map<String, String> env) throws IOException, InterruptedException {
        var builder = new ProcessBuilder(command)
                .directory(workDir.toFile())
                .redirectErrorStream(true);
        builder.environment().putAll(env);
        Process process = builder.start();
        process.getOutputStream().close();
        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> read(process.getInputStream()),
                outputReaders);

        boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!finished) {
            process.destroyForcibly();
            log.warn("onStatusChange timed out after {}s, killed", timeout.toSeconds());
            return -1;
        }
        String text = output.join();
        if (!text.isBlank()) {
            log.debug("onStatusChange output: {}", text.trim());
        }
        return process.exitValue();
    }

    private static String read(InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
