package com.backlogstore.core.store;

import com.backlogstore.core.error.StoreIoException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Creates a new backlog: the folder layout and a {@code config.yml}.
 */
public class BacklogInitializer {

    private static final Logger log = LoggerFactory.getLogger(BacklogInitializer.class);

    private static final Pattern PREFIX = Pattern.compile("^[a-zA-Z]+$");

    static final List<String> DIRECTORIES = List.of(
            "tasks",
            "drafts",
            "completed",
            "archive/tasks",
            "archive/drafts",
            "archive/milestones",
            "docs",
            "decisions",
            "milestones");

    /**
     * @param statuses            first one is the default status
     * @param checkActiveBranches written only when non-null, like the other optional settings
     */
    public record Options(String projectName, String taskPrefix, List<String> statuses,
                          Boolean checkActiveBranches, Boolean remoteOperations, Integer activeBranchDays) {

        public Options {
            statuses = statuses == null || statuses.isEmpty() ? List.of("To Do", "In Progress", "Done") : List.copyOf(statuses);
        }

        public static Options of(String projectName, String taskPrefix) {
            return new Options(projectName, taskPrefix, null, null, null, null);
        }
    }

    public static boolean isValidPrefix(String prefix) {
        return prefix != null && PREFIX.matcher(prefix).matches();
    }

    /**
     * @return the created backlog directory
     * @throws IllegalArgumentException when the prefix has anything but letters
     * @throws StoreIoException         when the backlog directory already exists or cannot be written
     */
    public Path initialize(BacklogPaths paths, Options options) {
        if (!isValidPrefix(options.taskPrefix())) {
            throw new IllegalArgumentException("Invalid task prefix \"" + options.taskPrefix()
                    + "\": must contain only letters (a-z, A-Z)");
        }
        Path backlogDir = paths.backlogDir();
        try {
            if (Files.exists(backlogDir)) {
                throw new FileAlreadyExistsException(backlogDir.toString(), null, "Backlog folder already exists");
            }
            for (String dir : DIRECTORIES) {
                Files.createDirectories(backlogDir.resolve(dir));
            }
            Files.writeString(backlogDir.resolve("config.yml"), configYaml(options), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StoreIoException("Failed to initialize backlog at " + backlogDir, e);
        }
        log.info("Initialized backlog at {}", backlogDir);
        return backlogDir;
    }

    /** Config file text, keys in the order other backlog tools write them. */
    static String configYaml(Options options) {
        var lines = new ArrayList<String>();
        lines.add("project_name: " + quote(options.projectName()));
        lines.add("default_status: " + quote(options.statuses().get(0)));
        lines.add("statuses: [" + String.join(", ", options.statuses().stream().map(BacklogInitializer::quote).toList()) + "]");
        lines.add("labels: []");
        lines.add("milestones: []");
        lines.add("date_format: yyyy-mm-dd");
        lines.add("max_column_width: 20");
        if (options.remoteOperations() != null) {
            lines.add("remote_operations: " + options.remoteOperations());
        }
        if (options.checkActiveBranches() != null) {
            lines.add("check_active_branches: " + options.checkActiveBranches());
        }
        if (options.activeBranchDays() != null) {
            lines.add("active_branch_days: " + options.activeBranchDays());
        }
        lines.add("task_prefix: " + quote(options.taskPrefix()));
        lines.add("");
        return String.join("\n", lines);
    }

    private static String quote(String value) {
        return "\"" + (value == null ? "" : value.replace("\\", "\\\\").replace("\"", "\\\"")) + "\"";
    }
}
