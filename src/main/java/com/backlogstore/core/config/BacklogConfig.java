package com.backlogstore.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Workspace configuration read from {@code backlog/config.yml}.
 * Missing values take the defaults below; unknown keys are ignored.
 *
 * @param projectName            display name, nullable
 * @param statuses               ordered status list; first is the default, last counts as done
 * @param defaultStatus          status for new tasks when it differs from the first one, nullable
 * @param taskPrefix             file and id prefix of tasks, {@code task} by default
 * @param labels                 predefined labels offered alongside those found in tasks
 * @param milestones             plain names or {@code {id, name, description}} maps
 * @param dateFormat             {@code yyyy-mm-dd} or {@code yyyy-mm-dd hh:mm}, nullable
 * @param checkActiveBranches    enables cross-branch reconciliation
 * @param remoteOperations       also scan remote-tracking branches
 * @param activeBranchDays       branches with no commit in this window are skipped
 * @param taskResolutionStrategy how competing branch snapshots are resolved
 * @param onStatusChange         shell command run when a task changes status, nullable
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BacklogConfig(
    @JsonProperty("project_name") String projectName,
    List<String> statuses,
    @JsonProperty("default_status") String defaultStatus,
    @JsonProperty("task_prefix") String taskPrefix,
    List<String> labels,
    List<Object> milestones,
    @JsonProperty("date_format") String dateFormat,
    @JsonProperty("check_active_branches") Boolean checkActiveBranches,
    @JsonProperty("remote_operations") Boolean remoteOperations,
    @JsonProperty("active_branch_days") Integer activeBranchDays,
    @JsonProperty("task_resolution_strategy") ResolutionStrategy taskResolutionStrategy,
    @JsonProperty("onStatusChange") String onStatusChange
) {

    public static final List<String> DEFAULT_STATUSES = List.of("To Do", "In Progress", "Done");
    public static final String DEFAULT_PREFIX = "task";
    public static final int DEFAULT_ACTIVE_BRANCH_DAYS = 30;

    public BacklogConfig {
        statuses = statuses == null || statuses.isEmpty() ? DEFAULT_STATUSES : List.copyOf(statuses);
        taskPrefix = taskPrefix == null || taskPrefix.isBlank()
                ? DEFAULT_PREFIX
                : taskPrefix.trim().toLowerCase(Locale.ROOT);
        labels = labels == null ? List.of() : List.copyOf(labels);
        milestones = milestones == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(milestones));
        checkActiveBranches = checkActiveBranches != null && checkActiveBranches;
        remoteOperations = remoteOperations != null && remoteOperations;
        activeBranchDays = activeBranchDays == null || activeBranchDays <= 0
                ? DEFAULT_ACTIVE_BRANCH_DAYS
                : activeBranchDays;
        taskResolutionStrategy = taskResolutionStrategy == null
                ? ResolutionStrategy.MOST_RECENT
                : taskResolutionStrategy;
    }

    public static BacklogConfig defaults() {
        return new BacklogConfig(null, null, null, null, null, null, null,
                null, null, null, null, null);
    }

    /** Status for new tasks: {@code default_status} when it is one of the statuses, else the first status. */
    public String initialStatus() {
        if (defaultStatus != null) {
            for (String status : statuses) {
                if (status.equalsIgnoreCase(defaultStatus.trim())) {
                    return status;
                }
            }
        }
        return statuses.get(0);
    }

    public String doneStatus() {
        return statuses.get(statuses.size() - 1);
    }

    /** Upper-cased id prefix, e.g. {@code TASK}. */
    public String idPrefix() {
        return taskPrefix.toUpperCase(Locale.ROOT);
    }

    /** Whether new dates carry a time of day. */
    public boolean datesWithTime() {
        return dateFormat != null && dateFormat.toLowerCase(Locale.ROOT).contains("hh");
    }

    public List<String> milestoneNames() {
        var names = new ArrayList<String>();
        for (Object milestone : milestones) {
            if (milestone instanceof Map<?, ?> map) {
                Object name = map.get("name") != null ? map.get("name") : map.get("id");
                if (name != null) {
                    names.add(String.valueOf(name));
                }
            } else if (milestone != null) {
                names.add(String.valueOf(milestone));
            }
        }
        return names;
    }
}
