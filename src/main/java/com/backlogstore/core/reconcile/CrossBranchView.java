package com.backlogstore.core.reconcile;

import com.backlogstore.core.model.Task;

import java.util.List;

/**
 * Result of reconciling branches.
 *
 * @param resolved one task per id across every scanned branch
 * @param local    the working-tree tasks; only these may be written
 * @param branches names of the branches that were scanned besides the current one
 */
public record CrossBranchView(List<Task> resolved, List<Task> local, List<String> branches) {

    public CrossBranchView {
        resolved = List.copyOf(resolved);
        local = List.copyOf(local);
        branches = List.copyOf(branches);
    }

    public static CrossBranchView localOnly(List<Task> local) {
        return new CrossBranchView(local, local, List.of());
    }
}
