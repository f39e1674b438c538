package com.backlogstore.core.git;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of the version-control history the branch reconciler needs.
 * Nothing here checks out a branch or touches the working tree.
 *
 * <p>Paths are relative to the repository root and use forward slashes.
 */
public interface GitClient {

    boolean isRepository();

    String currentBranch();

    List<BranchInfo> listLocalBranches();

    List<BranchInfo> listRemoteBranches();

    /** File names (not paths) directly inside {@code dir} at {@code ref}; empty if the directory is absent. */
    List<String> listFiles(String ref, String dir);

    /** Content of {@code path} at {@code ref}, empty if the file does not exist there. */
    Optional<String> readFile(String ref, String path);

    /** Last commit time per file name in {@code dir}, as seen from {@code ref}. */
    Map<String, Instant> fileModifiedTimes(String ref, String dir);

    boolean pathExists(String ref, String path);
}
