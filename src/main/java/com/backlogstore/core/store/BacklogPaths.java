package com.backlogstore.core.store;

import com.backlogstore.core.model.TaskFolder;

import java.nio.file.Path;

/**
 * Locations of the backlog directory and its folders inside one workspace.
 */
public final class BacklogPaths {

    private final Path workspaceRoot;
    private final String folderName;
    private final Path backlogDir;

    public BacklogPaths(Path workspaceRoot, String folderName) {
        this.workspaceRoot = workspaceRoot.toAbsolutePath().normalize();
        this.folderName = folderName;
        this.backlogDir = this.workspaceRoot.resolve(folderName);
    }

    public Path workspaceRoot() {
        return workspaceRoot;
    }

    public Path backlogDir() {
        return backlogDir;
    }

    public Path folder(TaskFolder folder) {
        return backlogDir.resolve(folder.relativePath());
    }

    public Path docsDir() {
        return backlogDir.resolve("docs");
    }

    public Path decisionsDir() {
        return backlogDir.resolve("decisions");
    }

    /** Repository-relative path of a folder, as git sees it. */
    public String repositoryPath(TaskFolder folder) {
        return folderName + "/" + folder.relativePath();
    }

    public String repositoryBacklogPath() {
        return folderName;
    }
}
