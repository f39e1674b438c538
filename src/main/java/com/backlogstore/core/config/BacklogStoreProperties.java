package com.backlogstore.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Process-level settings under {@code backlog.*}. Workspace-level settings
 * (statuses, prefix, branch policy) live in the workspace's own
 * {@code config.yml}, see {@link BacklogConfig}.
 */
@ConfigurationProperties(prefix = "backlog")
public class BacklogStoreProperties {

    /** Workspace root; the backlog directory is resolved inside it. */
    private String root = ".";
    private String folder = "backlog";
    private boolean stampUpdatedDate = false;
    private int statusCallbackTimeoutSeconds = 30;
    private Git git = new Git();
    private Reconcile reconcile = new Reconcile();

    public String getRoot() { return root; }
    public void setRoot(String root) { this.root = root; }
    public String getFolder() { return folder; }
    public void setFolder(String folder) { this.folder = folder; }
    public boolean isStampUpdatedDate() { return stampUpdatedDate; }
    public void setStampUpdatedDate(boolean stampUpdatedDate) { this.stampUpdatedDate = stampUpdatedDate; }
    public int getStatusCallbackTimeoutSeconds() { return statusCallbackTimeoutSeconds; }
    public void setStatusCallbackTimeoutSeconds(int seconds) { this.statusCallbackTimeoutSeconds = seconds; }
    public Git getGit() { return git; }
    public void setGit(Git git) { this.git = git; }
    public Reconcile getReconcile() { return reconcile; }
    public void setReconcile(Reconcile reconcile) { this.reconcile = reconcile; }

    public static class Git {
        private String executable = "git";
        private int timeoutSeconds = 10;
        private int maxProcesses = 4;

        public String getExecutable() { return executable; }
        public void setExecutable(String executable) { this.executable = executable; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
        public int getMaxProcesses() { return maxProcesses; }
        public void setMaxProcesses(int maxProcesses) { this.maxProcesses = maxProcesses; }
    }

    public static class Reconcile {
        private int branchBatchSize = 5;
        private int hydrateBatchSize = 8;
        private int threads = 4;

        public int getBranchBatchSize() { return branchBatchSize; }
        public void setBranchBatchSize(int branchBatchSize) { this.branchBatchSize = branchBatchSize; }
        public int getHydrateBatchSize() { return hydrateBatchSize; }
        public void setHydrateBatchSize(int hydrateBatchSize) { this.hydrateBatchSize = hydrateBatchSize; }
        public int getThreads() { return threads; }
        public void setThreads(int threads) { this.threads = threads; }
    }
}
