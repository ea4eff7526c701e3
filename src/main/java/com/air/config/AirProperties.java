package com.air.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings under {@code air.*}. Read once at start.
 */
@Component
@ConfigurationProperties(prefix = "air")
public class AirProperties {

    private String gitTree = "./linux";
    private String worktreeDir = "./air-worktrees";
    private String resultsPath = "./results/air";
    private Setup setup = new Setup();
    private Reviewer reviewer = new Reviewer();
    private Snapshot snapshot = new Snapshot();
    private Index index = new Index();
    private Remote remote = new Remote();
    private Git git = new Git();
    private Patchwork patchwork = new Patchwork();

    // -- Convenience accessors (delegate to nested) --
    public int getSetupConcurrency() { return setup.concurrency; }
    public int getReviewerConcurrency() { return reviewer.concurrency; }
    public int getReviewerTimeoutSeconds() { return reviewer.timeoutSeconds; }
    public int getReviewerMaxAttempts() { return reviewer.maxAttempts; }
    /** Snapshots that may wait for a reviewer: two per reviewer worker. */
    public int getHandoffCapacity() { return 2 * reviewer.concurrency; }

    public String getGitTree() { return gitTree; }
    public void setGitTree(String gitTree) { this.gitTree = gitTree; }
    public String getWorktreeDir() { return worktreeDir; }
    public void setWorktreeDir(String worktreeDir) { this.worktreeDir = worktreeDir; }
    public String getResultsPath() { return resultsPath; }
    public void setResultsPath(String resultsPath) { this.resultsPath = resultsPath; }
    public Setup getSetup() { return setup; }
    public void setSetup(Setup setup) { this.setup = setup; }
    public Reviewer getReviewer() { return reviewer; }
    public void setReviewer(Reviewer reviewer) { this.reviewer = reviewer; }
    public Snapshot getSnapshot() { return snapshot; }
    public void setSnapshot(Snapshot snapshot) { this.snapshot = snapshot; }
    public Index getIndex() { return index; }
    public void setIndex(Index index) { this.index = index; }
    public Remote getRemote() { return remote; }
    public void setRemote(Remote remote) { this.remote = remote; }
    public Git getGit() { return git; }
    public void setGit(Git git) { this.git = git; }
    public Patchwork getPatchwork() { return patchwork; }
    public void setPatchwork(Patchwork patchwork) { this.patchwork = patchwork; }

    public static class Setup {
        private int concurrency = 4;

        public int getConcurrency() { return concurrency; }
        public void setConcurrency(int concurrency) { this.concurrency = concurrency; }
    }

    public static class Reviewer {
        private int concurrency = 4;
        private int timeoutSeconds = 800;
        private int maxAttempts = 3;
        private List<String> command = new ArrayList<>(List.of(
                "claude", "--model", "{model}",
                "-p", "review the top commit in this directory using prompt {prompt}",
                "--verbose", "--output-format=stream-json"));
        private String model = "sonnet";
        private String promptDir = "";
        private String promptFile = "review-core.md";

        public int getConcurrency() { return concurrency; }
        public void setConcurrency(int concurrency) { this.concurrency = concurrency; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public List<String> getCommand() { return command; }
        public void setCommand(List<String> command) { this.command = command; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
        public String getPromptDir() { return promptDir; }
        public void setPromptDir(String promptDir) { this.promptDir = promptDir; }
        public String getPromptFile() { return promptFile; }
        public void setPromptFile(String promptFile) { this.promptFile = promptFile; }
    }

    public static class Snapshot {
        /** {@code always} or {@code auto}. */
        private String reflink = "always";
        private boolean keep = false;

        public String getReflink() { return reflink; }
        public void setReflink(String reflink) { this.reflink = reflink; }
        public boolean isKeep() { return keep; }
        public void setKeep(boolean keep) { this.keep = keep; }
    }

    public static class Index {
        /** Empty disables indexing. {@code {range}} is replaced by the prepared git range. */
        private List<String> command = new ArrayList<>();
        private int timeoutSeconds = 300;

        public List<String> getCommand() { return command; }
        public void setCommand(List<String> command) { this.command = command; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    }

    public static class Remote {
        private String urlTemplate = "git://git.kernel.org/pub/scm/linux/kernel/git/{tree}.git";
        private Map<String, String> urls = new HashMap<>();

        public String getUrlTemplate() { return urlTemplate; }
        public void setUrlTemplate(String urlTemplate) { this.urlTemplate = urlTemplate; }
        public Map<String, String> getUrls() { return urls; }
        public void setUrls(Map<String, String> urls) { this.urls = urls; }
    }

    public static class Git {
        private int timeoutSeconds = 600;

        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    }

    public static class Patchwork {
        private String url = "";

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
    }
}
