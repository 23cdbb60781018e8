package com.asyncreview.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Budgets and limits for snapshots, diff context, the reasoning loop and traces.
 */
@Component
@ConfigurationProperties(prefix = "asyncreview")
public class AsyncReviewProperties {

    private Loop loop = new Loop();
    private Snapshot snapshot = new Snapshot();
    private Diff diff = new Diff();
    private Trace trace = new Trace();
    private Session session = new Session();

    public Loop getLoop() { return loop; }
    public void setLoop(Loop loop) { this.loop = loop; }
    public Snapshot getSnapshot() { return snapshot; }
    public void setSnapshot(Snapshot snapshot) { this.snapshot = snapshot; }
    public Diff getDiff() { return diff; }
    public void setDiff(Diff diff) { this.diff = diff; }
    public Trace getTrace() { return trace; }
    public void setTrace(Trace trace) { this.trace = trace; }
    public Session getSession() { return session; }
    public void setSession(Session session) { this.session = session; }

    public static class Loop {
        private int maxIterations = 20;
        private int maxLlmCalls = 25;
        private int maxOutputChars = 5000;
        private Duration modelTimeout = Duration.ofSeconds(120);
        private int variablePreviewChars = 4_000;

        public int getMaxIterations() { return maxIterations; }
        public void setMaxIterations(int maxIterations) { this.maxIterations = maxIterations; }
        public int getMaxLlmCalls() { return maxLlmCalls; }
        public void setMaxLlmCalls(int maxLlmCalls) { this.maxLlmCalls = maxLlmCalls; }
        public int getMaxOutputChars() { return maxOutputChars; }
        public void setMaxOutputChars(int maxOutputChars) { this.maxOutputChars = maxOutputChars; }
        public Duration getModelTimeout() { return modelTimeout; }
        public void setModelTimeout(Duration modelTimeout) { this.modelTimeout = modelTimeout; }
        public int getVariablePreviewChars() { return variablePreviewChars; }
        public void setVariablePreviewChars(int variablePreviewChars) { this.variablePreviewChars = variablePreviewChars; }
    }

    public static class Snapshot {
        private long maxFileBytes = 200_000;
        private long maxTotalBytes = 5_000_000;
        private List<String> includeGlobs = new ArrayList<>();
        private List<String> excludeGlobs = new ArrayList<>();
        private int overviewChars = 20_000;

        public long getMaxFileBytes() { return maxFileBytes; }
        public void setMaxFileBytes(long maxFileBytes) { this.maxFileBytes = maxFileBytes; }
        public long getMaxTotalBytes() { return maxTotalBytes; }
        public void setMaxTotalBytes(long maxTotalBytes) { this.maxTotalBytes = maxTotalBytes; }
        public List<String> getIncludeGlobs() { return includeGlobs; }
        public void setIncludeGlobs(List<String> includeGlobs) { this.includeGlobs = includeGlobs; }
        public List<String> getExcludeGlobs() { return excludeGlobs; }
        public void setExcludeGlobs(List<String> excludeGlobs) { this.excludeGlobs = excludeGlobs; }
        public int getOverviewChars() { return overviewChars; }
        public void setOverviewChars(int overviewChars) { this.overviewChars = overviewChars; }
    }

    public static class Diff {
        private int maxVisibleFiles = 50;
        private int contentCharCap = 10_000;
        private int patchCharCap = 5_000;
        private int maxFetchedFiles = 50;
        private int fetchConcurrency = 8;
        private int reviewFileLimit = 100;

        public int getMaxVisibleFiles() { return maxVisibleFiles; }
        public void setMaxVisibleFiles(int maxVisibleFiles) { this.maxVisibleFiles = maxVisibleFiles; }
        public int getContentCharCap() { return contentCharCap; }
        public void setContentCharCap(int contentCharCap) { this.contentCharCap = contentCharCap; }
        public int getPatchCharCap() { return patchCharCap; }
        public void setPatchCharCap(int patchCharCap) { this.patchCharCap = patchCharCap; }
        public int getMaxFetchedFiles() { return maxFetchedFiles; }
        public void setMaxFetchedFiles(int maxFetchedFiles) { this.maxFetchedFiles = maxFetchedFiles; }
        public int getFetchConcurrency() { return fetchConcurrency; }
        public void setFetchConcurrency(int fetchConcurrency) { this.fetchConcurrency = fetchConcurrency; }
        public int getReviewFileLimit() { return reviewFileLimit; }
        public void setReviewFileLimit(int reviewFileLimit) { this.reviewFileLimit = reviewFileLimit; }
    }

    public static class Trace {
        private boolean enabled = true;
        private String directory = System.getProperty("user.home") + "/.asyncreview/traces";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }
    }

    public static class Session {
        private int maxSessions = 100;

        public int getMaxSessions() { return maxSessions; }
        public void setMaxSessions(int maxSessions) { this.maxSessions = maxSessions; }
    }
}
