package com.anton.core.model;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Builds {@link RunConfig} instances for tests with the application defaults.
 */
public final class RunConfigFixtures {

    private RunConfigFixtures() {}

    public static Builder builder(Path projectDir) {
        return new Builder(projectDir);
    }

    public static RunConfig defaults(Path projectDir) {
        return builder(projectDir).build();
    }

    public static final class Builder {
        private final Path projectDir;
        private Path taskFile;
        private Duration taskTimeout = Duration.ofSeconds(5);
        private Duration totalTimeout = Duration.ofHours(2);
        private Double taskMaxIterations = 50.0;
        private int maxTotalIterations = 200;
        private int maxRetries = 3;
        private int maxIdenticalFailures = 3;
        private boolean decompose = true;
        private int maxDecomposeDepth = 2;
        private int maxTotalTasks = 500;
        private boolean autoCommit = true;
        private boolean verifyAi = false;
        private boolean skipOnBlocked = true;
        private boolean skipOnFail = false;
        private boolean rollbackOnFail = false;
        private ScopeGuardMode scopeGuard = ScopeGuardMode.OFF;
        private String approvalMode = "yolo";
        private boolean progressEvents = true;
        private int maxPromptTokens = 128_000;
        private int toolLoopMaxRetries = 3;
        private String branch;
        private boolean dryRun;
        private boolean preflight;
        private boolean requirementsReview = true;
        private int preflightRetries = 2;
        private Duration preflightTimeout = Duration.ofSeconds(5);

        private Builder(Path projectDir) {
            this.projectDir = projectDir;
            this.taskFile = projectDir.resolve("TASKS.md");
        }

        public Builder taskFile(Path v) { this.taskFile = v; return this; }
        public Builder taskTimeout(Duration v) { this.taskTimeout = v; return this; }
        public Builder totalTimeout(Duration v) { this.totalTimeout = v; return this; }
        public Builder taskMaxIterations(Double v) { this.taskMaxIterations = v; return this; }
        public Builder maxTotalIterations(int v) { this.maxTotalIterations = v; return this; }
        public Builder maxRetries(int v) { this.maxRetries = v; return this; }
        public Builder maxIdenticalFailures(int v) { this.maxIdenticalFailures = v; return this; }
        public Builder decompose(boolean v) { this.decompose = v; return this; }
        public Builder maxDecomposeDepth(int v) { this.maxDecomposeDepth = v; return this; }
        public Builder maxTotalTasks(int v) { this.maxTotalTasks = v; return this; }
        public Builder autoCommit(boolean v) { this.autoCommit = v; return this; }
        public Builder verifyAi(boolean v) { this.verifyAi = v; return this; }
        public Builder skipOnBlocked(boolean v) { this.skipOnBlocked = v; return this; }
        public Builder skipOnFail(boolean v) { this.skipOnFail = v; return this; }
        public Builder rollbackOnFail(boolean v) { this.rollbackOnFail = v; return this; }
        public Builder scopeGuard(ScopeGuardMode v) { this.scopeGuard = v; return this; }
        public Builder approvalMode(String v) { this.approvalMode = v; return this; }
        public Builder progressEvents(boolean v) { this.progressEvents = v; return this; }
        public Builder maxPromptTokens(int v) { this.maxPromptTokens = v; return this; }
        public Builder toolLoopMaxRetries(int v) { this.toolLoopMaxRetries = v; return this; }
        public Builder branch(String v) { this.branch = v; return this; }
        public Builder dryRun(boolean v) { this.dryRun = v; return this; }
        public Builder preflight(boolean v) { this.preflight = v; return this; }
        public Builder requirementsReview(boolean v) { this.requirementsReview = v; return this; }
        public Builder preflightRetries(int v) { this.preflightRetries = v; return this; }
        public Builder preflightTimeout(Duration v) { this.preflightTimeout = v; return this; }

        public RunConfig build() {
            return new RunConfig(taskFile, projectDir, projectDir.resolve(".agents/tasks"), taskTimeout,
                    totalTimeout, taskMaxIterations, maxTotalIterations, maxRetries, maxIdenticalFailures,
                    decompose, maxDecomposeDepth, maxTotalTasks, autoCommit, verifyAi, skipOnBlocked, skipOnFail,
                    rollbackOnFail, false, scopeGuard, approvalMode, Duration.ofSeconds(30), progressEvents, 8000,
                    maxPromptTokens, toolLoopMaxRetries, branch, dryRun,
                    new RunConfig.Preflight(preflight, requirementsReview, preflightTimeout, preflightTimeout,
                            preflightTimeout, preflightRetries, 500.0));
        }
    }
}
