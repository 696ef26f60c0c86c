package com.anton.config;

import com.anton.core.model.RunConfig;
import com.anton.core.model.ScopeGuardMode;
import com.anton.core.session.AgentCommand;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Run policy and session settings under the {@code anton} prefix. Mutable for binding only;
 * the controller works from the immutable {@link RunConfig} resolved by {@link #toRunConfig}.
 */
@ConfigurationProperties(prefix = "anton")
public class AntonProperties {

    static final int MIN_HEARTBEAT_SECONDS = 5;

    private int taskTimeoutSec = 600;
    private int totalTimeoutSec = 7200;
    private int maxRetries = 3;
    private Double taskMaxIterations = 50.0;
    private int maxTotalIterations = 200;
    private int maxIdenticalFailures = 3;
    private boolean autoCommit = true;
    private boolean verifyAi = false;
    private String verifyModel = "";
    private boolean decompose = true;
    private int maxDecomposeDepth = 2;
    private int maxTotalTasks = 500;
    private boolean skipOnFail = false;
    private boolean skipOnBlocked = true;
    private boolean rollbackOnFail = false;
    private boolean aggressiveClean = false;
    private String scopeGuard = "lax";
    private String approvalMode = "yolo";
    private int progressHeartbeatSec = 30;
    private boolean progressEvents = true;
    private String planDir = ".agents/tasks";
    private int maxContextTokens = 8000;
    private int maxPromptTokens = 128_000;
    private int toolLoopMaxRetries = 3;
    private boolean branch = false;

    private Preflight preflight = new Preflight();
    private Session session = new Session();
    private Agent agent = new Agent();
    private Lock lock = new Lock();

    /**
     * Resolves the policy for one run.
     *
     * @param taskFile   task document, relative paths resolve against {@code projectDir}
     * @param projectDir working tree of the run
     * @param overrides  per-run overrides from the command line; null fields keep the configured value
     */
    public RunConfig toRunConfig(Path taskFile, Path projectDir, RunOverrides overrides) {
        return toRunConfig(taskFile, projectDir, overrides, Clock.systemUTC());
    }

    RunConfig toRunConfig(Path taskFile, Path projectDir, RunOverrides overrides, Clock clock) {
        RunOverrides o = overrides == null ? RunOverrides.none() : overrides;
        Path project = projectDir.toAbsolutePath().normalize();
        Path file = project.resolve(taskFile).normalize();
        Path plans = project.resolve(planDir).normalize();

        Preflight p = preflight;
        int sessionTimeout = Math.max(p.sessionTimeoutSec, 1);
        RunConfig.Preflight preflightPolicy = new RunConfig.Preflight(
                o.preflight() != null ? o.preflight() : p.enabled,
                p.requirementsReview,
                Duration.ofSeconds(Math.min(p.discoveryTimeoutSec, sessionTimeout)),
                Duration.ofSeconds(Math.min(p.reviewTimeoutSec, sessionTimeout)),
                Duration.ofSeconds(sessionTimeout),
                Math.max(p.maxRetries, 1),
                p.sessionMaxIterations);

        boolean createBranch = o.branch() != null ? o.branch() : branch;
        return new RunConfig(
                file,
                project,
                plans,
                Duration.ofSeconds(taskTimeoutSec),
                Duration.ofSeconds(totalTimeoutSec),
                taskMaxIterations,
                maxTotalIterations,
                Math.max(maxRetries, 1),
                maxIdenticalFailures,
                decompose,
                maxDecomposeDepth,
                maxTotalTasks,
                o.autoCommit() != null ? o.autoCommit() : autoCommit,
                verifyAi,
                skipOnBlocked,
                o.skipOnFail() != null ? o.skipOnFail() : skipOnFail,
                o.rollbackOnFail() != null ? o.rollbackOnFail() : rollbackOnFail,
                aggressiveClean,
                ScopeGuardMode.fromConfig(scopeGuard),
                approvalMode,
                Duration.ofSeconds(Math.max(progressHeartbeatSec, MIN_HEARTBEAT_SECONDS)),
                progressEvents,
                maxContextTokens,
                maxPromptTokens,
                toolLoopMaxRetries,
                createBranch ? "anton-" + clock.millis() : null,
                o.dryRun() != null && o.dryRun(),
                preflightPolicy);
    }

    /**
     * Per-run command-line overrides. A null field leaves the configured value in place.
     */
    public record RunOverrides(Boolean preflight, Boolean autoCommit, Boolean skipOnFail,
                               Boolean rollbackOnFail, Boolean branch, Boolean dryRun) {

        public static RunOverrides none() {
            return new RunOverrides(null, null, null, null, null, null);
        }
    }

    public int getTaskTimeoutSec() { return taskTimeoutSec; }
    public void setTaskTimeoutSec(int taskTimeoutSec) { this.taskTimeoutSec = taskTimeoutSec; }
    public int getTotalTimeoutSec() { return totalTimeoutSec; }
    public void setTotalTimeoutSec(int totalTimeoutSec) { this.totalTimeoutSec = totalTimeoutSec; }
    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
    public Double getTaskMaxIterations() { return taskMaxIterations; }
    public void setTaskMaxIterations(Double taskMaxIterations) { this.taskMaxIterations = taskMaxIterations; }
    public int getMaxTotalIterations() { return maxTotalIterations; }
    public void setMaxTotalIterations(int maxTotalIterations) { this.maxTotalIterations = maxTotalIterations; }
    public int getMaxIdenticalFailures() { return maxIdenticalFailures; }
    public void setMaxIdenticalFailures(int maxIdenticalFailures) { this.maxIdenticalFailures = maxIdenticalFailures; }
    public boolean isAutoCommit() { return autoCommit; }
    public void setAutoCommit(boolean autoCommit) { this.autoCommit = autoCommit; }
    public boolean isVerifyAi() { return verifyAi; }
    public void setVerifyAi(boolean verifyAi) { this.verifyAi = verifyAi; }
    public String getVerifyModel() { return verifyModel; }
    public void setVerifyModel(String verifyModel) { this.verifyModel = verifyModel; }
    public boolean isDecompose() { return decompose; }
    public void setDecompose(boolean decompose) { this.decompose = decompose; }
    public int getMaxDecomposeDepth() { return maxDecomposeDepth; }
    public void setMaxDecomposeDepth(int maxDecomposeDepth) { this.maxDecomposeDepth = maxDecomposeDepth; }
    public int getMaxTotalTasks() { return maxTotalTasks; }
    public void setMaxTotalTasks(int maxTotalTasks) { this.maxTotalTasks = maxTotalTasks; }
    public boolean isSkipOnFail() { return skipOnFail; }
    public void setSkipOnFail(boolean skipOnFail) { this.skipOnFail = skipOnFail; }
    public boolean isSkipOnBlocked() { return skipOnBlocked; }
    public void setSkipOnBlocked(boolean skipOnBlocked) { this.skipOnBlocked = skipOnBlocked; }
    public boolean isRollbackOnFail() { return rollbackOnFail; }
    public void setRollbackOnFail(boolean rollbackOnFail) { this.rollbackOnFail = rollbackOnFail; }
    public boolean isAggressiveClean() { return aggressiveClean; }
    public void setAggressiveClean(boolean aggressiveClean) { this.aggressiveClean = aggressiveClean; }
    public String getScopeGuard() { return scopeGuard; }
    public void setScopeGuard(String scopeGuard) { this.scopeGuard = scopeGuard; }
    public String getApprovalMode() { return approvalMode; }
    public void setApprovalMode(String approvalMode) { this.approvalMode = approvalMode; }
    public int getProgressHeartbeatSec() { return progressHeartbeatSec; }
    public void setProgressHeartbeatSec(int progressHeartbeatSec) { this.progressHeartbeatSec = progressHeartbeatSec; }
    public boolean isProgressEvents() { return progressEvents; }
    public void setProgressEvents(boolean progressEvents) { this.progressEvents = progressEvents; }
    public String getPlanDir() { return planDir; }
    public void setPlanDir(String planDir) { this.planDir = planDir; }
    public int getMaxContextTokens() { return maxContextTokens; }
    public void setMaxContextTokens(int maxContextTokens) { this.maxContextTokens = maxContextTokens; }
    public int getMaxPromptTokens() { return maxPromptTokens; }
    public void setMaxPromptTokens(int maxPromptTokens) { this.maxPromptTokens = maxPromptTokens; }
    public int getToolLoopMaxRetries() { return toolLoopMaxRetries; }
    public void setToolLoopMaxRetries(int toolLoopMaxRetries) { this.toolLoopMaxRetries = toolLoopMaxRetries; }
    public boolean isBranch() { return branch; }
    public void setBranch(boolean branch) { this.branch = branch; }

    public Preflight getPreflight() { return preflight; }
    public void setPreflight(Preflight preflight) { this.preflight = preflight; }
    public Session getSession() { return session; }
    public void setSession(Session session) { this.session = session; }
    public Agent getAgent() { return agent; }
    public void setAgent(Agent agent) { this.agent = agent; }
    public Lock getLock() { return lock; }
    public void setLock(Lock lock) { this.lock = lock; }

    public static class Preflight {
        private boolean enabled = false;
        private boolean requirementsReview = true;
        private int discoveryTimeoutSec = 600;
        private int reviewTimeoutSec = 600;
        private int sessionTimeoutSec = 1200;
        private int maxRetries = 2;
        private Double sessionMaxIterations = 500.0;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public boolean isRequirementsReview() { return requirementsReview; }
        public void setRequirementsReview(boolean requirementsReview) { this.requirementsReview = requirementsReview; }
        public int getDiscoveryTimeoutSec() { return discoveryTimeoutSec; }
        public void setDiscoveryTimeoutSec(int discoveryTimeoutSec) { this.discoveryTimeoutSec = discoveryTimeoutSec; }
        public int getReviewTimeoutSec() { return reviewTimeoutSec; }
        public void setReviewTimeoutSec(int reviewTimeoutSec) { this.reviewTimeoutSec = reviewTimeoutSec; }
        public int getSessionTimeoutSec() { return sessionTimeoutSec; }
        public void setSessionTimeoutSec(int sessionTimeoutSec) { this.sessionTimeoutSec = sessionTimeoutSec; }
        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public Double getSessionMaxIterations() { return sessionMaxIterations; }
        public void setSessionMaxIterations(Double sessionMaxIterations) { this.sessionMaxIterations = sessionMaxIterations; }
    }

    /** Base settings for every agent session. */
    public static class Session {
        private String model = "";
        private boolean toolsEnabled = true;
        private List<String> writeRoots = new ArrayList<>();
        private boolean delegationEnabled = false;
        private boolean toolServersEnabled = true;
        private int timeoutSec = 600;

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
        public boolean isToolsEnabled() { return toolsEnabled; }
        public void setToolsEnabled(boolean toolsEnabled) { this.toolsEnabled = toolsEnabled; }
        public List<String> getWriteRoots() { return writeRoots; }
        public void setWriteRoots(List<String> writeRoots) { this.writeRoots = writeRoots; }
        public boolean isDelegationEnabled() { return delegationEnabled; }
        public void setDelegationEnabled(boolean delegationEnabled) { this.delegationEnabled = delegationEnabled; }
        public boolean isToolServersEnabled() { return toolServersEnabled; }
        public void setToolServersEnabled(boolean toolServersEnabled) { this.toolServersEnabled = toolServersEnabled; }
        public int getTimeoutSec() { return timeoutSec; }
        public void setTimeoutSec(int timeoutSec) { this.timeoutSec = timeoutSec; }
    }

    /** The external agent CLI that runs tool-using sessions. */
    public static class Agent {
        private List<String> command = new ArrayList<>(AgentCommand.GOOSE);
        private Map<String, String> environment = new LinkedHashMap<>();
        private String loopPattern = "(?i)tool[- ]call loop detected";
        private String toolCallPattern = "";
        private boolean useChatModel = true;

        public List<String> getCommand() { return command; }
        public void setCommand(List<String> command) { this.command = command; }
        public Map<String, String> getEnvironment() { return environment; }
        public void setEnvironment(Map<String, String> environment) { this.environment = environment; }
        public String getLoopPattern() { return loopPattern; }
        public void setLoopPattern(String loopPattern) { this.loopPattern = loopPattern; }
        public String getToolCallPattern() { return toolCallPattern; }
        public void setToolCallPattern(String toolCallPattern) { this.toolCallPattern = toolCallPattern; }
        public boolean isUseChatModel() { return useChatModel; }
        public void setUseChatModel(boolean useChatModel) { this.useChatModel = useChatModel; }
    }

    public static class Lock {
        private String stateDir = System.getProperty("user.home") + "/.anton";
        private int staleAfterMinutes = 60;

        public String getStateDir() { return stateDir; }
        public void setStateDir(String stateDir) { this.stateDir = stateDir; }
        public int getStaleAfterMinutes() { return staleAfterMinutes; }
        public void setStaleAfterMinutes(int staleAfterMinutes) { this.staleAfterMinutes = staleAfterMinutes; }
    }
}
