package com.anton.core.session;

import com.anton.core.model.RunConfig;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Derives bounded session settings from the shared base and the run policy.
 *
 * <p>Implementation sessions follow the base tool setting inside the project. Preflight (discovery and
 * review) sessions always have tools on so they can read the repository, but may write only
 * to the plan directory, with delegation and tool servers off.
 */
public final class SessionConfigBuilder {

    public static final int DEFAULT_TASK_ITERATIONS = 50;
    public static final int DEFAULT_PREFLIGHT_ITERATIONS = 500;

    private SessionConfigBuilder() {}

    public static SessionConfig forImplementation(SessionDefaults base, RunConfig run) {
        List<Path> roots = base.writeRoots().isEmpty() ? List.of(run.projectDir()) : base.writeRoots();
        return new SessionConfig(
                SessionPurpose.IMPLEMENTATION,
                run.projectDir(),
                base.toolsEnabled(),
                roots,
                effectiveIterations(run.taskMaxIterations(), DEFAULT_TASK_ITERATIONS),
                run.taskTimeout(),
                run.approvalMode(),
                "yolo".equalsIgnoreCase(run.approvalMode()),
                base.delegationEnabled(),
                base.toolServersEnabled(),
                base.model());
    }

    /**
     * Settings for a discovery or requirements-review session.
     *
     * @param stageTimeout budget for this stage; the preflight session timeout caps it
     */
    public static SessionConfig forPreflight(SessionDefaults base, RunConfig run, SessionPurpose purpose,
                                             Duration stageTimeout) {
        Duration cap = run.preflight().sessionTimeout();
        Duration timeout = cap != null && cap.compareTo(stageTimeout) < 0 ? cap : stageTimeout;
        return new SessionConfig(
                purpose,
                run.projectDir(),
                true,
                List.of(run.planDir()),
                effectiveIterations(run.preflight().sessionMaxIterations(), DEFAULT_PREFLIGHT_ITERATIONS),
                timeout,
                run.approvalMode(),
                true,
                false,
                false,
                base.model());
    }

    /** Single-turn, tool-less session used to review a diff. */
    public static SessionConfig forVerification(SessionDefaults base, RunConfig run, String verifyModel) {
        return new SessionConfig(
                SessionPurpose.VERIFICATION,
                run.projectDir(),
                false,
                List.of(),
                1,
                base.timeout(),
                "yolo",
                true,
                false,
                false,
                verifyModel != null && !verifyModel.isBlank() ? verifyModel : base.model());
    }

    /**
     * Floor of a configured positive cap, or {@code fallback} when unset, non-finite or below one.
     */
    public static int effectiveIterations(Double configured, int fallback) {
        if (configured == null || configured.isNaN() || configured.isInfinite()) {
            return fallback;
        }
        double floored = Math.floor(configured);
        if (floored < 1) {
            return fallback;
        }
        return floored >= Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) floored;
    }
}
