package com.anton.core.verify;

import com.anton.core.model.RunConfig;
import com.anton.core.model.ScopeGuardMode;
import com.anton.core.model.Task;
import com.anton.core.vcs.GitSafetyNet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * Re-verifies the working tree after an agent reports a task done. The scope guard runs on
 * the uncommitted changes; the AI review runs on whichever diff the caller hands it, so a
 * task can be committed first and reviewed against its commit.
 */
public class TaskVerifier {

    private static final Logger log = LoggerFactory.getLogger(TaskVerifier.class);

    private final AiVerifier aiVerifier;

    /**
     * @param aiVerifier AI reviewer, or null when no verification model is available
     */
    public TaskVerifier(AiVerifier aiVerifier) {
        this.aiVerifier = aiVerifier;
    }

    public VerificationResult checkScope(Task task, GitSafetyNet git, RunConfig run) {
        if (run.scopeGuard() == ScopeGuardMode.OFF) {
            return VerificationResult.skipped();
        }
        List<String> changed = withoutPlanDir(git.changedFiles(), run);
        ScopeGuard.ScopeCheck scope = ScopeGuard.check(task.text(), changed, run.scopeGuard());
        if (!scope.ok()) {
            log.info("Scope guard rejected '{}': {}", task.text(), scope.outOfScope());
            return new VerificationResult(false, scope.reason(), false, null, null);
        }
        return VerificationResult.skipped();
    }

    public boolean reviewsDiffs(RunConfig run) {
        return run.verifyAi() && aiVerifier != null;
    }

    /**
     * AI review of a diff. Skipped (passes) when AI verification is off or the diff is empty.
     */
    public VerificationResult reviewDiff(Task task, String diff, RunConfig run) {
        if (!reviewsDiffs(run) || diff == null || diff.isBlank()) {
            return VerificationResult.skipped();
        }
        AiVerdict verdict = aiVerifier.verify(task, diff, run);
        if (!verdict.pass()) {
            return new VerificationResult(false, "AI verification failed: " + verdict.reason(), true, false,
                    verdict.reason());
        }
        return new VerificationResult(true, null, true, true, verdict.reason());
    }

    /** Plan files written during preflight are never counted against the task's scope. */
    static List<String> withoutPlanDir(List<String> changed, RunConfig run) {
        Path project = run.projectDir().toAbsolutePath().normalize();
        Path plans = run.planDir().toAbsolutePath().normalize();
        if (!plans.startsWith(project)) {
            return changed;
        }
        String prefix = project.relativize(plans).toString().replace('\\', '/') + "/";
        return changed.stream().filter(f -> !f.startsWith(prefix)).toList();
    }
}
