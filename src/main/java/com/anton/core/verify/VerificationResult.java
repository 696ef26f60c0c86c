package com.anton.core.verify;

/**
 * Combined verification outcome for a task the agent reported done.
 *
 * @param passed whether the task may be committed
 * @param summary one-line failure summary, null when passed
 * @param scopeOk scope guard outcome
 * @param aiPassed AI verdict, null when AI verification did not run
 * @param aiReason AI verdict reason, null when AI verification did not run
 */
public record VerificationResult(boolean passed, String summary, boolean scopeOk, Boolean aiPassed, String aiReason) {

    public static VerificationResult skipped() {
        return new VerificationResult(true, null, true, null, null);
    }
}
