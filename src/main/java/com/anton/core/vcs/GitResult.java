package com.anton.core.vcs;

/**
 * Exit code and captured streams of one git invocation.
 */
public record GitResult(int exitCode, String stdout, String stderr) {

    public boolean ok() {
        return exitCode == 0;
    }

    /** stderr, or stdout when stderr is empty; used in error messages. */
    public String detail() {
        String text = stderr != null && !stderr.isBlank() ? stderr : stdout;
        return text == null || text.isBlank() ? "unknown error" : text.trim();
    }
}
